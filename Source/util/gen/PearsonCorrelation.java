package util.gen;

/**Calculates Pearson Correlations (R) on paired double[]s, skipping any pair with a NaN in either array.*/
public class PearsonCorrelation {

	/**Minimum number of complete pairs needed to return a correlation.*/
	public static final int MINIMUM_COMPLETE_PAIRS = 3;

	/**Calculates Pearson correlation coefficient, r, from two double[]s using only the indexes where both
	 * values are defined. Returns NaN if fewer than 3 complete pairs remain or one side is uniform.*/
	public static double correlationCoefficientPairwise (double[] x, double[] y){
		double N = 0;
		double xTot=0;
		double yTot=0;
		double sqrXTot =0;
		double sqrYTot =0;
		double xYTot=0;
		for (int i=0; i<x.length; i++){
			if (Double.isNaN(x[i]) || Double.isNaN(y[i])) continue;
			xTot += x[i];
			yTot += y[i];
			sqrXTot += x[i] * x[i];
			sqrYTot += y[i] * y[i];
			xYTot += (x[i] * y[i]);
			N++;
		}
		if (N < MINIMUM_COMPLETE_PAIRS) return Double.NaN;
		double top = (N * xYTot) - (xTot * yTot);
		double botLeft = Math.sqrt( (N * sqrXTot) - (xTot * xTot) );
		double botRight = Math.sqrt( (N * sqrYTot) - (yTot * yTot) );
		double bot = botLeft*botRight;
		if (bot == 0 || Double.isNaN(bot)) return Double.NaN;
		double r = top/bot;
		//rounding can push |r| past 1
		if (r > 1) return 1;
		if (r < -1) return -1;
		return r;
	}
}
