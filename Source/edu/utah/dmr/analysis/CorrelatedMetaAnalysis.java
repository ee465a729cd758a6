package edu.utah.dmr.analysis;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.utah.dmr.data.BandedCorrelation;
import edu.utah.dmr.data.MetaStats;
import edu.utah.dmr.data.SiteTable;

/**Fixed effect combination of correlated site estimates by generalized least squares.  With covariance
 * Sigma = D rho D, D = diag(se), the weights are Sigma^-1 1 normalized to sum to 1, B = w'estimates and 
 * S = 1/(1' Sigma^-1 1). Spans wider than the correlation band, or whose covariance can't be inverted, get 
 * the conservative null result instead.
 * @author Nix*/
public class CorrelatedMetaAnalysis {
	
	private static final Logger log = LogManager.getLogger(CorrelatedMetaAnalysis.class);
	
	//fields
	private final double diagonal;
	private final MetaStats nullStats;
	
	//constructors
	public CorrelatedMetaAnalysis (DmrConfig config){
		this(config.getDiagonalRegularizer(), config.getNullEstimate(), config.getNullVariance());
	}
	
	/**@param diagonal self correlation placed on the diagonal of each rebuilt correlation matrix
	 * @param nullEstimate B returned for spans that can't be combined
	 * @param nullVariance S returned for spans that can't be combined*/
	public CorrelatedMetaAnalysis (double diagonal, double nullEstimate, double nullVariance){
		this.diagonal = diagonal;
		this.nullStats = new MetaStats(nullEstimate, nullVariance);
	}
	
	/**Combines sites start to end, inclusive.*/
	public MetaStats stats(SiteTable sites, BandedCorrelation rho, int start, int end){
		double[] bs = new double[2];
		if (combine(sites, rho, start, end, bs) == false) return nullStats;
		return new MetaStats(bs[0], bs[1]);
	}
	
	/**Same as stats() but only returns B/sqrt(S), for the shrinker's inner loop.*/
	public double z(SiteTable sites, BandedCorrelation rho, int start, int end){
		double[] bs = new double[2];
		if (combine(sites, rho, start, end, bs) == false) return nullStats.getZ();
		return bs[0] / Math.sqrt(bs[1]);
	}
	
	/**Combines estimates given a dense correlation matrix, the diagonal is used as given.*/
	public MetaStats stats(double[] estimates, double[] se, double[][] correlation){
		int k = estimates.length;
		if (se.length != k || correlation.length != k) throw new IllegalArgumentException("Dimension mismatch: "+k+" estimates, "+se.length+" standard errors, "+correlation.length+" correlation rows");
		for (int i=0; i< k; i++){
			if (correlation[i].length != k) throw new IllegalArgumentException("Correlation matrix must be square, row "+i+" has "+correlation[i].length+" columns");
		}
		double[] bs = new double[2];
		if (solve(correlation, se, estimates, bs) == false) return nullStats;
		return new MetaStats(bs[0], bs[1]);
	}
	
	private boolean combine(SiteTable sites, BandedCorrelation rho, int start, int end, double[] bs){
		int k = end - start + 1;
		if (rho.covers(k) == false) {
			log.debug("Span "+start+"-"+end+" of "+k+" sites exceeds the correlation bandwidth, using the null result");
			return false;
		}
		double[][] corr = rho.extract(start, end, diagonal);
		double[] estimates = new double[k];
		double[] se = new double[k];
		for (int i=0; i< k; i++){
			estimates[i] = sites.get(start+i).getEstimate();
			se[i] = sites.get(start+i).getSe();
		}
		return solve(corr, se, estimates, bs);
	}
	
	/**Loads B and S into bs, returns false if the covariance can't be used.  Works on the correlation scale,
	 * Sigma^-1 1 = D^-1 rho^-1 D^-1 1, so tiny standard errors don't look singular.*/
	private boolean solve(double[][] correlation, double[] se, double[] estimates, double[] bs){
		int k = estimates.length;
		double[] inverseSe = new double[k];
		for (int i=0; i< k; i++){
			inverseSe[i] = 1.0 / se[i];
			for (int j=0; j< k; j++){
				if (Double.isNaN(correlation[i][j]) || Double.isInfinite(correlation[i][j])) {
					log.debug("Undefined correlation entry, using the null result");
					return false;
				}
			}
		}
		RealVector y;
		try {
			DecompositionSolver solver = new LUDecomposition(new Array2DRowRealMatrix(correlation, false)).getSolver();
			y = solver.solve(new ArrayRealVector(inverseSe, false));
		} catch (SingularMatrixException e){
			log.warn("Singular correlation matrix for a span of "+k+" sites, using the null result");
			return false;
		}
		double total = 0;
		double weighted = 0;
		for (int i=0; i< k; i++){
			//row sum i of Sigma^-1
			double w = y.getEntry(i) * inverseSe[i];
			total += w;
			weighted += w * estimates[i];
		}
		if ((total > 0) == false || Double.isInfinite(total)) {
			log.warn("Non positive combined precision "+total+" for a span of "+k+" sites, using the null result");
			return false;
		}
		bs[0] = weighted / total;
		bs[1] = 1.0 / total;
		return true;
	}

	public MetaStats getNullStats() {
		return nullStats;
	}
}
