package util.gen;

import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Static number and stats methods.
 */
public class Num {

	private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0, 1);

	/**Returns the two sided p-value for a z-score from the standard normal, 2*pnorm(-|z|).*/
	public static double twoSidedPValue(double z){
		if (Double.isNaN(z)) return 1.0;
		return 2.0 * STANDARD_NORMAL.cumulativeProbability(-Math.abs(z));
	}

	/**Parses a double, returning NaN for the usual missing value markers.*/
	public static double parseDoubleNA(String value){
		if (Misc.isMissing(value)) return Double.NaN;
		return Double.parseDouble(value.trim());
	}
}
