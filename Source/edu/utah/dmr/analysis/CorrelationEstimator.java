package edu.utah.dmr.analysis;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.utah.dmr.data.BandedCorrelation;
import edu.utah.dmr.data.SiteTable;
import util.gen.PearsonCorrelation;

/**Calculates the Pearson correlation of each site's measurements with those of the next bandwidth sites.
 * Cost is proportional to sites x bandwidth x samples, the all pairs matrix is never built.
 * @author Nix*/
public class CorrelationEstimator {
	
	private static final Logger log = LogManager.getLogger(CorrelationEstimator.class);
	
	/**@param sites sorted sites
	 * @param matrix measurements, row i belongs to site i of the table, NaN marks a missing sample
	 * @param bandwidth number of downstream neighbors to correlate with
	 * @throws IllegalArgumentException if the matrix row count differs from the site count or rows differ in length*/
	public static BandedCorrelation estimate(SiteTable sites, double[][] matrix, int bandwidth){
		int n = sites.size();
		if (matrix.length != n) throw new IllegalArgumentException("Dimension mismatch: "+matrix.length+" matrix rows for "+n+" sites");
		if (bandwidth < 1) throw new IllegalArgumentException("Correlation bandwidth must be >= 1, found "+bandwidth);
		if (n != 0) {
			int numSamples = matrix[0].length;
			for (int i=1; i< n; i++){
				if (matrix[i].length != numSamples) throw new IllegalArgumentException("Dimension mismatch: matrix row "+i+" has "+matrix[i].length+" samples, expected "+numSamples);
			}
		}
		
		double[][] band = new double[n][bandwidth];
		int numUndefined = 0;
		for (int i=0; i< n; i++){
			for (int offset=1; offset<= bandwidth; offset++){
				int j = i + offset;
				//past the end or onto the next chromosome
				if (j >= n || sites.get(i).sameChromosome(sites.get(j)) == false) {
					band[i][offset-1] = Double.NaN;
					continue;
				}
				double r = PearsonCorrelation.correlationCoefficientPairwise(matrix[i], matrix[j]);
				if (Double.isNaN(r)) {
					r = 0;
					numUndefined++;
				}
				band[i][offset-1] = r;
			}
		}
		if (numUndefined != 0) log.warn(numUndefined+" neighbor correlations could not be calculated (too few complete samples or no variance) and were set to 0");
		log.debug("Calculated banded correlations for "+n+" sites, bandwidth "+bandwidth);
		return new BandedCorrelation(band, bandwidth);
	}
}
