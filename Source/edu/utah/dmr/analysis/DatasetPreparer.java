package edu.utah.dmr.analysis;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.utah.dmr.data.BandedCorrelation;
import edu.utah.dmr.data.PreparedDataset;
import edu.utah.dmr.data.Site;
import edu.utah.dmr.data.SiteTable;

/**Sorts a dataset's sites along with its measurement matrix and computes the banded correlation, producing
 * the PreparedDataset the region callers work from.*/
public class DatasetPreparer {
	
	private static final Logger log = LogManager.getLogger(DatasetPreparer.class);
	
	/**@param sites in any order
	 * @param matrix measurement rows in the same order as the sites, columns are samples, NaN for missing
	 * @throws IllegalArgumentException on a dimension mismatch, duplicate ids or bad site statistics*/
	public static PreparedDataset prepare(String name, Site[] sites, double[][] matrix, int bandwidth){
		if (matrix.length != sites.length) {
			throw new IllegalArgumentException("Dimension mismatch in "+name+": "+matrix.length+" matrix rows for "+sites.length+" sites");
		}
		SiteTable table = new SiteTable(sites);
		double[][] aligned = table.alignRows(matrix);
		BandedCorrelation rho = CorrelationEstimator.estimate(table, aligned, bandwidth);
		log.info("Prepared "+name+", "+table.size()+" sites");
		return new PreparedDataset(name, table, rho);
	}
}
