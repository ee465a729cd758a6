package edu.utah.dmr.analysis;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.utah.dmr.data.DmrRecord;
import edu.utah.dmr.data.PreparedDataset;
import edu.utah.dmr.data.Site;

/**Single dataset entry point.  Calls differentially methylated regions from one set of per site association
 * statistics and the measurement matrix behind them.
 * <pre>
 * DmrConfig config = new DmrConfig();
 * DmrRecord[] dmrs = DmrFinder.findDmrs(sites, betaValues, config);
 * </pre>
 * @author Nix*/
public class DmrFinder {
	
	private static final Logger log = LogManager.getLogger(DmrFinder.class);
	
	/**@param sites in any order, they are sorted internally
	 * @param matrix one row of sample measurements per site, rows follow the order of the sites, NaN for missing
	 * @return regions in candidate discovery order, start and end indexes refer to the sorted sites
	 * @throws IllegalArgumentException on a dimension mismatch, duplicate site ids or a bad config*/
	public static DmrRecord[] findDmrs(Site[] sites, double[][] matrix, DmrConfig config){
		config.validate();
		PreparedDataset dataset = DatasetPreparer.prepare("dataset", sites, matrix, config.getBandwidth());
		return findDmrs(dataset, config);
	}
	
	/**Runs on a dataset that has already been prepared.  The dataset's own correlation bandwidth is used.*/
	public static DmrRecord[] findDmrs(PreparedDataset dataset, DmrConfig config){
		config.validate();
		log.info("Calling regions in "+dataset);
		CorrelatedMetaAnalysis engine = new CorrelatedMetaAnalysis(config);
		DmrPipeline pipeline = new DmrPipeline(new CohortRegionScorer(dataset, engine), config);
		return pipeline.run();
	}
}
