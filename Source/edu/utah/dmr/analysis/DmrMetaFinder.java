package edu.utah.dmr.analysis;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.utah.dmr.data.DmrRecord;
import edu.utah.dmr.data.MetaAnalysisResult;
import edu.utah.dmr.data.PreparedDataset;
import edu.utah.dmr.data.SiteTable;

/**Multi dataset entry point.  Meta analyzes the sites shared by every dataset, calls candidates on the 
 * combined statistics, then scores each span per dataset with that dataset's correlation before combining 
 * across datasets.
 * <pre>
 * PreparedDataset a = DatasetPreparer.prepare("cohortA", sitesA, matrixA, config.getBandwidth());
 * PreparedDataset b = DatasetPreparer.prepare("cohortB", sitesB, matrixB, config.getBandwidth());
 * MetaAnalysisResult res = DmrMetaFinder.findDmrs(new PreparedDataset[]{a, b}, config);
 * </pre>
 * @author Nix*/
public class DmrMetaFinder {
	
	private static final Logger log = LogManager.getLogger(DmrMetaFinder.class);
	
	/**@throws IllegalArgumentException with fewer than two datasets or a bad config, checked before any work*/
	public static MetaAnalysisResult findDmrs(PreparedDataset[] datasets, DmrConfig config){
		CrossDatasetCombiner.checkDatasets(datasets);
		config.validate();
		for (PreparedDataset d: datasets) log.info("Meta analyzing "+d);
		
		SiteTable combined = CrossDatasetCombiner.combineSites(datasets);
		if (combined.size() == 0) return new MetaAnalysisResult(combined, new DmrRecord[0]);
		
		CorrelatedMetaAnalysis engine = new CorrelatedMetaAnalysis(config);
		DmrPipeline pipeline = new DmrPipeline(new MetaRegionScorer(combined, datasets, engine), config);
		return new MetaAnalysisResult(combined, pipeline.run());
	}
}
