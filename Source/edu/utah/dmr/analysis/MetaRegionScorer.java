package edu.utah.dmr.analysis;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.utah.dmr.data.MetaStats;
import edu.utah.dmr.data.PreparedDataset;
import edu.utah.dmr.data.SiteTable;

/**Scores spans of the combined site table.  Each dataset's sites between the span's first and last site ids
 * are combined with that dataset's correlation, then the per dataset results are inverse variance weighted
 * as independent studies.
 * @author Nix*/
public class MetaRegionScorer implements RegionScorer {
	
	private static final Logger log = LogManager.getLogger(MetaRegionScorer.class);
	
	//fields
	private final SiteTable combinedSites;
	private final PreparedDataset[] datasets;
	private final CorrelatedMetaAnalysis engine;
	
	public MetaRegionScorer (SiteTable combinedSites, PreparedDataset[] datasets, CorrelatedMetaAnalysis engine){
		this.combinedSites = combinedSites;
		this.datasets = datasets;
		this.engine = engine;
	}

	public SiteTable getSites() {
		return combinedSites;
	}

	public double z(int startIndex, int endIndex) {
		return stats(startIndex, endIndex).getZ();
	}

	public MetaStats stats(int startIndex, int endIndex) {
		String firstId = combinedSites.get(startIndex).getId();
		String lastId = combinedSites.get(endIndex).getId();
		double[] estimates = new double[datasets.length];
		double[] variances = new double[datasets.length];
		for (int i=0; i< datasets.length; i++){
			MetaStats ms = datasetStats(datasets[i], firstId, lastId);
			estimates[i] = ms.getEstimate();
			variances[i] = ms.getVariance();
		}
		return CrossDatasetCombiner.inverseVarianceWeight(estimates, variances);
	}
	
	private MetaStats datasetStats(PreparedDataset dataset, String firstId, String lastId){
		SiteTable sites = dataset.getSites();
		int start = sites.indexOf(firstId);
		int end = sites.indexOf(lastId);
		if (start == -1 || end == -1 || end < start) {
			log.debug("Span "+firstId+"-"+lastId+" doesn't map onto "+dataset.getName()+", using the null result");
			return engine.getNullStats();
		}
		return engine.stats(sites, dataset.getCorrelation(), start, end);
	}
}
