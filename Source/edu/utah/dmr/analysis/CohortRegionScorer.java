package edu.utah.dmr.analysis;

import edu.utah.dmr.data.BandedCorrelation;
import edu.utah.dmr.data.MetaStats;
import edu.utah.dmr.data.PreparedDataset;
import edu.utah.dmr.data.SiteTable;

/**Scores spans within one dataset using its own banded correlation.*/
public class CohortRegionScorer implements RegionScorer {
	
	//fields
	private final SiteTable sites;
	private final BandedCorrelation rho;
	private final CorrelatedMetaAnalysis engine;
	
	public CohortRegionScorer (PreparedDataset dataset, CorrelatedMetaAnalysis engine){
		this.sites = dataset.getSites();
		this.rho = dataset.getCorrelation();
		this.engine = engine;
	}

	public SiteTable getSites() {
		return sites;
	}

	public double z(int startIndex, int endIndex) {
		return engine.z(sites, rho, startIndex, endIndex);
	}

	public MetaStats stats(int startIndex, int endIndex) {
		return engine.stats(sites, rho, startIndex, endIndex);
	}
}
