package edu.utah.dmr.analysis;

import edu.utah.dmr.data.MetaStats;
import edu.utah.dmr.data.SiteTable;

/**Scores a span of sites in a SiteTable.  One implementation per run mode, single dataset or multi dataset. 
 * Implementations must be safe to call from several worker threads at once.*/
public interface RegionScorer {
	
	/**The table the start and end indexes refer to.*/
	public SiteTable getSites();
	
	/**Combined z-score of sites startIndex to endIndex, inclusive.*/
	public double z(int startIndex, int endIndex);
	
	/**Combined estimate and variance of sites startIndex to endIndex, inclusive.*/
	public MetaStats stats(int startIndex, int endIndex);
}
