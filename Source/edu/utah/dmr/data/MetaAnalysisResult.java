package edu.utah.dmr.data;

/**Output of a multi dataset run, the combined per site table and the regions called from it.*/
public class MetaAnalysisResult {
	
	//fields
	private final SiteTable combinedSites;
	private final DmrRecord[] dmrs;
	
	//constructor
	public MetaAnalysisResult (SiteTable combinedSites, DmrRecord[] dmrs){
		this.combinedSites = combinedSites;
		this.dmrs = dmrs;
	}

	public SiteTable getCombinedSites() {
		return combinedSites;
	}
	public DmrRecord[] getDmrs() {
		return dmrs;
	}
}
