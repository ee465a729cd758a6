package edu.utah.dmr.data;

/**One dataset ready for region calling: its sorted sites and the matching banded correlation.*/
public class PreparedDataset {
	
	//fields
	private final String name;
	private final SiteTable sites;
	private final BandedCorrelation correlation;
	
	//constructors
	/**@throws IllegalArgumentException if the correlation rows don't match the number of sites*/
	public PreparedDataset (String name, SiteTable sites, BandedCorrelation correlation){
		if (correlation.getNumberRows() != sites.size()) {
			throw new IllegalArgumentException("Dimension mismatch in "+name+": "+correlation.getNumberRows()+" correlation rows for "+sites.size()+" sites");
		}
		this.name = name;
		this.sites = sites;
		this.correlation = correlation;
	}
	
	/**For datasets prepared elsewhere.  The band rows follow the sites so the sites must already be sorted, 
	 * there is no way to put a band computed on another order back in line.
	 * @throws IllegalArgumentException if the sites aren't sorted or the shapes disagree*/
	public static PreparedDataset fromSorted(String name, Site[] sortedSites, double[][] band, int width){
		if (SiteTable.isSorted(sortedSites) == false) {
			throw new IllegalArgumentException("Sites in "+name+" must be sorted by chromosome and position to pair with a precomputed correlation band");
		}
		return new PreparedDataset(name, new SiteTable(sortedSites), new BandedCorrelation(band, width));
	}
	
	public String toString(){
		return name+"\t"+sites.size()+" sites\tbandwidth "+correlation.getWidth();
	}

	public String getName() {
		return name;
	}
	public SiteTable getSites() {
		return sites;
	}
	public BandedCorrelation getCorrelation() {
		return correlation;
	}
}
