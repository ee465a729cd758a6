package edu.utah.dmr.data;

/**Inclusive start and end indexes of a run of significant, same sign, closely spaced sites in a SiteTable.*/
public class CandidateRegion {
	
	//fields
	private final int startIndex;
	private final int endIndex;
	
	//constructor
	public CandidateRegion (int startIndex, int endIndex){
		if (startIndex < 0 || endIndex < startIndex) throw new IllegalArgumentException("Bad candidate span "+startIndex+"-"+endIndex);
		this.startIndex = startIndex;
		this.endIndex = endIndex;
	}
	
	public String toString(){
		return startIndex+"\t"+endIndex;
	}
	
	public int getNumberSites(){
		return endIndex - startIndex + 1;
	}
	public int getStartIndex() {
		return startIndex;
	}
	public int getEndIndex() {
		return endIndex;
	}
}
