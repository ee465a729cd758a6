package edu.utah.dmr.data;

/**A differentially methylated region, the final output unit.  Start and end index point back into the 
 * SiteTable the region was called from.
 * @author Nix*/
public class DmrRecord {
	
	public static final String HEADER = "Chr\tStart\tEnd\t#Sites\tEstimate\tSE\tZ\tPValue\tAdjPValue\tStartIndex\tEndIndex";
	
	//fields
	private final String chromosome;
	private final int start;
	private final int end;
	private final int numberSites;
	private final double estimate;
	private final double se;
	private final double z;
	private final double pValue;
	private final double adjustedPValue;
	private final int startIndex;
	private final int endIndex;

	//constructor
	public DmrRecord (String chromosome, int start, int end, int numberSites, double estimate, double se, double z, double pValue, double adjustedPValue, int startIndex, int endIndex){
		this.chromosome = chromosome;
		this.start = start;
		this.end = end;
		this.numberSites = numberSites;
		this.estimate = estimate;
		this.se = se;
		this.z = z;
		this.pValue = pValue;
		this.adjustedPValue = adjustedPValue;
		this.startIndex = startIndex;
		this.endIndex = endIndex;
	}
	
	/**Tab delimited, matches the HEADER.*/
	public String toString(){
		return chromosome+"\t"+start+"\t"+end+"\t"+numberSites+"\t"+estimate+"\t"+se+"\t"+z+"\t"+pValue+"\t"+adjustedPValue+"\t"+startIndex+"\t"+endIndex;
	}
	
	public boolean equals(Object o){
		if (this == o) return true;
		if (o instanceof DmrRecord == false) return false;
		DmrRecord other = (DmrRecord)o;
		return chromosome.equals(other.chromosome) && start == other.start && end == other.end && numberSites == other.numberSites && 
				startIndex == other.startIndex && endIndex == other.endIndex &&
				Double.compare(estimate, other.estimate) == 0 && Double.compare(se, other.se) == 0 && Double.compare(z, other.z) == 0 && 
				Double.compare(pValue, other.pValue) == 0 && Double.compare(adjustedPValue, other.adjustedPValue) == 0;
	}
	
	public int hashCode(){
		int h = chromosome.hashCode();
		h = 31 * h + start;
		h = 31 * h + end;
		h = 31 * h + Double.hashCode(estimate);
		return 31 * h + Double.hashCode(se);
	}

	public String getChromosome() {
		return chromosome;
	}
	public int getStart() {
		return start;
	}
	public int getEnd() {
		return end;
	}
	public int getNumberSites() {
		return numberSites;
	}
	public double getEstimate() {
		return estimate;
	}
	public double getSe() {
		return se;
	}
	public double getZ() {
		return z;
	}
	public double getPValue() {
		return pValue;
	}
	public double getAdjustedPValue() {
		return adjustedPValue;
	}
	public int getStartIndex() {
		return startIndex;
	}
	public int getEndIndex() {
		return endIndex;
	}
}
