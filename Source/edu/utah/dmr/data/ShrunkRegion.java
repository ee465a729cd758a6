package edu.utah.dmr.data;

/**The sub span of a CandidateRegion picked by the shrinker along with the bookkeeping needed for the multiple
 * test correction.*/
public class ShrunkRegion {
	
	//fields
	private final int candidateIndex;
	private final int startIndex;
	private final int endIndex;
	private final double z;
	private final int numberTests;
	private final int numberTrims;
	
	//constructor
	/**@param z the z-score of the chosen span, NaN when no test was run
	 * @param numberTests number of combined z-scores calculated while searching
	 * @param numberTrims number of accepted single site trims*/
	public ShrunkRegion (int candidateIndex, int startIndex, int endIndex, double z, int numberTests, int numberTrims){
		this.candidateIndex = candidateIndex;
		this.startIndex = startIndex;
		this.endIndex = endIndex;
		this.z = z;
		this.numberTests = numberTests;
		this.numberTrims = numberTrims;
	}
	
	public String toString(){
		return candidateIndex+"\t"+startIndex+"\t"+endIndex+"\t"+z+"\t"+numberTests+"\t"+numberTrims;
	}

	public int getNumberSites(){
		return endIndex - startIndex + 1;
	}
	public int getCandidateIndex() {
		return candidateIndex;
	}
	public int getStartIndex() {
		return startIndex;
	}
	public int getEndIndex() {
		return endIndex;
	}
	public double getZ() {
		return z;
	}
	public int getNumberTests() {
		return numberTests;
	}
	public int getNumberTrims() {
		return numberTrims;
	}
}
