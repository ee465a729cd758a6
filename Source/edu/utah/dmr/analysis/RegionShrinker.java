package edu.utah.dmr.analysis;

import edu.utah.dmr.data.CandidateRegion;
import edu.utah.dmr.data.ShrunkRegion;

/**Greedy search for the sub span of a candidate with the largest |z|.  Starting with the whole candidate, 
 * each step scores the span with one site trimmed off the left and the span with one trimmed off the right, 
 * moves to the better of the two if it beats the current |z|, and stops otherwise or at one site.  Every 
 * z-score calculated counts as a test for the multiple test correction.  Ties go to the left trim.
 * @author Nix*/
public class RegionShrinker {
	
	public static ShrunkRegion shrink(int candidateIndex, CandidateRegion candidate, RegionScorer scorer){
		int start = candidate.getStartIndex();
		int end = candidate.getEndIndex();
		
		//nothing to search
		if (start == end) return new ShrunkRegion(candidateIndex, start, end, Double.NaN, 0, 0);
		
		double z = scorer.z(start, end);
		int numberTests = 1;
		int numberTrims = 0;
		while (end > start){
			double zLeft = scorer.z(start+1, end);
			double zRight = scorer.z(start, end-1);
			numberTests += 2;
			double absLeft = Math.abs(zLeft);
			double absRight = Math.abs(zRight);
			double absCurrent = Math.abs(z);
			if (absLeft >= absRight && absLeft > absCurrent){
				start++;
				z = zLeft;
			}
			else if (absRight > absLeft && absRight > absCurrent){
				end--;
				z = zRight;
			}
			else break;
			numberTrims++;
		}
		return new ShrunkRegion(candidateIndex, start, end, z, numberTests, numberTrims);
	}
}
