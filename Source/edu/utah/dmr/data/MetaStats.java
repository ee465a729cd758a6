package edu.utah.dmr.data;

import util.gen.Num;

/**A combined fixed effect estimate (B) and its variance (S).*/
public class MetaStats {
	
	//fields
	private final double estimate;
	private final double variance;
	
	//constructor
	public MetaStats (double estimate, double variance){
		this.estimate = estimate;
		this.variance = variance;
	}
	
	public String toString(){
		return estimate+"\t"+getSe()+"\t"+getZ()+"\t"+getPValue();
	}
	
	public double getSe(){
		return Math.sqrt(variance);
	}
	
	/**B/sqrt(S)*/
	public double getZ(){
		return estimate/Math.sqrt(variance);
	}
	
	/**Two sided p-value of the z-score.*/
	public double getPValue(){
		return Num.twoSidedPValue(getZ());
	}
	
	public double getEstimate() {
		return estimate;
	}
	public double getVariance() {
		return variance;
	}
}
