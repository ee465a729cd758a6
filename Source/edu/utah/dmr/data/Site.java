package edu.utah.dmr.data;

import java.io.Serializable;

import util.gen.Num;

/**One measured genomic position with its association test statistics. Immutable.
 * @author Nix*/
public class Site implements Serializable {
	
	//fields
	private static final long serialVersionUID = 1L;
	private final String id;
	private final String chromosome;
	private final int position;
	private final double estimate;
	private final double se;
	private final double pValue;

	//constructors
	/**Derives the p-value from the estimate and standard error.*/
	public Site (String id, String chromosome, int position, double estimate, double se){
		this(id, chromosome, position, estimate, se, Double.NaN);
	}

	/**@param pValue pass NaN to derive it as 2*pnorm(-|estimate/se|)
	 * @throws IllegalArgumentException if the se isn't a positive finite number or the p-value is outside [0,1]*/
	public Site (String id, String chromosome, int position, double estimate, double se, double pValue){
		if (id == null || chromosome == null) throw new IllegalArgumentException("Site id and chromosome cannot be null");
		if (Double.isNaN(estimate) || Double.isInfinite(estimate)) throw new IllegalArgumentException("Estimate for site "+id+" is not a finite number: "+estimate);
		if ((se > 0 && Double.isInfinite(se) == false) == false) throw new IllegalArgumentException("Standard error for site "+id+" must be > 0, found "+se);
		if (Double.isNaN(pValue)) pValue = Num.twoSidedPValue(estimate/se);
		else if (pValue < 0 || pValue > 1) throw new IllegalArgumentException("P-value for site "+id+" must be within [0,1], found "+pValue);
		this.id = id;
		this.chromosome = chromosome;
		this.position = position;
		this.estimate = estimate;
		this.se = se;
		this.pValue = pValue;
	}

	public String toString(){
		return id+"\t"+chromosome+"\t"+position+"\t"+estimate+"\t"+se+"\t"+getZ()+"\t"+pValue;
	}

	/**Returns true if both sites are on the same chromosome.*/
	public boolean sameChromosome(Site other){
		return chromosome.equals(other.chromosome);
	}

	public double getZ(){
		return estimate/se;
	}
	public String getId() {
		return id;
	}
	public String getChromosome() {
		return chromosome;
	}
	public int getPosition() {
		return position;
	}
	public double getEstimate() {
		return estimate;
	}
	public double getSe() {
		return se;
	}
	public double getPValue() {
		return pValue;
	}
}
