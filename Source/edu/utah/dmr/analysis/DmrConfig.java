package edu.utah.dmr.analysis;

/**Settings for one region calling run.  Passed explicitly into each entry point, nothing is read from global state.*/
public class DmrConfig {
	
	//fields
	private int bandwidth = 20;
	private int maxGap = 500;
	private double pValueCutoff = 0.05;
	private int numberThreads = 1;
	private double diagonalRegularizer = 1.05;
	private double nullEstimate = 0;
	private double nullVariance = 1;
	
	/**@throws IllegalArgumentException if any setting is out of range*/
	public void validate(){
		if (bandwidth < 1) throw new IllegalArgumentException("Correlation bandwidth must be >= 1, found "+bandwidth);
		if (maxGap < 0) throw new IllegalArgumentException("Maximum gap must be >= 0, found "+maxGap);
		if (pValueCutoff <= 0 || pValueCutoff > 1) throw new IllegalArgumentException("P-value cutoff must be within (0,1], found "+pValueCutoff);
		if (diagonalRegularizer < 1) throw new IllegalArgumentException("Diagonal regularizer must be >= 1, found "+diagonalRegularizer);
		if ((nullVariance > 0) == false) throw new IllegalArgumentException("Null result variance must be > 0, found "+nullVariance);
	}
	
	/**Returns the number of worker threads to use, values < 1 or more than are available are reset to the 
	 * number of available processors.*/
	public int fetchNumberThreads(){
		int numAvail = Runtime.getRuntime().availableProcessors();
		if (numberThreads < 1 || numberThreads > numAvail) return numAvail;
		return numberThreads;
	}
	
	public String toString(){
		StringBuilder sb = new StringBuilder();
		sb.append(bandwidth).append("\tCorrelation bandwidth\n");
		sb.append(maxGap).append("\tMax gap between sites\n");
		sb.append(pValueCutoff).append("\tSite p-value cutoff\n");
		sb.append(diagonalRegularizer).append("\tCorrelation diagonal\n");
		sb.append(numberThreads).append("\tThreads");
		return sb.toString();
	}

	public int getBandwidth() {
		return bandwidth;
	}
	public void setBandwidth(int bandwidth) {
		this.bandwidth = bandwidth;
	}
	public int getMaxGap() {
		return maxGap;
	}
	public void setMaxGap(int maxGap) {
		this.maxGap = maxGap;
	}
	public double getPValueCutoff() {
		return pValueCutoff;
	}
	public void setPValueCutoff(double pValueCutoff) {
		this.pValueCutoff = pValueCutoff;
	}
	public int getNumberThreads() {
		return numberThreads;
	}
	public void setNumberThreads(int numberThreads) {
		this.numberThreads = numberThreads;
	}
	public double getDiagonalRegularizer() {
		return diagonalRegularizer;
	}
	public void setDiagonalRegularizer(double diagonalRegularizer) {
		this.diagonalRegularizer = diagonalRegularizer;
	}
	public double getNullEstimate() {
		return nullEstimate;
	}
	public void setNullEstimate(double nullEstimate) {
		this.nullEstimate = nullEstimate;
	}
	public double getNullVariance() {
		return nullVariance;
	}
	public void setNullVariance(double nullVariance) {
		this.nullVariance = nullVariance;
	}
}
