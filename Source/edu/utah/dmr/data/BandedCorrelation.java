package edu.utah.dmr.data;

/**Correlations between each site and the next width sites along the genome.  Row i, column k-1 holds the 
 * correlation between site i and site i+k.  Entries past the end of the table or across a chromosome 
 * boundary are NaN and never read.  The full site by site matrix is never stored.
 * @author Nix*/
public class BandedCorrelation {
	
	//fields
	private final double[][] band;
	private final int width;
	
	//constructor
	/**Takes ownership of the band, callers shouldn't modify it afterwards.
	 * @throws IllegalArgumentException if a row doesn't have width columns*/
	public BandedCorrelation (double[][] band, int width){
		if (width < 1) throw new IllegalArgumentException("Correlation bandwidth must be >= 1, found "+width);
		for (int i=0; i< band.length; i++){
			if (band[i].length != width) throw new IllegalArgumentException("Dimension mismatch: correlation row "+i+" has "+band[i].length+" columns, expected "+width);
		}
		this.band = band;
		this.width = width;
	}
	
	/**Returns the correlation between site index and site index+offset, offset must be within 1 and width.*/
	public double get(int index, int offset){
		return band[index][offset-1];
	}
	
	/**Returns true if a span of this many sites can be rebuilt from the band.*/
	public boolean covers(int numberSites){
		return numberSites <= width + 1;
	}
	
	/**Rebuilds the dense correlation matrix for sites start to end, inclusive.  
	 * @param diagonal value placed on the diagonal, slightly > 1 to keep the matrix invertible
	 * @throws IllegalArgumentException if the span is wider than the band*/
	public double[][] extract(int start, int end, double diagonal){
		int k = end - start + 1;
		if (covers(k) == false) throw new IllegalArgumentException("Span of "+k+" sites exceeds the correlation bandwidth "+width);
		double[][] rho = new double[k][k];
		for (int i=0; i< k; i++){
			rho[i][i] = diagonal;
			for (int j=i+1; j< k; j++){
				double r = band[start+i][j-i-1];
				rho[i][j] = r;
				rho[j][i] = r;
			}
		}
		return rho;
	}

	public int getWidth() {
		return width;
	}
	
	public int getNumberRows() {
		return band.length;
	}
}
