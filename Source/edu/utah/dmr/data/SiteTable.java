package edu.utah.dmr.data;

import java.util.Arrays;
import java.util.HashMap;

/**An immutable table of Sites sorted by chromosome and position.  Every downstream step addresses sites by
 * their index in this table.  The table remembers where each site came from so that parallel inputs, 
 * e.g. a measurement matrix, can be put in the same order.
 * @author Nix*/
public class SiteTable {
	
	//fields
	private final Site[] sites;
	private final int[] originalIndexes;
	private final HashMap<String, Integer> idIndex;
	
	//constructor
	/**Sorts a copy of the sites, the caller's array isn't touched.
	 * @throws IllegalArgumentException if a site id is used more than once*/
	public SiteTable (Site[] unsorted){
		Integer[] order = new Integer[unsorted.length];
		for (int i=0; i< order.length; i++) order[i] = i;
		final ComparatorSitePosition comp = new ComparatorSitePosition();
		Arrays.sort(order, (a, b) -> comp.compare(unsorted[a], unsorted[b]));
		
		sites = new Site[unsorted.length];
		originalIndexes = new int[unsorted.length];
		idIndex = new HashMap<String, Integer>(unsorted.length * 2);
		for (int i=0; i< order.length; i++){
			sites[i] = unsorted[order[i]];
			originalIndexes[i] = order[i];
			Integer prior = idIndex.put(sites[i].getId(), i);
			if (prior != null) throw new IllegalArgumentException("Site ids must be unique, found two '"+sites[i].getId()+"'");
		}
	}
	
	/**Returns true if the Sites are already in chromosome, position, id order.*/
	public static boolean isSorted(Site[] sites){
		ComparatorSitePosition comp = new ComparatorSitePosition();
		for (int i=1; i< sites.length; i++){
			if (comp.compare(sites[i-1], sites[i]) > 0) return false;
		}
		return true;
	}
	
	/**Returns the rows reordered to match this table, row i of the result is the row of site i.  
	 * The row arrays themselves are shared, not copied.
	 * @throws IllegalArgumentException if the number of rows differs from the number of sites*/
	public double[][] alignRows(double[][] rowsInInputOrder){
		if (rowsInInputOrder.length != sites.length) {
			throw new IllegalArgumentException("Dimension mismatch: "+rowsInInputOrder.length+" matrix rows for "+sites.length+" sites");
		}
		double[][] aligned = new double[sites.length][];
		for (int i=0; i< sites.length; i++) aligned[i] = rowsInInputOrder[originalIndexes[i]];
		return aligned;
	}
	
	/**Returns the index of the site with this id or -1 if not present.*/
	public int indexOf(String id){
		Integer index = idIndex.get(id);
		if (index == null) return -1;
		return index;
	}
	
	public boolean contains(String id){
		return idIndex.containsKey(id);
	}

	public Site get(int index){
		return sites[index];
	}

	public int size(){
		return sites.length;
	}
	
	/**Returns a copy of the sorted sites.*/
	public Site[] getSites(){
		return sites.clone();
	}
	
	/**Returns the index in the caller's original array of the site now at index.*/
	public int getOriginalIndex(int index){
		return originalIndexes[index];
	}
}
