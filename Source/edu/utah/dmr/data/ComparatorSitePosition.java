package edu.utah.dmr.data;

import java.util.Comparator;

/**Sorts Sites by chromosome, then position, then id so that ties are broken the same way regardless of input order.*/
public class ComparatorSitePosition implements Comparator<Site> {

	public int compare(Site first, Site second) {
		int chrom = first.getChromosome().compareTo(second.getChromosome());
		if (chrom != 0) return chrom;
		if (first.getPosition() < second.getPosition()) return -1;
		if (first.getPosition() > second.getPosition()) return 1;
		return first.getId().compareTo(second.getId());
	}
}
