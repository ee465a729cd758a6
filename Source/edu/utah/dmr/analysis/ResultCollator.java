package edu.utah.dmr.analysis;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.utah.dmr.data.DmrRecord;
import edu.utah.dmr.data.MetaStats;
import edu.utah.dmr.data.ShrunkRegion;
import edu.utah.dmr.data.Site;
import edu.utah.dmr.data.SiteTable;

/**Turns shrunk spans and their stats into DmrRecords and applies a Bonferroni correction over every test run, 
 * one per site plus every z-score the shrinker calculated.  Records keep candidate order.
 * @author Nix*/
public class ResultCollator {
	
	private static final Logger log = LogManager.getLogger(ResultCollator.class);
	
	public static DmrRecord[] collate(SiteTable sites, ShrunkRegion[] shrunk, MetaStats[] stats){
		if (shrunk.length != stats.length) throw new IllegalArgumentException("Dimension mismatch: "+shrunk.length+" regions with "+stats.length+" stats");
		long numberTests = countTests(sites.size(), shrunk);
		log.info(shrunk.length+" regions, Bonferroni correcting for "+numberTests+" tests");
		
		DmrRecord[] dmrs = new DmrRecord[shrunk.length];
		for (int i=0; i< shrunk.length; i++){
			ShrunkRegion sr = shrunk[i];
			MetaStats ms = stats[i];
			Site first = sites.get(sr.getStartIndex());
			Site last = sites.get(sr.getEndIndex());
			double p = ms.getPValue();
			dmrs[i] = new DmrRecord(first.getChromosome(), first.getPosition(), last.getPosition(), sr.getNumberSites(), 
					ms.getEstimate(), ms.getSe(), ms.getZ(), p, bonferroni(p, numberTests), sr.getStartIndex(), sr.getEndIndex());
		}
		return dmrs;
	}
	
	/**Number of sites plus every shrinker test.*/
	public static long countTests(int numberSites, ShrunkRegion[] shrunk){
		long num = numberSites;
		for (ShrunkRegion sr: shrunk) num += sr.getNumberTests();
		return num;
	}
	
	/**p x number of tests, capped at 1.*/
	public static double bonferroni(double pValue, long numberTests){
		double adj = pValue * (double)numberTests;
		if (adj > 1) return 1;
		if (adj < pValue) return pValue;
		return adj;
	}
	
	/**Returns the sites making up the region, in position order.*/
	public static Site[] fetchSites(DmrRecord dmr, SiteTable sites){
		Site[] s = new Site[dmr.getNumberSites()];
		for (int i=0; i< s.length; i++) s[i] = sites.get(dmr.getStartIndex() + i);
		return s;
	}
}
