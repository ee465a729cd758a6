package edu.utah.dmr.analysis;

import java.util.ArrayList;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.utah.dmr.data.CandidateRegion;
import edu.utah.dmr.data.Site;
import edu.utah.dmr.data.SiteTable;

/**Single left to right scan that splits the sorted sites into maximal runs where every site has a p-value
 * below the cutoff, all estimates share a sign, and neighbors sit on the same chromosome within maxGap bp.
 * @author Nix*/
public class CandidateDetector {
	
	private static final Logger log = LogManager.getLogger(CandidateDetector.class);
	
	/**Returns the candidates in position order, single site candidates included.*/
	public static CandidateRegion[] detect(SiteTable sites, double pValueCutoff, int maxGap){
		ArrayList<CandidateRegion> candidates = new ArrayList<CandidateRegion>();
		int start = -1;
		double sign = 0;
		for (int i=0; i< sites.size(); i++){
			Site site = sites.get(i);
			boolean significant = site.getPValue() < pValueCutoff;
			
			//extend or close the open candidate
			if (start != -1){
				Site prior = sites.get(i-1);
				boolean extend = significant && 
						Math.signum(site.getEstimate()) == sign && 
						site.sameChromosome(prior) && 
						(site.getPosition() - prior.getPosition()) <= maxGap;
				if (extend) continue;
				candidates.add(new CandidateRegion(start, i-1));
				start = -1;
			}
			
			//open a new one?
			if (significant){
				start = i;
				sign = Math.signum(site.getEstimate());
			}
		}
		if (start != -1) candidates.add(new CandidateRegion(start, sites.size()-1));
		
		log.info(candidates.size()+" candidate regions found in "+sites.size()+" sites, p < "+pValueCutoff+", max gap "+maxGap);
		CandidateRegion[] cr = new CandidateRegion[candidates.size()];
		candidates.toArray(cr);
		return cr;
	}
}
