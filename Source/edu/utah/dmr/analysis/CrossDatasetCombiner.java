package edu.utah.dmr.analysis;

import java.util.ArrayList;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.utah.dmr.data.MetaStats;
import edu.utah.dmr.data.PreparedDataset;
import edu.utah.dmr.data.Site;
import edu.utah.dmr.data.SiteTable;

/**Combines statistics across independent datasets with standard inverse variance weighting, no cross dataset 
 * correlation term.  Used on each shared site before candidate detection and on each dataset's region 
 * statistics after shrinking.
 * @author Nix*/
public class CrossDatasetCombiner {
	
	private static final Logger log = LogManager.getLogger(CrossDatasetCombiner.class);
	
	/**@throws IllegalArgumentException if fewer than two datasets are provided*/
	public static void checkDatasets(PreparedDataset[] datasets){
		if (datasets == null || datasets.length < 2) {
			throw new IllegalArgumentException("At least two datasets are needed for a meta analysis, found "+(datasets == null ? 0 : datasets.length));
		}
	}
	
	/**Fixed effect combination of independent estimates, B = sum(e/v)/sum(1/v), S = 1/sum(1/v).*/
	public static MetaStats inverseVarianceWeight(double[] estimates, double[] variances){
		double totalWeight = 0;
		double weighted = 0;
		for (int i=0; i< estimates.length; i++){
			double w = 1.0 / variances[i];
			totalWeight += w;
			weighted += w * estimates[i];
		}
		return new MetaStats(weighted / totalWeight, 1.0 / totalWeight);
	}
	
	/**Builds the combined site table over the ids present in every dataset.  Chromosome and position come 
	 * from the first dataset.  An empty table is returned if no id is shared.*/
	public static SiteTable combineSites(PreparedDataset[] datasets){
		checkDatasets(datasets);
		SiteTable first = datasets[0].getSites();
		ArrayList<Site> combined = new ArrayList<Site>();
		double[] estimates = new double[datasets.length];
		double[] variances = new double[datasets.length];
		
		for (int i=0; i< first.size(); i++){
			String id = first.get(i).getId();
			boolean shared = true;
			for (int d=0; d< datasets.length; d++){
				int index = datasets[d].getSites().indexOf(id);
				if (index == -1) {
					shared = false;
					break;
				}
				Site s = datasets[d].getSites().get(index);
				estimates[d] = s.getEstimate();
				variances[d] = s.getSe() * s.getSe();
			}
			if (shared == false) continue;
			MetaStats ms = inverseVarianceWeight(estimates, variances);
			combined.add(new Site(id, first.get(i).getChromosome(), first.get(i).getPosition(), ms.getEstimate(), ms.getSe()));
		}
		
		if (combined.size() == 0) log.warn("No site ids are shared by all "+datasets.length+" datasets");
		else log.info(combined.size()+" sites shared by all "+datasets.length+" datasets");
		Site[] s = new Site[combined.size()];
		combined.toArray(s);
		return new SiteTable(s);
	}
}
