package edu.utah.dmr.analysis;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.utah.dmr.data.CandidateRegion;
import edu.utah.dmr.data.DmrRecord;
import edu.utah.dmr.data.MetaStats;
import edu.utah.dmr.data.ShrunkRegion;
import edu.utah.dmr.data.SiteTable;

/**Candidate detection, parallel shrinking and collation over the sites of a RegionScorer.  Candidates are 
 * independent so ShrinkWorkers pull them one at a time, results land in slots keyed by candidate index, and 
 * collation waits for every worker since the test count spans all candidates.
 * @author Nix*/
public class DmrPipeline {
	
	private static final Logger log = LogManager.getLogger(DmrPipeline.class);
	
	//fields
	private final RegionScorer scorer;
	private final DmrConfig config;
	private CandidateRegion[] candidates;
	private ShrunkRegion[] shrunk;
	private MetaStats[] stats;
	private int nextCandidateIndex = 0;
	
	public DmrPipeline (RegionScorer scorer, DmrConfig config){
		this.scorer = scorer;
		this.config = config;
	}
	
	/**@throws IllegalStateException if a worker fails or the wait is interrupted*/
	public DmrRecord[] run(){
		SiteTable sites = scorer.getSites();
		candidates = CandidateDetector.detect(sites, config.getPValueCutoff(), config.getMaxGap());
		shrunk = new ShrunkRegion[candidates.length];
		stats = new MetaStats[candidates.length];
		nextCandidateIndex = 0;
		
		if (candidates.length != 0) shrinkCandidates();
		
		return ResultCollator.collate(sites, shrunk, stats);
	}
	
	private void shrinkCandidates(){
		int numberThreads = Math.min(config.fetchNumberThreads(), candidates.length);
		ShrinkWorker[] workers = new ShrinkWorker[numberThreads];
		for (int i=0; i< workers.length; i++) workers[i] = new ShrinkWorker(this, scorer);
		
		ExecutorService executor = Executors.newFixedThreadPool(numberThreads);
		for (ShrinkWorker w: workers) executor.execute(w);
		executor.shutdown();
		try {
			while (executor.awaitTermination(1, TimeUnit.MINUTES) == false) {
				log.debug("Waiting on "+numberThreads+" shrink workers...");
			}
		} catch (InterruptedException e) {
			executor.shutdownNow();
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while shrinking candidate regions", e);
		}
		
		//check workers
		for (ShrinkWorker w: workers) {
			if (w.isFailed()) throw new IllegalStateException("Shrink worker failed, aborting", w.getFailure());
			log.debug("\t"+w.getNumberProcessed()+" candidates shrunk by one worker");
		}
		log.debug("Shrunk "+candidates.length+" candidates with "+numberThreads+" threads");
	}
	
	/**Returns the next candidate index to process or -1 when all have been handed out.*/
	synchronized int nextCandidate(){
		if (nextCandidateIndex >= candidates.length) return -1;
		return nextCandidateIndex++;
	}
	
	CandidateRegion getCandidate(int index){
		return candidates[index];
	}
	
	synchronized void save(int index, ShrunkRegion region, MetaStats regionStats){
		shrunk[index] = region;
		stats[index] = regionStats;
	}

	/**Candidates from the last run, in position order.*/
	public CandidateRegion[] getCandidates() {
		return candidates;
	}
	
	/**Shrunk spans from the last run, in candidate order.*/
	public ShrunkRegion[] getShrunk() {
		return shrunk;
	}
}
