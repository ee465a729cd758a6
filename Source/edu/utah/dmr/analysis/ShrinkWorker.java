package edu.utah.dmr.analysis;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.utah.dmr.data.CandidateRegion;
import edu.utah.dmr.data.MetaStats;
import edu.utah.dmr.data.ShrunkRegion;

/**Pulls candidate indexes from the DmrPipeline, shrinks each one and calculates the final stats for the chosen span.*/
public class ShrinkWorker implements Runnable {
	
	private static final Logger log = LogManager.getLogger(ShrinkWorker.class);
	
	//fields
	private final DmrPipeline pipeline;
	private final RegionScorer scorer;
	private boolean failed = false;
	private Exception failure = null;
	private int numberProcessed = 0;
	
	public ShrinkWorker (DmrPipeline pipeline, RegionScorer scorer){
		this.pipeline = pipeline;
		this.scorer = scorer;
	}

	public void run() {
		try {
			int index;
			while ((index = pipeline.nextCandidate()) != -1){
				CandidateRegion candidate = pipeline.getCandidate(index);
				ShrunkRegion shrunk = RegionShrinker.shrink(index, candidate, scorer);
				MetaStats stats = scorer.stats(shrunk.getStartIndex(), shrunk.getEndIndex());
				pipeline.save(index, shrunk, stats);
				numberProcessed++;
			}
		} catch (Exception e) {
			failed = true;
			failure = e;
			log.error("Problem shrinking candidate regions", e);
		}
	}

	public boolean isFailed() {
		return failed;
	}
	public Exception getFailure() {
		return failure;
	}
	public int getNumberProcessed() {
		return numberProcessed;
	}
}
