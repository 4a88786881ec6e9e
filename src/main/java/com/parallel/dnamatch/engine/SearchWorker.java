package com.parallel.dnamatch.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.PrimitiveIterator;
import java.util.concurrent.Callable;

/**
 * Scores one worker's share of offsets and merges the local best into the shared result.
 * Scoring happens outside the lock; only the final comparison runs under it.
 */
public class SearchWorker implements Callable<SearchResult> {

    private static final Logger log = LoggerFactory.getLogger(SearchWorker.class);

    private final Sequence subject;
    private final Sequence pattern;
    private final int workerId;
    private final int workerCount;
    private final SharedResult shared;
    private final WorkerHook hook;

    public SearchWorker(Sequence subject, Sequence pattern, int workerId, int workerCount,
                        SharedResult shared, WorkerHook hook) {
        this.subject = subject;
        this.pattern = pattern;
        this.workerId = workerId;
        this.workerCount = workerCount;
        this.shared = shared;
        this.hook = hook;
    }

    /**
     * Best offset within {@code offsets}. A later offset replaces the current best only with a strictly
     * higher count, so ties keep the lowest offset.
     */
    public static SearchResult localBest(Sequence subject, Sequence pattern, Partitioner.Offsets offsets) {
        SearchResult best = SearchResult.NONE;
        PrimitiveIterator.OfInt it = offsets.iterator();
        while (it.hasNext()) {
            int offset = it.nextInt();
            int matches = Scorer.score(subject, pattern, offset);
            if (matches > best.count()) {
                best = new SearchResult(offset, matches);
            }
        }
        return best;
    }

    /**
     * @return the local best this worker submitted, or {@link SearchResult#NONE} when it had no offsets
     */
    @Override
    public SearchResult call() throws Exception {
        boolean succeeded = false;
        try {
            Partitioner.Offsets offsets = Partitioner.offsets(workerId, workerCount, subject.length());
            SearchResult best = localBest(subject, pattern, offsets);
            if (best.isNone()) {
                log.debug("Worker {} had no offsets, nothing to submit", workerId);
            } else {
                hook.beforeSubmit(workerId, best);
                boolean replaced = shared.merge(best);
                log.debug("Worker {} submitted {} over {} offsets (replaced={})",
                        workerId, best, offsets.size(), replaced);
            }
            succeeded = true;
            return best;
        } finally {
            hook.onExit(workerId, succeeded);
        }
    }
}
