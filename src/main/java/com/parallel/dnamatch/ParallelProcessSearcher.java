package com.parallel.dnamatch;

import com.parallel.dnamatch.engine.ProcessSearchCoordinator;
import com.parallel.dnamatch.engine.SearchCoordinator;
import com.parallel.dnamatch.engine.SearchEngineException;
import com.parallel.dnamatch.engine.SearchResult;
import com.parallel.dnamatch.engine.Sequence;

/**
 * Parallel search with one child JVM per worker, merging through a memory-mapped record.
 * Timings include JVM start-up of every worker.
 */
public class ParallelProcessSearcher implements BestMatchSearcher {

    private final int processCount;
    private final SearchCoordinator coordinator = new ProcessSearchCoordinator();

    public ParallelProcessSearcher(int processCount) {
        this.processCount = Math.max(1, processCount);
    }

    @Override
    public String name() {
        return "ParallelProcess";
    }

    @Override
    public MatchReport search(String datasetName, Sequence subject, Sequence pattern) throws SearchEngineException {
        long start = System.nanoTime();
        SearchResult best = coordinator.search(subject, pattern, processCount);
        long elapsed = System.nanoTime() - start;
        return new MatchReport(name(), datasetName, best.position(), best.count(), elapsed / 1_000_000, processCount, "CPU");
    }
}
