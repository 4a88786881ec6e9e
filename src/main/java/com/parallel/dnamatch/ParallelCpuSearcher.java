package com.parallel.dnamatch;

import com.parallel.dnamatch.engine.SearchCoordinator;
import com.parallel.dnamatch.engine.SearchEngineException;
import com.parallel.dnamatch.engine.SearchResult;
import com.parallel.dnamatch.engine.Sequence;
import com.parallel.dnamatch.engine.ThreadSearchCoordinator;

/**
 * Parallel search on CPU with one thread per worker, interleaving the offsets between them.
 */
public class ParallelCpuSearcher implements BestMatchSearcher {

    private final int threadCount;
    private final SearchCoordinator coordinator = new ThreadSearchCoordinator();

    public ParallelCpuSearcher(int threadCount) {
        this.threadCount = Math.max(1, threadCount);
    }

    @Override
    public String name() {
        return "ParallelCPU";
    }

    @Override
    public MatchReport search(String datasetName, Sequence subject, Sequence pattern) throws SearchEngineException {
        long start = System.nanoTime();
        SearchResult best = coordinator.search(subject, pattern, threadCount);
        long elapsed = System.nanoTime() - start;
        return new MatchReport(name(), datasetName, best.position(), best.count(), elapsed / 1_000_000, threadCount, "CPU");
    }
}
