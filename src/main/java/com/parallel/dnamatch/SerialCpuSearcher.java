package com.parallel.dnamatch;

import com.parallel.dnamatch.engine.Partitioner;
import com.parallel.dnamatch.engine.SearchResult;
import com.parallel.dnamatch.engine.SearchWorker;
import com.parallel.dnamatch.engine.Sequence;

/**
 * Serial search on CPU: one scan over every offset, no shared state. Reference for the parallel strategies.
 */
public class SerialCpuSearcher implements BestMatchSearcher {

    @Override
    public String name() {
        return "SerialCPU";
    }

    @Override
    public MatchReport search(String datasetName, Sequence subject, Sequence pattern) {
        long start = System.nanoTime();
        SearchResult best = SearchWorker.localBest(subject, pattern, Partitioner.offsets(0, 1, subject.length()));
        long elapsed = System.nanoTime() - start;
        return new MatchReport(name(), datasetName, best.position(), best.count(), elapsed / 1_000_000, 1, "CPU");
    }
}
