package com.parallel.dnamatch;

import com.parallel.dnamatch.engine.SearchResult;

/**
 * Outcome and timing of a single execution of a search strategy.
 */
public record MatchReport(
        String method,
        String dataset,
        int position,
        int count,
        long durationMillis,
        Integer workers,
        String deviceType) {

    public SearchResult result() {
        return new SearchResult(position, count);
    }
}
