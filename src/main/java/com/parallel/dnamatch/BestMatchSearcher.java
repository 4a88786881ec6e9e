package com.parallel.dnamatch;

import com.parallel.dnamatch.engine.Sequence;

/**
 * Base contract for best-match search strategies.
 */
public interface BestMatchSearcher {
    String name();

    MatchReport search(String datasetName, Sequence subject, Sequence pattern) throws Exception;
}
