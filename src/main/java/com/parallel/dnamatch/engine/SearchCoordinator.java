package com.parallel.dnamatch.engine;

/**
 * Runs one partitioned best-match search across a number of workers and returns the merged result.
 */
public interface SearchCoordinator {

    SearchResult search(Sequence subject, Sequence pattern, int workerCount) throws SearchEngineException;

    /**
     * State of the most recent search on this coordinator.
     */
    CoordinatorState state();
}
