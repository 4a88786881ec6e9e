package com.parallel.dnamatch.engine;

/**
 * Observation points in a worker's life. Throwing from {@link #beforeSubmit} makes the worker fail.
 */
public interface WorkerHook {

    WorkerHook NONE = new WorkerHook() {
    };

    default void beforeSubmit(int workerId, SearchResult localBest) throws Exception {
    }

    default void onExit(int workerId, boolean succeeded) {
    }
}
