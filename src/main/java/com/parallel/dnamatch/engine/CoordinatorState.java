package com.parallel.dnamatch.engine;

/**
 * Lifecycle of one search run.
 */
public enum CoordinatorState {
    INIT,
    SPAWNING,
    AWAITING,
    DONE,
    FAILED
}
