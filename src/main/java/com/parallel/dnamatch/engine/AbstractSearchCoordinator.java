package com.parallel.dnamatch.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Validation and state tracking shared by the worker realisations. Subclasses allocate the shared
 * result, start the workers and wait for every one of them before returning or throwing.
 */
public abstract class AbstractSearchCoordinator implements SearchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AbstractSearchCoordinator.class);

    private volatile CoordinatorState state = CoordinatorState.INIT;

    @Override
    public final synchronized SearchResult search(Sequence subject, Sequence pattern, int workerCount)
            throws SearchEngineException {
        transition(CoordinatorState.INIT);
        try {
            validate(subject, pattern, workerCount);
            SearchResult result = execute(subject, pattern, workerCount);
            transition(CoordinatorState.DONE);
            log.debug("Search over {} symbols with {} workers finished: {}", subject.length(), workerCount, result);
            return result;
        } catch (SearchEngineException | RuntimeException e) {
            transition(CoordinatorState.FAILED);
            log.warn("Search with {} workers failed: {}", workerCount, e.getMessage());
            throw e;
        }
    }

    @Override
    public CoordinatorState state() {
        return state;
    }

    /**
     * Called with validated arguments. Must not return or throw while any started worker is still running.
     */
    protected abstract SearchResult execute(Sequence subject, Sequence pattern, int workerCount)
            throws SearchEngineException;

    protected void transition(CoordinatorState next) {
        log.debug("{} -> {}", state, next);
        state = next;
    }

    private static void validate(Sequence subject, Sequence pattern, int workerCount) throws ConfigurationException {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(pattern, "pattern");
        if (workerCount < 1) {
            throw new ConfigurationException("Worker count must be positive: " + workerCount);
        }
        if (subject.isEmpty() || pattern.isEmpty()) {
            throw new ConfigurationException("Subject and pattern must not be empty");
        }
    }
}
