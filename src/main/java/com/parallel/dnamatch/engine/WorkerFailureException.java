package com.parallel.dnamatch.engine;

import java.util.List;

/**
 * One or more workers did not terminate successfully, so the merged result may be missing a submission.
 */
public class WorkerFailureException extends SearchEngineException {

    private final List<Integer> failedWorkers;

    public WorkerFailureException(List<Integer> failedWorkers, Throwable firstCause) {
        super("Worker(s) " + failedWorkers + " terminated abnormally", firstCause);
        this.failedWorkers = List.copyOf(failedWorkers);
    }

    public List<Integer> failedWorkers() {
        return failedWorkers;
    }
}
