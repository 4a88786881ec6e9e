package com.parallel.dnamatch.engine;

/**
 * Shared state could not be allocated, locked or released, or a worker could not be started.
 */
public class ResourceException extends SearchEngineException {

    public ResourceException(String message) {
        super(message);
    }

    public ResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
