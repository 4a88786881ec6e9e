package com.parallel.dnamatch.engine;

/**
 * Base type of every failure the search engine reports instead of a {@link SearchResult}.
 */
public class SearchEngineException extends Exception {

    public SearchEngineException(String message) {
        super(message);
    }

    public SearchEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
