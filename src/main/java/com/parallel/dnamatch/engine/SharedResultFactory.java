package com.parallel.dnamatch.engine;

/**
 * Allocates a fresh {@link SharedResult} holding {@link SearchResult#NONE} with its lock released.
 */
@FunctionalInterface
public interface SharedResultFactory {

    SharedResult create() throws ResourceException;
}
