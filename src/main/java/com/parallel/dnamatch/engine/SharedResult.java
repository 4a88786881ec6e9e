package com.parallel.dnamatch.engine;

/**
 * The single cross-worker best result plus the lock that guards it.
 * <p>
 * {@link #read()} and {@link #write(SearchResult)} may only be called between {@link #acquire()} and
 * {@link #release()}, except for the final lock-free read once every worker has terminated.
 * {@link #close()} releases the backing resources and must happen exactly once.
 */
public interface SharedResult extends AutoCloseable {

    /**
     * Blocks until the exclusive lock is held.
     */
    void acquire() throws ResourceException;

    void release() throws ResourceException;

    SearchResult read();

    void write(SearchResult value);

    /**
     * Applies the merge rule under the lock: the candidate replaces the shared value only when it has a
     * higher count, or the same count at a lower position.
     *
     * @return whether the shared value was replaced
     */
    default boolean merge(SearchResult candidate) throws ResourceException {
        acquire();
        try {
            if (candidate.isBetterThan(read())) {
                write(candidate);
                return true;
            }
            return false;
        } finally {
            release();
        }
    }

    @Override
    void close() throws ResourceException;
}
