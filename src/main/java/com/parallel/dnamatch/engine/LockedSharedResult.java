package com.parallel.dnamatch.engine;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process shared result for thread workers.
 */
public class LockedSharedResult implements SharedResult {

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile SearchResult value = SearchResult.NONE;

    @Override
    public void acquire() throws ResourceException {
        ensureOpen();
        lock.lock();
    }

    @Override
    public void release() throws ResourceException {
        if (!lock.isHeldByCurrentThread()) {
            throw new ResourceException("Lock released by a thread that does not hold it");
        }
        lock.unlock();
    }

    @Override
    public SearchResult read() {
        return value;
    }

    @Override
    public void write(SearchResult value) {
        this.value = value;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            throw new IllegalStateException("Shared result already released");
        }
    }

    private void ensureOpen() throws ResourceException {
        if (closed.get()) {
            throw new ResourceException("Shared result used after release");
        }
    }
}
