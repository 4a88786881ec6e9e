package com.parallel.dnamatch.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps a shared result and remembers every value written and every release of the backing resources.
 */
class RecordingSharedResult implements SharedResult {

    private final SharedResult delegate;
    private final List<SearchResult> writes = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger closes = new AtomicInteger();

    RecordingSharedResult(SharedResult delegate) {
        this.delegate = delegate;
    }

    @Override
    public void acquire() throws ResourceException {
        delegate.acquire();
    }

    @Override
    public void release() throws ResourceException {
        delegate.release();
    }

    @Override
    public SearchResult read() {
        return delegate.read();
    }

    @Override
    public void write(SearchResult value) {
        writes.add(value);
        delegate.write(value);
    }

    @Override
    public void close() throws ResourceException {
        closes.incrementAndGet();
        delegate.close();
    }

    List<SearchResult> writes() {
        synchronized (writes) {
            return new ArrayList<>(writes);
        }
    }

    int closes() {
        return closes.get();
    }
}
