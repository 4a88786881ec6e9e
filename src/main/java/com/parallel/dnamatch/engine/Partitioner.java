package com.parallel.dnamatch.engine;

import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/**
 * Interleaved assignment of starting offsets: worker {@code i} of {@code n} gets {@code i, i+n, i+2n, ...}.
 * Over all worker ids every offset in {@code [0, length)} is handed out exactly once, and a pattern of
 * any length costs every worker about the same.
 */
public final class Partitioner {

    private Partitioner() {
    }

    public static Offsets offsets(int workerId, int workerCount, int subjectLength) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1: " + workerCount);
        }
        if (workerId < 0 || workerId >= workerCount) {
            throw new IllegalArgumentException("workerId " + workerId + " outside [0, " + workerCount + ")");
        }
        if (subjectLength < 0) {
            throw new IllegalArgumentException("subjectLength must be >= 0: " + subjectLength);
        }
        return new Offsets(workerId, workerCount, subjectLength);
    }

    /**
     * Lazy stride over one worker's offsets. Each call to {@link #iterator()} starts over.
     */
    public record Offsets(int first, int stride, int bound) implements Iterable<Integer> {

        public Offsets {
            if (stride < 1) {
                throw new IllegalArgumentException("stride must be >= 1: " + stride);
            }
        }

        public int size() {
            return first >= bound ? 0 : (bound - first - 1) / stride + 1;
        }

        @Override
        public PrimitiveIterator.OfInt iterator() {
            return new PrimitiveIterator.OfInt() {
                private long next = first;

                @Override
                public boolean hasNext() {
                    return next < bound;
                }

                @Override
                public int nextInt() {
                    if (next >= bound) {
                        throw new NoSuchElementException();
                    }
                    int current = (int) next;
                    next += stride;
                    return current;
                }
            };
        }
    }
}
