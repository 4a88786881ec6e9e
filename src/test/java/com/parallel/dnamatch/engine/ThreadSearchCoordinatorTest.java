package com.parallel.dnamatch.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThreadSearchCoordinatorTest {

    @Test
    void exactMatchWithSingleWorker() throws Exception {
        ThreadSearchCoordinator coordinator = new ThreadSearchCoordinator();
        SearchResult result = coordinator.search(Sequence.of("GATTACA"), Sequence.of("ACA"), 1);
        assertEquals(new SearchResult(4, 3), result);
        assertEquals(CoordinatorState.DONE, coordinator.state());
    }

    @Test
    void tiesResolveToLowestPosition() throws Exception {
        SearchResult result = new ThreadSearchCoordinator().search(Sequence.of("AAAA"), Sequence.of("AA"), 2);
        assertEquals(new SearchResult(0, 2), result);
    }

    @Test
    void oneOffsetPerWorker() throws Exception {
        String subject = "TTGACGTACGGA";
        String pattern = "ACGG";
        SearchResult result = new ThreadSearchCoordinator()
                .search(Sequence.of(subject), Sequence.of(pattern), subject.length());
        assertEquals(BruteForce.best(subject, pattern), result);
        assertEquals(new SearchResult(7, 4), result);
    }

    @Test
    void moreWorkersThanOffsetsIsAccepted() throws Exception {
        SearchResult result = new ThreadSearchCoordinator().search(Sequence.of("ACG"), Sequence.of("CG"), 5);
        assertEquals(new SearchResult(1, 2), result);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 7, 16})
    void agreesWithExhaustiveScan(int workers) throws Exception {
        Random random = new Random(42 + workers);
        String subject = BruteForce.randomDna(random, 5_000);
        String pattern = BruteForce.randomDna(random, 25);
        SearchResult result = new ThreadSearchCoordinator().search(Sequence.of(subject), Sequence.of(pattern), workers);
        assertEquals(BruteForce.best(subject, pattern), result);
    }

    @Test
    void repeatedRunsGiveTheSameResult() throws Exception {
        // short alphabet-poor subject: many offsets tie on the best count
        String subject = BruteForce.randomDna(new Random(7), 2_000).replace('G', 'A').replace('T', 'C');
        String pattern = "ACACCA";
        SearchResult expected = BruteForce.best(subject, pattern);
        ThreadSearchCoordinator coordinator = new ThreadSearchCoordinator();
        for (int run = 0; run < 25; run++) {
            assertEquals(expected, coordinator.search(Sequence.of(subject), Sequence.of(pattern), 8));
        }
    }

    @Test
    void lowerPositionWinsEvenWhenSubmittedLast() throws Exception {
        CountDownLatch higherPositionMerged = new CountDownLatch(1);
        WorkerHook hook = new WorkerHook() {
            @Override
            public void beforeSubmit(int workerId, SearchResult localBest) throws Exception {
                if (workerId == 0 && !higherPositionMerged.await(10, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("worker 1 never merged");
                }
            }

            @Override
            public void onExit(int workerId, boolean succeeded) {
                if (workerId == 1) {
                    higherPositionMerged.countDown();
                }
            }
        };
        RecordingSharedResult[] shared = new RecordingSharedResult[1];
        ThreadSearchCoordinator coordinator = new ThreadSearchCoordinator(
                () -> shared[0] = new RecordingSharedResult(new LockedSharedResult()),
                ThreadSearchCoordinator.workerThreadFactory(), hook);

        SearchResult result = coordinator.search(Sequence.of("AAAA"), Sequence.of("AA"), 2);

        assertEquals(new SearchResult(0, 2), result);
        assertEquals(List.of(new SearchResult(1, 2), new SearchResult(0, 2)), shared[0].writes());
    }

    @Test
    void mergedValuesOnlyImprove() throws Exception {
        RecordingSharedResult[] shared = new RecordingSharedResult[1];
        ThreadSearchCoordinator coordinator = new ThreadSearchCoordinator(
                () -> shared[0] = new RecordingSharedResult(new LockedSharedResult()),
                ThreadSearchCoordinator.workerThreadFactory(), WorkerHook.NONE);
        Random random = new Random(3);
        String subject = BruteForce.randomDna(random, 4_000);
        String pattern = BruteForce.randomDna(random, 12);

        SearchResult result = coordinator.search(Sequence.of(subject), Sequence.of(pattern), 12);

        List<SearchResult> writes = shared[0].writes();
        assertFalse(writes.isEmpty());
        for (int i = 1; i < writes.size(); i++) {
            assertTrue(writes.get(i).isBetterThan(writes.get(i - 1)), "merge went backwards: " + writes);
        }
        assertEquals(result, writes.get(writes.size() - 1));
        assertEquals(1, shared[0].closes());
    }

    @Test
    void failingWorkerFailsTheSearchAfterAllWorkersExit() {
        int workers = 6;
        Map<Integer, Boolean> exits = new ConcurrentHashMap<>();
        WorkerHook hook = new WorkerHook() {
            @Override
            public void beforeSubmit(int workerId, SearchResult localBest) {
                if (workerId == 2) {
                    throw new IllegalStateException("simulated fault");
                }
            }

            @Override
            public void onExit(int workerId, boolean succeeded) {
                exits.put(workerId, succeeded);
            }
        };
        RecordingThreadFactory threads = new RecordingThreadFactory(Integer.MAX_VALUE);
        RecordingSharedResult[] shared = new RecordingSharedResult[1];
        ThreadSearchCoordinator coordinator = new ThreadSearchCoordinator(
                () -> shared[0] = new RecordingSharedResult(new LockedSharedResult()), threads, hook);

        WorkerFailureException failure = assertThrows(WorkerFailureException.class,
                () -> coordinator.search(Sequence.of("GATTACAGATTACA"), Sequence.of("ACA"), workers));

        assertEquals(List.of(2), failure.failedWorkers());
        assertTrue(failure.getCause() instanceof IllegalStateException);
        assertEquals(CoordinatorState.FAILED, coordinator.state());
        assertEquals(workers, exits.size());
        assertFalse(exits.get(2));
        exits.forEach((id, ok) -> assertTrue(id == 2 || ok));
        assertEquals(workers, threads.created.size());
        threads.created.forEach(t -> assertFalse(t.isAlive()));
        assertEquals(1, shared[0].closes());
    }

    @Test
    void spawnFailureReapsStartedWorkers() {
        RecordingThreadFactory threads = new RecordingThreadFactory(3);
        RecordingSharedResult[] shared = new RecordingSharedResult[1];
        ThreadSearchCoordinator coordinator = new ThreadSearchCoordinator(
                () -> shared[0] = new RecordingSharedResult(new LockedSharedResult()), threads, WorkerHook.NONE);

        assertThrows(ResourceException.class,
                () -> coordinator.search(Sequence.of("GATTACA"), Sequence.of("ACA"), 5));

        assertEquals(CoordinatorState.FAILED, coordinator.state());
        assertEquals(3, threads.created.size());
        threads.created.forEach(t -> assertFalse(t.isAlive()));
        assertEquals(1, shared[0].closes());
    }

    @Test
    void sharedStateAllocationFailureIsAResourceError() {
        ThreadSearchCoordinator coordinator = new ThreadSearchCoordinator(
                () -> {
                    throw new ResourceException("no memory for shared result");
                },
                ThreadSearchCoordinator.workerThreadFactory(), WorkerHook.NONE);

        assertThrows(ResourceException.class,
                () -> coordinator.search(Sequence.of("GATTACA"), Sequence.of("ACA"), 2));
        assertEquals(CoordinatorState.FAILED, coordinator.state());
    }

    @Test
    void invalidConfigurationIsRejectedBeforeSpawning() {
        RecordingThreadFactory threads = new RecordingThreadFactory(Integer.MAX_VALUE);
        ThreadSearchCoordinator coordinator = new ThreadSearchCoordinator(LockedSharedResult::new, threads, WorkerHook.NONE);

        assertThrows(ConfigurationException.class,
                () -> coordinator.search(Sequence.of("GATTACA"), Sequence.of("ACA"), 0));
        assertThrows(ConfigurationException.class,
                () -> coordinator.search(Sequence.of("GATTACA"), Sequence.of(""), 2));
        assertThrows(ConfigurationException.class,
                () -> coordinator.search(Sequence.of(""), Sequence.of("ACA"), 2));
        assertTrue(threads.created.isEmpty());
        assertEquals(CoordinatorState.FAILED, coordinator.state());
    }

    @Test
    void coordinatorCanBeReusedAfterFailure() throws Exception {
        ThreadSearchCoordinator coordinator = new ThreadSearchCoordinator();
        assertThrows(ConfigurationException.class,
                () -> coordinator.search(Sequence.of("GATTACA"), Sequence.of("ACA"), -1));
        assertEquals(new SearchResult(4, 3), coordinator.search(Sequence.of("GATTACA"), Sequence.of("ACA"), 3));
        assertEquals(CoordinatorState.DONE, coordinator.state());
    }

    /**
     * Hands out real threads until the limit, then refuses.
     */
    private static final class RecordingThreadFactory implements ThreadFactory {
        private final int limit;
        private final AtomicInteger issued = new AtomicInteger();
        final List<Thread> created = new CopyOnWriteArrayList<>();

        RecordingThreadFactory(int limit) {
            this.limit = limit;
        }

        @Override
        public Thread newThread(Runnable r) {
            if (issued.getAndIncrement() >= limit) {
                return null;
            }
            Thread thread = new Thread(r, "test-worker-" + created.size());
            created.add(thread);
            return thread;
        }
    }
}
