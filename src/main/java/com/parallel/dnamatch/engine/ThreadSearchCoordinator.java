package com.parallel.dnamatch.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Workers are platform threads of this JVM merging into an in-process {@link SharedResult}.
 */
public class ThreadSearchCoordinator extends AbstractSearchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ThreadSearchCoordinator.class);

    private final SharedResultFactory sharedResultFactory;
    private final ThreadFactory threadFactory;
    private final WorkerHook hook;

    public ThreadSearchCoordinator() {
        this(LockedSharedResult::new, workerThreadFactory(), WorkerHook.NONE);
    }

    public ThreadSearchCoordinator(SharedResultFactory sharedResultFactory, ThreadFactory threadFactory,
                                   WorkerHook hook) {
        this.sharedResultFactory = sharedResultFactory;
        this.threadFactory = threadFactory;
        this.hook = hook;
    }

    public static ThreadFactory workerThreadFactory() {
        AtomicInteger sequence = new AtomicInteger();
        return r -> new Thread(r, "dnamatch-worker-" + sequence.getAndIncrement());
    }

    @Override
    protected SearchResult execute(Sequence subject, Sequence pattern, int workerCount) throws SearchEngineException {
        try (SharedResult shared = sharedResultFactory.create()) {
            transition(CoordinatorState.SPAWNING);
            List<RunningWorker> running = new ArrayList<>(workerCount);
            ResourceException spawnFailure = null;
            for (int id = 0; id < workerCount; id++) {
                FutureTask<SearchResult> task =
                        new FutureTask<>(new SearchWorker(subject, pattern, id, workerCount, shared, hook));
                try {
                    Thread thread = threadFactory.newThread(task);
                    if (thread == null) {
                        throw new ResourceException("Thread factory refused worker " + id);
                    }
                    thread.start();
                    running.add(new RunningWorker(id, thread, task));
                } catch (ResourceException e) {
                    spawnFailure = e;
                    break;
                } catch (RuntimeException | OutOfMemoryError e) {
                    spawnFailure = new ResourceException("Cannot start worker " + id, e);
                    break;
                }
            }
            log.debug("Started {} of {} worker threads", running.size(), workerCount);

            if (spawnFailure != null) {
                awaitAll(running);
                throw spawnFailure;
            }

            transition(CoordinatorState.AWAITING);
            Map<Integer, Throwable> failures = awaitAll(running);
            if (!failures.isEmpty()) {
                throw new WorkerFailureException(new ArrayList<>(failures.keySet()),
                        failures.values().iterator().next());
            }
            return shared.read();
        }
    }

    /**
     * Joins every worker, even across interrupts of the calling thread, and returns the failures by worker id.
     */
    private Map<Integer, Throwable> awaitAll(List<RunningWorker> running) {
        boolean interrupted = false;
        Map<Integer, Throwable> failures = new LinkedHashMap<>();
        for (RunningWorker worker : running) {
            interrupted |= joinUninterruptibly(worker.thread());
            Throwable failure = worker.failure();
            if (failure != null) {
                log.warn("Worker {} failed", worker.id(), failure);
                failures.put(worker.id(), failure);
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return failures;
    }

    private static boolean joinUninterruptibly(Thread thread) {
        boolean interrupted = false;
        while (true) {
            try {
                thread.join();
                return interrupted;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
    }

    private record RunningWorker(int id, Thread thread, FutureTask<SearchResult> task) {

        /**
         * Failure of a task whose thread has terminated, or null when it completed normally.
         */
        Throwable failure() {
            if (!task.isDone()) {
                return new IllegalStateException("Worker " + id + " thread ended without running its task");
            }
            try {
                task.get();
                return null;
            } catch (ExecutionException e) {
                return e.getCause();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return e;
            }
        }
    }
}
