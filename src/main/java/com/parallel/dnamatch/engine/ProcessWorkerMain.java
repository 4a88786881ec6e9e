package com.parallel.dnamatch.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Entry point of a worker process started by {@link ProcessSearchCoordinator}.
 * <p>
 * Arguments: {@code <subject file> <pattern file> <shared file> <worker id> <worker count>}.
 * Exit status 0 means the local best was merged (or there was nothing to merge).
 */
public final class ProcessWorkerMain {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerMain.class);

    private ProcessWorkerMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] args) {
        if (args.length != 5) {
            System.err.println("Usage: ProcessWorkerMain <subject_file> <pattern_file> <shared_file> <worker_id> <worker_count>");
            return EXIT_USAGE;
        }
        int workerId;
        int workerCount;
        try {
            workerId = Integer.parseInt(args[3]);
            workerCount = Integer.parseInt(args[4]);
        } catch (NumberFormatException e) {
            System.err.println("Worker id and count must be integers: " + e.getMessage());
            return EXIT_USAGE;
        }
        try {
            Sequence subject = Sequence.ofBytes(Files.readAllBytes(Paths.get(args[0])));
            Sequence pattern = Sequence.ofBytes(Files.readAllBytes(Paths.get(args[1])));
            Path sharedFile = Paths.get(args[2]);
            try (MappedSharedResult shared = MappedSharedResult.attach(sharedFile)) {
                new SearchWorker(subject, pattern, workerId, workerCount, shared, WorkerHook.NONE).call();
            }
            return EXIT_OK;
        } catch (Exception e) {
            log.error("Worker {} of {} failed", workerId, workerCount, e);
            return EXIT_FAILURE;
        }
    }
}
