package com.parallel.dnamatch.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Workers are child JVMs running {@link ProcessWorkerMain}; they merge through a {@link MappedSharedResult}.
 * <p>
 * Each search gets a private temporary directory holding the two sequences and the shared record.
 * The directory is removed only after every started child has exited.
 */
public class ProcessSearchCoordinator extends AbstractSearchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ProcessSearchCoordinator.class);

    static final String SUBJECT_FILE = "subject.seq";
    static final String PATTERN_FILE = "pattern.seq";
    static final String SHARED_FILE = "best.shm";

    private final String javaExecutable;
    private final String classPath;
    private final String workerMainClass;

    public ProcessSearchCoordinator() {
        this(ProcessWorkerMain.class.getName());
    }

    public ProcessSearchCoordinator(String workerMainClass) {
        this(Paths.get(System.getProperty("java.home"), "bin", "java").toString(),
                System.getProperty("java.class.path"),
                workerMainClass);
    }

    public ProcessSearchCoordinator(String javaExecutable, String classPath, String workerMainClass) {
        this.javaExecutable = javaExecutable;
        this.classPath = classPath;
        this.workerMainClass = workerMainClass;
    }

    @Override
    protected SearchResult execute(Sequence subject, Sequence pattern, int workerCount) throws SearchEngineException {
        Path workDir;
        try {
            workDir = Files.createTempDirectory("dnamatch-");
        } catch (IOException e) {
            throw new ResourceException("Cannot create working directory for worker processes", e);
        }
        try {
            Path subjectFile = workDir.resolve(SUBJECT_FILE);
            Path patternFile = workDir.resolve(PATTERN_FILE);
            writeSequence(subjectFile, subject);
            writeSequence(patternFile, pattern);
            try (MappedSharedResult shared = MappedSharedResult.create(workDir.resolve(SHARED_FILE))) {
                return runWorkers(subjectFile, patternFile, shared, workerCount);
            }
        } finally {
            deleteRecursively(workDir);
        }
    }

    private SearchResult runWorkers(Path subjectFile, Path patternFile, MappedSharedResult shared, int workerCount)
            throws SearchEngineException {
        transition(CoordinatorState.SPAWNING);
        List<RunningProcess> running = new ArrayList<>(workerCount);
        for (int id = 0; id < workerCount; id++) {
            ProcessBuilder builder = new ProcessBuilder(
                    command(subjectFile, patternFile, shared.path(), id, workerCount))
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.INHERIT);
            try {
                running.add(new RunningProcess(id, builder.start()));
            } catch (IOException | RuntimeException e) {
                awaitAll(running);
                throw new ResourceException("Cannot start worker process " + id, e);
            }
        }
        log.debug("Started {} worker processes", running.size());

        transition(CoordinatorState.AWAITING);
        List<Integer> failed = awaitAll(running);
        if (!failed.isEmpty()) {
            throw new WorkerFailureException(failed, null);
        }
        return shared.read();
    }

    List<String> command(Path subjectFile, Path patternFile, Path sharedFile, int workerId, int workerCount) {
        return List.of(javaExecutable, "-cp", classPath, workerMainClass,
                subjectFile.toString(), patternFile.toString(), sharedFile.toString(),
                String.valueOf(workerId), String.valueOf(workerCount));
    }

    /**
     * Reaps every process, even across interrupts of the calling thread, and returns the ids of those that
     * exited with a non-zero status.
     */
    private List<Integer> awaitAll(List<RunningProcess> running) {
        boolean interrupted = false;
        List<Integer> failed = new ArrayList<>();
        for (RunningProcess worker : running) {
            int exitCode;
            while (true) {
                try {
                    exitCode = worker.process().waitFor();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (exitCode != 0) {
                log.warn("Worker process {} (pid {}) exited with status {}", worker.id(), worker.process().pid(), exitCode);
                failed.add(worker.id());
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return failed;
    }

    private static void writeSequence(Path file, Sequence sequence) throws ResourceException {
        try {
            Files.write(file, sequence.toByteArray());
        } catch (IOException e) {
            throw new ResourceException("Cannot write " + file, e);
        }
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("Could not remove working directory {}", dir, e);
        }
    }

    private record RunningProcess(int id, Process process) {
    }
}
