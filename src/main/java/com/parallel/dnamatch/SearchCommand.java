package com.parallel.dnamatch;

import com.parallel.dnamatch.engine.ProcessSearchCoordinator;
import com.parallel.dnamatch.engine.SearchCoordinator;
import com.parallel.dnamatch.engine.SearchEngineException;
import com.parallel.dnamatch.engine.SearchResult;
import com.parallel.dnamatch.engine.Sequence;
import com.parallel.dnamatch.engine.ThreadSearchCoordinator;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Single search from the command line: {@code <sequence_file> <subsequence_file> <workers> [--mode m]}.
 * Prints the worker count, best position and best count on three lines, or an error and exit status 1.
 */
public class SearchCommand {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;

    public enum Mode {
        THREADS("Number of Threads:   "),
        PROCESSES("Number of Processes: ");

        private final String workersLabel;

        Mode(String workersLabel) {
            this.workersLabel = workersLabel;
        }

        SearchCoordinator newCoordinator() {
            return this == THREADS ? new ThreadSearchCoordinator() : new ProcessSearchCoordinator();
        }

        static Mode parse(String raw) {
            try {
                return valueOf(raw.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Modo desconhecido: " + raw + " (use threads ou processes)");
            }
        }
    }

    private final PrintStream out;
    private final PrintStream err;
    private final Function<Mode, SearchCoordinator> coordinators;

    public SearchCommand() {
        this(System.out, System.err, Mode::newCoordinator);
    }

    public SearchCommand(PrintStream out, PrintStream err, Function<Mode, SearchCoordinator> coordinators) {
        this.out = out;
        this.err = err;
        this.coordinators = coordinators;
    }

    public static void main(String[] args) {
        System.exit(new SearchCommand().run(args));
    }

    public int run(String[] args) {
        Config config;
        try {
            config = Config.fromArgs(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage();
            return EXIT_ERROR;
        }

        Sequence subject;
        Sequence pattern;
        try {
            subject = SequenceLoader.loadSequence(config.sequenceFile());
            pattern = SequenceLoader.loadSubsequence(config.subsequenceFile());
        } catch (IOException e) {
            err.println("Falha ao ler entrada: " + e.getMessage());
            return EXIT_ERROR;
        }
        if (subject.isEmpty() || pattern.isEmpty()) {
            err.println("empty sequence or subsequence");
            return EXIT_ERROR;
        }
        if (config.workers() > subject.length()) {
            err.println("number of workers (" + config.workers() + ") exceeds sequence length (" + subject.length() + ")");
            return EXIT_ERROR;
        }

        SearchResult best;
        try {
            best = coordinators.apply(config.mode()).search(subject, pattern, config.workers());
        } catch (SearchEngineException e) {
            err.println("search failed: " + e.getMessage());
            return EXIT_ERROR;
        }

        out.println(config.mode().workersLabel + config.workers());
        out.println("Best Match Position: " + best.position());
        out.println("Best Match Count:    " + best.count());
        return EXIT_OK;
    }

    private void printUsage() {
        out.println("""
                Uso:
                  search <sequence_file> <subsequence_file> <workers> [--mode threads|processes]

                  sequence_file     sequencia de DNA principal (max 1MB apos filtrar A/C/G/T)
                  subsequence_file  sequencia procurada (max 10KB apos filtrar A/C/G/T)
                  workers           numero de workers (1 .. tamanho da sequencia)
                  --mode            threads ou processes (padrao: processes)

                Exemplo: search sequence.txt subsequence.txt 4
                """);
    }

    record Config(Path sequenceFile, Path subsequenceFile, int workers, Mode mode) {

        static Config fromArgs(String[] args) {
            List<String> positional = new ArrayList<>();
            Mode mode = Mode.PROCESSES;
            for (int i = 0; i < args.length; i++) {
                if ("--mode".equals(args[i])) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Valor esperado apos --mode");
                    }
                    mode = Mode.parse(args[++i]);
                } else {
                    positional.add(args[i]);
                }
            }
            if (positional.size() != 3) {
                throw new IllegalArgumentException("wrong number of args");
            }
            int workers;
            try {
                workers = Integer.parseInt(positional.get(2).trim());
            } catch (NumberFormatException e) {
                workers = 0;
            }
            if (workers <= 0) {
                throw new IllegalArgumentException("need positive number of workers");
            }
            return new Config(Paths.get(positional.get(0)), Paths.get(positional.get(1)), workers, mode);
        }
    }
}
