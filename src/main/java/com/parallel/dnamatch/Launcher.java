package com.parallel.dnamatch;

import java.util.Arrays;

/**
 * Dispatches to a command.
 *
 * - "search": a single best-match search ({@link SearchCommand}).
 * - "benchmark": compares the strategies and writes CSV/chart ({@link BenchmarkRunner}).
 */
public class Launcher {

    public static void main(String[] args) throws Exception {
        if (args.length == 0 || "--help".equals(args[0])) {
            printUsage();
            return;
        }
        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        switch (args[0]) {
            case "search" -> System.exit(new SearchCommand().run(rest));
            case "benchmark" -> BenchmarkRunner.main(rest);
            default -> {
                System.err.println("Comando desconhecido: " + args[0]);
                printUsage();
                System.exit(SearchCommand.EXIT_ERROR);
            }
        }
    }

    private static void printUsage() {
        System.out.println("""
                Uso:
                  search <sequence_file> <subsequence_file> <workers> [--mode threads|processes]
                  benchmark --pattern <arquivo> [--inputs a,b,c] [--runs n] [--workers 2,4,8] ... (--help para detalhes)
                """);
    }
}
