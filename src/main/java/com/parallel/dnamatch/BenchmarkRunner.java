package com.parallel.dnamatch;

import com.parallel.dnamatch.engine.Sequence;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * CLI runner for benchmarking the search strategies against each other.
 */
public class BenchmarkRunner {

    public static void main(String[] args) throws Exception {
        Config config = Config.fromArgs(args);
        if (config.help) {
            printUsage();
            return;
        }
        validate(config);

        Sequence pattern = SequenceLoader.loadSubsequence(config.pattern);
        SerialCpuSearcher serial = new SerialCpuSearcher();
        ParallelGpuSearcher gpu = new ParallelGpuSearcher();

        List<MatchReport> results = new ArrayList<>();

        for (Path input : config.inputs) {
            String datasetName = input.getFileName().toString();
            Sequence subject = SequenceLoader.loadSequence(input);
            if (subject.isEmpty()) {
                System.err.println("Dataset " + datasetName + " ignorado: sequencia vazia apos filtrar A/C/G/T");
                continue;
            }
            System.out.println("\nDataset: " + datasetName + " (" + subject.length() + " bases)");

            for (int run = 1; run <= config.runs; run++) {
                System.out.println("  Run " + run + "/" + config.runs);
                MatchReport reference = serial.search(datasetName, subject, pattern);
                results.add(reference);

                for (int workers : config.workerOptions) {
                    if (workers > subject.length()) {
                        System.err.println("    " + workers + " workers ignorado: maior que a sequencia");
                        continue;
                    }
                    results.add(verified(reference, new ParallelCpuSearcher(workers).search(datasetName, subject, pattern)));
                    if (!config.skipProcesses) {
                        results.add(verified(reference,
                                new ParallelProcessSearcher(workers).search(datasetName, subject, pattern)));
                    }
                }

                if (!config.skipGpu) {
                    MatchReport gpuReport;
                    try {
                        gpuReport = gpu.search(datasetName, subject, pattern);
                    } catch (Exception | LinkageError ex) {
                        System.err.println("    GPU run skipped: " + ex.getMessage());
                        continue;
                    }
                    results.add(verified(reference, gpuReport));
                }
            }
        }

        Path csvPath = config.csvOutput != null ? config.csvOutput : defaultCsvPath();
        CsvExporter.write(csvPath, results);
        System.out.println("\nCSV salvo em: " + csvPath.toAbsolutePath());

        if (config.chartOutput != null) {
            ChartGenerator.exportAverageDurationChart(results, config.chartOutput);
            System.out.println("Grafico salvo em: " + config.chartOutput.toAbsolutePath());
        }
    }

    /**
     * Every strategy must find the same position and count as the serial scan.
     */
    static MatchReport verified(MatchReport reference, MatchReport candidate) {
        if (!reference.result().equals(candidate.result())) {
            throw new IllegalStateException(candidate.method() + " found " + candidate.result()
                    + " but " + reference.method() + " found " + reference.result()
                    + " on " + candidate.dataset());
        }
        return candidate;
    }

    private static void validate(Config config) {
        if (config.pattern == null) {
            throw new IllegalArgumentException("Informe a subsequencia com --pattern <arquivo>");
        }
        if (!Files.exists(config.pattern)) {
            throw new IllegalArgumentException("Arquivo de subsequencia nao encontrado: " + config.pattern);
        }
        for (Path input : config.inputs) {
            if (!Files.exists(input)) {
                throw new IllegalArgumentException("Arquivo de entrada nao encontrado: " + input);
            }
        }
        if (config.runs < 1) {
            throw new IllegalArgumentException("--runs deve ser positivo: " + config.runs);
        }
        for (int workers : config.workerOptions) {
            if (workers < 1) {
                throw new IllegalArgumentException("--workers deve conter apenas valores positivos: " + workers);
            }
        }
    }

    private static Path defaultCsvPath() {
        String timestamp = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").format(LocalDateTime.now());
        return Paths.get("results", "dnamatch_" + timestamp + ".csv");
    }

    static void printUsage() {
        System.out.println("""
                Uso:
                  java -jar target/dnamatch-parallel-1.0.0-jar-with-dependencies.jar benchmark --pattern sub.txt
                      --inputs data/seq_small.txt,data/seq_medium.txt,data/seq_large.txt
                      [--runs 3] [--workers 2,4,8] [--csv results/out.csv] [--chart results/out.png]
                      [--skip-gpu] [--skip-processes]

                Opcoes:
                  --pattern <arquivo>        Subsequencia procurada (obrigatorio, max 10KB apos filtrar)
                  --inputs <lista>           Sequencias separadas por virgula (padrao: amostras em data/)
                  --runs <n>                 Numero de execucoes repetidas por dataset (padrao: 3)
                  --workers <lista>          Quantidade de workers das versoes paralelas (padrao: nucleos disponiveis - 1)
                  --csv <arquivo>            Caminho do CSV de saida (padrao: results/dnamatch_TIMESTAMP.csv)
                  --chart <arquivo>          Caminho do grafico PNG com tempos medios (padrao: results/dnamatch_chart.png)
                  --skip-gpu                 Nao executar a versao GPU (util se nao houver driver OpenCL)
                  --skip-processes           Nao executar a versao com processos filhos
                  --help                     Exibe esta mensagem
                """);
    }

    record Config(
            Path pattern,
            List<Path> inputs,
            int runs,
            List<Integer> workerOptions,
            Path csvOutput,
            Path chartOutput,
            boolean skipGpu,
            boolean skipProcesses,
            boolean help) {

        static Config fromArgs(String[] args) {
            List<Path> inputs = new ArrayList<>();
            Path pattern = null;
            int runs = 3;
            List<Integer> workers = null;
            Path csv = null;
            Path chart = null;
            boolean skipGpu = false;
            boolean skipProcesses = false;
            boolean help = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--pattern" -> pattern = Paths.get(valueAt(args, ++i));
                    case "--inputs" -> inputs = parsePaths(valueAt(args, ++i));
                    case "--runs" -> runs = Integer.parseInt(valueAt(args, ++i));
                    case "--workers" -> workers = parseIntegers(valueAt(args, ++i));
                    case "--csv" -> csv = Paths.get(valueAt(args, ++i));
                    case "--chart" -> chart = Paths.get(valueAt(args, ++i));
                    case "--skip-gpu" -> skipGpu = true;
                    case "--skip-processes" -> skipProcesses = true;
                    case "--help" -> help = true;
                    default -> throw new IllegalArgumentException("Opcao desconhecida: " + args[i]);
                }
            }

            if (workers == null) {
                workers = List.of(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
            }
            if (inputs.isEmpty()) {
                inputs = List.of(
                        Paths.get("data", "seq_small.txt"),
                        Paths.get("data", "seq_medium.txt"),
                        Paths.get("data", "seq_large.txt"));
            }
            if (chart == null) {
                chart = Paths.get("results", "dnamatch_chart.png");
            }

            return new Config(pattern, inputs, runs, workers, csv, chart, skipGpu, skipProcesses, help);
        }

        private static String valueAt(String[] args, int idx) {
            if (idx >= args.length) {
                throw new IllegalArgumentException("Valor esperado apos " + args[idx - 1]);
            }
            return args[idx];
        }

        private static List<Path> parsePaths(String raw) {
            return Arrays.stream(raw.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(Paths::get)
                    .toList();
        }

        private static List<Integer> parseIntegers(String raw) {
            return Arrays.stream(raw.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(Integer::parseInt)
                    .toList();
        }
    }
}
