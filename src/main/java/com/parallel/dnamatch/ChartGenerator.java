package com.parallel.dnamatch;

import org.knowm.xchart.BitmapEncoder;
import org.knowm.xchart.CategoryChart;
import org.knowm.xchart.CategoryChartBuilder;
import org.knowm.xchart.style.Styler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class ChartGenerator {

    private ChartGenerator() {
    }

    /**
     * Series label of a report: parallel strategies are split by worker count, e.g. {@code ParallelCPU x4}.
     */
    static String seriesName(MatchReport r) {
        if (r.workers() == null || (r.workers() == 1 && r.method().startsWith("Serial"))) {
            return r.method();
        }
        return r.method() + " x" + r.workers();
    }

    public static void exportAverageDurationChart(List<MatchReport> results, Path outputFile) throws IOException {
        if (results.isEmpty()) {
            return;
        }
        if (outputFile.getParent() != null) {
            Files.createDirectories(outputFile.getParent());
        }

        Map<String, Map<String, Stats>> aggregated = averageDurations(results);
        Set<String> series = new LinkedHashSet<>();
        for (MatchReport r : results) {
            series.add(seriesName(r));
        }

        List<String> datasets = new ArrayList<>(aggregated.keySet());

        CategoryChart chart = new CategoryChartBuilder()
                .width(1100)
                .height(650)
                .title("Tempo medio da busca por dataset")
                .xAxisTitle("Dataset")
                .yAxisTitle("Tempo (ms)")
                .build();

        chart.getStyler().setLegendPosition(Styler.LegendPosition.InsideNE);
        chart.getStyler().setAvailableSpaceFill(0.8);

        for (String name : series) {
            List<Double> values = new ArrayList<>();
            for (String dataset : datasets) {
                Stats stats = aggregated.get(dataset).get(name);
                values.add(stats == null ? 0.0 : stats.average());
            }
            chart.addSeries(name, datasets, values);
        }

        BitmapEncoder.saveBitmap(chart, outputFile.toString(), BitmapEncoder.BitmapFormat.PNG);
    }

    static Map<String, Map<String, Stats>> averageDurations(List<MatchReport> results) {
        Map<String, Map<String, Stats>> aggregated = new LinkedHashMap<>();
        for (MatchReport r : results) {
            aggregated.computeIfAbsent(r.dataset(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(seriesName(r), k -> new Stats())
                    .add(r.durationMillis());
        }
        return aggregated;
    }

    static class Stats {
        private long total = 0;
        private int count = 0;

        void add(long value) {
            total += value;
            count++;
        }

        double average() {
            return count == 0 ? 0 : (double) total / count;
        }
    }
}
