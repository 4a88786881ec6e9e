package com.parallel.dnamatch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class CsvExporter {

    static final String HEADER = "method,dataset,position,count,duration_ms,workers,device";

    private CsvExporter() {
    }

    public static void write(Path path, List<MatchReport> results) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        List<String> lines = new ArrayList<>();
        lines.add(HEADER);
        for (MatchReport r : results) {
            lines.add(String.join(",",
                    r.method(),
                    sanitize(r.dataset()),
                    String.valueOf(r.position()),
                    String.valueOf(r.count()),
                    String.valueOf(r.durationMillis()),
                    r.workers() == null ? "" : String.valueOf(r.workers()),
                    sanitize(r.deviceType())));
        }
        Files.write(path, lines);
    }

    private static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return value.replace(",", " ");
    }
}
