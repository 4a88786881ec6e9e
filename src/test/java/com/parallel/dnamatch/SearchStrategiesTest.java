package com.parallel.dnamatch;

import com.parallel.dnamatch.engine.Sequence;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class SearchStrategiesTest {

    private static Sequence randomDna(long seed, int length) {
        Random random = new Random(seed);
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(Sequence.ALPHABET.charAt(random.nextInt(4)));
        }
        return Sequence.of(sb.toString());
    }

    @Test
    void serialFindsExactMatch() {
        MatchReport report = new SerialCpuSearcher().search("gattaca", Sequence.of("GATTACA"), Sequence.of("ACA"));
        assertEquals(4, report.position());
        assertEquals(3, report.count());
        assertEquals(1, report.workers());
        assertEquals("SerialCPU", report.method());
        assertEquals("gattaca", report.dataset());
    }

    @Test
    void parallelCpuMatchesSerial() throws Exception {
        Sequence subject = randomDna(1, 30_000);
        Sequence pattern = randomDna(2, 64);
        MatchReport serial = new SerialCpuSearcher().search("random", subject, pattern);
        for (int threads : new int[]{2, 5, 8}) {
            MatchReport parallel = new ParallelCpuSearcher(threads).search("random", subject, pattern);
            assertEquals(serial.result(), parallel.result(), "threads=" + threads);
            assertEquals(threads, parallel.workers());
        }
    }

    @Test
    void parallelProcessesMatchSerial() throws Exception {
        Sequence subject = randomDna(3, 10_000);
        Sequence pattern = randomDna(4, 30);
        MatchReport serial = new SerialCpuSearcher().search("random", subject, pattern);
        MatchReport processes = new ParallelProcessSearcher(2).search("random", subject, pattern);
        assertEquals(serial.result(), processes.result());
        assertEquals("ParallelProcess", processes.method());
    }

    @Test
    void nonPositiveWorkerCountFallsBackToOne() throws Exception {
        MatchReport report = new ParallelCpuSearcher(0).search("d", Sequence.of("AAAA"), Sequence.of("AA"));
        assertEquals(1, report.workers());
        assertEquals(0, report.position());
    }

    @Test
    void gpuReportHasNoWorkerCount() {
        MatchReport report = new MatchReport("ParallelGPU", "d", 0, 1, 2L, null, "GPU (x)");
        assertNull(report.workers());
    }
}
