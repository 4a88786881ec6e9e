package com.parallel.dnamatch;

import com.parallel.dnamatch.engine.SearchResult;
import com.parallel.dnamatch.engine.Sequence;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ParallelGpuSearcherTest {

    @Test
    void hostReductionKeepsHighestThenLowestOffset() {
        assertEquals(new SearchResult(1, 3), ParallelGpuSearcher.bestOf(new int[]{2, 3, 1, 3, 0}));
        assertEquals(new SearchResult(0, 0), ParallelGpuSearcher.bestOf(new int[]{0, 0, 0}));
        assertEquals(SearchResult.NONE, ParallelGpuSearcher.bestOf(new int[0]));
    }

    @Test
    void kernelAgreesWithSerialWhenOpenClIsAvailable() {
        Sequence subject = Sequence.of("TTGACGTACGGAACGGT");
        Sequence pattern = Sequence.of("ACGG");
        MatchReport gpu;
        try {
            gpu = new ParallelGpuSearcher().search("small", subject, pattern);
        } catch (RuntimeException | LinkageError e) {
            assumeTrue(false, "OpenCL not available: " + e.getMessage());
            return;
        }
        MatchReport serial = new SerialCpuSearcher().search("small", subject, pattern);
        assertEquals(serial.result(), gpu.result());
    }
}
