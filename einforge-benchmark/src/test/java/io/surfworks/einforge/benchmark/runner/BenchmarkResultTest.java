package io.surfworks.einforge.benchmark.runner;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BenchmarkResultTest {

    private static BenchmarkResult result(long... nanos) {
        return new BenchmarkResult("chain", "opt_flops", "cpu", 2, nanos.length, nanos);
    }

    @Test
    void medianOfOddCountIsMiddleValue() {
        BenchmarkResult r = result(5_000_000, 1_000_000, 3_000_000, 9_000_000, 2_000_000);
        assertEquals(3.0, r.medianMillis(), 1e-12);
    }

    @Test
    void medianOfEvenCountIsUpperMiddle() {
        assertEquals(3_000_000, result(4_000_000, 1_000_000, 3_000_000, 2_000_000).medianNanos());
    }

    @Test
    void summaryStatistics() {
        BenchmarkResult r = result(1_000_000, 2_000_000, 3_000_000);
        assertEquals(2.0, r.meanMillis(), 1e-12);
        assertEquals(1.0, r.stdDevMillis(), 1e-12);
        assertEquals(1.0, r.minMillis(), 1e-12);
        assertEquals(3.0, r.maxMillis(), 1e-12);
        assertEquals(3.0, r.percentileMillis(99), 1e-12);
        assertEquals(50.0, r.coefficientOfVariationPercent(), 1e-9);
    }

    @Test
    void timingsAreCopied() {
        long[] nanos = {1, 2, 3};
        BenchmarkResult r = result(nanos);
        nanos[0] = 100;
        assertEquals(1e-6, r.minMillis(), 1e-15);
    }

    @Test
    void equalityComparesTimings() {
        assertEquals(result(1, 2, 3), result(1, 2, 3));
        assertNotEquals(result(1, 2, 3), result(1, 2, 4));
    }

    @Test
    void summaryMentionsInstanceAndMedian() {
        String summary = result(2_000_000).toSummaryString();
        assertTrue(summary.contains("chain"));
        assertTrue(summary.contains("median=2.000 ms"));
    }
}
