package io.surfworks.einforge.benchmark.runner;

import java.util.Arrays;
import java.util.Objects;

/**
 * Timings from the measured runs of one instance under one strategy, with summary statistics.
 *
 * <p>Warmup runs are not recorded. Timings cover path execution only; operand allocation
 * happens before the clock starts.
 */
public record BenchmarkResult(
    String instanceName,
    String strategy,
    String backend,
    int warmupIterations,
    int measurementIterations,
    long[] timingsNanos
) {

    public BenchmarkResult {
        timingsNanos = timingsNanos.clone();
    }

    /**
     * Median run time in milliseconds. This is the figure reported per instance.
     */
    public double medianMillis() {
        return medianNanos() / 1e6;
    }

    /**
     * Median run time in nanoseconds; for an even count the upper of the two middle values.
     */
    public long medianNanos() {
        if (timingsNanos.length == 0) return 0L;
        long[] sorted = timingsNanos.clone();
        Arrays.sort(sorted);
        return sorted[sorted.length / 2];
    }

    /**
     * Calculates the mean execution time in milliseconds.
     */
    public double meanMillis() {
        if (timingsNanos.length == 0) return 0.0;
        return Arrays.stream(timingsNanos).average().orElse(0.0) / 1e6;
    }

    /**
     * Calculates the sample standard deviation in milliseconds.
     */
    public double stdDevMillis() {
        if (timingsNanos.length < 2) return 0.0;
        double mean = meanMillis();
        double sumSquaredDiff = Arrays.stream(timingsNanos)
            .mapToDouble(t -> t / 1e6 - mean)
            .map(d -> d * d)
            .sum();
        return Math.sqrt(sumSquaredDiff / (timingsNanos.length - 1));
    }

    public double minMillis() {
        return Arrays.stream(timingsNanos).min().orElse(0L) / 1e6;
    }

    public double maxMillis() {
        return Arrays.stream(timingsNanos).max().orElse(0L) / 1e6;
    }

    /**
     * Nearest-rank percentile in milliseconds.
     */
    public double percentileMillis(double percentile) {
        if (timingsNanos.length == 0) return 0.0;
        long[] sorted = timingsNanos.clone();
        Arrays.sort(sorted);
        int index = (int) Math.ceil(percentile / 100.0 * sorted.length) - 1;
        return sorted[Math.max(0, Math.min(index, sorted.length - 1))] / 1e6;
    }

    /**
     * Calculates the coefficient of variation (CV) as a percentage.
     * Lower is better - indicates more stable measurements.
     */
    public double coefficientOfVariationPercent() {
        double mean = meanMillis();
        if (mean <= 0) return 0.0;
        return (stdDevMillis() / mean) * 100.0;
    }

    /**
     * Formats the result as a human-readable summary string.
     */
    public String toSummaryString() {
        return String.format(
            "%s [%s/%s]: median=%.3f ms, mean=%.3f ± %.3f ms (min=%.3f, max=%.3f) CV=%.1f%%",
            instanceName,
            strategy,
            backend,
            medianMillis(),
            meanMillis(),
            stdDevMillis(),
            minMillis(),
            maxMillis(),
            coefficientOfVariationPercent()
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BenchmarkResult that)) return false;
        return warmupIterations == that.warmupIterations
            && measurementIterations == that.measurementIterations
            && instanceName.equals(that.instanceName)
            && strategy.equals(that.strategy)
            && backend.equals(that.backend)
            && Arrays.equals(timingsNanos, that.timingsNanos);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(instanceName, strategy, backend, warmupIterations, measurementIterations);
        return 31 * result + Arrays.hashCode(timingsNanos);
    }
}
