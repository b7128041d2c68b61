package io.surfworks.einforge.benchmark.runner;

import io.surfworks.einforge.benchmark.instance.Strategy;

/**
 * What happened when one instance was run under one strategy: either a result or a skip reason.
 *
 * @param instanceName instance name
 * @param strategy     strategy that was run
 * @param numTensors   operand count
 * @param log10Flops   estimated log10 FLOP count of the path
 * @param log2Size     estimated log2 largest intermediate size of the path
 * @param result       measurements, or null if skipped
 * @param skipReason   why the instance was skipped, or null if it ran
 */
public record InstanceOutcome(
    String instanceName,
    Strategy strategy,
    int numTensors,
    double log10Flops,
    double log2Size,
    BenchmarkResult result,
    String skipReason
) {

    public boolean skipped() {
        return result == null;
    }
}
