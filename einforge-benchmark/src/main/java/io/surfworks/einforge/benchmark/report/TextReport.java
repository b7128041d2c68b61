package io.surfworks.einforge.benchmark.report;

import io.surfworks.einforge.benchmark.config.BenchmarkConfig;
import io.surfworks.einforge.benchmark.instance.Strategy;
import io.surfworks.einforge.benchmark.runner.InstanceOutcome;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Prints benchmark progress as a fixed-width text table, one block per strategy.
 *
 * <pre>
 * einforge(cpu) benchmark suite
 * ==================================
 * Loaded 3 instances from data/instances
 * Backend: cpu
 * Threads: 1, Layout: row-major
 * Timing: median of 5 runs (2 warmup)
 *
 * Strategy: opt_flops
 * Instance                                            Tensors log10FLOPS     log2SIZE  Median (ms)
 * ------------------------------------------------------------------------------------------------
 * lm_batch_likelihood_sentence_3_12d                      84       9.37        21.00      123.456
 * </pre>
 *
 * <p>{@link ResultLogParser} reads this format back.
 */
public class TextReport {

    static final String ROW_FORMAT = "%-50s %8s %10s %12s %12s";
    static final String SEPARATOR = "-".repeat(96);
    static final String SKIP = "SKIP";

    private final PrintStream out;

    public TextReport(PrintStream out) {
        this.out = out;
    }

    public void header(String backendName, int instanceCount, Path dataDir, BenchmarkConfig config) {
        out.println("einforge(" + backendName + ") benchmark suite");
        out.println("==================================");
        out.println("Loaded " + instanceCount + " instances from " + dataDir);
        out.println("Backend: " + backendName);
        out.println("Threads: " + config.threads() + ", Layout: " + config.layout());
        out.println("Timing: median of " + config.measuredRuns() + " runs (" + config.warmupRuns() + " warmup)");
    }

    public void strategyHeader(Strategy strategy) {
        out.println();
        out.println("Strategy: " + strategy.key());
        out.println(String.format(Locale.ROOT, ROW_FORMAT,
            "Instance", "Tensors", "log10FLOPS", "log2SIZE", "Median (ms)"));
        out.println(SEPARATOR);
    }

    public void row(InstanceOutcome outcome) {
        String median = outcome.skipped()
            ? SKIP
            : String.format(Locale.ROOT, "%.3f", outcome.result().medianMillis());
        out.println(String.format(Locale.ROOT, ROW_FORMAT,
            outcome.instanceName(),
            Integer.toString(outcome.numTensors()),
            String.format(Locale.ROOT, "%.2f", outcome.log10Flops()),
            String.format(Locale.ROOT, "%.2f", outcome.log2Size()),
            median));
        if (outcome.skipped()) {
            out.println("  reason: " + outcome.skipReason());
        }
        out.flush();
    }
}
