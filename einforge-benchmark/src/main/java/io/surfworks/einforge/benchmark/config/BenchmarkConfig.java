package io.surfworks.einforge.benchmark.config;

import io.surfworks.einforge.benchmark.instance.Layout;
import io.surfworks.einforge.benchmark.instance.Strategy;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Configuration for a benchmark run.
 *
 * <p>Configuration is resolved in order of precedence:
 * <ol>
 *   <li>CLI arguments (highest priority)</li>
 *   <li>Config file ({@code ~/.config/einforge/bench.json}, or the file given with {@code --config})</li>
 *   <li>Defaults (lowest priority)</li>
 * </ol>
 *
 * @param dataDir        directory holding the instance JSON files
 * @param warmupRuns     untimed executions before measuring
 * @param measuredRuns   timed executions whose median is reported
 * @param threads        worker threads for the CPU backend
 * @param layout         which instance encoding to evaluate
 * @param strategies     strategies to run, in report order
 * @param instanceFilter only run the instance with this name (may be null)
 */
public record BenchmarkConfig(
        Path dataDir,
        int warmupRuns,
        int measuredRuns,
        int threads,
        Layout layout,
        List<Strategy> strategies,
        String instanceFilter
) {

    public static final Path DEFAULT_DATA_DIR = Path.of("data", "instances");
    public static final int DEFAULT_WARMUP_RUNS = 2;
    public static final int DEFAULT_MEASURED_RUNS = 5;

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "einforge"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "bench.json";

    public BenchmarkConfig {
        Objects.requireNonNull(dataDir, "dataDir cannot be null");
        Objects.requireNonNull(layout, "layout cannot be null");
        Objects.requireNonNull(strategies, "strategies cannot be null");
        if (warmupRuns < 0) {
            throw new IllegalArgumentException("warmupRuns must be >= 0, got " + warmupRuns);
        }
        if (measuredRuns < 1) {
            throw new IllegalArgumentException("measuredRuns must be >= 1, got " + measuredRuns);
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        }
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one strategy is required");
        }
        strategies = List.copyOf(strategies);
    }

    /**
     * Two warmup runs, five measured runs, a single thread, row-major,
     * opt_flops then opt_size.
     */
    public static BenchmarkConfig defaults() {
        return new BenchmarkConfig(
                DEFAULT_DATA_DIR,
                DEFAULT_WARMUP_RUNS,
                DEFAULT_MEASURED_RUNS,
                1,
                Layout.ROW_MAJOR,
                List.of(Strategy.OPT_FLOPS, Strategy.OPT_SIZE),
                null
        );
    }

    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public BenchmarkConfig withDataDir(Path dir) {
        return new BenchmarkConfig(dir, warmupRuns, measuredRuns, threads, layout, strategies, instanceFilter);
    }

    public BenchmarkConfig withWarmupRuns(int runs) {
        return new BenchmarkConfig(dataDir, runs, measuredRuns, threads, layout, strategies, instanceFilter);
    }

    public BenchmarkConfig withMeasuredRuns(int runs) {
        return new BenchmarkConfig(dataDir, warmupRuns, runs, threads, layout, strategies, instanceFilter);
    }

    public BenchmarkConfig withThreads(int count) {
        return new BenchmarkConfig(dataDir, warmupRuns, measuredRuns, count, layout, strategies, instanceFilter);
    }

    public BenchmarkConfig withLayout(Layout value) {
        return new BenchmarkConfig(dataDir, warmupRuns, measuredRuns, threads, value, strategies, instanceFilter);
    }

    public BenchmarkConfig withStrategies(List<Strategy> values) {
        return new BenchmarkConfig(dataDir, warmupRuns, measuredRuns, threads, layout, values, instanceFilter);
    }

    public BenchmarkConfig withInstanceFilter(String name) {
        return new BenchmarkConfig(dataDir, warmupRuns, measuredRuns, threads, layout, strategies, name);
    }
}
