package io.surfworks.einforge.benchmark.cli;

import io.surfworks.einforge.backend.cpu.CpuBackend;
import io.surfworks.einforge.benchmark.config.BenchmarkConfig;
import io.surfworks.einforge.benchmark.config.BenchmarkConfigLoader;
import io.surfworks.einforge.benchmark.instance.Layout;
import io.surfworks.einforge.benchmark.instance.Strategy;
import io.surfworks.einforge.benchmark.report.MarkdownTableFormatter;
import io.surfworks.einforge.benchmark.report.ResultKey;
import io.surfworks.einforge.benchmark.report.ResultLogParser;
import io.surfworks.einforge.benchmark.report.TextReport;
import io.surfworks.einforge.benchmark.runner.BenchmarkSuite;
import io.surfworks.einforge.core.path.PathExecutor;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Einforge benchmark CLI.
 *
 * <p>Commands:
 * <ul>
 *   <li>run - Run the einsum instances and print the timing table (the default)</li>
 *   <li>format - Turn one or more timing logs into markdown tables</li>
 * </ul>
 */
public class EinforgeBenchCli {

    static final String VERSION = "0.1.0";

    private static final Logger ROOT_LOGGER = Logger.getLogger("io.surfworks.einforge");

    private final PrintStream out;
    private final PrintStream err;

    EinforgeBenchCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new EinforgeBenchCli(System.out, System.err).execute(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    /**
     * Run a command.
     *
     * @return the process exit code
     */
    int execute(String[] args) {
        if (args.length == 0) {
            return runCommand("run", args);
        }

        String command = args[0];

        // Global flags only count when they are the command itself
        if (command.equals("--help") || command.equals("-h")) {
            printHelp();
            return 0;
        }
        if (command.equals("--version") || command.equals("-v")) {
            out.println("einforge-bench " + VERSION);
            return 0;
        }
        // Bare options run the benchmark
        if (command.startsWith("--")) {
            return runCommand("run", args);
        }
        return runCommand(command, Arrays.copyOfRange(args, 1, args.length));
    }

    private int runCommand(String command, String[] commandArgs) {
        try {
            switch (command) {
                case "run" -> {
                    return handleRun(commandArgs);
                }
                case "format" -> {
                    return handleFormat(commandArgs);
                }
                default -> {
                    err.println("Unknown command: " + command);
                    err.println("Run 'einforge-bench --help' for usage.");
                    return 1;
                }
            }
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private int handleRun(String[] args) throws IOException {
        if (hasFlag(args, "--help")) {
            printRunHelp();
            return 0;
        }
        if (hasFlag(args, "--verbose")) {
            enableVerboseLogging();
        }

        BenchmarkConfig config = resolveConfig(args);
        try (CpuBackend backend = new CpuBackend(config.threads())) {
            BenchmarkSuite suite = new BenchmarkSuite(config, new PathExecutor(backend), new TextReport(out));
            suite.run();
        }
        return 0;
    }

    /**
     * Merge the config file with command line flags; flags win.
     */
    BenchmarkConfig resolveConfig(String[] args) throws IOException {
        String configPath = getFlagValue(args, "--config");
        BenchmarkConfig config = configPath != null
            ? BenchmarkConfigLoader.load(Path.of(configPath))
            : BenchmarkConfigLoader.load();

        String dataDir = getFlagValue(args, "--data-dir");
        if (dataDir != null) {
            config = config.withDataDir(Path.of(dataDir));
        }
        String instance = getFlagValue(args, "--instance");
        if (instance != null) {
            config = config.withInstanceFilter(instance);
        }
        String warmup = getFlagValue(args, "--warmup");
        if (warmup != null) {
            config = config.withWarmupRuns(parseInt("--warmup", warmup));
        }
        String runs = getFlagValue(args, "--runs");
        if (runs != null) {
            config = config.withMeasuredRuns(parseInt("--runs", runs));
        }
        String threads = getFlagValue(args, "--threads");
        if (threads != null) {
            config = config.withThreads(parseInt("--threads", threads));
        }
        String layout = getFlagValue(args, "--layout");
        if (layout != null) {
            config = config.withLayout(Layout.fromKey(layout));
        }
        String strategies = getFlagValue(args, "--strategy");
        if (strategies != null) {
            List<Strategy> parsed = new ArrayList<>();
            for (String key : strategies.split(",")) {
                parsed.add(Strategy.fromKey(key.trim()));
            }
            config = config.withStrategies(parsed);
        }
        return config;
    }

    private int handleFormat(String[] args) throws IOException {
        if (hasFlag(args, "--help")) {
            printFormatHelp();
            return 0;
        }
        if (args.length == 0) {
            err.println("Error: at least one log file is required");
            printFormatHelp();
            return 1;
        }
        Map<ResultKey, Double> all = new LinkedHashMap<>();
        for (String file : args) {
            all.putAll(ResultLogParser.parse(Path.of(file)));
        }
        out.println(MarkdownTableFormatter.format(all));
        return 0;
    }

    private static void enableVerboseLogging() {
        ROOT_LOGGER.setLevel(Level.FINE);
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        ROOT_LOGGER.addHandler(handler);
        ROOT_LOGGER.setUseParentHandlers(false);
    }

    private static int parseInt(String flag, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " expects an integer, got '" + value + "'", e);
        }
    }

    private static boolean hasFlag(String[] args, String flag) {
        return Arrays.asList(args).contains(flag);
    }

    private static String getFlagValue(String[] args, String flag) {
        List<String> argList = Arrays.asList(args);
        int index = argList.indexOf(flag);
        if (index >= 0 && index < args.length - 1) {
            return args[index + 1];
        }
        return null;
    }

    // ===== Help output =====

    private void printHelp() {
        out.println("Einforge Benchmark CLI - pairwise einsum path execution timings");
        out.println();
        out.println("Usage: einforge-bench [command] [options]");
        out.println();
        out.println("Commands:");
        out.println("  run       Run benchmark instances and print median timings (default)");
        out.println("  format    Convert timing logs into markdown tables");
        out.println();
        out.println("Global options:");
        out.println("  --help, -h       Show this help");
        out.println("  --version, -v    Show version");
        out.println();
        out.println("Run 'einforge-bench <command> --help' for command options.");
    }

    private void printRunHelp() {
        out.println("Usage: einforge-bench run [options]");
        out.println();
        out.println("Options:");
        out.println("  --data-dir <dir>       Instance directory (default: data/instances)");
        out.println("  --instance <name>      Run only the named instance");
        out.println("  --strategy <list>      Comma separated: opt_flops,opt_size (default: both)");
        out.println("  --layout <layout>      row-major or col-major (default: row-major)");
        out.println("  --warmup <n>           Warmup runs per instance (default: 2)");
        out.println("  --runs <n>             Timed runs per instance (default: 5)");
        out.println("  --threads <n>          CPU backend worker threads (default: 1)");
        out.println("  --config <file>        Config file (default: ~/.config/einforge/bench.json)");
        out.println("  --verbose              Log every contraction step");
    }

    private void printFormatHelp() {
        out.println("Usage: einforge-bench format <logfile> [logfile...]");
        out.println();
        out.println("Parses timing logs written by 'einforge-bench run' or by the Rust and Julia");
        out.println("einsum suites and prints one markdown table per strategy.");
    }
}
