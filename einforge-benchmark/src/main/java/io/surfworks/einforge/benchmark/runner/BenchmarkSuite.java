package io.surfworks.einforge.benchmark.runner;

import io.surfworks.einforge.benchmark.config.BenchmarkConfig;
import io.surfworks.einforge.benchmark.instance.BenchmarkInstance;
import io.surfworks.einforge.benchmark.instance.InstanceLoader;
import io.surfworks.einforge.benchmark.instance.Strategy;
import io.surfworks.einforge.benchmark.report.TextReport;
import io.surfworks.einforge.core.path.PathExecutor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Runs every configured strategy over every loaded instance and reports as it goes.
 */
public class BenchmarkSuite {

    private static final Logger LOG = Logger.getLogger(BenchmarkSuite.class.getName());

    private final BenchmarkConfig config;
    private final PathExecutor executor;
    private final TextReport report;

    public BenchmarkSuite(BenchmarkConfig config, PathExecutor executor, TextReport report) {
        this.config = config;
        this.executor = executor;
        this.report = report;
    }

    /**
     * Load the instances and run them.
     *
     * @return one outcome per strategy and instance, in report order
     * @throws IOException if instances cannot be loaded, or the instance filter matches nothing
     */
    public List<InstanceOutcome> run() throws IOException {
        List<BenchmarkInstance> instances = InstanceLoader.loadAll(config.dataDir(), config.instanceFilter());
        if (instances.isEmpty() && config.instanceFilter() != null) {
            throw new IOException("No instance named '" + config.instanceFilter() + "' in " + config.dataDir());
        }
        return run(instances);
    }

    public List<InstanceOutcome> run(List<BenchmarkInstance> instances) {
        report.header(executor.backend().name(), instances.size(), config.dataDir(), config);

        InstanceRunner runner = new InstanceRunner(executor, config.warmupRuns(), config.measuredRuns());
        List<InstanceOutcome> outcomes = new ArrayList<>();
        for (Strategy strategy : config.strategies()) {
            report.strategyHeader(strategy);
            for (BenchmarkInstance instance : instances) {
                LOG.fine(() -> "Running " + instance.name() + " [" + strategy + ", " + config.layout() + "]");
                InstanceOutcome outcome = runner.run(instance, strategy, config.layout());
                report.row(outcome);
                outcomes.add(outcome);
            }
        }
        long skipped = outcomes.stream().filter(InstanceOutcome::skipped).count();
        LOG.info(() -> "Finished " + outcomes.size() + " runs, " + skipped + " skipped");
        return outcomes;
    }
}
