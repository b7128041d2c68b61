package io.surfworks.einforge.benchmark.runner;

import io.surfworks.einforge.benchmark.instance.BenchmarkInstance;
import io.surfworks.einforge.benchmark.instance.Layout;
import io.surfworks.einforge.benchmark.instance.PathMeta;
import io.surfworks.einforge.benchmark.instance.Strategy;
import io.surfworks.einforge.core.backend.Backend;
import io.surfworks.einforge.core.backend.BackendException;
import io.surfworks.einforge.core.einsum.ContractionException;
import io.surfworks.einforge.core.einsum.EinsumFormat;
import io.surfworks.einforge.core.path.PathExecutor;
import io.surfworks.einforge.core.tensor.Tensor;
import io.surfworks.einforge.core.tensor.TensorSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Runs one instance under one strategy: warmup runs, then timed runs.
 *
 * <p>Operands are zero-filled tensors allocated once before the first run and shared by all
 * runs; the executor never writes to its inputs. Only path execution is timed.
 *
 * <p>A failure in any run turns the whole outcome into a skip carrying the failure message.
 */
public class InstanceRunner {

    private static final Logger LOG = Logger.getLogger(InstanceRunner.class.getName());

    private final PathExecutor executor;
    private final int warmupRuns;
    private final int measuredRuns;

    public InstanceRunner(PathExecutor executor, int warmupRuns, int measuredRuns) {
        if (warmupRuns < 0) {
            throw new IllegalArgumentException("warmupRuns must be >= 0, got " + warmupRuns);
        }
        if (measuredRuns < 1) {
            throw new IllegalArgumentException("measuredRuns must be >= 1, got " + measuredRuns);
        }
        this.executor = executor;
        this.warmupRuns = warmupRuns;
        this.measuredRuns = measuredRuns;
    }

    public InstanceOutcome run(BenchmarkInstance instance, Strategy strategy, Layout layout) {
        PathMeta meta = instance.paths().get(strategy);
        if (meta == null) {
            return skip(instance, strategy, Double.NaN, Double.NaN, "no " + strategy + " path");
        }
        try {
            EinsumFormat format = instance.format(layout);
            List<Tensor> tensors = allocateOperands(instance, layout);

            for (int i = 0; i < warmupRuns; i++) {
                executor.execute(format, tensors, meta.path());
            }

            long[] timings = new long[measuredRuns];
            for (int i = 0; i < measuredRuns; i++) {
                long start = System.nanoTime();
                executor.execute(format, tensors, meta.path());
                timings[i] = System.nanoTime() - start;
            }

            BenchmarkResult result = new BenchmarkResult(instance.name(), strategy.key(),
                executor.backend().name(), warmupRuns, measuredRuns, timings);
            LOG.info(() -> result.toSummaryString());
            return new InstanceOutcome(instance.name(), strategy, instance.numTensors(),
                meta.log10Flops(), meta.log2Size(), result, null);
        } catch (ContractionException | BackendException | IllegalArgumentException e) {
            LOG.warning("Skipping " + instance.name() + " [" + strategy + "]: " + e.getMessage());
            return skip(instance, strategy, meta.log10Flops(), meta.log2Size(), e.getMessage());
        }
    }

    private List<Tensor> allocateOperands(BenchmarkInstance instance, Layout layout) {
        Backend backend = executor.backend();
        List<int[]> shapes = instance.shapes(layout);
        List<Tensor> tensors = new ArrayList<>(shapes.size());
        for (int[] shape : shapes) {
            tensors.add(backend.allocate(TensorSpec.of(instance.dtype(), shape)));
        }
        return tensors;
    }

    private static InstanceOutcome skip(BenchmarkInstance instance, Strategy strategy,
                                        double log10Flops, double log2Size, String reason) {
        return new InstanceOutcome(instance.name(), strategy, instance.numTensors(),
            log10Flops, log2Size, null, reason);
    }
}
