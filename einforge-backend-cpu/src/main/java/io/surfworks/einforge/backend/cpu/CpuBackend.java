package io.surfworks.einforge.backend.cpu;

import io.surfworks.einforge.backend.cpu.ops.ContractKernel;
import io.surfworks.einforge.backend.cpu.ops.OutputAllocator;
import io.surfworks.einforge.backend.cpu.ops.PermuteKernel;
import io.surfworks.einforge.backend.cpu.ops.RangeExecutor;
import io.surfworks.einforge.backend.cpu.ops.RangeTask;
import io.surfworks.einforge.core.backend.Backend;
import io.surfworks.einforge.core.backend.BackendCapabilities;
import io.surfworks.einforge.core.backend.BackendException;
import io.surfworks.einforge.core.tensor.ScalarType;
import io.surfworks.einforge.core.tensor.Tensor;
import io.surfworks.einforge.core.tensor.TensorSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * CPU backend implementing the contraction and permutation primitives on heap tensors.
 *
 * <p>With a parallelism above one, each primitive call splits its output range across a
 * fixed pool of daemon threads and blocks until all slices are done.
 */
public class CpuBackend implements Backend {

    private static final Logger LOG = Logger.getLogger(CpuBackend.class.getName());

    /** Below this many output elements a call always runs on the caller thread. */
    private static final long MIN_PARALLEL_ELEMENTS = 1 << 14;

    private final BackendCapabilities capabilities;
    private final OutputAllocator allocator;
    private final ContractKernel contractKernel;
    private final PermuteKernel permuteKernel;
    private final ExecutorService pool;
    private final RangeExecutor rangeExecutor;
    private volatile boolean closed = false;

    public CpuBackend() {
        this(1);
    }

    /**
     * @param parallelism number of threads a single primitive call may use
     */
    public CpuBackend(int parallelism) {
        this(BackendCapabilities.builder()
            .supportedDtypes(Set.of(ScalarType.F64, ScalarType.C128))
            .parallelism(parallelism)
            .build());
    }

    /**
     * Create a backend bounded by {@code capabilities}. Tensors above its rank or element
     * limits are rejected with a {@link BackendException}.
     */
    public CpuBackend(BackendCapabilities capabilities) {
        this.capabilities = capabilities;
        this.allocator = OutputAllocator.of(capabilities);
        this.contractKernel = new ContractKernel(allocator);
        this.permuteKernel = new PermuteKernel(allocator);
        int parallelism = capabilities.parallelism();
        if (parallelism > 1) {
            this.pool = Executors.newFixedThreadPool(parallelism, new KernelThreadFactory());
            this.rangeExecutor = this::executeSplit;
        } else {
            this.pool = null;
            this.rangeExecutor = RangeExecutor.SEQUENTIAL;
        }
        LOG.fine(() -> "cpu backend created with parallelism " + parallelism);
    }

    @Override
    public String name() {
        return "cpu";
    }

    @Override
    public BackendCapabilities capabilities() {
        return capabilities;
    }

    @Override
    public Tensor contract(Tensor a, List<Character> aLabels,
                           Tensor b, List<Character> bLabels,
                           List<Character> outLabels) {
        checkNotClosed();
        checkDtype(a);
        checkDtype(b);
        return contractKernel.execute(a, aLabels, b, bLabels, outLabels, rangeExecutor);
    }

    @Override
    public Tensor permute(Tensor input, int[] perm) {
        checkNotClosed();
        checkDtype(input);
        allocator.checkRank("permute", input.rank());
        return permuteKernel.execute(input, perm, rangeExecutor);
    }

    @Override
    public Tensor allocate(TensorSpec spec) {
        checkNotClosed();
        if (!capabilities.supports(spec.dtype())) {
            throw new BackendException("allocate", "unsupported dtype " + spec.dtype());
        }
        return allocator.allocate("allocate", spec);
    }

    @Override
    public void close() {
        closed = true;
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private void executeSplit(long total, RangeTask task) {
        int parallelism = capabilities.parallelism();
        if (total < MIN_PARALLEL_ELEMENTS) {
            task.run(0, total);
            return;
        }
        long chunk = (total + parallelism - 1) / parallelism;
        List<Callable<Void>> slices = new ArrayList<>(parallelism);
        for (long start = 0; start < total; start += chunk) {
            long sliceStart = start;
            long sliceEnd = Math.min(total, start + chunk);
            slices.add(() -> {
                task.run(sliceStart, sliceEnd);
                return null;
            });
        }
        try {
            for (Future<Void> future : pool.invokeAll(slices)) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException("cpu", "interrupted while waiting for kernel slices", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new BackendException("cpu", "kernel slice failed", cause);
        }
    }

    private void checkDtype(Tensor tensor) {
        if (!capabilities.supports(tensor.dtype())) {
            throw new BackendException("cpu", "unsupported dtype " + tensor.dtype());
        }
    }

    private void checkNotClosed() {
        if (closed) {
            throw new IllegalStateException("Backend has been closed");
        }
    }

    private static final class KernelThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "einforge-cpu-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
