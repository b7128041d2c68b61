package io.surfworks.einforge.backend.cpu.ops;

import io.surfworks.einforge.core.backend.BackendException;
import io.surfworks.einforge.core.tensor.Tensor;
import io.surfworks.einforge.core.tensor.TensorSpec;

import java.util.Arrays;

/**
 * Permute tensor axes: axis {@code k} of the output is axis {@code perm[k]} of the input.
 */
public class PermuteKernel {

    private static final String PRIMITIVE = "permute";

    private final OutputAllocator allocator;

    public PermuteKernel() {
        this(OutputAllocator.UNBOUNDED);
    }

    public PermuteKernel(OutputAllocator allocator) {
        this.allocator = allocator;
    }

    public Tensor execute(Tensor input, int[] perm, RangeExecutor executor) {
        int rank = input.rank();
        if (perm.length != rank) {
            throw new BackendException(PRIMITIVE,
                "permutation " + Arrays.toString(perm) + " does not match rank " + rank);
        }
        boolean[] seen = new boolean[rank];
        for (int p : perm) {
            if (p < 0 || p >= rank || seen[p]) {
                throw new BackendException(PRIMITIVE, "not a permutation: " + Arrays.toString(perm));
            }
            seen[p] = true;
        }

        TensorSpec outSpec = input.spec().permuted(perm);
        Tensor output = allocator.allocate(PRIMITIVE, outSpec);
        int[] outputShape = outSpec.shape();
        long[] inputStrides = input.spec().strides();
        double[] inputData = input.data();
        double[] outputData = output.data();
        int components = input.dtype().components();

        // Transpose by iterating over output and looking up input
        executor.execute(output.elementCount(), (start, end) -> {
            int[] outputIndices = new int[outputShape.length];
            for (long flatOut = start; flatOut < end; flatOut++) {
                long remaining = flatOut;
                for (int d = outputShape.length - 1; d >= 0; d--) {
                    outputIndices[d] = (int) (remaining % outputShape[d]);
                    remaining /= outputShape[d];
                }

                long flatIn = 0;
                for (int d = 0; d < perm.length; d++) {
                    flatIn += outputIndices[d] * inputStrides[perm[d]];
                }

                int src = (int) (flatIn * components);
                int dst = (int) (flatOut * components);
                outputData[dst] = inputData[src];
                if (components == 2) {
                    outputData[dst + 1] = inputData[src + 1];
                }
            }
        });
        return output;
    }
}
