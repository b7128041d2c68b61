package io.surfworks.einforge.core.backend;

import io.surfworks.einforge.core.tensor.Tensor;
import io.surfworks.einforge.core.tensor.TensorSpec;

import java.util.List;

/**
 * Backend interface for the numeric primitives the contraction executor delegates to.
 * Implementations provide execution on different targets; the executor only decides
 * which labels survive each step and in what order.
 *
 * <p>All calls are blocking. A backend may parallelize a single call internally.
 * Failures are reported as {@link BackendException} and are not retried by callers.
 */
public interface Backend extends AutoCloseable {

    /**
     * Returns the name of this backend (e.g., "cpu").
     */
    String name();

    /**
     * Returns the capabilities of this backend.
     */
    BackendCapabilities capabilities();

    /**
     * Binary einsum: contract {@code a} and {@code b} into a new tensor laid out in {@code outLabels} order.
     *
     * <p>A label present in both inputs and in the output is a batch dimension; present in
     * both but not in the output it is contracted; present in one input only and absent from
     * the output it is summed over that input alone.
     *
     * @param a         first input
     * @param aLabels   one label per axis of {@code a}
     * @param b         second input
     * @param bLabels   one label per axis of {@code b}
     * @param outLabels labels of the result, each appearing in {@code aLabels} or {@code bLabels}
     * @return a newly allocated tensor of rank {@code outLabels.size()}
     * @throws BackendException if the labels are inconsistent with the inputs or the call fails
     */
    Tensor contract(Tensor a, List<Character> aLabels,
                    Tensor b, List<Character> bLabels,
                    List<Character> outLabels);

    /**
     * Reorder axes: axis {@code k} of the result is axis {@code perm[k]} of {@code input}.
     *
     * @throws BackendException if {@code perm} is not a permutation of the input's axes
     */
    Tensor permute(Tensor input, int[] perm);

    /**
     * Allocate a tensor on this backend.
     *
     * @param spec The specification of the tensor to allocate
     * @return A newly allocated, zero-initialized tensor
     */
    Tensor allocate(TensorSpec spec);

    /**
     * Close this backend and release any resources.
     */
    @Override
    void close();
}
