package io.surfworks.einforge.backend.cpu.ops;

import io.surfworks.einforge.core.backend.BackendCapabilities;
import io.surfworks.einforge.core.backend.BackendException;
import io.surfworks.einforge.core.tensor.Tensor;
import io.surfworks.einforge.core.tensor.TensorSpec;

/**
 * Allocates kernel output tensors within the rank and element limits of a backend.
 *
 * <p>Every failure, including running out of heap, surfaces as a {@link BackendException}
 * naming the primitive that asked for the tensor.
 */
public final class OutputAllocator {

    /** No limits beyond what heap storage can hold. */
    public static final OutputAllocator UNBOUNDED = new OutputAllocator(Integer.MAX_VALUE, Long.MAX_VALUE);

    private final int maxRank;
    private final long maxElements;

    public OutputAllocator(int maxRank, long maxElements) {
        this.maxRank = maxRank;
        this.maxElements = maxElements;
    }

    public static OutputAllocator of(BackendCapabilities capabilities) {
        return new OutputAllocator(capabilities.maxTensorRank(), capabilities.maxElementCount());
    }

    /**
     * Fail unless a tensor of this rank may be handed to or produced by the backend.
     */
    public void checkRank(String primitive, int rank) {
        if (rank > maxRank) {
            throw new BackendException(primitive, "rank " + rank + " exceeds backend limit of " + maxRank);
        }
    }

    /**
     * Allocate a zero-filled tensor for {@code spec}.
     *
     * @throws BackendException if the spec exceeds the limits or the storage cannot be allocated
     */
    public Tensor allocate(String primitive, TensorSpec spec) {
        checkRank(primitive, spec.rank());
        long elements = spec.elementCount();
        if (elements > maxElements) {
            throw new BackendException(primitive,
                spec + " has " + elements + " elements, backend limit is " + maxElements);
        }
        try {
            return Tensor.zeros(spec);
        } catch (OutOfMemoryError | IllegalArgumentException e) {
            throw new BackendException(primitive, "cannot allocate " + spec, e);
        }
    }
}
