package io.surfworks.einforge.core.tensor;

import java.util.Arrays;

/**
 * Tensor specification: shape, dtype, and computed strides.
 * Immutable metadata describing a row-major tensor layout.
 */
public record TensorSpec(
    int[] shape,
    ScalarType dtype,
    long[] strides
) {
    public TensorSpec {
        if (shape.length != strides.length) {
            throw new IllegalArgumentException("Shape and strides must have same length");
        }
        for (int dim : shape) {
            if (dim < 0) {
                throw new IllegalArgumentException("Negative extent in shape " + Arrays.toString(shape));
            }
        }
    }

    /**
     * Create a TensorSpec with row-major (C-contiguous) strides.
     */
    public static TensorSpec of(ScalarType dtype, int... shape) {
        long[] strides = computeRowMajorStrides(shape);
        return new TensorSpec(shape.clone(), dtype, strides);
    }

    /**
     * Number of dimensions.
     */
    public int rank() {
        return shape.length;
    }

    /**
     * Total number of elements.
     */
    public long elementCount() {
        if (shape.length == 0) {
            return 1; // Scalar tensor
        }
        long count = 1;
        for (int dim : shape) {
            count *= dim;
        }
        return count;
    }

    /**
     * Total size in bytes.
     */
    public long byteSize() {
        return elementCount() * dtype.byteSize();
    }

    /**
     * Compute flat element index from multi-dimensional indices.
     */
    public long flatIndex(int... indices) {
        if (indices.length != shape.length) {
            throw new IllegalArgumentException(
                "Expected " + shape.length + " indices, got " + indices.length);
        }
        long idx = 0;
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] < 0 || indices[i] >= shape[i]) {
                throw new IndexOutOfBoundsException(
                    "Index " + indices[i] + " out of bounds for dimension " + i + " with size " + shape[i]);
            }
            idx += indices[i] * strides[i];
        }
        return idx;
    }

    /**
     * Spec with the same dtype and the given axes order: axis k of the result is axis perm[k] of this.
     */
    public TensorSpec permuted(int[] perm) {
        if (perm.length != shape.length) {
            throw new IllegalArgumentException(
                "Permutation " + Arrays.toString(perm) + " does not match rank " + shape.length);
        }
        int[] permutedShape = new int[perm.length];
        for (int k = 0; k < perm.length; k++) {
            permutedShape[k] = shape[perm[k]];
        }
        return of(dtype, permutedShape);
    }

    /**
     * Compute row-major (C-contiguous) strides for a shape.
     */
    public static long[] computeRowMajorStrides(int[] shape) {
        if (shape.length == 0) {
            return new long[0];
        }
        long[] strides = new long[shape.length];
        long stride = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            strides[i] = stride;
            stride *= shape[i];
        }
        return strides;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TensorSpec that)) return false;
        return Arrays.equals(shape, that.shape) &&
               dtype == that.dtype &&
               Arrays.equals(strides, that.strides);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(shape);
        result = 31 * result + dtype.hashCode();
        result = 31 * result + Arrays.hashCode(strides);
        return result;
    }

    @Override
    public String toString() {
        return "TensorSpec[shape=" + Arrays.toString(shape) +
               ", dtype=" + dtype +
               ", strides=" + Arrays.toString(strides) + "]";
    }
}
