package io.surfworks.einforge.core.tensor;

import java.util.Arrays;

/**
 * A dense, row-major, multi-dimensional tensor backed by a heap {@code double[]}.
 *
 * <p>Real tensors store one double per element. Complex tensors store interleaved
 * (real, imaginary) pairs, so element {@code i} lives at {@code data[2 * i]} and
 * {@code data[2 * i + 1]}.
 */
public final class Tensor {
    private final TensorSpec spec;
    private final double[] data;

    private Tensor(TensorSpec spec, double[] data) {
        this.spec = spec;
        this.data = data;
    }

    // ==================== Factory Methods ====================

    /**
     * Create a zero-initialized tensor with the given dtype and shape.
     */
    public static Tensor zeros(ScalarType dtype, int... shape) {
        return zeros(TensorSpec.of(dtype, shape));
    }

    /**
     * Create a zero-initialized tensor for a spec.
     */
    public static Tensor zeros(TensorSpec spec) {
        return new Tensor(spec, new double[storageLength(spec)]);
    }

    /**
     * Create a rank-0 real tensor holding one value.
     */
    public static Tensor scalar(double value) {
        return fromDoubleArray(new double[]{value});
    }

    /**
     * Create a real tensor from a double array (flattened, row-major).
     */
    public static Tensor fromDoubleArray(double[] data, int... shape) {
        TensorSpec spec = TensorSpec.of(ScalarType.F64, shape);
        if (data.length != spec.elementCount()) {
            throw new IllegalArgumentException(
                "Data length " + data.length + " doesn't match shape " + Arrays.toString(shape) +
                " (expected " + spec.elementCount() + " elements)");
        }
        return new Tensor(spec, data.clone());
    }

    /**
     * Create a complex tensor from interleaved (real, imaginary) pairs.
     */
    public static Tensor fromComplexArray(double[] interleaved, int... shape) {
        TensorSpec spec = TensorSpec.of(ScalarType.C128, shape);
        if (interleaved.length != 2 * spec.elementCount()) {
            throw new IllegalArgumentException(
                "Data length " + interleaved.length + " doesn't match complex shape " + Arrays.toString(shape) +
                " (expected " + 2 * spec.elementCount() + " doubles)");
        }
        return new Tensor(spec, interleaved.clone());
    }

    /**
     * Wrap an existing storage array without copying. The array is owned by the tensor afterwards.
     */
    public static Tensor wrap(TensorSpec spec, double[] storage) {
        if (storage.length != storageLength(spec)) {
            throw new IllegalArgumentException(
                "Storage length " + storage.length + " doesn't match " + spec +
                " (expected " + storageLength(spec) + " doubles)");
        }
        return new Tensor(spec, storage);
    }

    private static int storageLength(TensorSpec spec) {
        long length = spec.elementCount() * spec.dtype().components();
        if (length > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Tensor too large for heap storage: " + spec);
        }
        return (int) length;
    }

    // ==================== Accessors ====================

    public TensorSpec spec() {
        return spec;
    }

    public int[] shape() {
        return spec.shape().clone();
    }

    public int rank() {
        return spec.rank();
    }

    public long elementCount() {
        return spec.elementCount();
    }

    public ScalarType dtype() {
        return spec.dtype();
    }

    /**
     * The backing storage. Kernels read and write it directly; callers must not resize or share it.
     */
    public double[] data() {
        return data;
    }

    // ==================== Element Access ====================

    /**
     * Get a real element (or the real part of a complex element) at multi-dimensional indices.
     */
    public double getDouble(int... indices) {
        return data[(int) spec.flatIndex(indices) * spec.dtype().components()];
    }

    /**
     * Set a real element at multi-dimensional indices.
     */
    public void setDouble(double value, int... indices) {
        data[(int) spec.flatIndex(indices) * spec.dtype().components()] = value;
    }

    /**
     * Get the imaginary part of a complex element; 0 for real tensors.
     */
    public double getImag(int... indices) {
        if (!spec.dtype().isComplex()) {
            return 0.0;
        }
        return data[(int) spec.flatIndex(indices) * 2 + 1];
    }

    /**
     * Set a complex element at multi-dimensional indices.
     */
    public void setComplex(double real, double imag, int... indices) {
        if (!spec.dtype().isComplex()) {
            throw new IllegalStateException("setComplex on a " + spec.dtype() + " tensor");
        }
        int offset = (int) spec.flatIndex(indices) * 2;
        data[offset] = real;
        data[offset + 1] = imag;
    }

    // ==================== Bulk Operations ====================

    /**
     * Create a deep copy of this tensor.
     */
    public Tensor copy() {
        return new Tensor(spec, data.clone());
    }

    @Override
    public String toString() {
        return "Tensor[" + Arrays.toString(spec.shape()) + ", " + spec.dtype() + "]";
    }
}
