package io.surfworks.einforge.core.testing;

import io.surfworks.einforge.core.tensor.Tensor;

import java.util.Arrays;

/**
 * Assertion utilities for tensor comparisons in tests.
 * Provides detailed failure messages showing where tensors differ.
 */
public final class TensorAssert {

    private static final int MAX_REPORTED = 5;

    private TensorAssert() {} // Utility class

    /**
     * Assert that two tensors are equal within the default tolerance of the expected dtype.
     */
    public static void assertEquals(Tensor expected, Tensor actual) {
        assertEquals(null, expected, actual, ToleranceConfig.forDtype(expected.dtype()));
    }

    /**
     * Assert that two tensors are equal within specified tolerance.
     */
    public static void assertEquals(Tensor expected, Tensor actual, ToleranceConfig tolerance) {
        assertEquals(null, expected, actual, tolerance);
    }

    /**
     * Assert that two tensors are equal within specified tolerance with custom message.
     *
     * @throws AssertionError on shape, dtype or element mismatch
     */
    public static void assertEquals(String message, Tensor expected, Tensor actual, ToleranceConfig tolerance) {
        String prefix = message != null ? message + ": " : "";

        if (expected == null || actual == null) {
            if (expected != actual) {
                throw new AssertionError(prefix + "expected " + expected + " but was " + actual);
            }
            return;
        }

        if (!Arrays.equals(expected.shape(), actual.shape())) {
            throw new AssertionError(prefix + "shape mismatch: expected " +
                Arrays.toString(expected.shape()) + " but was " + Arrays.toString(actual.shape()));
        }
        if (expected.dtype() != actual.dtype()) {
            throw new AssertionError(prefix + "dtype mismatch: expected " +
                expected.dtype() + " but was " + actual.dtype());
        }

        double[] e = expected.data();
        double[] a = actual.data();
        int components = expected.dtype().components();
        StringBuilder failures = new StringBuilder();
        int failureCount = 0;
        for (int i = 0; i < e.length; i++) {
            if (!tolerance.isClose(e[i], a[i])) {
                failureCount++;
                if (failureCount <= MAX_REPORTED) {
                    failures.append("\n  element ").append(i / components);
                    if (components == 2) {
                        failures.append(i % 2 == 0 ? " (re)" : " (im)");
                    }
                    failures.append(": expected ").append(e[i]).append(" but was ").append(a[i]);
                }
            }
        }
        if (failureCount > 0) {
            throw new AssertionError(prefix + failureCount + " values differ beyond atol=" +
                tolerance.atol() + ", rtol=" + tolerance.rtol() + failures);
        }
    }

    /**
     * Assert that a tensor contains finite values only.
     */
    public static void assertFinite(Tensor tensor) {
        double[] data = tensor.data();
        for (int i = 0; i < data.length; i++) {
            if (!Double.isFinite(data[i])) {
                throw new AssertionError("tensor contains non-finite value " + data[i] + " at storage index " + i);
            }
        }
    }
}
