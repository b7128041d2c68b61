package io.surfworks.einforge.backend.cpu.ops;

import io.surfworks.einforge.core.backend.BackendException;
import io.surfworks.einforge.core.tensor.ScalarType;
import io.surfworks.einforge.core.tensor.Tensor;
import io.surfworks.einforge.core.tensor.TensorSpec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Binary einsum over labelled axes.
 *
 * <p>Every label of either input is classified by the requested output labels: labels in the
 * output are free (or batch, when shared), labels missing from it are summed. The kernel walks
 * the output in row-major order and, for each element, accumulates the product of the two
 * inputs over all summed label combinations. Complex inputs are handled with interleaved
 * storage; a real input paired with a complex one is promoted.
 */
public class ContractKernel {

    private static final String PRIMITIVE = "contract";

    private final OutputAllocator allocator;

    public ContractKernel() {
        this(OutputAllocator.UNBOUNDED);
    }

    public ContractKernel(OutputAllocator allocator) {
        this.allocator = allocator;
    }

    public Tensor execute(Tensor a, List<Character> aLabels,
                          Tensor b, List<Character> bLabels,
                          List<Character> outLabels,
                          RangeExecutor executor) {
        checkOperand("first", a, aLabels);
        checkOperand("second", b, bLabels);
        allocator.checkRank(PRIMITIVE, a.rank());
        allocator.checkRank(PRIMITIVE, b.rank());
        requireDistinct("output", outLabels);

        Map<Character, Integer> extents = new HashMap<>();
        collectExtents(extents, a.shape(), aLabels);
        collectExtents(extents, b.shape(), bLabels);

        for (Character label : outLabels) {
            if (!extents.containsKey(label)) {
                throw new BackendException(PRIMITIVE,
                    "output label '" + label + "' appears in neither input " + aLabels + " nor " + bLabels);
            }
        }

        Set<Character> summed = new LinkedHashSet<>(aLabels);
        summed.addAll(bLabels);
        summed.removeAll(new HashSet<>(outLabels));

        int[] outShape = new int[outLabels.size()];
        for (int d = 0; d < outShape.length; d++) {
            outShape[d] = extents.get(outLabels.get(d));
        }
        ScalarType dtype = a.dtype().isComplex() || b.dtype().isComplex() ? ScalarType.C128 : ScalarType.F64;
        Tensor output = allocator.allocate(PRIMITIVE, TensorSpec.of(dtype, outShape));

        Axes outAxes = Axes.of(new ArrayList<>(outLabels), extents, a, aLabels, b, bLabels);
        Axes sumAxes = Axes.of(new ArrayList<>(summed), extents, a, aLabels, b, bLabels);
        long outCount = output.elementCount();
        long sumCount = sumAxes.count();
        if (outCount == 0 || sumCount == 0) {
            return output;
        }

        double[] aData = a.data();
        double[] bData = b.data();
        double[] outData = output.data();
        int ca = a.dtype().components();
        int cb = b.dtype().components();
        boolean complex = dtype.isComplex();

        executor.execute(outCount, (start, end) -> {
            int[] outIdx = outAxes.unflatten(start);
            long aBase = outAxes.offsetA(outIdx);
            long bBase = outAxes.offsetB(outIdx);
            int[] sumIdx = new int[sumAxes.rank()];

            for (long o = start; o < end; o++) {
                double re = 0.0;
                double im = 0.0;
                long aOff = aBase;
                long bOff = bBase;
                Arrays.fill(sumIdx, 0);
                for (long s = 0; s < sumCount; s++) {
                    int ai = (int) (aOff * ca);
                    int bi = (int) (bOff * cb);
                    if (complex) {
                        double ar = aData[ai];
                        double aim = ca == 2 ? aData[ai + 1] : 0.0;
                        double br = bData[bi];
                        double bim = cb == 2 ? bData[bi + 1] : 0.0;
                        re += ar * br - aim * bim;
                        im += ar * bim + aim * br;
                    } else {
                        re += aData[ai] * bData[bi];
                    }
                    // advance the summed odometer, adjusting offsets incrementally
                    for (int d = sumIdx.length - 1; d >= 0; d--) {
                        sumIdx[d]++;
                        aOff += sumAxes.strideA[d];
                        bOff += sumAxes.strideB[d];
                        if (sumIdx[d] < sumAxes.extent[d]) {
                            break;
                        }
                        aOff -= (long) sumAxes.extent[d] * sumAxes.strideA[d];
                        bOff -= (long) sumAxes.extent[d] * sumAxes.strideB[d];
                        sumIdx[d] = 0;
                    }
                }
                if (complex) {
                    outData[(int) (2 * o)] = re;
                    outData[(int) (2 * o + 1)] = im;
                } else {
                    outData[(int) o] = re;
                }

                for (int d = outIdx.length - 1; d >= 0; d--) {
                    outIdx[d]++;
                    aBase += outAxes.strideA[d];
                    bBase += outAxes.strideB[d];
                    if (outIdx[d] < outAxes.extent[d]) {
                        break;
                    }
                    aBase -= (long) outAxes.extent[d] * outAxes.strideA[d];
                    bBase -= (long) outAxes.extent[d] * outAxes.strideB[d];
                    outIdx[d] = 0;
                }
            }
        });
        return output;
    }

    private static void checkOperand(String which, Tensor tensor, List<Character> labels) {
        if (labels.size() != tensor.rank()) {
            throw new BackendException(PRIMITIVE,
                which + " input has rank " + tensor.rank() + " but " + labels.size() + " labels " + labels);
        }
        requireDistinct(which + " input", labels);
    }

    private static void requireDistinct(String which, List<Character> labels) {
        if (new HashSet<>(labels).size() != labels.size()) {
            throw new BackendException(PRIMITIVE, which + " repeats a label: " + labels);
        }
    }

    private static void collectExtents(Map<Character, Integer> extents, int[] shape, List<Character> labels) {
        for (int d = 0; d < shape.length; d++) {
            Character label = labels.get(d);
            Integer previous = extents.putIfAbsent(label, shape[d]);
            if (previous != null && previous != shape[d]) {
                throw new BackendException(PRIMITIVE,
                    "label '" + label + "' has extent " + previous + " and " + shape[d]);
            }
        }
    }

    /**
     * A list of labelled loop axes with their extents and element strides in each input
     * (0 where the input lacks the label).
     */
    private static final class Axes {
        final int[] extent;
        final long[] strideA;
        final long[] strideB;

        private Axes(int rank) {
            extent = new int[rank];
            strideA = new long[rank];
            strideB = new long[rank];
        }

        static Axes of(List<Character> labels, Map<Character, Integer> extents,
                       Tensor a, List<Character> aLabels, Tensor b, List<Character> bLabels) {
            Axes axes = new Axes(labels.size());
            long[] aStrides = a.spec().strides();
            long[] bStrides = b.spec().strides();
            for (int d = 0; d < labels.size(); d++) {
                Character label = labels.get(d);
                axes.extent[d] = extents.get(label);
                int ai = aLabels.indexOf(label);
                int bi = bLabels.indexOf(label);
                axes.strideA[d] = ai >= 0 ? aStrides[ai] : 0;
                axes.strideB[d] = bi >= 0 ? bStrides[bi] : 0;
            }
            return axes;
        }

        int rank() {
            return extent.length;
        }

        long count() {
            long count = 1;
            for (int e : extent) {
                count *= e;
            }
            return count;
        }

        int[] unflatten(long flat) {
            int[] idx = new int[extent.length];
            for (int d = extent.length - 1; d >= 0; d--) {
                idx[d] = (int) (flat % extent[d]);
                flat /= extent[d];
            }
            return idx;
        }

        long offsetA(int[] idx) {
            long off = 0;
            for (int d = 0; d < idx.length; d++) {
                off += idx[d] * strideA[d];
            }
            return off;
        }

        long offsetB(int[] idx) {
            long off = 0;
            for (int d = 0; d < idx.length; d++) {
                off += idx[d] * strideB[d];
            }
            return off;
        }
    }
}
