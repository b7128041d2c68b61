package io.surfworks.einforge.core.path;

import io.surfworks.einforge.core.backend.Backend;
import io.surfworks.einforge.core.einsum.ContractionException;
import io.surfworks.einforge.core.einsum.EinsumFormat;
import io.surfworks.einforge.core.einsum.Operand;
import io.surfworks.einforge.core.einsum.OperandList;
import io.surfworks.einforge.core.einsum.PathIndexException;
import io.surfworks.einforge.core.tensor.Tensor;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Evaluates a tensor network by replaying a precomputed pairwise contraction path on a {@link Backend}.
 *
 * <p>Steps run strictly in the order given; each consumes the operand list produced by the
 * previous one. The executor keeps no state between calls and may be reused.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (CpuBackend backend = new CpuBackend()) {
 *     PathExecutor executor = new PathExecutor(backend);
 *     EinsumFormat format = EinsumFormat.parse("ij,jk,kl->il");
 *     Tensor result = executor.execute(format, List.of(a, b, c),
 *         ContractionPath.of(new PathStep(0, 1), new PathStep(0, 1)));
 * }
 * }</pre>
 */
public final class PathExecutor {

    private static final Logger LOG = Logger.getLogger(PathExecutor.class.getName());

    private final Backend backend;
    private final StepExecutor stepExecutor;
    private final FinalReconciler reconciler;

    /**
     * Create an executor using the given backend.
     *
     * @param backend The backend providing the contraction and permutation primitives
     */
    public PathExecutor(Backend backend) {
        this.backend = backend;
        this.stepExecutor = new StepExecutor(backend);
        this.reconciler = new FinalReconciler(backend);
    }

    /**
     * Evaluate {@code operands} along {@code path}.
     *
     * @param operands     input tensors with their labels; ownership passes to the executor
     * @param path         the contraction path
     * @param outputLabels requested axis order of the result
     * @return the result tensor laid out in {@code outputLabels} order
     * @throws PathIndexException   if a path entry names a position that is not live at its step;
     *                              this is checked before the path length
     * @throws ContractionException if the path length does not fit the operands or the path ends
     *                              with labels other than {@code outputLabels}
     */
    public Tensor execute(List<Operand> operands, ContractionPath path, List<Character> outputLabels)
            throws ContractionException {
        if (operands.isEmpty()) {
            throw new ContractionException("No operands to contract");
        }
        checkIndices(path, operands.size());
        if (path.expectedOperandCount() != operands.size()) {
            throw new ContractionException(
                "Path with " + path.size() + " steps reduces " + path.expectedOperandCount() +
                " operands, but " + operands.size() + " were supplied");
        }

        OperandList live = new OperandList(operands);
        List<PathStep> steps = path.steps();
        for (int k = 0; k < steps.size(); k++) {
            stepExecutor.apply(live, outputLabels, steps.get(k), k);
        }

        Operand last = live.sole();
        LOG.fine(() -> "path of " + steps.size() + " steps ended with " +
            EinsumFormat.labelString(last.labels()) + ", requested " + EinsumFormat.labelString(outputLabels));
        return reconciler.reconcile(last, outputLabels);
    }

    /**
     * Replay the list sizes along the path and reject the first entry naming a dead position,
     * before any primitive is called.
     */
    private static void checkIndices(ContractionPath path, int operandCount) throws PathIndexException {
        int size = operandCount;
        List<PathStep> steps = path.steps();
        for (int k = 0; k < steps.size(); k++) {
            PathStep step = steps.get(k);
            if (step.lower() < 0) {
                throw new PathIndexException(k, step.lower(), size);
            }
            if (step.higher() >= size) {
                throw new PathIndexException(k, step.higher(), size);
            }
            size--;
        }
    }

    /**
     * Evaluate tensors described by an einsum format along {@code path}.
     *
     * @throws IllegalArgumentException if the tensor count or ranks do not match the format
     */
    public Tensor execute(EinsumFormat format, List<Tensor> tensors, ContractionPath path)
            throws ContractionException {
        if (tensors.size() != format.operandCount()) {
            throw new IllegalArgumentException(
                "Format " + format + " has " + format.operandCount() + " operands, got " + tensors.size() + " tensors");
        }
        List<Operand> operands = new ArrayList<>(tensors.size());
        for (int i = 0; i < tensors.size(); i++) {
            operands.add(new Operand(tensors.get(i), format.inputs().get(i)));
        }
        return execute(operands, path, format.output());
    }

    /**
     * Get the backend used by this executor.
     */
    public Backend backend() {
        return backend;
    }
}
