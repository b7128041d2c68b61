package io.surfworks.einforge.core.path;

import io.surfworks.einforge.core.backend.Backend;
import io.surfworks.einforge.core.einsum.EinsumFormat;
import io.surfworks.einforge.core.einsum.LabelAlgebra;
import io.surfworks.einforge.core.einsum.Operand;
import io.surfworks.einforge.core.einsum.OperandList;
import io.surfworks.einforge.core.einsum.PathIndexException;
import io.surfworks.einforge.core.jfr.ContractionStepEvent;
import io.surfworks.einforge.core.tensor.Tensor;

import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies a single path step to the operand list.
 *
 * <ol>
 *   <li>remove the operand at the higher position, then the one at the lower position</li>
 *   <li>collect the labels still needed: the output labels plus every label left in the list</li>
 *   <li>keep the first-seen needed labels of the lower operand followed by the higher one</li>
 *   <li>contract the pair on the backend and append the result</li>
 * </ol>
 */
public final class StepExecutor {

    private static final Logger LOG = Logger.getLogger(StepExecutor.class.getName());

    private final Backend backend;

    public StepExecutor(Backend backend) {
        this.backend = backend;
    }

    /**
     * Apply {@code step} to {@code operands}.
     *
     * @param operands     the live operand list, mutated in place
     * @param outputLabels the final output label sequence
     * @param step         the pair to contract
     * @param stepIndex    position of the step in its path (for diagnostics)
     * @return the appended operand
     * @throws PathIndexException if either position is outside the list; the list is left untouched
     */
    public Operand apply(OperandList operands, List<Character> outputLabels, PathStep step, int stepIndex)
            throws PathIndexException {
        int i = step.lower();
        int j = step.higher();
        if (i < 0 || j >= operands.size()) {
            throw new PathIndexException(stepIndex, i < 0 ? i : j, operands.size());
        }

        Operand right = operands.removeAt(j);
        Operand left = operands.removeAt(i);

        Set<Character> stillNeeded = LabelAlgebra.stillNeeded(outputLabels, operands.labelsOfAll());
        List<Character> pairOutput = LabelAlgebra.pairOutput(left.labels(), right.labels(), stillNeeded);

        ContractionStepEvent event = new ContractionStepEvent();
        event.begin();
        Tensor result = backend.contract(left.tensor(), left.labels(), right.tensor(), right.labels(), pairOutput);
        event.end();

        Operand produced = new Operand(result, pairOutput);
        operands.append(produced);

        if (event.shouldCommit()) {
            event.stepIndex = stepIndex;
            event.firstPosition = i;
            event.secondPosition = j;
            event.leftLabels = EinsumFormat.labelString(left.labels());
            event.rightLabels = EinsumFormat.labelString(right.labels());
            event.outputLabels = EinsumFormat.labelString(pairOutput);
            event.resultElements = result.elementCount();
            event.liveOperands = operands.size();
            event.backend = backend.name();
            event.commit();
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("step %d %s: %s,%s->%s (%d live)",
                stepIndex, step,
                EinsumFormat.labelString(left.labels()),
                EinsumFormat.labelString(right.labels()),
                EinsumFormat.labelString(pairOutput),
                operands.size()));
        }
        return produced;
    }
}
