package io.surfworks.einforge.core.einsum;

import java.util.ArrayList;
import java.util.List;

/**
 * The evolving, ordered list of live operands during a path evaluation.
 *
 * <p>Every path step removes two entries and appends one, so positions refer to the list
 * as it exists at that point in execution. Untouched entries keep their relative order.
 */
public final class OperandList {

    private final List<Operand> operands;

    public OperandList(List<Operand> initial) {
        this.operands = new ArrayList<>(initial);
    }

    public int size() {
        return operands.size();
    }

    public Operand get(int index) throws PathIndexException {
        checkIndex(index);
        return operands.get(index);
    }

    /**
     * Remove and return the operand at {@code index}, shifting later entries down by one.
     */
    public Operand removeAt(int index) throws PathIndexException {
        checkIndex(index);
        return operands.remove(index);
    }

    /**
     * Add an operand at the end.
     */
    public void append(Operand operand) {
        operands.add(operand);
    }

    /**
     * Label sequences of all live operands, in list order.
     */
    public List<List<Character>> labelsOfAll() {
        List<List<Character>> labels = new ArrayList<>(operands.size());
        for (Operand operand : operands) {
            labels.add(operand.labels());
        }
        return labels;
    }

    /**
     * The single operand left once a path has been fully applied.
     *
     * @throws ContractionException if the list does not hold exactly one operand
     */
    public Operand sole() throws ContractionException {
        if (operands.size() != 1) {
            throw new ContractionException(
                "Expected exactly one operand after the path, found " + operands.size());
        }
        return operands.get(0);
    }

    /**
     * Fail with {@link PathIndexException} unless {@code index} is a live position.
     */
    public void checkIndex(int index) throws PathIndexException {
        if (index < 0 || index >= operands.size()) {
            throw new PathIndexException(index, operands.size());
        }
    }
}
