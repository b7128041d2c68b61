package io.surfworks.einforge.core.einsum;

import java.util.List;

/**
 * The surviving operand's labels are not a permutation of the requested output labels.
 * Signals that the path and the instance description do not belong together.
 */
public class LabelSetMismatchException extends ContractionException {

    private final List<Character> finalLabels;
    private final List<Character> outputLabels;

    public LabelSetMismatchException(List<Character> finalLabels, List<Character> outputLabels) {
        super("Final labels " + EinsumFormat.labelString(finalLabels) +
              " do not match output labels " + EinsumFormat.labelString(outputLabels));
        this.finalLabels = List.copyOf(finalLabels);
        this.outputLabels = List.copyOf(outputLabels);
    }

    public List<Character> finalLabels() {
        return finalLabels;
    }

    public List<Character> outputLabels() {
        return outputLabels;
    }
}
