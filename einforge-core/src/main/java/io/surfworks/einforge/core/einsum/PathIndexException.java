package io.surfworks.einforge.core.einsum;

/**
 * A path entry referenced a position outside the current operand list.
 */
public class PathIndexException extends ContractionException {

    private final int stepIndex;
    private final int index;
    private final int listSize;

    public PathIndexException(int index, int listSize) {
        this(-1, index, listSize);
    }

    public PathIndexException(int stepIndex, int index, int listSize) {
        super(describe(stepIndex, index, listSize));
        this.stepIndex = stepIndex;
        this.index = index;
        this.listSize = listSize;
    }

    private static String describe(int stepIndex, int index, int listSize) {
        String where = stepIndex >= 0 ? "Path step " + stepIndex + ": index " : "Index ";
        return where + index + " out of range for " + listSize + " live operands";
    }

    /**
     * The failing step, or -1 when raised outside a path step.
     */
    public int stepIndex() {
        return stepIndex;
    }

    public int index() {
        return index;
    }

    public int listSize() {
        return listSize;
    }
}
