package io.surfworks.einforge.core.path;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered, opt_einsum-style contraction path.
 *
 * <p>Each step names two live positions; the higher one is removed first, then the lower,
 * and the contracted result is appended at the end of the operand list.
 *
 * @param steps the steps in application order
 */
public record ContractionPath(List<PathStep> steps) {

    public ContractionPath {
        steps = List.copyOf(steps);
    }

    /**
     * Build a path from raw index pairs as found in instance files.
     *
     * @throws IllegalArgumentException if an entry is not a pair or names the same position twice
     */
    public static ContractionPath fromPairs(List<int[]> pairs) {
        List<PathStep> steps = new ArrayList<>(pairs.size());
        for (int i = 0; i < pairs.size(); i++) {
            int[] pair = pairs.get(i);
            if (pair == null || pair.length != 2) {
                throw new IllegalArgumentException(
                    "Path entry " + i + " must be a pair of indices, got " +
                    (pair == null ? "null" : pair.length + " values"));
            }
            steps.add(new PathStep(pair[0], pair[1]));
        }
        return new ContractionPath(steps);
    }

    public static ContractionPath of(PathStep... steps) {
        return new ContractionPath(List.of(steps));
    }

    public int size() {
        return steps.size();
    }

    /**
     * Number of operands this path fully reduces to a single one.
     */
    public int expectedOperandCount() {
        return steps.size() + 1;
    }

    @Override
    public String toString() {
        return steps.toString();
    }
}
