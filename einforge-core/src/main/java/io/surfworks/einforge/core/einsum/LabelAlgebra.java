package io.surfworks.einforge.core.einsum;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pure label computations used by the contraction executor.
 *
 * <p>Labels are compared with {@code equals} only; the only order that matters is the
 * first-seen position within a sequence.
 */
public final class LabelAlgebra {

    private LabelAlgebra() {}

    /**
     * Labels that survive a binary step: scan {@code first} then {@code second}, keeping each
     * label the first time it is seen if and only if it is still needed.
     *
     * <p>A label shared by both inputs and still needed is carried forward once (batch);
     * shared and not needed it is contracted; present in one input and not needed it is
     * summed over that input alone.
     */
    public static <L> List<L> pairOutput(List<L> first, List<L> second, Set<L> stillNeeded) {
        Set<L> kept = new LinkedHashSet<>();
        for (L label : first) {
            if (stillNeeded.contains(label)) {
                kept.add(label);
            }
        }
        for (L label : second) {
            if (stillNeeded.contains(label)) {
                kept.add(label);
            }
        }
        return new ArrayList<>(kept);
    }

    /**
     * Union of the final output labels and the labels of every operand still waiting to be contracted.
     */
    public static <L> Set<L> stillNeeded(List<L> outputLabels, Collection<? extends List<L>> remaining) {
        Set<L> needed = new HashSet<>(outputLabels);
        for (List<L> labels : remaining) {
            needed.addAll(labels);
        }
        return needed;
    }

    /**
     * True if both sequences hold the same labels, ignoring order and repetition.
     */
    public static <L> boolean sameLabelSet(List<L> a, List<L> b) {
        return new HashSet<>(a).equals(new HashSet<>(b));
    }

    /**
     * Permutation taking {@code from} to {@code to}: {@code perm[k]} is the position in
     * {@code from} of {@code to.get(k)}.
     *
     * @throws IllegalArgumentException if {@code to} is not a permutation of {@code from}
     */
    public static <L> int[] permutation(List<L> from, List<L> to) {
        if (from.size() != to.size()) {
            throw new IllegalArgumentException("Cannot permute " + from + " into " + to + ": rank differs");
        }
        int[] perm = new int[to.size()];
        boolean[] used = new boolean[from.size()];
        for (int k = 0; k < to.size(); k++) {
            int position = from.indexOf(to.get(k));
            if (position < 0 || used[position]) {
                throw new IllegalArgumentException("Cannot permute " + from + " into " + to);
            }
            used[position] = true;
            perm[k] = position;
        }
        return perm;
    }
}
