package io.surfworks.einforge.core.einsum;

import io.surfworks.einforge.core.tensor.Tensor;

import java.util.List;
import java.util.Objects;

/**
 * A tensor together with one label per axis: {@code labels.get(i)} names axis {@code i}.
 *
 * @param tensor the tensor handle
 * @param labels the axis labels, size equal to the tensor's rank
 */
public record Operand(Tensor tensor, List<Character> labels) {

    public Operand {
        Objects.requireNonNull(tensor, "tensor cannot be null");
        Objects.requireNonNull(labels, "labels cannot be null");
        labels = List.copyOf(labels);
        if (labels.size() != tensor.rank()) {
            throw new IllegalArgumentException(
                "Operand has " + labels.size() + " labels " + labels + " but tensor rank is " + tensor.rank());
        }
    }

    /**
     * Create an operand from a label string such as {@code "ijk"}.
     */
    public static Operand of(Tensor tensor, String labels) {
        return new Operand(tensor, EinsumFormat.labelsOf(labels));
    }

    @Override
    public String toString() {
        return "Operand[" + EinsumFormat.labelString(labels) + ", " + tensor + "]";
    }
}
