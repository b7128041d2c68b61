package io.surfworks.einforge.core.path;

import io.surfworks.einforge.core.backend.Backend;
import io.surfworks.einforge.core.einsum.EinsumFormat;
import io.surfworks.einforge.core.einsum.LabelAlgebra;
import io.surfworks.einforge.core.einsum.LabelSetMismatchException;
import io.surfworks.einforge.core.einsum.Operand;
import io.surfworks.einforge.core.tensor.Tensor;

import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * Brings the last surviving operand into the requested output axis order.
 */
public final class FinalReconciler {

    private static final Logger LOG = Logger.getLogger(FinalReconciler.class.getName());

    private final Backend backend;

    public FinalReconciler(Backend backend) {
        this.backend = backend;
    }

    /**
     * Return the operand's tensor unchanged if its labels already equal {@code outputLabels},
     * otherwise permute it on the backend.
     *
     * @throws LabelSetMismatchException if the labels are not a permutation of {@code outputLabels}
     */
    public Tensor reconcile(Operand last, List<Character> outputLabels) throws LabelSetMismatchException {
        List<Character> finalLabels = last.labels();
        if (finalLabels.equals(outputLabels)) {
            return last.tensor();
        }
        if (finalLabels.size() != outputLabels.size() || !LabelAlgebra.sameLabelSet(finalLabels, outputLabels)) {
            throw new LabelSetMismatchException(finalLabels, outputLabels);
        }
        int[] perm = LabelAlgebra.permutation(finalLabels, outputLabels);
        LOG.fine(() -> "permuting " + EinsumFormat.labelString(finalLabels) + " -> " +
            EinsumFormat.labelString(outputLabels) + " with " + Arrays.toString(perm));
        return backend.permute(last.tensor(), perm);
    }
}
