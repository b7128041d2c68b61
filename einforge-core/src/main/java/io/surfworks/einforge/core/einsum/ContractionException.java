package io.surfworks.einforge.core.einsum;

/**
 * Checked exception for fatal usage errors while evaluating a contraction path.
 *
 * <p>These are never recovered inside the executor: the in-progress operand list is
 * discarded and the instance fails as a whole.
 */
public class ContractionException extends Exception {

    public ContractionException(String message) {
        super(message);
    }

    public ContractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
