package io.surfworks.einforge.core.backend;

/**
 * Unchecked exception raised by a {@link Backend} primitive.
 *
 * <p>The contraction executor never catches it: a primitive failure aborts the
 * whole path evaluation and reaches the caller unchanged.
 */
public class BackendException extends RuntimeException {

    private final String primitive;

    public BackendException(String primitive, String message) {
        super(primitive + ": " + message);
        this.primitive = primitive;
    }

    public BackendException(String primitive, String message, Throwable cause) {
        super(primitive + ": " + message, cause);
        this.primitive = primitive;
    }

    /**
     * Returns the primitive that failed ("contract", "permute" or "allocate").
     */
    public String primitive() {
        return primitive;
    }
}
