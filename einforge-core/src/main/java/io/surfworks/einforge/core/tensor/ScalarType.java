package io.surfworks.einforge.core.tensor;

/**
 * Scalar element types for tensors.
 *
 * <p>Complex types are stored as interleaved (real, imaginary) pairs of doubles,
 * so {@link #components()} reports how many doubles make up one element.
 */
public enum ScalarType {
    F64(8, 1, "float64"),
    C128(16, 2, "complex128");

    private final int byteSize;
    private final int components;
    private final String numpyName;

    ScalarType(int byteSize, int components, String numpyName) {
        this.byteSize = byteSize;
        this.components = components;
        this.numpyName = numpyName;
    }

    public int byteSize() {
        return byteSize;
    }

    /**
     * Number of doubles stored per element (1 for real, 2 for complex).
     */
    public int components() {
        return components;
    }

    public boolean isComplex() {
        return components == 2;
    }

    /**
     * The NumPy dtype name (e.g., "float64").
     */
    public String numpyName() {
        return numpyName;
    }

    /**
     * Parse from a NumPy dtype name as found in benchmark instance files.
     * Also accepts the short forms "f8" and "c16" with an optional byte order prefix.
     */
    public static ScalarType fromNumpyName(String dtype) {
        String typeStr = dtype;
        if (dtype.startsWith("<") || dtype.startsWith(">") || dtype.startsWith("|") || dtype.startsWith("=")) {
            typeStr = dtype.substring(1);
        }

        return switch (typeStr) {
            case "float64", "f8" -> F64;
            case "complex128", "c16" -> C128;
            default -> throw new IllegalArgumentException("unsupported dtype: " + dtype);
        };
    }
}
