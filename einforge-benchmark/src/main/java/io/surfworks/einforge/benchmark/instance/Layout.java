package io.surfworks.einforge.benchmark.instance;

/**
 * Which encoding of an instance to evaluate.
 *
 * <p>Instance files carry the row-major description and a column-major twin in which every
 * operand's labels and shape are reversed. Both describe the same contraction.
 */
public enum Layout {
    ROW_MAJOR("row-major"),
    COLUMN_MAJOR("col-major");

    private final String key;

    Layout(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Layout fromKey(String key) {
        return switch (key) {
            case "row-major", "rowmajor" -> ROW_MAJOR;
            case "col-major", "colmajor", "column-major" -> COLUMN_MAJOR;
            default -> throw new IllegalArgumentException("Unknown layout: " + key + " (expected row-major or col-major)");
        };
    }

    @Override
    public String toString() {
        return key;
    }
}
