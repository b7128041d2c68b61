package io.surfworks.einforge.benchmark.instance;

/**
 * Named contraction path choices stored with every instance.
 */
public enum Strategy {
    /** Path minimizing floating point operations. */
    OPT_FLOPS("opt_flops"),
    /** Path minimizing the largest intermediate tensor. */
    OPT_SIZE("opt_size");

    private final String key;

    Strategy(String key) {
        this.key = key;
    }

    /**
     * The key used in instance files and reports.
     */
    public String key() {
        return key;
    }

    public static Strategy fromKey(String key) {
        for (Strategy strategy : values()) {
            if (strategy.key.equals(key)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown strategy: " + key + " (expected opt_flops or opt_size)");
    }

    @Override
    public String toString() {
        return key;
    }
}
