package io.surfworks.einforge.benchmark.report;

/**
 * Identifies one cell of the comparison table.
 *
 * @param instance instance name
 * @param strategy strategy key, such as {@code opt_flops}
 * @param mode     which engine produced the figure
 */
public record ResultKey(String instance, String strategy, String mode) {
}
