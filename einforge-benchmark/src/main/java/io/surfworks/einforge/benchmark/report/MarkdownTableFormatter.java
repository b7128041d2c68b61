package io.surfworks.einforge.benchmark.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Renders parsed timings as markdown tables, one per strategy, with a column per engine mode.
 *
 * <p>Instances, strategies and modes are sorted by name, except that known modes come first
 * in a fixed order. Missing cells are shown as {@code -}.
 */
public final class MarkdownTableFormatter {

    private static final List<String> MODE_ORDER = List.of(
        "einforge",
        "strided-opteinsum",
        "omeinsum_path",
        "omeinsum_opt",
        "tensorops"
    );

    private static final Map<String, String> MODE_LABELS = Map.of(
        "einforge", "Java einforge (ms)",
        "strided-opteinsum", "Rust strided-opteinsum (ms)",
        "omeinsum_path", "Julia OMEinsum path (ms)",
        "omeinsum_opt", "Julia OMEinsum opt (ms)",
        "tensorops", "Julia TensorOps (ms)"
    );

    private MarkdownTableFormatter() {
    }

    public static String format(Map<ResultKey, Double> results) {
        TreeSet<String> instances = new TreeSet<>();
        TreeSet<String> strategies = new TreeSet<>();
        TreeSet<String> modes = new TreeSet<>();
        for (ResultKey key : results.keySet()) {
            instances.add(key.instance());
            strategies.add(key.strategy());
            modes.add(key.mode());
        }

        List<String> modeOrder = new ArrayList<>();
        for (String mode : MODE_ORDER) {
            if (modes.contains(mode)) {
                modeOrder.add(mode);
            }
        }
        for (String mode : modes) {
            if (!modeOrder.contains(mode)) {
                modeOrder.add(mode);
            }
        }

        List<String> lines = new ArrayList<>();
        for (String strategy : strategies) {
            lines.add("### Strategy: " + strategy);
            lines.add("");
            lines.add("Median time (ms) over the measured runs; `-` marks a missing or skipped result.");
            lines.add("");

            StringBuilder header = new StringBuilder("| Instance |");
            StringBuilder separator = new StringBuilder("|---|");
            for (String mode : modeOrder) {
                header.append(' ').append(MODE_LABELS.getOrDefault(mode, mode)).append(" |");
                separator.append("---:|");
            }
            lines.add(header.toString());
            lines.add(separator.toString());

            for (String instance : instances) {
                StringBuilder row = new StringBuilder("| ").append(instance);
                for (String mode : modeOrder) {
                    Double value = results.get(new ResultKey(instance, strategy, mode));
                    row.append(" | ").append(value != null ? String.format(Locale.ROOT, "%.3f", value) : "-");
                }
                lines.add(row.append(" |").toString());
            }
            lines.add("");
        }
        return String.join("\n", lines);
    }
}
