package io.surfworks.einforge.benchmark.report;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts median timings from benchmark logs.
 *
 * <p>Understands the text written by {@link TextReport} as well as logs of the Rust and Julia
 * einsum suites this harness is compared against:
 * <ul>
 *   <li>{@code Strategy: <name>} starts a block for the engine named in the log banner</li>
 *   <li>{@code Mode: <mode> / Strategy: <name>} starts a block for an explicit mode</li>
 *   <li>a data line has at least five fields: the instance name first and the median last</li>
 * </ul>
 * Lines whose last field is not a number, such as skipped instances, are ignored.
 */
public final class ResultLogParser {

    public static final String MODE_EINFORGE = "einforge";
    public static final String MODE_STRIDED = "strided-opteinsum";

    private static final Pattern STRATEGY = Pattern.compile("^Strategy:\\s+(\\w+)");
    private static final Pattern MODE_STRATEGY = Pattern.compile("^Mode:\\s+(\\w+)\\s*/\\s*Strategy:\\s+(\\w+)");

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private ResultLogParser() {
    }

    public static Map<ResultKey, Double> parse(Path file) throws IOException {
        return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    /**
     * Parse log lines. Later entries for the same key replace earlier ones.
     */
    public static Map<ResultKey, Double> parse(List<String> lines) {
        Map<ResultKey, Double> results = new LinkedHashMap<>();
        String engine = null;
        String mode = null;
        String strategy = null;

        for (String raw : lines) {
            String line = raw.stripTrailing();
            String lower = line.toLowerCase(Locale.ROOT);
            if (engine == null) {
                if (lower.contains("einforge")) {
                    engine = MODE_EINFORGE;
                } else if (lower.contains(MODE_STRIDED)) {
                    engine = MODE_STRIDED;
                }
            }

            Matcher m = STRATEGY.matcher(line);
            if (m.find()) {
                strategy = m.group(1);
                mode = engine != null ? engine : MODE_STRIDED;
                continue;
            }
            m = MODE_STRATEGY.matcher(line);
            if (m.find()) {
                mode = m.group(1);
                strategy = m.group(2);
                continue;
            }

            if (line.isEmpty() || line.startsWith("Instance") || line.startsWith("-")
                    || Character.isWhitespace(line.charAt(0))) {
                continue;
            }

            String[] parts = line.trim().split("\\s+");
            if (parts.length >= 5 && mode != null && strategy != null) {
                String last = parts[parts.length - 1];
                if (NUMBER.matcher(last).matches()) {
                    results.put(new ResultKey(parts[0], strategy, mode), Double.parseDouble(last));
                }
            }
        }
        return results;
    }
}
