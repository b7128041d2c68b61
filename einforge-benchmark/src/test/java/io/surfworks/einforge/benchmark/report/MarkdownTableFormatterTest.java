package io.surfworks.einforge.benchmark.report;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownTableFormatterTest {

    @Test
    void oneTablePerStrategyWithKnownModesFirst() {
        Map<ResultKey, Double> results = new LinkedHashMap<>();
        results.put(new ResultKey("chain_b", "opt_size", "tensorops"), 4.0);
        results.put(new ResultKey("chain_a", "opt_size", "einforge"), 1.23456);
        results.put(new ResultKey("chain_a", "opt_flops", "strided-opteinsum"), 0.5);
        results.put(new ResultKey("chain_a", "opt_size", "custom"), 7.0);

        String markdown = MarkdownTableFormatter.format(results);

        String expected = String.join("\n",
            "### Strategy: opt_flops",
            "",
            "Median time (ms) over the measured runs; `-` marks a missing or skipped result.",
            "",
            "| Instance | Java einforge (ms) | Rust strided-opteinsum (ms) | Julia TensorOps (ms) | custom |",
            "|---|---:|---:|---:|---:|",
            "| chain_a | - | 0.500 | - | - |",
            "| chain_b | - | - | - | - |",
            "",
            "### Strategy: opt_size",
            "",
            "Median time (ms) over the measured runs; `-` marks a missing or skipped result.",
            "",
            "| Instance | Java einforge (ms) | Rust strided-opteinsum (ms) | Julia TensorOps (ms) | custom |",
            "|---|---:|---:|---:|---:|",
            "| chain_a | 1.235 | - | - | 7.000 |",
            "| chain_b | - | - | 4.000 | - |",
            "");
        assertEquals(expected, markdown);
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        assertEquals("", MarkdownTableFormatter.format(Map.of()));
    }
}
