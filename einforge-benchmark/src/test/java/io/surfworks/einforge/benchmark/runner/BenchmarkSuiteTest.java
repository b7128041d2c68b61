package io.surfworks.einforge.benchmark.runner;

import io.surfworks.einforge.backend.cpu.CpuBackend;
import io.surfworks.einforge.benchmark.config.BenchmarkConfig;
import io.surfworks.einforge.benchmark.report.ResultKey;
import io.surfworks.einforge.benchmark.report.ResultLogParser;
import io.surfworks.einforge.benchmark.report.TextReport;
import io.surfworks.einforge.core.path.PathExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BenchmarkSuiteTest {

    private CpuBackend backend;
    private ByteArrayOutputStream buffer;
    private BenchmarkConfig config;

    @BeforeEach
    void setUp() throws Exception {
        backend = new CpuBackend();
        buffer = new ByteArrayOutputStream();
        Path dir = Path.of(BenchmarkSuiteTest.class.getResource("/instances").toURI());
        config = BenchmarkConfig.defaults().withDataDir(dir).withWarmupRuns(1).withMeasuredRuns(2);
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    private BenchmarkSuite suite(BenchmarkConfig c) {
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        return new BenchmarkSuite(c, new PathExecutor(backend), new TextReport(out));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void runsEveryStrategyOverEveryInstance() throws IOException {
        List<InstanceOutcome> outcomes = suite(config).run();

        assertEquals(6, outcomes.size());
        // strategies in configured order, instances in file name order
        assertEquals("opt_flops", outcomes.get(0).strategy().key());
        assertEquals("batched_complex", outcomes.get(0).instanceName());
        assertEquals("opt_size", outcomes.get(3).strategy().key());
    }

    @Test
    void skippedInstanceDoesNotStopTheRun() throws IOException {
        List<InstanceOutcome> outcomes = suite(config).run();

        long skipped = outcomes.stream().filter(InstanceOutcome::skipped).count();
        assertEquals(1, skipped);
        assertTrue(output().contains("SKIP"));
        assertTrue(output().contains("  reason: Path step 0"));
    }

    @Test
    void reportCanBeParsedBack() throws IOException {
        suite(config).run();

        Map<ResultKey, Double> parsed = ResultLogParser.parse(output().lines().toList());

        assertEquals(5, parsed.size());
        assertTrue(parsed.containsKey(new ResultKey("matrix_chain_3", "opt_size", "einforge")));
        assertFalse(parsed.containsKey(new ResultKey("broken_path", "opt_size", "einforge")));
    }

    @Test
    void headerDescribesTheRun() throws IOException {
        suite(config).run();

        String text = output();
        assertTrue(text.startsWith("einforge(cpu) benchmark suite"));
        assertTrue(text.contains("Loaded 3 instances from"));
        assertTrue(text.contains("Timing: median of 2 runs (1 warmup)"));
        assertTrue(text.contains("-".repeat(96)));
    }

    @Test
    void instanceFilterRunsOnlyThatInstance() throws IOException {
        List<InstanceOutcome> outcomes = suite(config.withInstanceFilter("matrix_chain_3")).run();

        assertEquals(2, outcomes.size());
        assertTrue(outcomes.stream().allMatch(o -> o.instanceName().equals("matrix_chain_3")));
    }

    @Test
    void unknownInstanceFilterFails() {
        BenchmarkSuite suite = suite(config.withInstanceFilter("no_such_instance"));
        IOException e = assertThrows(IOException.class, suite::run);
        assertTrue(e.getMessage().contains("no_such_instance"));
    }
}
