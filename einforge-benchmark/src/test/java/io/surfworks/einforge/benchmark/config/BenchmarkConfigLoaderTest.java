package io.surfworks.einforge.benchmark.config;

import io.surfworks.einforge.benchmark.instance.Layout;
import io.surfworks.einforge.benchmark.instance.Strategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BenchmarkConfigLoaderTest {

    @Test
    void defaultsMatchReferenceHarness() {
        BenchmarkConfig config = BenchmarkConfig.defaults();
        assertEquals(2, config.warmupRuns());
        assertEquals(5, config.measuredRuns());
        assertEquals(1, config.threads());
        assertEquals(Layout.ROW_MAJOR, config.layout());
        assertEquals(List.of(Strategy.OPT_FLOPS, Strategy.OPT_SIZE), config.strategies());
        assertNull(config.instanceFilter());
    }

    @Test
    void fileOverridesOnlyGivenKeys(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("bench.json");
        Files.writeString(file, "{\"measuredRuns\": 9, \"layout\": \"col-major\", \"strategies\": [\"opt_size\"]}");

        BenchmarkConfig config = BenchmarkConfigLoader.load(file);

        assertEquals(9, config.measuredRuns());
        assertEquals(2, config.warmupRuns());
        assertEquals(Layout.COLUMN_MAJOR, config.layout());
        assertEquals(List.of(Strategy.OPT_SIZE), config.strategies());
    }

    @Test
    void saveThenLoad(@TempDir Path dir) throws IOException {
        BenchmarkConfig original = BenchmarkConfig.defaults()
            .withDataDir(Path.of("instances"))
            .withThreads(4)
            .withInstanceFilter("matrix_chain_3");
        Path file = dir.resolve("nested").resolve("bench.json");

        BenchmarkConfigLoader.save(original, file);

        assertEquals(original, BenchmarkConfigLoader.load(file));
    }

    @Test
    void invalidValuesAreReported(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("bench.json");
        Files.writeString(file, "{\"measuredRuns\": 0}");
        assertThrows(IOException.class, () -> BenchmarkConfigLoader.load(file));
    }

    @Test
    void malformedJsonIsReported(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("bench.json");
        Files.writeString(file, "[1, 2");
        assertThrows(IOException.class, () -> BenchmarkConfigLoader.load(file));
    }

    @Test
    void recordValidation() {
        BenchmarkConfig config = BenchmarkConfig.defaults();
        assertThrows(IllegalArgumentException.class, () -> config.withWarmupRuns(-1));
        assertThrows(IllegalArgumentException.class, () -> config.withThreads(0));
        assertThrows(IllegalArgumentException.class, () -> config.withStrategies(List.of()));
    }
}
