package io.surfworks.einforge.benchmark.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import io.surfworks.einforge.benchmark.instance.Layout;
import io.surfworks.einforge.benchmark.instance.Strategy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Loads and saves {@link BenchmarkConfig}.
 *
 * <p>The file is a flat JSON object; every key is optional:
 * <pre>{@code
 * {
 *   "dataDir": "data/instances",
 *   "warmupRuns": 2,
 *   "measuredRuns": 5,
 *   "threads": 1,
 *   "layout": "row-major",
 *   "strategies": ["opt_flops", "opt_size"],
 *   "instance": "lm_batch_likelihood_sentence_4_12d"
 * }
 * }</pre>
 *
 * <p>CLI arguments are handled by the caller and merged into the config.
 */
public final class BenchmarkConfigLoader {

    private static final Logger LOG = Logger.getLogger(BenchmarkConfigLoader.class.getName());

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    private BenchmarkConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     *
     * <p>A missing file yields the defaults. An unreadable or malformed default file is
     * logged and ignored.
     */
    public static BenchmarkConfig load() {
        Path file = BenchmarkConfig.configFile();
        if (!Files.exists(file)) {
            return BenchmarkConfig.defaults();
        }
        try {
            return load(file);
        } catch (IOException e) {
            LOG.warning("Ignoring config file " + file + ": " + e.getMessage());
            return BenchmarkConfig.defaults();
        }
    }

    /**
     * Loads configuration from a specific file over the defaults.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     * @throws IOException if the file cannot be read or holds invalid values
     */
    public static BenchmarkConfig load(Path configFile) throws IOException {
        String json = Files.readString(configFile, StandardCharsets.UTF_8);
        try {
            JsonObject root = GSON.fromJson(json, JsonObject.class);
            if (root == null) {
                return BenchmarkConfig.defaults();
            }
            return apply(root, BenchmarkConfig.defaults());
        } catch (JsonParseException | IllegalStateException | IllegalArgumentException | ClassCastException e) {
            throw new IOException("Invalid config file " + configFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Saves configuration to a specific file.
     *
     * @param config     the configuration to save
     * @param configFile path to write the config
     * @throws IOException if saving fails
     */
    public static void save(BenchmarkConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        JsonObject root = new JsonObject();
        root.addProperty("dataDir", config.dataDir().toString());
        root.addProperty("warmupRuns", config.warmupRuns());
        root.addProperty("measuredRuns", config.measuredRuns());
        root.addProperty("threads", config.threads());
        root.addProperty("layout", config.layout().key());
        JsonArray strategies = new JsonArray();
        for (Strategy strategy : config.strategies()) {
            strategies.add(strategy.key());
        }
        root.add("strategies", strategies);
        if (config.instanceFilter() != null) {
            root.addProperty("instance", config.instanceFilter());
        }

        Files.writeString(configFile, GSON.toJson(root), StandardCharsets.UTF_8);
    }

    private static BenchmarkConfig apply(JsonObject root, BenchmarkConfig base) {
        BenchmarkConfig config = base;
        if (root.has("dataDir")) {
            config = config.withDataDir(Path.of(root.get("dataDir").getAsString()));
        }
        if (root.has("warmupRuns")) {
            config = config.withWarmupRuns(root.get("warmupRuns").getAsInt());
        }
        if (root.has("measuredRuns")) {
            config = config.withMeasuredRuns(root.get("measuredRuns").getAsInt());
        }
        if (root.has("threads")) {
            config = config.withThreads(root.get("threads").getAsInt());
        }
        if (root.has("layout")) {
            config = config.withLayout(Layout.fromKey(root.get("layout").getAsString()));
        }
        if (root.has("strategies")) {
            List<Strategy> strategies = new ArrayList<>();
            for (JsonElement element : root.getAsJsonArray("strategies")) {
                strategies.add(Strategy.fromKey(element.getAsString()));
            }
            config = config.withStrategies(strategies);
        }
        if (root.has("instance")) {
            config = config.withInstanceFilter(root.get("instance").getAsString());
        }
        return config;
    }
}
