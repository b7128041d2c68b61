package io.surfworks.einforge.benchmark.instance;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import io.surfworks.einforge.core.path.ContractionPath;
import io.surfworks.einforge.core.tensor.ScalarType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads benchmark instances from a directory of JSON files.
 *
 * <p>Each {@code *.json} file holds one instance:
 * <pre>{@code
 * {
 *   "name": "...",
 *   "format_string": "ab,bc->ac",
 *   "shapes": [[2, 3], [3, 4]],
 *   "format_string_colmajor": "ba,cb->ca",
 *   "shapes_colmajor": [[3, 2], [4, 3]],
 *   "dtype": "float64",
 *   "num_tensors": 2,
 *   "paths": {
 *     "opt_size":  {"path": [[0, 1]], "log2_size": 3.0, "log10_flops": 1.4},
 *     "opt_flops": {"path": [[0, 1]], "log2_size": 3.0, "log10_flops": 1.4}
 *   }
 * }
 * }</pre>
 * Files are visited in file name order so runs are reproducible.
 */
public final class InstanceLoader {

    private static final Logger LOG = Logger.getLogger(InstanceLoader.class.getName());

    private static final Gson GSON = new GsonBuilder().create();

    private InstanceLoader() {
    }

    /**
     * Load every instance in a directory, sorted by file name.
     *
     * @param directory directory containing {@code *.json} instance files
     * @return the instances, possibly empty
     * @throws IOException if the directory cannot be listed or a file is malformed
     */
    public static List<BenchmarkInstance> loadAll(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Instance directory not found: " + directory);
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream
                .filter(p -> p.getFileName().toString().endsWith(".json"))
                .filter(Files::isRegularFile)
                .sorted()
                .collect(Collectors.toList());
        }
        List<BenchmarkInstance> instances = new ArrayList<>(files.size());
        for (Path file : files) {
            instances.add(load(file));
        }
        LOG.fine(() -> "Loaded " + instances.size() + " instances from " + directory);
        return instances;
    }

    /**
     * Load every instance in a directory and keep those whose name equals {@code name}.
     * A null name keeps everything.
     */
    public static List<BenchmarkInstance> loadAll(Path directory, String name) throws IOException {
        List<BenchmarkInstance> all = loadAll(directory);
        if (name == null || name.isEmpty()) {
            return all;
        }
        return all.stream()
            .filter(instance -> instance.name().equals(name))
            .collect(Collectors.toList());
    }

    /**
     * Load a single instance file.
     *
     * @throws InstanceFormatException if the JSON is invalid or required fields are missing
     */
    public static BenchmarkInstance load(Path file) throws IOException {
        String json = Files.readString(file, StandardCharsets.UTF_8);
        JsonObject root;
        try {
            root = GSON.fromJson(json, JsonObject.class);
        } catch (JsonParseException e) {
            throw new InstanceFormatException(file, "invalid JSON: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new InstanceFormatException(file, "empty file");
        }
        try {
            return parse(file, root);
        } catch (JsonParseException | IllegalStateException | ClassCastException e) {
            throw new InstanceFormatException(file, "malformed field: " + e.getMessage(), e);
        }
    }

    private static BenchmarkInstance parse(Path file, JsonObject root) throws InstanceFormatException {
        String name = requireString(file, root, "name");
        String format = requireString(file, root, "format_string");
        List<int[]> shapes = shapes(file, root, "shapes");
        String formatColMajor = root.has("format_string_colmajor")
            ? root.get("format_string_colmajor").getAsString()
            : null;
        List<int[]> shapesColMajor = root.has("shapes_colmajor") ? shapes(file, root, "shapes_colmajor") : null;

        ScalarType dtype;
        try {
            dtype = ScalarType.fromNumpyName(requireString(file, root, "dtype"));
        } catch (IllegalArgumentException e) {
            throw new InstanceFormatException(file, e.getMessage(), e);
        }

        int numTensors = root.has("num_tensors") ? root.get("num_tensors").getAsInt() : shapes.size();
        if (numTensors != shapes.size()) {
            throw new InstanceFormatException(file,
                "num_tensors is " + numTensors + " but " + shapes.size() + " shapes are given");
        }

        JsonObject pathsObj = root.getAsJsonObject("paths");
        if (pathsObj == null) {
            throw new InstanceFormatException(file, "missing field 'paths'");
        }
        Map<Strategy, PathMeta> paths = new EnumMap<>(Strategy.class);
        for (Strategy strategy : Strategy.values()) {
            JsonObject entry = pathsObj.getAsJsonObject(strategy.key());
            if (entry != null) {
                paths.put(strategy, pathMeta(file, entry));
            }
        }
        return new BenchmarkInstance(name, format, shapes, formatColMajor, shapesColMajor,
            dtype, numTensors, paths);
    }

    private static PathMeta pathMeta(Path file, JsonObject entry) throws InstanceFormatException {
        JsonArray steps = entry.getAsJsonArray("path");
        if (steps == null) {
            throw new InstanceFormatException(file, "path entry without 'path'");
        }
        List<int[]> pairs = new ArrayList<>(steps.size());
        for (JsonElement step : steps) {
            pairs.add(GSON.fromJson(step, int[].class));
        }
        ContractionPath path;
        try {
            path = ContractionPath.fromPairs(pairs);
        } catch (IllegalArgumentException e) {
            throw new InstanceFormatException(file, e.getMessage(), e);
        }
        double log2Size = entry.has("log2_size") ? entry.get("log2_size").getAsDouble() : Double.NaN;
        double log10Flops = entry.has("log10_flops") ? entry.get("log10_flops").getAsDouble() : Double.NaN;
        return new PathMeta(path, log2Size, log10Flops);
    }

    private static List<int[]> shapes(Path file, JsonObject root, String field) throws InstanceFormatException {
        JsonArray array = root.getAsJsonArray(field);
        if (array == null) {
            throw new InstanceFormatException(file, "missing field '" + field + "'");
        }
        List<int[]> shapes = new ArrayList<>(array.size());
        for (JsonElement element : array) {
            shapes.add(GSON.fromJson(element, int[].class));
        }
        return shapes;
    }

    private static String requireString(Path file, JsonObject root, String field) throws InstanceFormatException {
        JsonElement element = root.get(field);
        if (element == null || element.isJsonNull()) {
            throw new InstanceFormatException(file, "missing field '" + field + "'");
        }
        return element.getAsString();
    }
}
