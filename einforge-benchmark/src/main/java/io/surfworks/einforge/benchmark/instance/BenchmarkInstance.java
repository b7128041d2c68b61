package io.surfworks.einforge.benchmark.instance;

import io.surfworks.einforge.core.einsum.EinsumFormat;
import io.surfworks.einforge.core.tensor.ScalarType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One einsum benchmark instance: a tensor network description plus its precomputed paths.
 * Tensors are not stored; they are created zero-filled from the shapes at run time.
 *
 * @param name                 instance name
 * @param formatString         row-major einsum format
 * @param shapes               row-major shape of each operand
 * @param formatStringColMajor column-major einsum format, or null if absent from the file
 * @param shapesColMajor       column-major shapes, or null if absent from the file
 * @param dtype                element type shared by all operands
 * @param numTensors           declared operand count
 * @param paths                available paths by strategy
 */
public record BenchmarkInstance(
    String name,
    String formatString,
    List<int[]> shapes,
    String formatStringColMajor,
    List<int[]> shapesColMajor,
    ScalarType dtype,
    int numTensors,
    Map<Strategy, PathMeta> paths
) {
    public BenchmarkInstance {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(formatString, "formatString cannot be null");
        Objects.requireNonNull(shapes, "shapes cannot be null");
        Objects.requireNonNull(dtype, "dtype cannot be null");
        shapes = List.copyOf(shapes);
        shapesColMajor = shapesColMajor == null ? null : List.copyOf(shapesColMajor);
        paths = Map.copyOf(paths);
    }

    /**
     * The path for a strategy.
     *
     * @throws IllegalArgumentException if the instance has no such path
     */
    public PathMeta path(Strategy strategy) {
        PathMeta meta = paths.get(strategy);
        if (meta == null) {
            throw new IllegalArgumentException("Instance " + name + " has no " + strategy + " path");
        }
        return meta;
    }

    /**
     * The einsum format in the given layout. The column-major form is derived from the
     * row-major one when the file does not carry it.
     */
    public EinsumFormat format(Layout layout) {
        return switch (layout) {
            case ROW_MAJOR -> EinsumFormat.parse(formatString);
            case COLUMN_MAJOR -> formatStringColMajor != null
                ? EinsumFormat.parse(formatStringColMajor)
                : EinsumFormat.parse(formatString).reversed();
        };
    }

    /**
     * Operand shapes in the given layout.
     */
    public List<int[]> shapes(Layout layout) {
        return switch (layout) {
            case ROW_MAJOR -> shapes;
            case COLUMN_MAJOR -> shapesColMajor != null ? shapesColMajor : reverseEach(shapes);
        };
    }

    private static List<int[]> reverseEach(List<int[]> shapes) {
        List<int[]> reversed = new ArrayList<>(shapes.size());
        for (int[] shape : shapes) {
            int[] r = new int[shape.length];
            for (int i = 0; i < shape.length; i++) {
                r[i] = shape[shape.length - 1 - i];
            }
            reversed.add(r);
        }
        return reversed;
    }
}
