package io.surfworks.einforge.benchmark.instance;

import io.surfworks.einforge.core.path.ContractionPath;

import java.util.Objects;

/**
 * A contraction path with the cost estimates computed by the path optimizer.
 *
 * @param path       the pairwise contraction path
 * @param log2Size   log2 of the largest intermediate size
 * @param log10Flops log10 of the floating point operation count
 */
public record PathMeta(ContractionPath path, double log2Size, double log10Flops) {

    public PathMeta {
        Objects.requireNonNull(path, "path cannot be null");
    }
}
