package io.surfworks.einforge.core.backend;

import io.surfworks.einforge.core.tensor.ScalarType;

import java.util.Set;

/**
 * Describes the capabilities of a backend.
 *
 * @param supportedDtypes dtypes the primitives accept
 * @param parallelism     threads a single primitive call may use
 * @param maxTensorRank   highest rank of any input or output tensor
 * @param maxElementCount most elements of any tensor the backend allocates
 */
public record BackendCapabilities(
    Set<ScalarType> supportedDtypes,
    int parallelism,
    int maxTensorRank,
    long maxElementCount
) {
    public BackendCapabilities {
        supportedDtypes = Set.copyOf(supportedDtypes);
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        if (maxTensorRank < 0) {
            throw new IllegalArgumentException("maxTensorRank must be >= 0, got " + maxTensorRank);
        }
        if (maxElementCount < 1) {
            throw new IllegalArgumentException("maxElementCount must be >= 1, got " + maxElementCount);
        }
    }

    /**
     * Default capabilities for a single-threaded CPU backend.
     */
    public static BackendCapabilities cpu() {
        return new BackendCapabilities(
            Set.of(ScalarType.F64, ScalarType.C128),
            1,
            64,               // Max rank
            Integer.MAX_VALUE // Max elements
        );
    }

    public boolean supports(ScalarType dtype) {
        return supportedDtypes.contains(dtype);
    }

    /**
     * Builder for custom capabilities.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Set<ScalarType> dtypes = Set.of(ScalarType.F64);
        private int parallelism = 1;
        private int maxRank = 64;
        private long maxElements = Integer.MAX_VALUE;

        public Builder supportedDtypes(Set<ScalarType> dtypes) {
            this.dtypes = dtypes;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder maxTensorRank(int maxRank) {
            this.maxRank = maxRank;
            return this;
        }

        public Builder maxElementCount(long maxElements) {
            this.maxElements = maxElements;
            return this;
        }

        public BackendCapabilities build() {
            return new BackendCapabilities(dtypes, parallelism, maxRank, maxElements);
        }
    }
}
