package io.surfworks.einforge.core.tensor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TensorSpec")
class TensorSpecTest {

    @Nested
    @DisplayName("Layout")
    class Layout {

        @Test
        @DisplayName("row-major strides put the last axis innermost")
        void rowMajorStrides() {
            TensorSpec spec = TensorSpec.of(ScalarType.F64, 2, 3, 4);
            assertArrayEquals(new long[]{12, 4, 1}, spec.strides());
            assertEquals(23, spec.flatIndex(1, 2, 3));
        }

        @Test
        @DisplayName("rank-0 spec holds one element")
        void scalarSpec() {
            TensorSpec spec = TensorSpec.of(ScalarType.F64);
            assertEquals(0, spec.rank());
            assertEquals(1, spec.elementCount());
            assertEquals(0, spec.flatIndex());
        }

        @Test
        @DisplayName("a zero extent gives zero elements")
        void zeroExtent() {
            assertEquals(0, TensorSpec.of(ScalarType.F64, 3, 0, 2).elementCount());
        }

        @Test
        @DisplayName("complex elements take sixteen bytes")
        void complexByteSize() {
            assertEquals(16 * 6, TensorSpec.of(ScalarType.C128, 2, 3).byteSize());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("negative extent is rejected")
        void negativeExtent() {
            assertThrows(IllegalArgumentException.class, () -> TensorSpec.of(ScalarType.F64, 2, -1));
        }

        @Test
        @DisplayName("flatIndex names the failing dimension")
        void outOfBounds() {
            TensorSpec spec = TensorSpec.of(ScalarType.F64, 2, 3);
            var ex = assertThrows(IndexOutOfBoundsException.class, () -> spec.flatIndex(0, 3));
            assertTrue(ex.getMessage().contains("dimension 1"));
        }

        @Test
        @DisplayName("flatIndex needs one index per axis")
        void wrongIndexCount() {
            assertThrows(IllegalArgumentException.class, () -> TensorSpec.of(ScalarType.F64, 2, 3).flatIndex(1));
        }
    }

    @Test
    @DisplayName("permuted reorders extents and recomputes strides")
    void permuted() {
        TensorSpec spec = TensorSpec.of(ScalarType.C128, 2, 3, 4).permuted(new int[]{2, 0, 1});
        assertArrayEquals(new int[]{4, 2, 3}, spec.shape());
        assertArrayEquals(new long[]{6, 3, 1}, spec.strides());
        assertEquals(ScalarType.C128, spec.dtype());
    }

    @Test
    @DisplayName("dtype names from instance files")
    void numpyNames() {
        assertEquals(ScalarType.F64, ScalarType.fromNumpyName("float64"));
        assertEquals(ScalarType.F64, ScalarType.fromNumpyName("<f8"));
        assertEquals(ScalarType.C128, ScalarType.fromNumpyName("complex128"));
        assertEquals(ScalarType.C128, ScalarType.fromNumpyName("<c16"));
        assertThrows(IllegalArgumentException.class, () -> ScalarType.fromNumpyName("float32"));
    }
}
