package io.surfworks.einforge.core.backend;

import io.surfworks.einforge.core.tensor.ScalarType;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BackendExceptionTest {

    @Test
    void messageNamesPrimitive() {
        BackendException e = new BackendException("contract", "extent mismatch");
        assertEquals("contract", e.primitive());
        assertEquals("contract: extent mismatch", e.getMessage());
    }

    @Test
    void keepsCause() {
        OutOfMemoryError cause = new OutOfMemoryError("heap");
        BackendException e = new BackendException("allocate", "no memory", cause);
        assertSame(cause, e.getCause());
    }

    @Test
    void capabilitiesReportSupportedDtypes() {
        BackendCapabilities caps = BackendCapabilities.builder()
            .supportedDtypes(Set.of(ScalarType.F64))
            .parallelism(4)
            .build();
        assertTrue(caps.supports(ScalarType.F64));
        assertFalse(caps.supports(ScalarType.C128));
        assertEquals(4, caps.parallelism());
    }

    @Test
    void parallelismMustBePositive() {
        assertThrows(IllegalArgumentException.class,
            () -> BackendCapabilities.builder().parallelism(0).build());
    }

    @Test
    void limitsMustBePositive() {
        assertThrows(IllegalArgumentException.class,
            () -> BackendCapabilities.builder().maxElementCount(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> BackendCapabilities.builder().maxTensorRank(-1).build());
        assertEquals(12, BackendCapabilities.builder().maxTensorRank(12).build().maxTensorRank());
    }
}
