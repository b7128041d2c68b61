package io.surfworks.einforge.core.path;

import io.surfworks.einforge.core.einsum.EinsumFormat;
import io.surfworks.einforge.core.einsum.Operand;
import io.surfworks.einforge.core.einsum.OperandList;
import io.surfworks.einforge.core.einsum.PathIndexException;
import io.surfworks.einforge.core.jfr.ContractionStepEvent;
import io.surfworks.einforge.core.tensor.ScalarType;
import io.surfworks.einforge.core.tensor.Tensor;
import jdk.jfr.Recording;
import jdk.jfr.consumer.RecordedEvent;
import jdk.jfr.consumer.RecordingFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StepExecutorTest {

    private static Operand operand(String labels, int... shape) {
        return Operand.of(Tensor.zeros(ScalarType.F64, shape), labels);
    }

    @Test
    void failedStepLeavesListUntouched() {
        RecordingBackend backend = new RecordingBackend();
        StepExecutor step = new StepExecutor(backend);
        OperandList list = new OperandList(List.of(operand("ij", 2, 3), operand("jk", 3, 4)));

        assertThrows(PathIndexException.class,
            () -> step.apply(list, EinsumFormat.labelsOf("ik"), new PathStep(0, 2), 0));
        assertEquals(2, list.size());
        assertTrue(backend.contractCalls.isEmpty());
    }

    @Test
    void appendedOperandCarriesPairOutput() throws PathIndexException {
        StepExecutor step = new StepExecutor(new RecordingBackend());
        OperandList list = new OperandList(List.of(operand("ij", 2, 3), operand("x", 7), operand("jk", 3, 4)));

        Operand produced = step.apply(list, EinsumFormat.labelsOf("ikx"), new PathStep(2, 0), 0);

        assertEquals(EinsumFormat.labelsOf("ik"), produced.labels());
        assertEquals(2, list.size());
        assertEquals(EinsumFormat.labelsOf("x"), list.labelsOfAll().get(0));
        assertSame(produced, list.get(1));
    }

    @Test
    void emitsContractionStepEvent(@TempDir Path tempDir) throws Exception {
        Path dump = tempDir.resolve("steps.jfr");
        try (Recording recording = new Recording()) {
            recording.enable(ContractionStepEvent.class);
            recording.start();

            StepExecutor step = new StepExecutor(new RecordingBackend());
            OperandList list = new OperandList(List.of(operand("ij", 2, 3), operand("jk", 3, 4)));
            step.apply(list, EinsumFormat.labelsOf("ik"), new PathStep(0, 1), 0);

            recording.stop();
            recording.dump(dump);
        }

        List<RecordedEvent> events = RecordingFile.readAllEvents(dump).stream()
            .filter(e -> e.getEventType().getName().equals("io.surfworks.einforge.ContractionStep"))
            .toList();
        assertEquals(1, events.size());
        RecordedEvent event = events.get(0);
        assertEquals("ij", event.getString("leftLabels"));
        assertEquals("jk", event.getString("rightLabels"));
        assertEquals("ik", event.getString("outputLabels"));
        assertEquals(8L, event.getLong("resultElements"));
        assertEquals("recording", event.getString("backend"));
    }
}
