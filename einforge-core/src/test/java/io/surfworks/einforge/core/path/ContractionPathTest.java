package io.surfworks.einforge.core.path;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContractionPathTest {

    @Test
    void fromPairsKeepsOrder() {
        ContractionPath path = ContractionPath.fromPairs(List.of(new int[]{1, 3}, new int[]{0, 2}));

        assertEquals(2, path.size());
        assertEquals(new PathStep(1, 3), path.steps().get(0));
        assertEquals(new PathStep(0, 2), path.steps().get(1));
        assertEquals(3, path.expectedOperandCount());
    }

    @Test
    void entryMustBeAPair() {
        assertThrows(IllegalArgumentException.class,
            () -> ContractionPath.fromPairs(List.of(new int[]{0, 1, 2})));
    }

    @Test
    void stepCannotReuseAPosition() {
        assertThrows(IllegalArgumentException.class, () -> new PathStep(2, 2));
    }

    @Test
    void stepOrdersItsPositions() {
        PathStep step = new PathStep(4, 1);
        assertEquals(1, step.lower());
        assertEquals(4, step.higher());
        assertEquals("[4, 1]", step.toString());
    }

    @Test
    void emptyPathReducesOneOperand() {
        assertEquals(1, ContractionPath.of().expectedOperandCount());
    }
}
