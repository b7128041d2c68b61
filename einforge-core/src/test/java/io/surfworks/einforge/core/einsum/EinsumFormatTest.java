package io.surfworks.einforge.core.einsum;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EinsumFormatTest {

    @Nested
    @DisplayName("Parsing")
    class ParseTests {

        @Test
        void splitsOperandsAndOutput() {
            EinsumFormat format = EinsumFormat.parse("ba,dca,feb->fa");

            assertEquals(3, format.operandCount());
            assertEquals(List.of('b', 'a'), format.inputs().get(0));
            assertEquals(List.of('d', 'c', 'a'), format.inputs().get(1));
            assertEquals(List.of('f', 'e', 'b'), format.inputs().get(2));
            assertEquals(List.of('f', 'a'), format.output());
        }

        @Test
        void scalarOutput() {
            EinsumFormat format = EinsumFormat.parse("ij,ij->");
            assertTrue(format.output().isEmpty());
        }

        @Test
        void scalarOperand() {
            EinsumFormat format = EinsumFormat.parse(",ij->ij");
            assertEquals(2, format.operandCount());
            assertTrue(format.inputs().get(0).isEmpty());
        }

        @Test
        void labelsAreCaseSensitive() {
            EinsumFormat format = EinsumFormat.parse("aA,Ab->ab");
            assertEquals(List.of('a', 'A'), format.inputs().get(0));
        }

        @Test
        void roundTripsThroughToString() {
            assertEquals("ij,jk->ik", EinsumFormat.parse("ij,jk->ik").toString());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        void missingArrow() {
            assertThrows(IllegalArgumentException.class, () -> EinsumFormat.parse("ij,jk"));
        }

        @Test
        void secondArrow() {
            assertThrows(IllegalArgumentException.class, () -> EinsumFormat.parse("ij->jk->k"));
        }

        @Test
        void repeatedLabelInOperand() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> EinsumFormat.parse("ii,ij->j"));
            assertTrue(e.getMessage().contains("diagonal"));
        }

        @Test
        void repeatedLabelInOutput() {
            assertThrows(IllegalArgumentException.class, () -> EinsumFormat.parse("ij->ii"));
        }

        @Test
        void outputLabelWithoutSource() {
            assertThrows(IllegalArgumentException.class, () -> EinsumFormat.parse("ij,jk->iz"));
        }
    }

    @Test
    void reversedMirrorsEveryOperandAndOutput() {
        EinsumFormat reversed = EinsumFormat.parse("ij,jkl->li").reversed();
        assertEquals("ji,lkj->il", reversed.toString());
    }
}
