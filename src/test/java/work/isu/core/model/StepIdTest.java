package work.isu.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class StepIdTest {
    @Test
    void parsesHierarchicalIds() {
        var id = StepId.parse("S2_10_3");
        assertEquals(List.of(2, 10, 3), id.segments());
        assertEquals("S2_10_3", id.toString());
        assertEquals(3, id.depth());
    }

    @Test
    void rejectsMalformedIds() {
        assertFalse(StepId.isValid("S0"));
        assertFalse(StepId.isValid("S1_"));
        assertFalse(StepId.isValid("s1"));
        assertFalse(StepId.isValid("S01"));
        assertThrows(IllegalArgumentException.class, () -> StepId.parse("X1"));
    }

    @Test
    void ordersByStructuralPosition() {
        var ids = new ArrayList<>(List.of(
            StepId.parse("S10"),
            StepId.parse("S2_1"),
            StepId.parse("S2"),
            StepId.parse("S1_2"),
            StepId.parse("S1_10")
        ));
        Collections.sort(ids);
        assertEquals("[S1_2, S1_10, S2, S2_1, S10]", ids.toString());
    }

    @Test
    void knowsItsDescendants() {
        var parent = StepId.parse("S2");
        assertTrue(parent.isAncestorOf(StepId.parse("S2_1_4")));
        assertFalse(parent.isAncestorOf(parent));
        assertFalse(parent.isAncestorOf(StepId.parse("S20_1")));
        assertEquals(StepId.parse("S2_3"), parent.child(3));
    }
}
