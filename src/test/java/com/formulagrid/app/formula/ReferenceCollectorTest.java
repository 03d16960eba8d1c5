package com.formulagrid.app.formula;

import com.formulagrid.app.models.CellId;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceCollectorTest {

    private final FormulaParser parser = new FormulaParser();

    @Test
    void testCollectsDistinctReferencesInOrder() {
        Set<CellId> refs = ReferenceCollector.collect(parser.parse("=B1*A1+B1-(-C3/A1)"));

        assertEquals(List.of(CellId.of(1, 0), CellId.of(0, 0), CellId.of(2, 2)), List.copyOf(refs));
    }

    @Test
    void testConstantsHaveNoReferences() {
        assertTrue(ReferenceCollector.collect(parser.parse("=1+2*-3")).isEmpty());
    }

    @Test
    void testSelfReference() {
        assertEquals(Set.of(CellId.of(0, 0)), ReferenceCollector.collect(parser.parse("=A1")));
    }
}
