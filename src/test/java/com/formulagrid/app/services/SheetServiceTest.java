package com.formulagrid.app.services;

import com.formulagrid.app.exceptions.AddressParseException;
import com.formulagrid.app.exceptions.CircularReferenceException;
import com.formulagrid.app.exceptions.ExpressionParseException;
import com.formulagrid.app.exceptions.InvalidTypeException;
import com.formulagrid.app.models.CellId;
import com.formulagrid.app.models.CellView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SheetService logic, using an in-memory approach
 * (no HTTP or external server).
 */
class SheetServiceTest {

    private SheetService sheetService;

    @BeforeEach
    void setUp() {
        sheetService = new SheetService();
    }

    /**
     * Literal values read back exactly, including negatives and extremes.
     */
    @Test
    void testSetLiteralValues() {
        sheetService.setCellValue("A1", 42);
        sheetService.setCellValue("B7", -17L);
        sheetService.setCellValue("ZZ100", Long.MAX_VALUE);

        assertEquals(42, sheetService.getCellValue("A1"));
        assertEquals(-17, sheetService.getCellValue("B7"));
        assertEquals(Long.MAX_VALUE, sheetService.getCellValue("ZZ100"));
    }

    @Test
    void testUnsetCellReadsAsZero() {
        assertEquals(0, sheetService.getCellValue("Q42"));
        assertTrue(sheetService.getSheetData().isEmpty());
    }

    /**
     * A1 -> A2 -> ... -> A7, with A7 set last.
     */
    @Test
    void testReferenceChain() {
        for (int i = 1; i <= 6; i++) {
            sheetService.setCellValue("A" + i, "=A" + (i + 1));
        }
        sheetService.setCellValue("A7", 12);

        assertEquals(12, sheetService.getCellValue("A1"));
    }

    /**
     * B1 sums A1..A3; changing one input re-evaluates B1 only.
     */
    @Test
    void testFanInPropagation() {
        sheetService.setCellValue("B1", "=A1+A2+A3");
        sheetService.setCellValue("A1", 12);
        assertEquals(12, sheetService.getCellValue("B1"));

        sheetService.setCellValue("A2", 12);
        sheetService.setCellValue("A3", 12);
        assertEquals(36, sheetService.getCellValue("B1"));

        sheetService.setCellValue("C1", "=A1*2");
        sheetService.setCellValue("A2", 24);
        assertEquals(48, sheetService.getCellValue("B1"));
        assertEquals(12, sheetService.getCellValue("A1"));
        assertEquals(24, sheetService.getCellValue("C1"));
    }

    @Test
    void testFibonacci() {
        sheetService.setCellValue("A1", 0);
        sheetService.setCellValue("A2", 1);
        for (int i = 3; i < 15; i++) {
            sheetService.setCellValue("A" + i, "=A" + (i - 2) + "+A" + (i - 1));
        }

        assertEquals(233, sheetService.getCellValue("A14"));
    }

    /**
     * Changing the base of an existing Fibonacci column ripples all the way up.
     */
    @Test
    void testFibonacciUpdateRipples() {
        sheetService.setCellValue("A1", 0);
        sheetService.setCellValue("A2", 1);
        for (int i = 3; i < 15; i++) {
            sheetService.setCellValue("A" + i, "=A" + (i - 2) + "+A" + (i - 1));
        }
        sheetService.setCellValue("A1", 1);

        // Sequence now starts 1, 1, 2, ...
        assertEquals(377, sheetService.getCellValue("A14"));
    }

    @Test
    void testSingleCellCycle() {
        sheetService.setCellValue("A1", 5);

        // Attempt cycle => fails
        CircularReferenceException ex = assertThrows(CircularReferenceException.class, () ->
                sheetService.setCellValue("A1", "=A1"));
        assertEquals(CellId.of(0, 0), ex.getCycleCell());
        assertEquals(CellId.of(0, 0), ex.getMutatedCell());

        // Old value remains
        CellView a1 = sheetService.getCell("A1");
        assertEquals(5, a1.getValue());
        assertNull(a1.getFormula());
    }

    @Test
    void testTwoCellCycle() {
        sheetService.setCellValue("A1", "=A2");
        assertThrows(CircularReferenceException.class, () ->
                sheetService.setCellValue("A2", "=A1"));
    }

    /**
     * A1 -> A2 -> ... -> A15; closing the ring on the last edge fails.
     */
    @Test
    void testFifteenCellCycle() {
        for (int i = 1; i <= 15; i++) {
            sheetService.setCellValue("A" + i, "=A" + (i + 1));
        }
        assertThrows(CircularReferenceException.class, () ->
                sheetService.setCellValue("A15", "=A1"));
    }

    /**
     * A rejected cycle leaves the cell, its edges and every value as they were.
     */
    @Test
    void testCycleIsRolledBack() {
        sheetService.setCellValue("A1", "=B1+1");
        sheetService.setCellValue("B1", "=C1*2");
        sheetService.setCellValue("C1", 10);
        assertEquals(21, sheetService.getCellValue("A1"));

        assertThrows(CircularReferenceException.class, () ->
                sheetService.setCellValue("C1", "=A1"));

        assertEquals(10, sheetService.getCellValue("C1"));
        assertEquals(20, sheetService.getCellValue("B1"));
        assertEquals(21, sheetService.getCellValue("A1"));
        // C1 is still referenced by B1 but references nothing itself
        assertTrue(sheetService.getForwardGraph().get("C1").isEmpty());
        assertTrue(sheetService.getReverseGraph().get("A1").isEmpty());

        // Sheet is still usable afterwards
        sheetService.setCellValue("C1", 1);
        assertEquals(3, sheetService.getCellValue("A1"));
    }

    /**
     * A cell that did not exist before a rejected cycle is not created by it.
     */
    @Test
    void testCycleOnNewCellLeavesNoCell() {
        sheetService.setCellValue("A1", "=B1");

        assertThrows(CircularReferenceException.class, () ->
                sheetService.setCellValue("B1", "=A1"));

        assertFalse(sheetService.getSheetData().containsKey("B1"));
        assertEquals(Set.of("A1"), sheetService.getReverseGraph().get("B1"));
    }

    @Test
    void testParseFailureLeavesCellUntouched() {
        sheetService.setCellValue("A1", "=2*3");

        assertThrows(ExpressionParseException.class, () ->
                sheetService.setCellValue("A1", "=2*"));
        assertThrows(ExpressionParseException.class, () ->
                sheetService.setCellValue("A1", "2*3"));

        CellView a1 = sheetService.getCell("A1");
        assertEquals(6, a1.getValue());
        assertEquals("=2*3", a1.getFormula());
    }

    @Test
    void testInvalidAddress() {
        assertThrows(AddressParseException.class, () -> sheetService.setCellValue("a1", 1));
        assertThrows(AddressParseException.class, () -> sheetService.setCellValue("1A", 1));
        assertThrows(AddressParseException.class, () -> sheetService.getCellValue("A"));
        assertThrows(AddressParseException.class, () -> sheetService.getCellValue("A0"));
    }

    @Test
    void testInvalidValueType() {
        assertThrows(InvalidTypeException.class, () -> sheetService.setCellValue("A1", 1.5));
        assertThrows(InvalidTypeException.class, () -> sheetService.setCellValue("A1", true));
        assertThrows(InvalidTypeException.class, () -> sheetService.setCellValue("A1", (Object) null));
        assertTrue(sheetService.getSheetData().isEmpty());
    }

    /**
     * The address is checked before the value type.
     */
    @Test
    void testInvalidAddressReportedBeforeValueType() {
        assertThrows(AddressParseException.class, () -> sheetService.setCellValue("??", 1.5));
    }

    @Test
    void testDivisionByZeroYieldsZero() {
        sheetService.setCellValue("A1", 10);
        sheetService.setCellValue("B1", "=A1/(A2-A2)");
        assertEquals(0, sheetService.getCellValue("B1"));

        sheetService.setCellValue("A2", 0);
        sheetService.setCellValue("C1", "=A1/A2+7");
        assertEquals(7, sheetService.getCellValue("C1"));
    }

    @Test
    void testWhitespaceInsensitivity() {
        sheetService.setCellValue("A1", "=  12 + 14");
        sheetService.setCellValue("A2", "=12+14");
        assertEquals(26, sheetService.getCellValue("A1"));
        assertEquals(26, sheetService.getCellValue("A2"));
    }

    @Test
    void testChangeLiteralToFormula() {
        sheetService.setCellValue("A1", 3);
        sheetService.setCellValue("B1", 4);
        sheetService.setCellValue("C1", "=A1");
        assertEquals(3, sheetService.getCellValue("C1"));

        sheetService.setCellValue("C1", "=A1*A1+B1*B1");
        assertEquals(25, sheetService.getCellValue("C1"));
        assertEquals(Set.of("A1", "B1"), sheetService.getForwardGraph().get("C1"));
    }

    /**
     * Replacing a formula with a literal drops its references.
     */
    @Test
    void testChangeFormulaToLiteral() {
        sheetService.setCellValue("A1", 5);
        sheetService.setCellValue("C1", "=A1");
        assertEquals(5, sheetService.getCellValue("C1"));

        sheetService.setCellValue("C1", 99);
        sheetService.setCellValue("A1", 6);

        assertEquals(99, sheetService.getCellValue("C1"));
        assertNull(sheetService.getReverseGraph().get("A1"));
        // A1 may now refer to C1 without forming a cycle
        sheetService.setCellValue("A1", "=C1+1");
        assertEquals(100, sheetService.getCellValue("A1"));
    }

    @Test
    void testDuplicateReferencesCollapse() {
        sheetService.setCellValue("A1", 2);
        sheetService.setCellValue("B1", "=A1*A1+A1");

        assertEquals(6, sheetService.getCellValue("B1"));
        assertEquals(Set.of("A1"), sheetService.getForwardGraph().get("B1"));
        assertEquals(Set.of("B1"), sheetService.getReverseGraph().get("A1"));
    }

    /**
     * Diamond: D depends on B and C, both of which depend on A.
     */
    @Test
    void testDiamondDependencies() {
        sheetService.setCellValue("D1", "=B1+C1");
        sheetService.setCellValue("B1", "=A1*10");
        sheetService.setCellValue("C1", "=A1-1");
        sheetService.setCellValue("A1", 3);

        assertEquals(32, sheetService.getCellValue("D1"));
        sheetService.setCellValue("A1", -1);
        assertEquals(-12, sheetService.getCellValue("D1"));
    }

    @Test
    void testGetCellView() {
        sheetService.setCellValue("B2", "=-3*-4");
        CellView view = sheetService.getCell("B2");

        assertEquals("B2", view.getAddress());
        assertEquals(12, view.getValue());
        assertEquals("=-3*-4", view.getFormula());

        CellView unset = sheetService.getCell("C3");
        assertEquals(0, unset.getValue());
        assertNull(unset.getFormula());
    }

    @Test
    void testSheetDataIsOrderedByAddress() {
        sheetService.setCellValue("B1", 2);
        sheetService.setCellValue("A2", 3);
        sheetService.setCellValue("A1", 1);

        Map<String, Long> data = sheetService.getSheetData();
        assertEquals(List.of("A1", "A2", "B1"), new ArrayList<>(data.keySet()));
        assertEquals(3L, data.get("A2"));
    }

    /**
     * Long chains are refreshed without deep recursion.
     */
    @Test
    void testLongChainRefresh() {
        int length = 2000;
        sheetService.setCellValue("A1", 1);
        for (int i = 2; i <= length; i++) {
            sheetService.setCellValue("A" + i, "=A" + (i - 1) + "+1");
        }
        assertEquals(length, sheetService.getCellValue("A" + length));

        sheetService.setCellValue("A1", 1001);
        assertEquals(length + 1000, sheetService.getCellValue("A" + length));
    }

    /**
     * Simple concurrency test: ensures no concurrency errors
     * when two threads set different cells simultaneously.
     */
    @Test
    void testConcurrentCellUpdates() throws InterruptedException {
        sheetService.setCellValue("C1", "=A1+B1");
        Runnable task1 = () -> sheetService.setCellValue("A1", 10);
        Runnable task2 = () -> sheetService.setCellValue("B1", 20);

        Thread t1 = new Thread(task1);
        Thread t2 = new Thread(task2);

        t1.start();
        t2.start();
        t1.join();
        t2.join();

        assertEquals(10, sheetService.getCellValue("A1"));
        assertEquals(20, sheetService.getCellValue("B1"));
        assertEquals(30, sheetService.getCellValue("C1"));
    }
}
