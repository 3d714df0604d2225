package com.cellgraph.app.services;

import com.cellgraph.app.exceptions.CircularReferenceException;
import com.cellgraph.app.formula.FormulaParser;
import com.cellgraph.app.models.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphMaintainerTest {

    private DependencyGraphMaintainer maintainer;
    private FormulaEvaluator evaluator;
    private Sheet sheet;

    @BeforeEach
    void setUp() {
        evaluator = new FormulaEvaluator(seconds -> { });
        maintainer = new DependencyGraphMaintainer(evaluator);
        sheet = new Sheet(20, 10, 10);
    }

    private static CellAddress at(String cell) {
        return CellAddress.fromString(cell);
    }

    private void number(String cell, double value) {
        maintainer.assign(sheet, at(cell), CellData.literal(CellValue.number(value)));
    }

    private void formula(String cell, String text) {
        maintainer.assign(sheet, at(cell), CellData.formula(FormulaParser.parse(text, at(cell))));
    }

    private CellValue value(String cell) {
        return sheet.getStore().get(at(cell)).getValue();
    }

    /**
     * dependents and precedents must mirror each other exactly.
     */
    private void assertInverseRelation() {
        DependencyIndex index = sheet.getDependencies();
        for (int row = 0; row < sheet.getRows(); row++) {
            for (int column = 0; column < sheet.getColumns(); column++) {
                CellAddress cell = new CellAddress(column, row);
                for (CellAddress p : index.getPrecedents(cell)) {
                    assertTrue(index.getDependents(p).contains(cell), p + " -> " + cell);
                }
                for (CellRegion region : index.getRegions(cell)) {
                    assertTrue(index.getDependents(region.getTopLeft()).contains(cell), region + " -> " + cell);
                    assertTrue(index.getDependents(region.getBottomRight()).contains(cell), region + " -> " + cell);
                }
                for (CellAddress d : index.getDependents(cell)) {
                    boolean referenced = index.getPrecedents(d).contains(cell)
                            || index.getRegions(d).stream().anyMatch(r -> r.contains(cell));
                    assertTrue(referenced, d + " <- " + cell);
                }
            }
        }
    }

    /**
     * Every formula's cached value equals a fresh evaluation.
     */
    private void assertConsistent() {
        for (Map.Entry<CellAddress, CellData> e : sheet.getStore().after(null)) {
            CellData data = e.getValue();
            if (data.isFormula()) {
                assertEquals(evaluator.evaluate(sheet, e.getKey(), data.getFormula()), data.getValue(),
                        e.getKey().toString());
            }
        }
    }

    @Test
    void testEndToEndCycleRejection() {
        number("A1", 5);
        number("A2", 10);
        formula("B1", "A1+A2");
        assertEquals(CellValue.number(15), value("B1"));

        Map<String, Set<String>> forwardBefore = sheet.getDependencies().forwardView();
        Map<String, Set<String>> reverseBefore = sheet.getDependencies().reverseView();

        assertThrows(CircularReferenceException.class, () -> formula("A1", "B1"));

        assertEquals(CellValue.number(5), value("A1"));
        assertEquals(CellValue.number(15), value("B1"));
        assertEquals(forwardBefore, sheet.getDependencies().forwardView());
        assertEquals(reverseBefore, sheet.getDependencies().reverseView());
        assertEquals(3, sheet.getStore().size());
    }

    @Test
    void testSelfReferenceIsACycle() {
        assertThrows(CircularReferenceException.class, () -> formula("A1", "A1+1"));
        assertTrue(sheet.getStore().get(at("A1")).isEmpty());
        assertTrue(sheet.getDependencies().forwardView().isEmpty());
    }

    @Test
    void testCycleThroughRange() {
        formula("B1", "SUM(A1:A3)");
        assertThrows(CircularReferenceException.class, () -> formula("A2", "B1*2"));
        assertThrows(CircularReferenceException.class, () -> formula("B1", "SUM(A1:B2)"));
    }

    @Test
    void testLongerCycle() {
        formula("C1", "A1");
        formula("A1", "B1");
        assertThrows(CircularReferenceException.class, () -> formula("B1", "C1"));
        assertTrue(sheet.getStore().get(at("B1")).isEmpty());
        assertInverseRelation();
    }

    @Test
    void testReassignmentReplacesPrecedents() {
        formula("C1", "A1+B1");
        assertEquals(Set.of("A1", "B1"), sheet.getDependencies().forwardView().get("C1"));

        formula("C1", "B2*2");
        assertEquals(Set.of("B2"), sheet.getDependencies().forwardView().get("C1"));
        assertFalse(sheet.getDependencies().reverseView().containsKey("A1"));
        assertInverseRelation();

        number("C1", 7);
        assertTrue(sheet.getDependencies().forwardView().isEmpty());
        assertTrue(sheet.getDependencies().reverseView().isEmpty());
    }

    /**
     * Breaking the old edge makes a formerly cyclic assignment legal.
     */
    @Test
    void testCycleCheckUsesNewPrecedentsOnly() {
        formula("B1", "A1");
        formula("B1", "5");
        formula("A1", "B1+1");
        assertEquals(CellValue.number(6), value("A1"));
    }

    @Test
    void testDiamondRecomputesInDependencyOrder() {
        number("A1", 1);
        formula("B1", "A1*2");
        formula("C1", "A1+B1");
        formula("D1", "C1+B1");
        assertEquals(CellValue.number(5), value("D1"));

        number("A1", 2);
        assertEquals(CellValue.number(4), value("B1"));
        assertEquals(CellValue.number(6), value("C1"));
        assertEquals(CellValue.number(10), value("D1"));
        assertConsistent();

        List<CellAddress> order = maintainer.recomputationOrder(sheet.getDependencies(), at("A1"));
        assertEquals(4, order.size());
        assertEquals(at("A1"), order.get(0));
        assertTrue(order.indexOf(at("B1")) < order.indexOf(at("C1")));
        assertTrue(order.indexOf(at("C1")) < order.indexOf(at("D1")));
    }

    @Test
    void testAssignReturnsRecomputeCount() {
        number("A1", 1);
        formula("B1", "A1");
        formula("C1", "B1");
        assertEquals(2, maintainer.assign(sheet, at("A1"), CellData.literal(CellValue.number(3))));
        assertEquals(CellValue.number(3), value("C1"));
    }

    @Test
    void testErrorsFlowDownstreamAndRecover() {
        formula("A1", "1/0");
        formula("B1", "A1+1");
        formula("C1", "SUM(A1:A2)");
        assertEquals(CellValue.error(ErrorKind.DIV_BY_ZERO), value("A1"));
        assertEquals(CellValue.error(ErrorKind.BAD_REF), value("B1"));
        assertEquals(CellValue.error(ErrorKind.BAD_REF), value("C1"));

        formula("A1", "4/2");
        assertEquals(CellValue.number(3), value("B1"));
        assertEquals(CellValue.number(2), value("C1"));
    }

    @Test
    void testWritingInsideARangeTriggersRecompute() {
        formula("B1", "SUM(A1:A5)");
        number("A4", 7);
        assertEquals(CellValue.number(7), value("B1"));
        maintainer.assign(sheet, at("A4"), CellData.EMPTY);
        assertEquals(CellValue.number(0), value("B1"));
    }

    @Test
    void testRangeIsIndexedAsOneRectangle() {
        formula("B1", "SUM(A1:A5)+C2");
        DependencyIndex index = sheet.getDependencies();
        assertEquals(Set.of(at("C2")), index.getPrecedents(at("B1")));
        assertEquals(Set.of(CellRegion.between(at("A5"), at("A1"))), index.getRegions(at("B1")));
        assertEquals(Set.of(at("B1")), index.getDependents(at("A3")));
        assertTrue(index.getDependents(at("A6")).isEmpty());
        assertEquals(Set.of("A1:A5", "C2"), index.forwardView().get("B1"));
        assertEquals(Set.of("B1"), index.reverseView().get("A1:A5"));

        formula("B1", "C2");
        assertTrue(index.getRegions(at("B1")).isEmpty());
        assertTrue(index.getDependents(at("A3")).isEmpty());
        assertFalse(index.reverseView().containsKey("A1:A5"));
    }

    /**
     * A range over the whole largest sheet is stored as two corners, not one entry per cell.
     */
    @Test
    void testFullSheetRangeOnLargestSheet() {
        Sheet large = new Sheet(999, 18278, 10);
        maintainer.assign(large, at("C5"), CellData.literal(CellValue.number(3)));
        maintainer.assign(large, at("B1"), CellData.formula(FormulaParser.parse("SUM(C1:ZZZ999)", at("B1"))));
        assertEquals(CellValue.number(3), large.getStore().get(at("B1")).getValue());

        maintainer.assign(large, at("ZZZ999"), CellData.literal(CellValue.number(4)));
        assertEquals(CellValue.number(7), large.getStore().get(at("B1")).getValue());

        assertThrows(CircularReferenceException.class, () ->
                maintainer.assign(large, at("ZZ10"), CellData.formula(FormulaParser.parse("B1", at("ZZ10")))));
        assertEquals(Set.of("C1:ZZZ999"), large.getDependencies().forwardView().get("B1"));
    }

    @Test
    void testOutOfBoundsReferencesAreNotPrecedents() {
        formula("A1", "K1+1");
        assertEquals(CellValue.error(ErrorKind.RANGE_ERROR), value("A1"));
        assertTrue(sheet.getDependencies().forwardView().isEmpty());
    }

    @Test
    void testRandomEditsKeepIndexAndValuesConsistent() {
        String[] cells = {"A1", "A2", "A3", "B1", "B2", "B3", "C1", "C2"};
        java.util.Random random = new java.util.Random(42);
        for (int i = 0; i < 300; i++) {
            String target = cells[random.nextInt(cells.length)];
            String a = cells[random.nextInt(cells.length)];
            String b = cells[random.nextInt(cells.length)];
            try {
                switch (random.nextInt(4)) {
                    case 0:
                        number(target, random.nextInt(10));
                        break;
                    case 1:
                        formula(target, a + "+" + b);
                        break;
                    case 2:
                        formula(target, "SUM(A1:" + a + ")");
                        break;
                    default:
                        maintainer.assign(sheet, at(target), CellData.EMPTY);
                        break;
                }
            } catch (CircularReferenceException expected) {
                // rejected edits must leave everything consistent too
            }
            assertInverseRelation();
            assertConsistent();
        }
    }
}
