package com.cellgraph.app.models;

import com.cellgraph.app.formula.FormulaParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellDataTest {

    @Test
    void testNumbersDisplayWithoutTrailingZeros() {
        assertEquals("15", CellValue.number(15).display());
        assertEquals("-0.25", CellValue.number(-0.25).display());
        assertEquals("100000000000000000000", CellValue.number(1e20).display());
        assertEquals("#VALUE!", CellValue.error(ErrorKind.TYPE_MISMATCH).display());
        assertEquals("", CellValue.EMPTY.display());
    }

    @Test
    void testWrongTypeAccessFails() {
        assertThrows(IllegalStateException.class, () -> CellValue.text("x").getNumber());
        assertThrows(IllegalStateException.class, () -> CellValue.number(1).getError());
        assertThrows(IllegalStateException.class, () -> CellValue.number(1).getText());
        assertEquals("x", CellValue.text("x").getText());
    }

    @Test
    void testLiteralCannotHoldAnError() {
        assertThrows(IllegalArgumentException.class, () -> CellData.literal(CellValue.error(ErrorKind.BAD_REF)));
        assertSame(CellData.EMPTY, CellData.literal(CellValue.EMPTY));
    }

    @Test
    void testFormulaCache() {
        CellData formula = CellData.formula(FormulaParser.parse("A1+1", CellAddress.fromString("B1")));
        assertFalse(formula.hasCachedValue());
        assertTrue(formula.getValue().isEmpty());

        CellData computed = formula.withCachedValue(CellValue.number(3));
        assertEquals(CellValue.number(3), computed.getValue());
        assertEquals(formula, computed.withoutCachedValue());
    }
}
