package com.cellgraph.app.services;

import com.cellgraph.app.formula.Expression;
import com.cellgraph.app.formula.FormulaFormatter;
import com.cellgraph.app.formula.FormulaParser;
import com.cellgraph.app.models.CellAddress;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceTransformerTest {

    private final ReferenceTransformer transformer = new ReferenceTransformer();

    private String paste(String formula, String from, String to) {
        CellAddress source = CellAddress.fromString(from);
        CellAddress destination = CellAddress.fromString(to);
        Expression copied = FormulaParser.parse(formula, source);
        return FormulaFormatter.format(transformer.transformForPaste(copied, source, destination), destination);
    }

    @Test
    void testRelativeReferencesKeepTheirDisplacement() {
        assertEquals("B5+C5", paste("A1+B1", "C1", "D5"));
    }

    @Test
    void testAbsoluteReferencesStayPut() {
        assertEquals("$A$1+C5", paste("$A$1+B1", "C1", "D5"));
    }

    @Test
    void testRangeCornersMoveIndependently() {
        assertEquals("SUM(B2:C3)", paste("SUM(A1:B2)", "C3", "D4"));
        assertEquals("SUM($A$1:C3)", paste("SUM($A$1:B2)", "C3", "D4"));
    }

    @Test
    void testNestedExpressionsAreRewritten() {
        assertEquals("SLEEP(A2*2)-AVG(A2:A4)", paste("SLEEP(A1*2)-AVG(A1:A3)", "B1", "B2"));
    }

    @Test
    void testPastingInPlaceIsIdentity() {
        CellAddress home = CellAddress.fromString("E7");
        Expression formula = FormulaParser.parse("A1*$B$2+SUM(C1:D9)", home);
        assertEquals(formula, transformer.transformForPaste(formula, home, home));
    }

    @Test
    void testReferencePushedOffTheSheetHasNoAddress() {
        assertEquals("#REF!+1", paste("A1+1", "B1", "A1"));
    }
}
