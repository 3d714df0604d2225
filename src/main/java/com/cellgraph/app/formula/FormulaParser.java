package com.cellgraph.app.formula;

import com.cellgraph.app.exceptions.FormulaParseException;
import com.cellgraph.app.exceptions.InvalidCellAddressException;
import com.cellgraph.app.models.CellAddress;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive descent parser for formula text (without the leading '=').
 *
 * <pre>
 * expression := factor (("+"|"-") factor)*
 * factor     := term (("*"|"/") term)*
 * term       := number | function | cell_ref | "(" expression ")"
 * function   := ("MIN"|"MAX"|"AVG"|"SUM"|"STDEV") "(" cell_ref ":" cell_ref ")"
 *             | "SLEEP" "(" expression ")"
 * </pre>
 *
 * Plain references ("B2") become {@link RelCell}s relative to the home cell,
 * "$B$2" becomes an {@link AbsCell}. Spaces and tabs between tokens are ignored.
 */
public final class FormulaParser {

    private static final Pattern NUMBER_PATTERN = Pattern.compile("-?(\\d+\\.\\d*|\\.\\d+|\\d+)");
    private static final Pattern CELL_PATTERN = Pattern.compile("(\\$?)([A-Za-z]+)(\\$?)(\\d+)");
    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z]+");
    private static final String SLEEP = "SLEEP";

    private final String text;
    private final CellAddress home;
    private int pos;

    private FormulaParser(String text, CellAddress home) {
        this.text = text;
        this.home = home;
    }

    public static Expression parse(String formula, CellAddress home) {
        if (formula == null) {
            throw new FormulaParseException("Formula is missing", 0);
        }
        FormulaParser parser = new FormulaParser(formula, home);
        Expression expression = parser.expression();
        parser.skipWhitespace();
        if (parser.pos < formula.length()) {
            throw new FormulaParseException("Unexpected '" + formula.charAt(parser.pos) + "'", parser.pos);
        }
        return expression;
    }

    private Expression expression() {
        Expression left = factor();
        while (peekOperator('+', '-')) {
            Operator op = Operator.fromSymbol(text.charAt(pos++));
            left = new BinaryOperation(op, left, factor());
        }
        return left;
    }

    private Expression factor() {
        Expression left = term();
        while (peekOperator('*', '/')) {
            Operator op = Operator.fromSymbol(text.charAt(pos++));
            left = new BinaryOperation(op, left, term());
        }
        return left;
    }

    private Expression term() {
        skipWhitespace();
        if (pos >= text.length()) {
            throw new FormulaParseException("Unexpected end of formula", pos);
        }
        char c = text.charAt(pos);
        if (c == '(') {
            pos++;
            Expression inner = expression();
            expect(')');
            return inner;
        }
        if (c == '-' || c == '.' || (c >= '0' && c <= '9')) {
            return number();
        }
        if (c == '$') {
            return new CellReference(cellRef());
        }
        if (isAsciiLetter(c)) {
            Matcher name = NAME_PATTERN.matcher(text);
            name.region(pos, text.length());
            name.lookingAt();
            int afterName = name.end();
            if (nextNonBlankIs(afterName, '(')) {
                return function(name.group(), afterName);
            }
            return new CellReference(cellRef());
        }
        throw new FormulaParseException("Unexpected '" + c + "'", pos);
    }

    private Expression number() {
        Matcher matcher = NUMBER_PATTERN.matcher(text);
        matcher.region(pos, text.length());
        if (!matcher.lookingAt()) {
            throw new FormulaParseException("Malformed number", pos);
        }
        pos = matcher.end();
        return new NumberLiteral(Double.parseDouble(matcher.group()));
    }

    private Expression function(String name, int afterName) {
        int nameStart = pos;
        pos = afterName;
        expect('(');
        if (SLEEP.equals(name)) {
            Expression argument = expression();
            expect(')');
            return new DelayFunction(argument);
        }
        RangeFunctionType type = RangeFunctionType.fromName(name);
        if (type == null) {
            throw new FormulaParseException("Unknown function " + name, nameStart);
        }
        CellReferenceTarget start = cellRef();
        expect(':');
        CellReferenceTarget end = cellRef();
        expect(')');
        return new RangeFunction(type, new CellRange(start, end));
    }

    private CellReferenceTarget cellRef() {
        skipWhitespace();
        Matcher matcher = CELL_PATTERN.matcher(text);
        matcher.region(pos, text.length());
        if (!matcher.lookingAt()) {
            throw new FormulaParseException("Expected a cell reference", pos);
        }
        boolean absoluteColumn = !matcher.group(1).isEmpty();
        boolean absoluteRow = !matcher.group(3).isEmpty();
        if (absoluteColumn != absoluteRow) {
            throw new FormulaParseException("Mixed references are not supported", pos);
        }
        CellAddress address;
        try {
            address = CellAddress.fromString(matcher.group(2) + matcher.group(4));
        } catch (InvalidCellAddressException e) {
            throw new FormulaParseException(e.getMessage(), pos);
        }
        pos = matcher.end();
        return absoluteColumn ? new AbsCell(address) : RelCell.between(home, address);
    }

    private boolean peekOperator(char a, char b) {
        skipWhitespace();
        if (pos >= text.length()) {
            return false;
        }
        char c = text.charAt(pos);
        return c == a || c == b;
    }

    private void expect(char expected) {
        skipWhitespace();
        if (pos >= text.length() || text.charAt(pos) != expected) {
            throw new FormulaParseException("Expected '" + expected + "'", pos);
        }
        pos++;
    }

    private boolean nextNonBlankIs(int from, char expected) {
        int i = from;
        while (i < text.length() && isBlank(text.charAt(i))) {
            i++;
        }
        return i < text.length() && text.charAt(i) == expected;
    }

    private void skipWhitespace() {
        while (pos < text.length() && isBlank(text.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t';
    }
}
