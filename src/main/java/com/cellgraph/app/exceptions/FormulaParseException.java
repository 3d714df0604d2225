package com.cellgraph.app.exceptions;

/**
 * Thrown when formula text does not follow the formula grammar.
 * Raised before any assignment is attempted, so the sheet is never touched.
 */
public class FormulaParseException extends RuntimeException {

    private final int position;

    public FormulaParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
