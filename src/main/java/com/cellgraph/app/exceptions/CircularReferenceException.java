package com.cellgraph.app.exceptions;

import com.cellgraph.app.models.CellAddress;

/**
 * Thrown when a formula assignment would close a dependency loop
 * (a cell referencing itself, or a multi-cell loop).
 * The assignment is rejected before anything in the sheet changes.
 */
public class CircularReferenceException extends RuntimeException {

    private final CellAddress cell;

    public CircularReferenceException(CellAddress cell, String message) {
        super(message);
        this.cell = cell;
    }

    public CellAddress getCell() {
        return cell;
    }
}
