package com.cellgraph.app.exceptions;

/**
 * Thrown when a cell address is malformed (e.g. "1A")
 * or lies outside the sheet it is applied to.
 */
public class InvalidCellAddressException extends RuntimeException {
    public InvalidCellAddressException(String message) {
        super(message);
    }
}
