package com.cellgraph.app.exceptions;

/**
 * Thrown when a new sheet is requested with a row or column count
 * below 1 or above the configured maximum.
 */
public class InvalidSheetDimensionsException extends RuntimeException {
    public InvalidSheetDimensionsException(String message) {
        super(message);
    }
}
