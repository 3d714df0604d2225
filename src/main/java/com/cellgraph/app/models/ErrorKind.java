package com.cellgraph.app.models;

/**
 * Evaluation failures that are stored as a cell's value
 * and flow into downstream formulas like any other value.
 */
public enum ErrorKind {
    RANGE_ERROR("#RANGE!"),
    DIV_BY_ZERO("#DIV/0!"),
    BAD_REF("#REF!"),
    TYPE_MISMATCH("#VALUE!");

    private final String token;

    ErrorKind(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
