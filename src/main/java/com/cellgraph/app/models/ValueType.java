package com.cellgraph.app.models;

/**
 * The four shapes a cell value can take.
 */
public enum ValueType {
    NUMBER,
    TEXT,
    ERROR,
    EMPTY
}
