package com.cellgraph.app.models;

public enum CellDataType {
    EMPTY,
    LITERAL,
    FORMULA
}
