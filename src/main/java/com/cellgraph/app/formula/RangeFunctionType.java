package com.cellgraph.app.formula;

/**
 * Aggregates that take a single cell range argument.
 */
public enum RangeFunctionType {
    MIN,
    MAX,
    AVG,
    SUM,
    STDEV;

    /**
     * Returns null when {@code name} is not an aggregate (it may still be SLEEP or a column).
     */
    public static RangeFunctionType fromName(String name) {
        for (RangeFunctionType type : values()) {
            if (type.name().equals(name)) {
                return type;
            }
        }
        return null;
    }
}
