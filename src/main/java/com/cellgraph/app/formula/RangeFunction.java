package com.cellgraph.app.formula;

import java.util.Objects;

/**
 * SUM/AVG/MIN/MAX/STDEV over a cell range.
 */
public final class RangeFunction extends Expression {

    private final RangeFunctionType type;
    private final CellRange range;

    public RangeFunction(RangeFunctionType type, CellRange range) {
        this.type = Objects.requireNonNull(type);
        this.range = Objects.requireNonNull(range);
    }

    public RangeFunctionType getType() {
        return type;
    }

    public CellRange getRange() {
        return range;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitRangeFunction(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RangeFunction)) {
            return false;
        }
        RangeFunction that = (RangeFunction) o;
        return type == that.type && range.equals(that.range);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, range);
    }

    @Override
    public String toString() {
        return type + "(" + range + ")";
    }
}
