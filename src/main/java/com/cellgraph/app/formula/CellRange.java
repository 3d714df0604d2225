package com.cellgraph.app.formula;

import java.util.Objects;

/**
 * A rectangle given by two corner references ("A1:B10").
 * Each corner is relative or absolute on its own.
 */
public final class CellRange extends Expression {

    private final CellReferenceTarget start;
    private final CellReferenceTarget end;

    public CellRange(CellReferenceTarget start, CellReferenceTarget end) {
        this.start = Objects.requireNonNull(start);
        this.end = Objects.requireNonNull(end);
    }

    public CellReferenceTarget getStart() {
        return start;
    }

    public CellReferenceTarget getEnd() {
        return end;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitRange(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange that = (CellRange) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "Range(" + start + ":" + end + ")";
    }
}
