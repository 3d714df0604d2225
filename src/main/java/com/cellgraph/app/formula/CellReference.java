package com.cellgraph.app.formula;

import java.util.Objects;

/**
 * A single-cell reference, relative or absolute.
 */
public final class CellReference extends Expression {

    private final CellReferenceTarget target;

    public CellReference(CellReferenceTarget target) {
        this.target = Objects.requireNonNull(target);
    }

    public CellReferenceTarget getTarget() {
        return target;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitReference(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CellReference && target.equals(((CellReference) o).target);
    }

    @Override
    public int hashCode() {
        return target.hashCode();
    }

    @Override
    public String toString() {
        return "Ref(" + target + ")";
    }
}
