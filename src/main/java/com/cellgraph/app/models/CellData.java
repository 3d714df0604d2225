package com.cellgraph.app.models;

import com.cellgraph.app.formula.Expression;

import java.util.Objects;

/**
 * What a cell holds: nothing, a literal value, or a formula with its last computed result.
 * Instances are immutable; a recompute stores a copy carrying the new cached value.
 */
public final class CellData {

    public static final CellData EMPTY = new CellData(CellDataType.EMPTY, null, null, null);

    private final CellDataType type;
    private final CellValue literal;
    private final Expression formula;
    // null until the recompute pass reaches a freshly assigned formula
    private final CellValue cachedValue;

    private CellData(CellDataType type, CellValue literal, Expression formula, CellValue cachedValue) {
        this.type = type;
        this.literal = literal;
        this.formula = formula;
        this.cachedValue = cachedValue;
    }

    /**
     * Literal numbers and text. An empty value collapses to {@link #EMPTY}.
     */
    public static CellData literal(CellValue value) {
        switch (value.getType()) {
            case EMPTY:
                return EMPTY;
            case NUMBER:
            case TEXT:
                return new CellData(CellDataType.LITERAL, value, null, null);
            case ERROR:
                throw new IllegalArgumentException("Error markers are computed, not entered: " + value);
            default:
                throw new IllegalStateException("Unknown value type " + value.getType());
        }
    }

    public static CellData formula(Expression formula) {
        return new CellData(CellDataType.FORMULA, null, Objects.requireNonNull(formula), null);
    }

    public CellData withCachedValue(CellValue value) {
        if (type != CellDataType.FORMULA) {
            throw new IllegalStateException("Only formula cells cache a value");
        }
        return new CellData(type, null, formula, Objects.requireNonNull(value));
    }

    /**
     * The same content with any cached result dropped, as recorded in history.
     */
    public CellData withoutCachedValue() {
        return type == CellDataType.FORMULA && cachedValue != null ? formula(formula) : this;
    }

    public CellDataType getType() {
        return type;
    }

    public Expression getFormula() {
        return formula;
    }

    public boolean isEmpty() {
        return type == CellDataType.EMPTY;
    }

    public boolean isFormula() {
        return type == CellDataType.FORMULA;
    }

    public boolean hasCachedValue() {
        return cachedValue != null;
    }

    /**
     * The value other cells see: the literal, the cached formula result, or empty.
     */
    public CellValue getValue() {
        switch (type) {
            case EMPTY:
                return CellValue.EMPTY;
            case LITERAL:
                return literal;
            case FORMULA:
                return cachedValue != null ? cachedValue : CellValue.EMPTY;
            default:
                throw new IllegalStateException("Unknown cell data type " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellData)) {
            return false;
        }
        CellData that = (CellData) o;
        return type == that.type
                && Objects.equals(literal, that.literal)
                && Objects.equals(formula, that.formula)
                && Objects.equals(cachedValue, that.cachedValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, literal, formula, cachedValue);
    }

    @Override
    public String toString() {
        switch (type) {
            case EMPTY:
                return "Empty";
            case LITERAL:
                return "Literal(" + literal + ")";
            default:
                return "Formula(" + formula + " = " + cachedValue + ")";
        }
    }
}
