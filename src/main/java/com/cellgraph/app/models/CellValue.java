package com.cellgraph.app.models;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * An evaluated cell value: a number, a piece of text, an error marker, or empty.
 * Exactly one payload is meaningful, selected by {@link #getType()}.
 */
public final class CellValue {

    public static final CellValue EMPTY = new CellValue(ValueType.EMPTY, 0, null, null);

    private final ValueType type;
    private final double number;
    private final String text;
    private final ErrorKind error;

    private CellValue(ValueType type, double number, String text, ErrorKind error) {
        this.type = type;
        this.number = number;
        this.text = text;
        this.error = error;
    }

    public static CellValue number(double number) {
        return new CellValue(ValueType.NUMBER, number, null, null);
    }

    public static CellValue text(String text) {
        return new CellValue(ValueType.TEXT, 0, Objects.requireNonNull(text), null);
    }

    public static CellValue error(ErrorKind kind) {
        return new CellValue(ValueType.ERROR, 0, null, Objects.requireNonNull(kind));
    }

    public ValueType getType() {
        return type;
    }

    public double getNumber() {
        if (type != ValueType.NUMBER) {
            throw new IllegalStateException("Not a number: " + this);
        }
        return number;
    }

    public String getText() {
        if (type != ValueType.TEXT) {
            throw new IllegalStateException("Not text: " + this);
        }
        return text;
    }

    public ErrorKind getError() {
        if (type != ValueType.ERROR) {
            throw new IllegalStateException("Not an error: " + this);
        }
        return error;
    }

    public boolean isError() {
        return type == ValueType.ERROR;
    }

    public boolean isEmpty() {
        return type == ValueType.EMPTY;
    }

    /**
     * The value as a user would read it in a cell: numbers without a trailing ".0",
     * errors as their token, empty as "".
     */
    public String display() {
        switch (type) {
            case NUMBER:
                return formatNumber(number);
            case TEXT:
                return text;
            case ERROR:
                return error.getToken();
            case EMPTY:
                return "";
            default:
                throw new IllegalStateException("Unknown value type " + type);
        }
    }

    public static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue that = (CellValue) o;
        return type == that.type
                && Double.compare(number, that.number) == 0
                && Objects.equals(text, that.text)
                && error == that.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, text, error);
    }

    @Override
    public String toString() {
        return type + "(" + display() + ")";
    }
}
