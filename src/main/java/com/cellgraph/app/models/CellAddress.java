package com.cellgraph.app.models;

import com.cellgraph.app.exceptions.InvalidCellAddressException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Absolute position of a cell in a sheet.
 * Both coordinates are 0-based: "A1" is (column 0, row 0), "B3" is (column 1, row 2).
 * Ordering is row-major, so every row slice of a rectangle is a contiguous key range.
 */
public final class CellAddress implements Comparable<CellAddress> {

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^([A-Za-z]+)(\\d+)$");

    private final int column;
    private final int row;

    public CellAddress(int column, int row) {
        this.column = column;
        this.row = row;
    }

    /**
     * Parses the letters-then-digits form, e.g. "A1", "aa10".
     * Throws InvalidCellAddressException if the text is not an address.
     */
    @JsonCreator
    public static CellAddress fromString(String text) {
        if (text == null) {
            throw new InvalidCellAddressException("Cell address is missing");
        }
        Matcher matcher = ADDRESS_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            throw new InvalidCellAddressException("Not a cell address: " + text);
        }
        int row;
        try {
            row = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            throw new InvalidCellAddressException("Row number too large: " + text);
        }
        if (row < 1) {
            throw new InvalidCellAddressException("Rows start at 1: " + text);
        }
        return new CellAddress(columnIndex(matcher.group(1)), row - 1);
    }

    /**
     * "A" -> 0, "Z" -> 25, "AA" -> 26.
     */
    public static int columnIndex(String letters) {
        int index = 0;
        try {
            for (int i = 0; i < letters.length(); i++) {
                char c = Character.toUpperCase(letters.charAt(i));
                index = Math.addExact(Math.multiplyExact(index, 26), c - 'A' + 1);
            }
        } catch (ArithmeticException e) {
            throw new InvalidCellAddressException("Column too large: " + letters);
        }
        return index - 1;
    }

    public static String columnName(int column) {
        StringBuilder name = new StringBuilder();
        int n = column + 1;
        while (n > 0) {
            int rem = (n - 1) % 26;
            name.insert(0, (char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return name.toString();
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    public CellAddress offset(int rowOffset, int columnOffset) {
        return new CellAddress(column + columnOffset, row + rowOffset);
    }

    /**
     * Negative coordinates can appear after pasting a relative reference
     * near the sheet edge; they have no text form.
     */
    public boolean isNonNegative() {
        return column >= 0 && row >= 0;
    }

    @Override
    public int compareTo(CellAddress other) {
        int byRow = Integer.compare(row, other.row);
        return byRow != 0 ? byRow : Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return column == that.column && row == that.row;
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, row);
    }

    @JsonValue
    @Override
    public String toString() {
        if (!isNonNegative()) {
            return "#REF!";
        }
        return columnName(column) + (row + 1);
    }
}
