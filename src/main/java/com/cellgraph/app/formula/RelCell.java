package com.cellgraph.app.formula;

import com.cellgraph.app.models.CellAddress;

import java.util.Objects;

/**
 * A reference stored as an offset from the formula's home cell.
 * Pasting the formula somewhere else keeps the offset, so the reference moves with it.
 */
public final class RelCell implements CellReferenceTarget {

    private final int rowOffset;
    private final int columnOffset;

    public RelCell(int rowOffset, int columnOffset) {
        this.rowOffset = rowOffset;
        this.columnOffset = columnOffset;
    }

    /**
     * The relative reference that, seen from {@code home}, points at {@code target}.
     */
    public static RelCell between(CellAddress home, CellAddress target) {
        return new RelCell(target.getRow() - home.getRow(), target.getColumn() - home.getColumn());
    }

    public int getRowOffset() {
        return rowOffset;
    }

    public int getColumnOffset() {
        return columnOffset;
    }

    @Override
    public CellAddress resolve(CellAddress home) {
        return home.offset(rowOffset, columnOffset);
    }

    @Override
    public String render(CellAddress home) {
        return resolve(home).toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RelCell)) {
            return false;
        }
        RelCell that = (RelCell) o;
        return rowOffset == that.rowOffset && columnOffset == that.columnOffset;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowOffset, columnOffset);
    }

    @Override
    public String toString() {
        return "RelCell[" + rowOffset + "," + columnOffset + "]";
    }
}
