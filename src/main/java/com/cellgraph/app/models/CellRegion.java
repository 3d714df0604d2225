package com.cellgraph.app.models;

import java.util.Objects;

/**
 * A rectangle of cells with normalized corners, kept as two corners no matter how many
 * cells it spans.
 */
public final class CellRegion implements Comparable<CellRegion> {

    private final CellAddress topLeft;
    private final CellAddress bottomRight;

    private CellRegion(CellAddress topLeft, CellAddress bottomRight) {
        this.topLeft = topLeft;
        this.bottomRight = bottomRight;
    }

    /**
     * The rectangle spanned by two opposite corners given in any order.
     */
    public static CellRegion between(CellAddress a, CellAddress b) {
        return new CellRegion(
                new CellAddress(Math.min(a.getColumn(), b.getColumn()), Math.min(a.getRow(), b.getRow())),
                new CellAddress(Math.max(a.getColumn(), b.getColumn()), Math.max(a.getRow(), b.getRow())));
    }

    public CellAddress getTopLeft() {
        return topLeft;
    }

    public CellAddress getBottomRight() {
        return bottomRight;
    }

    public boolean contains(CellAddress address) {
        return address.getRow() >= topLeft.getRow() && address.getRow() <= bottomRight.getRow()
                && address.getColumn() >= topLeft.getColumn() && address.getColumn() <= bottomRight.getColumn();
    }

    @Override
    public int compareTo(CellRegion other) {
        int cmp = topLeft.compareTo(other.topLeft);
        return cmp != 0 ? cmp : bottomRight.compareTo(other.bottomRight);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRegion)) {
            return false;
        }
        CellRegion that = (CellRegion) o;
        return topLeft.equals(that.topLeft) && bottomRight.equals(that.bottomRight);
    }

    @Override
    public int hashCode() {
        return Objects.hash(topLeft, bottomRight);
    }

    @Override
    public String toString() {
        return topLeft + ":" + bottomRight;
    }
}
