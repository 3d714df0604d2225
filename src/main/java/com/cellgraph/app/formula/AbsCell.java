package com.cellgraph.app.formula;

import com.cellgraph.app.models.CellAddress;

import java.util.Objects;

/**
 * A reference pinned to one address ("$B$2"). Copy/paste leaves it untouched.
 */
public final class AbsCell implements CellReferenceTarget {

    private final CellAddress address;

    public AbsCell(CellAddress address) {
        this.address = Objects.requireNonNull(address);
    }

    public CellAddress getAddress() {
        return address;
    }

    @Override
    public CellAddress resolve(CellAddress home) {
        return address;
    }

    @Override
    public String render(CellAddress home) {
        return "$" + CellAddress.columnName(address.getColumn()) + "$" + (address.getRow() + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AbsCell)) {
            return false;
        }
        return address.equals(((AbsCell) o).address);
    }

    @Override
    public int hashCode() {
        return address.hashCode();
    }

    @Override
    public String toString() {
        return "AbsCell[" + address + "]";
    }
}
