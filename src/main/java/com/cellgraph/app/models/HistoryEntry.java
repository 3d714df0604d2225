package com.cellgraph.app.models;

/**
 * Before/after content of the one cell a user action touched.
 * Recomputed dependents are not recorded; replaying the edit recomputes them.
 */
public class HistoryEntry {
    private final CellAddress address;
    private final CellData before;
    private final CellData after;

    public HistoryEntry(CellAddress address, CellData before, CellData after) {
        this.address = address;
        this.before = before.withoutCachedValue();
        this.after = after.withoutCachedValue();
    }

    public CellAddress getAddress() {
        return address;
    }

    public CellData getBefore() {
        return before;
    }

    public CellData getAfter() {
        return after;
    }

    @Override
    public String toString() {
        return "HistoryEntry{" + address + ": " + before + " -> " + after + "}";
    }
}
