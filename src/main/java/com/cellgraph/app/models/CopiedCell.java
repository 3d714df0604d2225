package com.cellgraph.app.models;

/**
 * Clipboard content: a cell's data plus the address it was copied from,
 * needed to re-anchor relative references on paste.
 */
public class CopiedCell {
    private final CellData data;
    private final CellAddress home;

    public CopiedCell(CellData data, CellAddress home) {
        this.data = data.withoutCachedValue();
        this.home = home;
    }

    public CellData getData() {
        return data;
    }

    public CellAddress getHome() {
        return home;
    }
}
