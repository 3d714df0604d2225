package com.cellgraph.app.models;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents one spreadsheet and everything the engine keeps for it:
 * - A unique ID
 * - Its bounds (rows x columns)
 * - The sparse cell store
 * - The dependency index (forward + reverse)
 * - The undo/redo history
 * - A read/write lock: edits take the write lock for their whole cascade, reads share the read lock
 */
public class Sheet {

    // Generates unique IDs for newly created sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final int rows;
    private final int columns;

    private final SparseCellStore store = new SparseCellStore();
    private final DependencyIndex dependencies = new DependencyIndex();
    private final HistoryLog history;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet(int rows, int columns, int historyDepth) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.rows = rows;
        this.columns = columns;
        this.history = new HistoryLog(historyDepth);
    }

    public long getId() {
        return id;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    /**
     * True if the address lies inside this sheet's bounds.
     */
    public boolean contains(CellAddress address) {
        return address.isNonNegative() && address.getRow() < rows && address.getColumn() < columns;
    }

    public SparseCellStore getStore() {
        return store;
    }

    public DependencyIndex getDependencies() {
        return dependencies;
    }

    public HistoryLog getHistory() {
        return history;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
