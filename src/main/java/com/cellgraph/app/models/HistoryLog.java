package com.cellgraph.app.models;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Undo and redo stacks for one sheet.
 * The undo stack is bounded; once full, the oldest entry is dropped.
 */
public class HistoryLog {

    private final Deque<HistoryEntry> undoStack = new ArrayDeque<>();
    private final Deque<HistoryEntry> redoStack = new ArrayDeque<>();
    private final int maxEntries;

    public HistoryLog(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("History must hold at least one entry");
        }
        this.maxEntries = maxEntries;
    }

    /**
     * A new forward edit: remembered for undo, and any redo branch is discarded.
     */
    public void commit(HistoryEntry entry) {
        pushUndo(entry);
        redoStack.clear();
    }

    public HistoryEntry popUndo() {
        return undoStack.pollFirst();
    }

    public HistoryEntry popRedo() {
        return redoStack.pollFirst();
    }

    public void pushUndo(HistoryEntry entry) {
        undoStack.addFirst(entry);
        if (undoStack.size() > maxEntries) {
            undoStack.removeLast();
        }
    }

    public void pushRedo(HistoryEntry entry) {
        redoStack.addFirst(entry);
    }

    public int undoDepth() {
        return undoStack.size();
    }

    public int redoDepth() {
        return redoStack.size();
    }
}
