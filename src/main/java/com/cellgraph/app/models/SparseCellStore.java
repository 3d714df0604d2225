package com.cellgraph.app.models;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeMap;

/**
 * Ordered address -> CellData map holding only non-empty cells.
 * Plain storage: it knows nothing about formulas or dependencies.
 */
public class SparseCellStore {

    private final NavigableMap<CellAddress, CellData> cells = new TreeMap<>();

    /**
     * Never fails; absent addresses read as {@link CellData#EMPTY}.
     */
    public CellData get(CellAddress address) {
        CellData data = cells.get(address);
        return data == null ? CellData.EMPTY : data;
    }

    /**
     * Stores {@code data}; storing EMPTY removes the entry.
     */
    public void set(CellAddress address, CellData data) {
        if (data.isEmpty()) {
            cells.remove(address);
        } else {
            cells.put(address, data);
        }
    }

    public int size() {
        return cells.size();
    }

    public Set<CellAddress> addresses() {
        return Collections.unmodifiableSet(cells.keySet());
    }

    /**
     * Populated cells after {@code from} (exclusive) in address order; all cells when {@code from} is null.
     */
    public Iterable<Map.Entry<CellAddress, CellData>> after(CellAddress from) {
        Map<CellAddress, CellData> tail = from == null ? cells : cells.tailMap(from, false);
        return Collections.unmodifiableMap(tail).entrySet();
    }

    /**
     * Populated cells inside the rectangle spanned by two corners, in address order.
     * The corners may be given in any order. Each call to {@code iterator()} starts a new scan,
     * and the scan jumps over gaps instead of visiting empty addresses.
     */
    public Iterable<Map.Entry<CellAddress, CellData>> range(CellAddress a, CellAddress b) {
        int top = Math.min(a.getRow(), b.getRow());
        int bottom = Math.max(a.getRow(), b.getRow());
        int left = Math.min(a.getColumn(), b.getColumn());
        int right = Math.max(a.getColumn(), b.getColumn());
        return () -> new RangeIterator(top, bottom, left, right);
    }

    private final class RangeIterator implements Iterator<Map.Entry<CellAddress, CellData>> {

        private final int bottom;
        private final int left;
        private final int right;
        private CellAddress cursor;
        private Map.Entry<CellAddress, CellData> next;

        RangeIterator(int top, int bottom, int left, int right) {
            this.bottom = bottom;
            this.left = left;
            this.right = right;
            this.cursor = new CellAddress(left, top);
            advance();
        }

        private void advance() {
            next = null;
            while (cursor != null) {
                Map.Entry<CellAddress, CellData> candidate = cells.ceilingEntry(cursor);
                if (candidate == null || candidate.getKey().getRow() > bottom) {
                    cursor = null;
                    return;
                }
                CellAddress key = candidate.getKey();
                if (key.getColumn() < left) {
                    cursor = new CellAddress(left, key.getRow());
                } else if (key.getColumn() > right) {
                    cursor = new CellAddress(left, key.getRow() + 1);
                } else {
                    next = candidate;
                    cursor = new CellAddress(key.getColumn() + 1, key.getRow());
                    return;
                }
            }
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public Map.Entry<CellAddress, CellData> next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            Map.Entry<CellAddress, CellData> current = next;
            advance();
            return current;
        }
    }
}
