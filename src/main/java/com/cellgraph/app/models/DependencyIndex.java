package com.cellgraph.app.models;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Who references whom, in two parts:
 * - single-cell references, as two adjacency maps kept as mirror images of each other:
 *   precedents (forward): formula cell -> cells its formula references
 *   dependents (reverse): cell -> formula cells that reference it
 * - ranges, kept as rectangles per formula cell; a cell feeds every formula whose
 *   rectangle covers it, so a range costs the same whatever its size.
 * Empty sets are never stored.
 */
public class DependencyIndex {

    private final Map<CellAddress, Set<CellAddress>> precedents = new HashMap<>();
    private final Map<CellAddress, Set<CellAddress>> dependents = new HashMap<>();
    private final Map<CellAddress, Set<CellRegion>> regions = new HashMap<>();

    /**
     * Cells {@code cell} references one by one (ranges not included).
     */
    public Set<CellAddress> getPrecedents(CellAddress cell) {
        Set<CellAddress> set = precedents.get(cell);
        return set == null ? Collections.emptySet() : Collections.unmodifiableSet(set);
    }

    /**
     * Ranges {@code cell} references.
     */
    public Set<CellRegion> getRegions(CellAddress cell) {
        Set<CellRegion> set = regions.get(cell);
        return set == null ? Collections.emptySet() : Collections.unmodifiableSet(set);
    }

    /**
     * Formula cells that read {@code cell}, directly or through a range.
     */
    public Set<CellAddress> getDependents(CellAddress cell) {
        Set<CellAddress> direct = dependents.get(cell);
        Set<CellAddress> result = null;
        for (Map.Entry<CellAddress, Set<CellRegion>> e : regions.entrySet()) {
            if (covers(e.getValue(), cell)) {
                if (result == null) {
                    result = direct == null ? new TreeSet<>() : new TreeSet<>(direct);
                }
                result.add(e.getKey());
            }
        }
        if (result != null) {
            return Collections.unmodifiableSet(result);
        }
        return direct == null ? Collections.emptySet() : Collections.unmodifiableSet(direct);
    }

    /**
     * Replaces everything {@code cell} references, unlinking it from every old precedent
     * and linking it to every new one.
     */
    public void replacePrecedents(CellAddress cell, Set<CellAddress> newPrecedents, Set<CellRegion> newRegions) {
        Set<CellAddress> old = precedents.remove(cell);
        if (old != null) {
            for (CellAddress p : old) {
                Set<CellAddress> reverse = dependents.get(p);
                if (reverse != null) {
                    reverse.remove(cell);
                    if (reverse.isEmpty()) {
                        dependents.remove(p);
                    }
                }
            }
        }
        regions.remove(cell);

        if (!newRegions.isEmpty()) {
            regions.put(cell, new TreeSet<>(newRegions));
        }
        if (newPrecedents.isEmpty()) {
            return;
        }
        precedents.put(cell, new TreeSet<>(newPrecedents));
        for (CellAddress p : newPrecedents) {
            dependents.computeIfAbsent(p, k -> new TreeSet<>()).add(cell);
        }
    }

    private static boolean covers(Set<CellRegion> regions, CellAddress cell) {
        for (CellRegion region : regions) {
            if (region.contains(cell)) {
                return true;
            }
        }
        return false;
    }

    // Sorted, text-keyed copies for callers outside the sheet lock. Ranges appear as "A1:C3".

    public Map<String, Set<String>> forwardView() {
        Map<String, Set<String>> copy = new TreeMap<>();
        copyInto(copy, precedents);
        for (Map.Entry<CellAddress, Set<CellRegion>> e : regions.entrySet()) {
            Set<String> targets = copy.computeIfAbsent(e.getKey().toString(), k -> new TreeSet<>());
            for (CellRegion region : e.getValue()) {
                targets.add(region.toString());
            }
        }
        return copy;
    }

    public Map<String, Set<String>> reverseView() {
        Map<String, Set<String>> copy = new TreeMap<>();
        copyInto(copy, dependents);
        for (Map.Entry<CellAddress, Set<CellRegion>> e : regions.entrySet()) {
            for (CellRegion region : e.getValue()) {
                copy.computeIfAbsent(region.toString(), k -> new TreeSet<>()).add(e.getKey().toString());
            }
        }
        return copy;
    }

    private static void copyInto(Map<String, Set<String>> copy, Map<CellAddress, Set<CellAddress>> graph) {
        for (Map.Entry<CellAddress, Set<CellAddress>> e : graph.entrySet()) {
            Set<String> targets = new TreeSet<>();
            for (CellAddress a : e.getValue()) {
                targets.add(a.toString());
            }
            copy.put(e.getKey().toString(), targets);
        }
    }
}
