package com.cellgraph.app.services;

import com.cellgraph.app.exceptions.CircularReferenceException;
import com.cellgraph.app.formula.BinaryOperation;
import com.cellgraph.app.formula.CellRange;
import com.cellgraph.app.formula.CellReference;
import com.cellgraph.app.formula.DelayFunction;
import com.cellgraph.app.formula.ExpressionVisitor;
import com.cellgraph.app.formula.NumberLiteral;
import com.cellgraph.app.formula.RangeFunction;
import com.cellgraph.app.models.CellAddress;
import com.cellgraph.app.models.CellData;
import com.cellgraph.app.models.CellRegion;
import com.cellgraph.app.models.DependencyIndex;
import com.cellgraph.app.models.Sheet;
import com.cellgraph.app.models.SparseCellStore;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies one cell assignment to a sheet with these steps:
 * 1) Collect the cells and ranges the new content references (its precedents).
 * 2) Reject the edit if it would close a cycle; nothing has changed at that point.
 * 3) Rewire the dependency index and store the new content.
 * 4) Recompute the edited cell and everything that transitively depends on it,
 *    precedents strictly before dependents.
 * Callers hold the sheet's write lock.
 */
@Component
public class DependencyGraphMaintainer {

    private final FormulaEvaluator evaluator;

    public DependencyGraphMaintainer(FormulaEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * @return how many formula cells were recomputed
     * @throws CircularReferenceException if {@code data} would make {@code address} depend on itself
     */
    public int assign(Sheet sheet, CellAddress address, CellData data) {
        Precedents precedents = collectPrecedents(sheet, address, data);
        ensureAcyclic(sheet, address, precedents);

        sheet.getDependencies().replacePrecedents(address, precedents.getCells(), precedents.getRegions());
        sheet.getStore().set(address, data.withoutCachedValue());

        return recompute(sheet, recomputationOrder(sheet.getDependencies(), address));
    }

    /**
     * In-bounds cells and ranges referenced by the content. A range stays a rectangle,
     * so a later write anywhere inside it, populated or not, triggers a recompute.
     */
    public Precedents collectPrecedents(Sheet sheet, CellAddress home, CellData data) {
        Precedents found = new Precedents();
        if (data.isFormula()) {
            data.getFormula().accept(new PrecedentCollector(sheet, home, found));
        }
        return found;
    }

    /**
     * The new edges all point into {@code address}, so a cycle appears exactly when
     * {@code address} or something already downstream of it is among the new precedents.
     */
    void ensureAcyclic(Sheet sheet, CellAddress address, Precedents precedents) {
        if (precedents.isEmpty()) {
            return;
        }
        if (precedents.references(address)) {
            throw new CircularReferenceException(address, "Cell " + address + " cannot reference itself");
        }
        DependencyIndex index = sheet.getDependencies();
        Deque<CellAddress> stack = new ArrayDeque<>();
        Set<CellAddress> visited = new HashSet<>();
        stack.push(address);
        while (!stack.isEmpty()) {
            CellAddress current = stack.pop();
            for (CellAddress dependent : index.getDependents(current)) {
                if (precedents.references(dependent)) {
                    throw new CircularReferenceException(address,
                            "Assigning " + address + " would create a cycle through " + dependent);
                }
                if (visited.add(dependent)) {
                    stack.push(dependent);
                }
            }
        }
    }

    /**
     * {@code start} followed by its transitive dependents in topological order.
     * First pass counts, for every reachable cell, how many of its precedents are themselves
     * in the set; second pass releases a cell once all of those have been emitted.
     */
    List<CellAddress> recomputationOrder(DependencyIndex index, CellAddress start) {
        Map<CellAddress, Integer> pendingPrecedents = new HashMap<>();
        pendingPrecedents.put(start, 0);
        Deque<CellAddress> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            CellAddress current = stack.pop();
            for (CellAddress dependent : index.getDependents(current)) {
                if (pendingPrecedents.merge(dependent, 1, Integer::sum) == 1) {
                    stack.push(dependent);
                }
            }
        }

        List<CellAddress> order = new ArrayList<>(pendingPrecedents.size());
        Deque<CellAddress> ready = new ArrayDeque<>();
        ready.add(start);
        while (!ready.isEmpty()) {
            CellAddress current = ready.poll();
            order.add(current);
            for (CellAddress dependent : index.getDependents(current)) {
                if (pendingPrecedents.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        return order;
    }

    private int recompute(Sheet sheet, List<CellAddress> order) {
        SparseCellStore store = sheet.getStore();
        int recomputed = 0;
        for (CellAddress cell : order) {
            CellData data = store.get(cell);
            if (data.isFormula()) {
                store.set(cell, data.withCachedValue(evaluator.evaluate(sheet, cell, data.getFormula())));
                recomputed++;
            }
        }
        return recomputed;
    }

    /**
     * What one cell's content references: single cells, and ranges as rectangles.
     */
    public static class Precedents {
        private final Set<CellAddress> cells = new HashSet<>();
        private final Set<CellRegion> regions = new HashSet<>();

        public Set<CellAddress> getCells() {
            return cells;
        }

        public Set<CellRegion> getRegions() {
            return regions;
        }

        public boolean isEmpty() {
            return cells.isEmpty() && regions.isEmpty();
        }

        /**
         * True if {@code cell} is referenced directly or lies inside one of the ranges.
         */
        public boolean references(CellAddress cell) {
            if (cells.contains(cell)) {
                return true;
            }
            for (CellRegion region : regions) {
                if (region.contains(cell)) {
                    return true;
                }
            }
            return false;
        }
    }

    private static class PrecedentCollector implements ExpressionVisitor<Void> {
        private final Sheet sheet;
        private final CellAddress home;
        private final Precedents found;

        PrecedentCollector(Sheet sheet, CellAddress home, Precedents found) {
            this.sheet = sheet;
            this.home = home;
            this.found = found;
        }

        @Override
        public Void visitNumber(NumberLiteral number) {
            return null;
        }

        @Override
        public Void visitReference(CellReference reference) {
            CellAddress target = reference.getTarget().resolve(home);
            // out-of-bounds targets evaluate to RANGE_ERROR and can never change
            if (sheet.contains(target)) {
                found.getCells().add(target);
            }
            return null;
        }

        @Override
        public Void visitRange(CellRange range) {
            CellAddress start = range.getStart().resolve(home);
            CellAddress end = range.getEnd().resolve(home);
            if (sheet.contains(start) && sheet.contains(end)) {
                found.getRegions().add(CellRegion.between(start, end));
            }
            return null;
        }

        @Override
        public Void visitBinary(BinaryOperation operation) {
            operation.getLeft().accept(this);
            operation.getRight().accept(this);
            return null;
        }

        @Override
        public Void visitRangeFunction(RangeFunction function) {
            return function.getRange().accept(this);
        }

        @Override
        public Void visitDelay(DelayFunction delay) {
            return delay.getDuration().accept(this);
        }
    }
}
