package com.cellgraph.app.formula;

import com.cellgraph.app.models.CellAddress;

/**
 * What a reference inside a formula points at.
 * Implemented by {@link RelCell} and {@link AbsCell}; the two are never interchangeable,
 * and turning one into an address always requires the formula's home cell.
 */
public interface CellReferenceTarget {

    CellAddress resolve(CellAddress home);

    /**
     * The reference as formula text when the formula lives at {@code home}.
     */
    String render(CellAddress home);
}
