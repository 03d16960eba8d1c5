package com.formulagrid.app.formula;

import com.formulagrid.app.models.CellId;

/**
 * Read-only view of current cell values used during evaluation.
 * Implementations return 0 for cells that do not exist.
 */
@FunctionalInterface
public interface CellLookup {

    long valueOf(CellId cell);
}
