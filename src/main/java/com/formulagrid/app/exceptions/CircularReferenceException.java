package com.formulagrid.app.exceptions;

import com.formulagrid.app.models.CellId;

/**
 * Thrown when setting a cell would create a circular dependency
 * (e.g., a cell referencing itself, or a multi-cell loop).
 * The rejected mutation is rolled back before this reaches the caller.
 */
public class CircularReferenceException extends SheetException {

    private final CellId cycleCell;
    private final CellId mutatedCell;

    public CircularReferenceException(CellId cycleCell) {
        super(ErrorCode.CIRCULAR_REFERENCE, "Circular reference detected at " + cycleCell);
        this.cycleCell = cycleCell;
        this.mutatedCell = null;
    }

    public CircularReferenceException(CellId cycleCell, CellId mutatedCell) {
        super(ErrorCode.CIRCULAR_REFERENCE,
                "Circular reference detected at " + cycleCell + " while setting " + mutatedCell);
        this.cycleCell = cycleCell;
        this.mutatedCell = mutatedCell;
    }

    /**
     * The cell that was reached again while it was still being sorted.
     */
    public CellId getCycleCell() {
        return cycleCell;
    }

    /**
     * The cell whose mutation was rejected, or null when the cycle was found outside a mutation.
     */
    public CellId getMutatedCell() {
        return mutatedCell;
    }
}
