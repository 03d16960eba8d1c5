package com.formulagrid.app.models;

import com.formulagrid.app.graph.DependencyGraph;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents the in-memory spreadsheet:
 * - A map of CellId -> Cell, filled lazily as cells are first set
 * - The dependency graph tracking references between cells
 * - A read/write lock: one writer per mutation, shared readers for lookups
 */
public class Sheet {

    private final Map<CellId, Cell> cells = new HashMap<>();
    private final DependencyGraph graph = new DependencyGraph();

    // Lock to prevent race conditions when multiple threads update the Sheet
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Map<CellId, Cell> getCells() {
        return cells;
    }

    /**
     * Retrieves the cell, or null if it was never set.
     */
    public Cell getCell(CellId id) {
        return cells.get(id);
    }

    /**
     * Returns the cell's value, or 0 if it does not exist.
     */
    public long valueOf(CellId id) {
        Cell cell = cells.get(id);
        return cell == null ? 0 : cell.getValue();
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
