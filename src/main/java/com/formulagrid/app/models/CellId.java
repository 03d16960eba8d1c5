package com.formulagrid.app.models;

import java.util.Comparator;

/**
 * Zero-indexed (row, column) coordinate of a cell.
 * Immutable; equality and hashing use both fields.
 */
public final class CellId implements Comparable<CellId> {

    private static final Comparator<CellId> ORDER =
            Comparator.comparingInt(CellId::getRow).thenComparingInt(CellId::getColumn);

    private final int row;
    private final int column;

    private CellId(int row, int column) {
        this.row = row;
        this.column = column;
    }

    /**
     * Builds an id from zero-indexed coordinates.
     */
    public static CellId of(int row, int column) {
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException("Cell coordinates must be non-negative: " + row + "," + column);
        }
        return new CellId(row, column);
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public int compareTo(CellId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellId)) return false;
        CellId other = (CellId) o;
        return row == other.row && column == other.column;
    }

    @Override
    public int hashCode() {
        return 31 * row + column;
    }

    /**
     * The textual address, e.g. "AB32" for row 27, column 31.
     */
    @Override
    public String toString() {
        return CellAddress.format(this);
    }
}
