package com.formulagrid.app.models;

import com.formulagrid.app.formula.Expression;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - its address (id)
 * - either a literal integer or a parsed formula, never both
 * - value (the last computed result; for literals, the literal itself)
 */
public class Cell {
    private final CellId id;
    // formula is the text as the user wrote it, e.g. "=A1+B2"; null for literals
    private String formula;
    private Expression expression;
    private long value;

    public Cell(CellId id) {
        this.id = id;
    }

    /**
     * Copy used to restore a cell after a rejected mutation.
     */
    public Cell(Cell other) {
        this.id = other.id;
        this.formula = other.formula;
        this.expression = other.expression;
        this.value = other.value;
    }

    public CellId getId() {
        return id;
    }

    public String getFormula() {
        return formula;
    }

    public Expression getExpression() {
        return expression;
    }

    public boolean hasFormula() {
        return expression != null;
    }

    public long getValue() {
        return value;
    }

    // Clears any formula; the literal becomes the value
    public void setLiteral(long literal) {
        this.formula = null;
        this.expression = null;
        this.value = literal;
    }

    // Value stays 0 until the cell is re-evaluated
    public void setFormula(String formula, Expression expression) {
        this.formula = formula;
        this.expression = expression;
        this.value = 0;
    }

    public void setValue(long value) {
        this.value = value;
    }
}
