package com.formulagrid.app.formula;

import com.formulagrid.app.models.CellId;

import java.util.Collections;
import java.util.List;

/**
 * A reference to another cell's current value.
 */
public final class CellReference implements Expression {
    private final CellId target;

    public CellReference(CellId target) {
        this.target = target;
    }

    public CellId getTarget() {
        return target;
    }

    @Override
    public List<Expression> operands() {
        return Collections.emptyList();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor, List<R> operandResults) {
        return visitor.visitCellReference(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CellReference && ((CellReference) o).target.equals(target);
    }

    @Override
    public int hashCode() {
        return target.hashCode();
    }

    @Override
    public String toString() {
        return FormulaPrinter.print(this);
    }
}
