package com.formulagrid.app.formula;

import java.util.Collections;
import java.util.List;

/**
 * An integer literal.
 */
public final class Constant implements Expression {
    private final long value;

    public Constant(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public List<Expression> operands() {
        return Collections.emptyList();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor, List<R> operandResults) {
        return visitor.visitConstant(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Constant && ((Constant) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return FormulaPrinter.print(this);
    }
}
