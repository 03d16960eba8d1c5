package com.formulagrid.app.formula;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * An infix arithmetic operation on two operands.
 */
public final class BinaryOperation implements Expression {
    private final BinaryOperator operator;
    private final Expression left;
    private final Expression right;

    public BinaryOperation(BinaryOperator operator, Expression left, Expression right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public List<Expression> operands() {
        return Arrays.asList(left, right);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor, List<R> operandResults) {
        return visitor.visitBinary(this, operandResults.get(0), operandResults.get(1));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryOperation)) return false;
        BinaryOperation other = (BinaryOperation) o;
        return operator == other.operator && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return FormulaPrinter.print(this);
    }
}
