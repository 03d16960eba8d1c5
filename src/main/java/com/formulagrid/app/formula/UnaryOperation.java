package com.formulagrid.app.formula;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A prefix operator applied to one operand, e.g. "-A1".
 */
public final class UnaryOperation implements Expression {
    private final UnaryOperator operator;
    private final Expression operand;

    public UnaryOperation(UnaryOperator operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public List<Expression> operands() {
        return Collections.singletonList(operand);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor, List<R> operandResults) {
        return visitor.visitUnary(this, operandResults.get(0));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnaryOperation)) return false;
        UnaryOperation other = (UnaryOperation) o;
        return operator == other.operator && operand.equals(other.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    @Override
    public String toString() {
        return FormulaPrinter.print(this);
    }
}
