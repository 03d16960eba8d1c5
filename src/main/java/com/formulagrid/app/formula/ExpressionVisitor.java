package com.formulagrid.app.formula;

/**
 * Bottom-up fold over an {@link Expression}. One method per node kind, so adding a kind
 * breaks every visitor at compile time until it handles the new node.
 *
 * @param <R> the result of folding one node; must not be null
 */
public interface ExpressionVisitor<R> {

    R visitConstant(Constant constant);

    R visitCellReference(CellReference reference);

    R visitUnary(UnaryOperation operation, R operand);

    R visitBinary(BinaryOperation operation, R left, R right);
}
