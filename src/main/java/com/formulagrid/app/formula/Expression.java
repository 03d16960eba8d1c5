package com.formulagrid.app.formula;

import java.util.List;

/**
 * Immutable parsed formula. The set of node kinds is closed:
 * {@link Constant}, {@link CellReference}, {@link UnaryOperation} and {@link BinaryOperation}.
 * <p>
 * Trees are consumed through {@link ExpressionWalker}, which folds them bottom-up with an
 * explicit stack, so nesting depth is never limited by the call stack.
 */
public interface Expression {

    /**
     * Direct sub-expressions, left to right. Empty for leaves.
     */
    List<Expression> operands();

    /**
     * Dispatches to the visitor method for this node kind, given the already folded
     * results of {@link #operands()} in the same order.
     */
    <R> R accept(ExpressionVisitor<R> visitor, List<R> operandResults);
}
