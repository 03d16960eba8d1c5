package com.formulagrid.app.formula;

/**
 * Reduces an expression to an integer against a {@link CellLookup}.
 * <p>
 * Evaluation has no side effects and performs no cycle checks: callers must evaluate
 * cells in dependency order. Division by zero evaluates to 0 instead of failing.
 */
public final class Evaluator implements ExpressionVisitor<Long> {

    private final CellLookup lookup;

    private Evaluator(CellLookup lookup) {
        this.lookup = lookup;
    }

    public static long evaluate(Expression expression, CellLookup lookup) {
        return ExpressionWalker.fold(expression, new Evaluator(lookup));
    }

    @Override
    public Long visitConstant(Constant constant) {
        return constant.getValue();
    }

    @Override
    public Long visitCellReference(CellReference reference) {
        return lookup.valueOf(reference.getTarget());
    }

    @Override
    public Long visitUnary(UnaryOperation operation, Long operand) {
        switch (operation.getOperator()) {
            case NEGATE:
                return -operand;
            default:
                throw new IllegalStateException("Unknown unary operator: " + operation.getOperator());
        }
    }

    @Override
    public Long visitBinary(BinaryOperation operation, Long left, Long right) {
        switch (operation.getOperator()) {
            case ADD:
                return left + right;
            case SUBTRACT:
                return left - right;
            case MULTIPLY:
                return left * right;
            case DIVIDE:
                if (right == 0) {
                    return 0L;
                }
                return left / right;
            default:
                throw new IllegalStateException("Unknown binary operator: " + operation.getOperator());
        }
    }
}
