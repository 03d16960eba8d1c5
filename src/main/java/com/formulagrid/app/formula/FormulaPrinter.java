package com.formulagrid.app.formula;

/**
 * Renders an expression back to text that parses to the same tree.
 * Nested binary operations are always parenthesised, so "=1+2*3" prints as "1+(2*3)".
 */
public final class FormulaPrinter implements ExpressionVisitor<String> {

    private static final FormulaPrinter INSTANCE = new FormulaPrinter();

    private FormulaPrinter() {
    }

    public static String print(Expression expression) {
        return ExpressionWalker.fold(expression, INSTANCE);
    }

    /**
     * Same as {@link #print} with the leading '=' marker, ready to be stored in a cell.
     */
    public static String toFormula(Expression expression) {
        return Tokenizer.FORMULA_MARKER + print(expression);
    }

    @Override
    public String visitConstant(Constant constant) {
        if (constant.getValue() < 0) {
            // Only hand-built trees hold negative literals; the parser produces a negation instead
            return "(" + constant.getValue() + ")";
        }
        return Long.toString(constant.getValue());
    }

    @Override
    public String visitCellReference(CellReference reference) {
        return reference.getTarget().toString();
    }

    @Override
    public String visitUnary(UnaryOperation operation, String operand) {
        return operation.getOperator().getSymbol() + wrap(operation.getOperand(), operand);
    }

    @Override
    public String visitBinary(BinaryOperation operation, String left, String right) {
        return wrap(operation.getLeft(), left) + operation.getOperator().getSymbol()
                + wrap(operation.getRight(), right);
    }

    private static String wrap(Expression operand, String text) {
        return operand instanceof BinaryOperation ? "(" + text + ")" : text;
    }
}
