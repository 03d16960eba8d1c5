package com.formulagrid.app.exceptions;

/**
 * Thrown when formula text cannot be tokenized or parsed.
 * The position is the zero-based character offset in the formula, or -1 at end of input.
 */
public class ExpressionParseException extends SheetException {

    private final String formula;
    private final int position;

    public ExpressionParseException(String formula, int position, String message) {
        super(ErrorCode.PARSE_ERROR, describe(formula, position, message));
        this.formula = formula;
        this.position = position;
    }

    public String getFormula() {
        return formula;
    }

    public int getPosition() {
        return position;
    }

    private static String describe(String formula, int position, String message) {
        if (position < 0) {
            return "Cannot parse formula '" + formula + "': " + message;
        }
        return "Cannot parse formula '" + formula + "' at position " + position + ": " + message;
    }
}
