package com.formulagrid.app.formula;

/**
 * Arithmetic operators with the symbol used in formula text.
 */
public enum BinaryOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    static BinaryOperator of(TokenType type) {
        switch (type) {
            case PLUS:
                return ADD;
            case MINUS:
                return SUBTRACT;
            case STAR:
                return MULTIPLY;
            case SLASH:
                return DIVIDE;
            default:
                throw new IllegalArgumentException("Not a binary operator: " + type);
        }
    }
}
