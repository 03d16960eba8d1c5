package com.formulagrid.app.formula;

/**
 * Lexical categories produced by the {@link Tokenizer}.
 */
public enum TokenType {
    NUMBER,
    IDENT,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    LEFT_PAREN,
    RIGHT_PAREN;

    /**
     * Maps a single punctuation character to its type, or null if it is not an operator.
     */
    static TokenType ofSymbol(char ch) {
        switch (ch) {
            case '+':
                return PLUS;
            case '-':
                return MINUS;
            case '*':
                return STAR;
            case '/':
                return SLASH;
            case '(':
                return LEFT_PAREN;
            case ')':
                return RIGHT_PAREN;
            default:
                return null;
        }
    }
}
