package com.formulagrid.app.formula;

import com.formulagrid.app.exceptions.ExpressionParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits formula text such as "=A1 * (B2 + 3)" into tokens.
 * <p>
 * The text must start with '='. Spaces between tokens are skipped; any character
 * other than digits, letters, spaces and + - * / ( ) is rejected.
 */
public final class Tokenizer {

    public static final char FORMULA_MARKER = '=';

    private Tokenizer() {
    }

    public static List<Token> tokenize(String formula) {
        if (formula == null || formula.isEmpty() || formula.charAt(0) != FORMULA_MARKER) {
            throw new ExpressionParseException(formula, 0, "formula must start with '" + FORMULA_MARKER + "'");
        }
        List<Token> tokens = new ArrayList<>();
        int length = formula.length();
        int i = 1;
        while (i < length) {
            char ch = formula.charAt(i);
            if (ch == ' ') {
                i++;
            } else if (isDigit(ch)) {
                int start = i;
                while (i < length && isDigit(formula.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(TokenType.NUMBER, formula.substring(start, i), start));
            } else if (ch >= 'A' && ch <= 'Z') {
                // Cell references like A1 or AB32; the parser decides whether the run is a valid address
                int start = i;
                while (i < length && (isLetter(formula.charAt(i)) || isDigit(formula.charAt(i)))) {
                    i++;
                }
                tokens.add(new Token(TokenType.IDENT, formula.substring(start, i), start));
            } else {
                TokenType symbol = TokenType.ofSymbol(ch);
                if (symbol == null) {
                    throw new ExpressionParseException(formula, i, "unexpected character '" + ch + "'");
                }
                tokens.add(new Token(symbol, String.valueOf(ch), i));
                i++;
            }
        }
        return tokens;
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isLetter(char ch) {
        return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z');
    }
}
