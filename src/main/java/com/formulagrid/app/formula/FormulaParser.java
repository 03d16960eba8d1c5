package com.formulagrid.app.formula;

import com.formulagrid.app.exceptions.AddressParseException;
import com.formulagrid.app.exceptions.ExpressionParseException;
import com.formulagrid.app.models.CellAddress;

import java.util.List;

/**
 * Recursive-descent parser for cell formulas.
 *
 * <pre>
 * formula : '=' expr
 * expr    : term
 * term    : factor ( ( '+' | '-' ) factor )*
 * factor  : unary ( ( '*' | '/' ) unary )*
 * unary   : '-' unary | primary
 * primary : IDENT | NUMBER | '(' expr ')'
 * </pre>
 *
 * Binary operators are left-associative and unary minus binds tighter than '*' and '/'.
 * Instances are stateless and safe to share; each {@link #parse} call gets its own cursor.
 */
public class FormulaParser {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 512;

    private final int maxNestingDepth;

    public FormulaParser() {
        this(DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * @param maxNestingDepth how many parentheses and unary minus signs may be nested
     *                        before the formula is rejected
     */
    public FormulaParser(int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Parses formula text (including the leading '=') into an expression tree.
     *
     * @throws ExpressionParseException if the text is not a complete, well-formed formula
     */
    public Expression parse(String formula) {
        List<Token> tokens = Tokenizer.tokenize(formula);
        Cursor cursor = new Cursor(formula, tokens);
        Expression expression = cursor.expr();
        if (!cursor.isAtEnd()) {
            Token trailing = cursor.peek();
            throw new ExpressionParseException(formula, trailing.getPosition(),
                    "trailing tokens starting at '" + trailing.getText() + "'");
        }
        return expression;
    }

    private final class Cursor {
        private final String formula;
        private final List<Token> tokens;
        private int current = 0;
        private int depth = 0;

        private Cursor(String formula, List<Token> tokens) {
            this.formula = formula;
            this.tokens = tokens;
        }

        Expression expr() {
            return term();
        }

        private Expression term() {
            Expression expression = factor();
            while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
                BinaryOperator operator = BinaryOperator.of(advance().getType());
                expression = new BinaryOperation(operator, expression, factor());
            }
            return expression;
        }

        private Expression factor() {
            Expression expression = unary();
            while (check(TokenType.STAR) || check(TokenType.SLASH)) {
                BinaryOperator operator = BinaryOperator.of(advance().getType());
                expression = new BinaryOperation(operator, expression, unary());
            }
            return expression;
        }

        private Expression unary() {
            if (check(TokenType.MINUS)) {
                Token minus = advance();
                enter(minus);
                Expression operand = unary();
                depth--;
                return new UnaryOperation(UnaryOperator.NEGATE, operand);
            }
            return primary();
        }

        private Expression primary() {
            if (isAtEnd()) {
                throw new ExpressionParseException(formula, -1, "expected expression but found end of formula");
            }
            Token token = advance();
            switch (token.getType()) {
                case IDENT:
                    return reference(token);
                case NUMBER:
                    return number(token);
                case LEFT_PAREN:
                    enter(token);
                    Expression inner = expr();
                    if (!check(TokenType.RIGHT_PAREN)) {
                        int position = isAtEnd() ? -1 : peek().getPosition();
                        throw new ExpressionParseException(formula, position,
                                "missing ')' to close '(' at position " + token.getPosition());
                    }
                    advance();
                    depth--;
                    return inner;
                default:
                    throw unexpected(token);
            }
        }

        /**
         * Identifiers always start with a letter, so anything that is not an address is unexpected.
         */
        private Expression reference(Token token) {
            try {
                return new CellReference(CellAddress.parse(token.getText()));
            } catch (AddressParseException e) {
                throw unexpected(token);
            }
        }

        private Expression number(Token token) {
            try {
                return new Constant(Long.parseLong(token.getText()));
            } catch (NumberFormatException e) {
                throw new ExpressionParseException(formula, token.getPosition(),
                        "integer literal out of range: " + token.getText());
            }
        }

        private void enter(Token token) {
            if (++depth > maxNestingDepth) {
                throw new ExpressionParseException(formula, token.getPosition(),
                        "expression nested deeper than " + maxNestingDepth + " levels");
            }
        }

        private ExpressionParseException unexpected(Token token) {
            return new ExpressionParseException(formula, token.getPosition(),
                    "unexpected token '" + token.getText() + "'");
        }

        private boolean check(TokenType type) {
            return !isAtEnd() && peek().getType() == type;
        }

        private Token advance() {
            return tokens.get(current++);
        }

        private Token peek() {
            return tokens.get(current);
        }

        boolean isAtEnd() {
            return current >= tokens.size();
        }
    }
}
