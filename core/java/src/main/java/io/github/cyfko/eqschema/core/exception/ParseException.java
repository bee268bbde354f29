package io.github.cyfko.eqschema.core.exception;

import io.github.cyfko.eqschema.core.lexing.Token;

/**
 * Thrown when a token sequence does not form a complete, well-structured expression.
 * <p>
 * Raised for empty expressions, unbalanced parentheses, operators missing an operand,
 * tokens found where an operand was expected, trailing tokens after a complete
 * expression and excessive nesting.
 * </p>
 *
 * <pre>{@code
 * parser.parseExpression("AND A");   // → "Binary operator 'AND' at position 0 is missing its left operand"
 * parser.parseExpression("(A | B");  // → "Unbalanced parentheses: '(' at position 0 is never closed"
 * parser.parseExpression("A B");     // → "Unexpected token 'B' at position 2 after a complete expression"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ParseException extends EquationSyntaxException {

    private final transient Token token;

    /**
     * @param message  the message describing the failure
     * @param token    the unexpected token, or {@code null} when input ended prematurely
     * @param position offset of the unexpected token, or of the end of input
     */
    public ParseException(String message, Token token, int position) {
        super(message, position, token == null ? null : token.text());
        this.token = token;
    }

    /**
     * Returns the token that could not be accepted.
     *
     * @return the token, or {@code null} if the failure happened at end of input
     */
    public Token token() {
        return token;
    }
}
