package io.github.cyfko.eqschema.core.lexing;

import io.github.cyfko.eqschema.core.api.OperatorKind;

import java.util.Objects;

/**
 * An immutable lexical unit of an equation.
 *
 * @param type     token category
 * @param text     the spelling exactly as it appears in the input
 * @param kind     the operator denoted by an {@link TokenType#OPERATOR} token, {@code null} for other types
 * @param position zero-based offset of the first character in the equation text
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenType type, String text, OperatorKind kind, int position) {

    public Token {
        Objects.requireNonNull(type, "Token type cannot be null");
        Objects.requireNonNull(text, "Token text cannot be null");
        if ((type == TokenType.OPERATOR) != (kind != null)) {
            throw new IllegalArgumentException("Operator kind must be set for operator tokens only");
        }
    }

    public static Token identifier(String name, int position) {
        return new Token(TokenType.IDENTIFIER, name, null, position);
    }

    public static Token operator(String spelling, OperatorKind kind, int position) {
        return new Token(TokenType.OPERATOR, spelling, kind, position);
    }

    public static Token symbol(TokenType type, char c, int position) {
        return new Token(type, String.valueOf(c), null, position);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isOperator(OperatorKind expected) {
        return type == TokenType.OPERATOR && kind == expected;
    }

    /**
     * Returns the offset just past the last character of this token.
     *
     * @return {@code position + text.length()}
     */
    public int end() {
        return position + text.length();
    }

    @Override
    public String toString() {
        return type + "('" + text + "'@" + position + ")";
    }
}
