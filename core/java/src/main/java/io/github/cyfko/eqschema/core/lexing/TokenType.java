package io.github.cyfko.eqschema.core.lexing;

/**
 * Category of a {@link Token}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenType {
    /** Variable name. */
    IDENTIFIER,
    /** Any recognized operator spelling; see {@link Token#kind()}. */
    OPERATOR,
    LPAREN,
    RPAREN,
    /** The {@code =} separator. */
    EQUALS
}
