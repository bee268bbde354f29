package io.github.cyfko.eqschema.core.lexing;

import io.github.cyfko.eqschema.core.api.OperatorKind;
import io.github.cyfko.eqschema.core.config.AliasTable;
import io.github.cyfko.eqschema.core.config.PatternConfig;
import io.github.cyfko.eqschema.core.exception.LexException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Single-pass tokenizer for equation text.
 * <p>
 * Scans left to right and emits {@link Token}s in source order:
 * </p>
 * <ul>
 *   <li>Whitespace runs are skipped</li>
 *   <li>A letter starts a maximal run of letters and digits; the whole word is looked up in
 *       the {@link AliasTable} and becomes an operator ({@code NOT}, {@code and}, ...) or an identifier</li>
 *   <li>{@code (}, {@code )} and {@code =} produce their own tokens</li>
 *   <li>Any other character must begin a registered symbolic alias; the longest match wins</li>
 * </ul>
 *
 * <pre>{@code
 * Tokenizer.tokenize("F = !A & (B + C)", AliasTable.defaults());
 * // IDENTIFIER(F) EQUALS OPERATOR(!:NOT) IDENTIFIER(A) OPERATOR(&:AND)
 * // LPAREN IDENTIFIER(B) OPERATOR(+:OR) IDENTIFIER(C) RPAREN
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Tokenizer {

    private Tokenizer() {}

    /**
     * Tokenizes a whole string.
     *
     * @param input   the text to scan
     * @param aliases the operator spellings to recognize
     * @return the tokens in source order, possibly empty
     * @throws LexException on an unrecognized character or an identifier starting with a digit
     */
    public static List<Token> tokenize(String input, AliasTable aliases) {
        return tokenize(input, 0, input.length(), aliases);
    }

    /**
     * Tokenizes the region {@code [from, to)} of a string. Token positions are offsets in
     * the full string, so errors point at the right place of the original equation.
     *
     * @param input   the text to scan
     * @param from    inclusive start of the region
     * @param to      exclusive end of the region
     * @param aliases the operator spellings to recognize
     * @return the tokens in source order, possibly empty
     * @throws LexException on an unrecognized character or an identifier starting with a digit
     */
    public static List<Token> tokenize(String input, int from, int to, AliasTable aliases) {
        if (from < 0 || to > input.length() || from > to) {
            throw new IndexOutOfBoundsException("Invalid region [" + from + ", " + to + ") for length " + input.length());
        }

        List<Token> tokens = new ArrayList<>();
        int i = from;

        while (i < to) {
            char c = input.charAt(i);
            final int start = i;

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (PatternConfig.isIdentifierStart(c)) {
                i = scanWord(input, i, to);
                String word = input.substring(start, i);
                Optional<OperatorKind> kind = aliases.resolveOperator(word);
                tokens.add(kind.map(k -> Token.operator(word, k, start))
                        .orElseGet(() -> Token.identifier(word, start)));
                continue;
            }

            if (PatternConfig.isDigit(c)) {
                String word = input.substring(start, scanWord(input, i, to));
                throw new LexException(String.format(
                        "Invalid identifier '%s' at position %d: identifiers must start with a letter", word, start),
                        start, word);
            }

            switch (c) {
                case '(' -> tokens.add(Token.symbol(TokenType.LPAREN, c, start));
                case ')' -> tokens.add(Token.symbol(TokenType.RPAREN, c, start));
                case '=' -> tokens.add(Token.symbol(TokenType.EQUALS, c, start));
                default -> {
                    String symbol = aliases.matchSymbol(input, start, to);
                    if (symbol == null) {
                        throw new LexException(String.format("Unexpected character '%c' at position %d", c, start),
                                start, String.valueOf(c));
                    }
                    // matchSymbol only returns registered spellings
                    tokens.add(Token.operator(symbol, aliases.resolveOperator(symbol).orElseThrow(), start));
                    i += symbol.length() - 1;
                }
            }
            i++;
        }

        return tokens;
    }

    private static int scanWord(String input, int from, int to) {
        int end = from;
        while (end < to && PatternConfig.isIdentifierPart(input.charAt(end))) {
            end++;
        }
        return end;
    }
}
