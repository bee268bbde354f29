package io.github.cyfko.eqschema.core.parsing;

import io.github.cyfko.eqschema.core.api.ExpressionNode;
import io.github.cyfko.eqschema.core.api.OperatorKind;
import io.github.cyfko.eqschema.core.exception.ParseException;
import io.github.cyfko.eqschema.core.lexing.Token;
import io.github.cyfko.eqschema.core.lexing.TokenType;

import java.util.List;
import java.util.Objects;

/**
 * Builds an {@link ExpressionNode} tree from a token sequence by precedence climbing.
 * <p>
 * Precedence, tightest first: {@code NOT} &gt; {@code AND} &gt; {@code XOR} &gt; {@code OR}.
 * Binary operators are left-associative, so {@code A | B | C} groups as {@code (A | B) | C}.
 * Parentheses restart the climb at the lowest precedence and leave no node in the tree.
 * Repeated negations are kept: {@code NOT NOT A} yields two nested unary nodes.
 * </p>
 *
 * <p><strong>Algorithm:</strong></p>
 * <pre>
 * expression(min):
 *     left := operand()
 *     while next token is a binary operator op with precedence(op) &gt;= min:
 *         consume op
 *         right := expression(precedence(op) + 1)
 *         left  := BinaryOp(op, left, right)
 *     return left
 *
 * operand():
 *     NOT operand() | identifier | '(' expression(lowest) ')'
 * </pre>
 *
 * <p>The parser stops at the first error. Each {@link ParseException} carries the
 * offending token (or {@code null} at end of input) and its position.</p>
 *
 * <pre>{@code
 * List<Token> tokens = Tokenizer.tokenize("A and (B or C)", AliasTable.defaults());
 * ExpressionNode root = PrecedenceClimbingParser.parse(tokens, 256);
 * // BinaryOp[AND, Leaf[A], BinaryOp[OR, Leaf[B], Leaf[C]]]
 * }</pre>
 *
 * <p>Instances are private to a single call; the static entry point is thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PrecedenceClimbingParser {

    private final List<Token> tokens;
    private final int maxDepth;
    private int cursor;
    private int depth;

    private PrecedenceClimbingParser(List<Token> tokens, int maxDepth) {
        this.tokens = tokens;
        this.maxDepth = maxDepth;
    }

    /**
     * Parses a complete expression.
     *
     * @param tokens   the tokens of the expression, in source order
     * @param maxDepth maximum nesting of parentheses and negations
     * @return the root of the expression tree
     * @throws ParseException if the tokens do not form exactly one well-formed expression
     */
    public static ExpressionNode parse(List<Token> tokens, int maxDepth) {
        Objects.requireNonNull(tokens, "Tokens cannot be null");
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        if (tokens.isEmpty()) {
            throw new ParseException("Expression is empty", null, 0);
        }

        PrecedenceClimbingParser parser = new PrecedenceClimbingParser(tokens, maxDepth);
        ExpressionNode root = parser.expression(OperatorKind.LOWEST_PRECEDENCE);

        if (parser.hasNext()) {
            Token extra = parser.peek();
            if (extra.is(TokenType.RPAREN)) {
                throw new ParseException(String.format(
                        "Unbalanced parentheses: unmatched ')' at position %d", extra.position()), extra, extra.position());
            }
            throw new ParseException(String.format(
                    "Unexpected token '%s' at position %d after a complete expression", extra.text(), extra.position()),
                    extra, extra.position());
        }
        return root;
    }

    private ExpressionNode expression(int minPrecedence) {
        ExpressionNode left = operand();

        while (hasNext()) {
            Token next = peek();
            if (!next.is(TokenType.OPERATOR) || !next.kind().isBinary()
                    || next.kind().getPrecedence() < minPrecedence) {
                break;
            }
            cursor++;
            ExpressionNode right = expression(next.kind().getPrecedence() + 1);
            left = new ExpressionNode.BinaryOp(next.kind(), left, right);
        }
        return left;
    }

    private ExpressionNode operand() {
        if (!hasNext()) {
            throw endOfInput();
        }

        Token token = tokens.get(cursor++);
        switch (token.type()) {
            case IDENTIFIER:
                return new ExpressionNode.Leaf(token.text());

            case OPERATOR:
                if (token.kind().isUnary()) {
                    enter(token);
                    ExpressionNode child = operand();
                    depth--;
                    return new ExpressionNode.UnaryOp(token.kind(), child);
                }
                // Right after another operator, that one is the incomplete term
                Token previous = cursor >= 2 ? tokens.get(cursor - 2) : null;
                if (previous != null && previous.is(TokenType.OPERATOR)) {
                    String side = previous.kind().isBinary() ? "right operand" : "operand";
                    throw new ParseException(String.format(
                            "Operator '%s' at position %d is missing its %s: found '%s' at position %d",
                            previous.text(), previous.position(), side, token.text(), token.position()),
                            token, token.position());
                }
                throw new ParseException(String.format(
                        "Binary operator '%s' at position %d is missing its left operand", token.text(), token.position()),
                        token, token.position());

            case LPAREN: {
                enter(token);
                ExpressionNode inner = expression(OperatorKind.LOWEST_PRECEDENCE);
                if (!hasNext()) {
                    throw new ParseException(String.format(
                            "Unbalanced parentheses: '(' at position %d is never closed", token.position()),
                            token, token.position());
                }
                Token closing = tokens.get(cursor++);
                if (!closing.is(TokenType.RPAREN)) {
                    throw new ParseException(String.format(
                            "Expected ')' to close '(' at position %d but found '%s' at position %d",
                            token.position(), closing.text(), closing.position()), closing, closing.position());
                }
                depth--;
                return inner;
            }

            case RPAREN:
                throw new ParseException(String.format(
                        "Expected an operand but found ')' at position %d", token.position()), token, token.position());

            default:
                throw new ParseException(String.format(
                        "Unexpected '%s' at position %d in expression", token.text(), token.position()),
                        token, token.position());
        }
    }

    private void enter(Token token) {
        if (++depth > maxDepth) {
            throw new ParseException(String.format(
                    "Expression nesting exceeds the maximum depth of %d at position %d", maxDepth, token.position()),
                    token, token.position());
        }
    }

    private ParseException endOfInput() {
        Token last = tokens.get(tokens.size() - 1);
        if (last.is(TokenType.OPERATOR)) {
            String side = last.kind().isBinary() ? "right operand" : "operand";
            return new ParseException(String.format(
                    "Operator '%s' at position %d is missing its %s", last.text(), last.position(), side),
                    last, last.end());
        }
        return new ParseException(String.format(
                "Unexpected end of expression at position %d", last.end()), null, last.end());
    }

    private boolean hasNext() {
        return cursor < tokens.size();
    }

    private Token peek() {
        return tokens.get(cursor);
    }
}
