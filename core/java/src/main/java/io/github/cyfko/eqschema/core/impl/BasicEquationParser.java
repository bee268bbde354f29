package io.github.cyfko.eqschema.core.impl;

import io.github.cyfko.eqschema.core.api.Equation;
import io.github.cyfko.eqschema.core.api.EquationParser;
import io.github.cyfko.eqschema.core.api.ExpressionNode;
import io.github.cyfko.eqschema.core.config.AliasTable;
import io.github.cyfko.eqschema.core.config.EquationPolicy;
import io.github.cyfko.eqschema.core.exception.EquationFormatException;
import io.github.cyfko.eqschema.core.exception.EquationSyntaxException;
import io.github.cyfko.eqschema.core.exception.LexException;
import io.github.cyfko.eqschema.core.exception.ParseException;
import io.github.cyfko.eqschema.core.lexing.Token;
import io.github.cyfko.eqschema.core.lexing.TokenType;
import io.github.cyfko.eqschema.core.lexing.Tokenizer;
import io.github.cyfko.eqschema.core.parsing.PrecedenceClimbingParser;

import java.util.List;

/**
 * Default {@link EquationParser}: splits on {@code =}, validates the left-hand side and runs
 * the right-hand side through {@link Tokenizer} and {@link PrecedenceClimbingParser}.
 *
 * <h2>Processing steps</h2>
 * <ol>
 *   <li>Reject null, blank or over-long input ({@link EquationPolicy#maxExpressionLength()})</li>
 *   <li>Locate the single {@code =} separator; none or several is an {@link EquationFormatException}</li>
 *   <li>Tokenize the left side; it must be exactly one identifier</li>
 *   <li>Tokenize and parse the right side; token positions stay relative to the full equation</li>
 * </ol>
 *
 * <pre>{@code
 * EquationParser parser = new BasicEquationParser();
 * Equation eq = parser.parse("F = A xor (B + C)");
 * // Equation[lhs=F, expression=BinaryOp[XOR, Leaf[A], BinaryOp[OR, Leaf[B], Leaf[C]]]]
 *
 * EquationParser strict = new BasicEquationParser(EquationPolicy.strict());
 * }</pre>
 *
 * <p>This class holds no per-call state and is safe to share between threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicEquationParser implements EquationParser {

    private final EquationPolicy policy;

    /**
     * Default constructor using {@link EquationPolicy#defaults()}.
     */
    public BasicEquationParser() {
        this(EquationPolicy.defaults());
    }

    /**
     * @param policy the parsing policy
     * @throws IllegalArgumentException if policy is null
     */
    public BasicEquationParser(EquationPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Equation policy is required");
        }
        this.policy = policy;
    }

    public EquationPolicy getPolicy() {
        return policy;
    }

    @Override
    public Equation parse(String rawEquation) {
        if (rawEquation == null || rawEquation.isBlank()) {
            throw new EquationFormatException("Equation cannot be null or empty", EquationSyntaxException.UNKNOWN_POSITION, null);
        }
        checkLength(rawEquation, "Equation");

        int separator = rawEquation.indexOf(AliasTable.EQUALS);
        if (separator < 0) {
            throw new EquationFormatException("Missing '=' separator in equation", EquationSyntaxException.UNKNOWN_POSITION, null);
        }
        int duplicate = rawEquation.indexOf(AliasTable.EQUALS, separator + 1);
        if (duplicate >= 0) {
            throw new EquationFormatException(String.format(
                    "Duplicated '=' separator at position %d", duplicate), duplicate, AliasTable.EQUALS);
        }

        String lhs = readLeftHandSide(rawEquation, separator);
        List<Token> tokens = Tokenizer.tokenize(rawEquation, separator + 1, rawEquation.length(), policy.aliasTable());
        if (tokens.isEmpty()) {
            throw new ParseException("Missing right-hand side expression after '='", null, rawEquation.length());
        }
        ExpressionNode expression = PrecedenceClimbingParser.parse(tokens, policy.maxNestingDepth());

        return new Equation(lhs, expression);
    }

    @Override
    public ExpressionNode parseExpression(String expression) {
        if (expression == null) {
            throw new ParseException("Expression is empty", null, 0);
        }
        checkLength(expression, "Expression");
        List<Token> tokens = Tokenizer.tokenize(expression, policy.aliasTable());
        return PrecedenceClimbingParser.parse(tokens, policy.maxNestingDepth());
    }

    private String readLeftHandSide(String rawEquation, int separator) {
        String lhs = rawEquation.substring(0, separator).trim();
        List<Token> tokens;
        try {
            tokens = Tokenizer.tokenize(rawEquation, 0, separator, policy.aliasTable());
        } catch (LexException e) {
            throw new EquationFormatException(String.format(
                    "Left-hand side '%s' is not a valid identifier: %s", lhs, e.getMessage()), e.position(), e.offendingText(), e);
        }

        if (tokens.isEmpty()) {
            throw new EquationFormatException("Missing left-hand side identifier before '='", separator, AliasTable.EQUALS);
        }
        if (tokens.size() != 1 || !tokens.get(0).is(TokenType.IDENTIFIER)) {
            Token first = tokens.get(0);
            throw new EquationFormatException(String.format(
                    "Left-hand side '%s' must be a single identifier", lhs), first.position(), lhs);
        }
        return tokens.get(0).text();
    }

    private void checkLength(String text, String what) {
        if (text.length() > policy.maxExpressionLength()) {
            throw new EquationFormatException(String.format(
                    "%s too long (%d characters, max: %d). Policy applied: %s",
                    what, text.length(), policy.maxExpressionLength(), policy.policyName()),
                    EquationSyntaxException.UNKNOWN_POSITION, null);
        }
    }
}
