package io.github.cyfko.eqschema.core.api;

import io.github.cyfko.eqschema.core.exception.EquationSyntaxException;

/**
 * Entry point converting user-written equations into the canonical schema.
 * <p>
 * The canonical schema is the single normalized form consumed by downstream boolean
 * tooling: canonical symbols {@code ~ & ^ |}, the fewest parentheses that preserve the
 * parsed grouping, and no whitespace.
 * </p>
 *
 * <pre>{@code
 * EquationCanonicalizer canonicalizer = EquationSchemas.of();
 *
 * canonicalizer.canonicalize("F = NOT A");            // "F=~A"
 * canonicalizer.canonicalize("F = A AND (B OR C)");   // "F=A&(B|C)"
 * canonicalizer.canonicalize("F = A OR B OR C");      // "F=A|B|C"
 * }</pre>
 *
 * @see EquationParser
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface EquationCanonicalizer {

    /**
     * Converts an equation into its canonical schema string.
     * <p>
     * The result is a fixed point: canonicalizing it again returns the same string.
     * </p>
     *
     * @param rawEquation the equation text
     * @return the canonical form {@code lhs=expression}
     * @throws EquationSyntaxException if the equation cannot be read; the subtype identifies the failing stage
     */
    String canonicalize(String rawEquation);

    /**
     * Parses an equation without rendering it, for components that work on the tree.
     *
     * @param rawEquation the equation text
     * @return the parsed equation
     * @throws EquationSyntaxException if the equation cannot be read
     */
    Equation parse(String rawEquation);

    /**
     * Parses a bare right-hand side expression.
     *
     * @param expression the expression text, without {@code lhs =}
     * @return the expression tree
     * @throws EquationSyntaxException if the expression cannot be read
     */
    ExpressionNode parseExpression(String expression);
}
