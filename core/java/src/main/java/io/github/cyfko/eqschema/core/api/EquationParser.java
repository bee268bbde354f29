package io.github.cyfko.eqschema.core.api;

import io.github.cyfko.eqschema.core.exception.EquationFormatException;
import io.github.cyfko.eqschema.core.exception.LexException;
import io.github.cyfko.eqschema.core.exception.ParseException;

/**
 * Parser turning free-form equation text into an {@link Equation} tree.
 *
 * <h2>Grammar</h2>
 * <pre>
 * equation   := identifier '=' expression
 * expression := xorTerm (OR xorTerm)*
 * xorTerm    := andTerm (XOR andTerm)*
 * andTerm    := factor (AND factor)*
 * factor     := NOT factor | identifier | '(' expression ')'
 * identifier := letter (letter | digit)*
 * </pre>
 *
 * <p>Operators may be written with any spelling registered in the parser's alias table,
 * for instance {@code NOT}, {@code not}, {@code ~} or {@code !} for negation. Whitespace
 * between tokens is ignored.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EquationParser parser = new BasicEquationParser();
 *
 * Equation eq = parser.parse("F = A and (B or C)");
 * ExpressionNode rhs = parser.parseExpression("!A ^ B");
 * }</pre>
 *
 * <p>Implementations must be stateless with respect to individual calls so they can be
 * shared between threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface EquationParser {

    /**
     * Parses a complete equation.
     *
     * @param rawEquation the equation text, e.g. {@code "F = NOT A"}
     * @return the parsed equation
     * @throws EquationFormatException if the text is blank or too long, the {@code =} separator is missing or repeated,
     *                                 or the left side is not one identifier
     * @throws LexException            if the right side contains an unrecognized character or invalid identifier
     * @throws ParseException          if the right side is not a well-formed expression
     */
    Equation parse(String rawEquation);

    /**
     * Parses a bare boolean expression (the right-hand side of an equation).
     *
     * @param expression the expression text, e.g. {@code "A | ~B"}
     * @return the root of the expression tree
     * @throws LexException   if the text contains an unrecognized character or invalid identifier
     * @throws ParseException if the text is empty or not a well-formed expression
     * @throws EquationFormatException if the text exceeds the configured length limit
     */
    ExpressionNode parseExpression(String expression);
}
