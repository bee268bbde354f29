package io.github.cyfko.eqschema.core.api;

import io.github.cyfko.eqschema.core.config.PatternConfig;
import io.github.cyfko.eqschema.core.printing.CanonicalPrinter;

import java.util.*;

/**
 * A parsed equation: a result variable bound to a boolean expression.
 * <p>
 * Downstream components (truth table generation, evaluation, satisfiability checks)
 * can consume this object directly instead of re-parsing the canonical string.
 * </p>
 *
 * <pre>{@code
 * Equation eq = EquationSchemas.of().parse("F = B AND (A OR NOT B)");
 * eq.lhs();                 // "F"
 * eq.symbols();             // ["B", "A"]
 * eq.toCanonicalString();   // "F=B&(A|~B)"
 * }</pre>
 *
 * @param lhs        the single identifier on the left of {@code =}
 * @param expression the fully parsed right-hand side
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Equation(String lhs, ExpressionNode expression) {

    public Equation {
        if (!PatternConfig.isIdentifier(lhs)) {
            throw new IllegalArgumentException("Left-hand side must be a single identifier, got: " + lhs);
        }
        Objects.requireNonNull(expression, "Expression cannot be null");
    }

    /**
     * Returns the distinct variable names of the right-hand side, in order of first appearance.
     *
     * @return an unmodifiable list of variable names
     */
    public List<String> symbols() {
        Set<String> seen = new LinkedHashSet<>();
        Deque<ExpressionNode> pending = new ArrayDeque<>();
        pending.push(expression);

        // Pre-order, left operand first
        while (!pending.isEmpty()) {
            ExpressionNode node = pending.pop();
            if (node instanceof ExpressionNode.Leaf leaf) {
                seen.add(leaf.name());
            } else if (node instanceof ExpressionNode.UnaryOp unary) {
                pending.push(unary.child());
            } else if (node instanceof ExpressionNode.BinaryOp binary) {
                pending.push(binary.right());
                pending.push(binary.left());
            }
        }
        return List.copyOf(seen);
    }

    /**
     * Renders this equation in canonical schema form.
     *
     * @return {@code lhs=expression} with canonical symbols and no whitespace
     */
    public String toCanonicalString() {
        return CanonicalPrinter.print(this);
    }
}
