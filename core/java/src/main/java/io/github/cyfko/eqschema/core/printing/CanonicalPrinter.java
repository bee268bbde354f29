package io.github.cyfko.eqschema.core.printing;

import io.github.cyfko.eqschema.core.api.Equation;
import io.github.cyfko.eqschema.core.api.ExpressionNode;

import java.util.Objects;

/**
 * Renders expression trees in canonical schema form.
 * <p>
 * Canonical form uses the symbols {@code ~ & ^ |}, never inserts whitespace and emits only
 * the parentheses required to read the same tree back:
 * </p>
 * <ul>
 *   <li>A negated binary expression is parenthesized: {@code ~(A&B)}</li>
 *   <li>A left operand is parenthesized when it binds strictly looser than its parent: {@code (A|B)&C}</li>
 *   <li>A right operand is parenthesized when it binds looser than or as loose as its parent,
 *       which keeps left-associative grouping intact: {@code A|(B|C)}, {@code A&(B|C)}</li>
 * </ul>
 *
 * <pre>{@code
 * CanonicalPrinter.print(parser.parseExpression("A AND (B OR C)"));   // "A&(B|C)"
 * CanonicalPrinter.print(parser.parseExpression("(A OR B) OR C"));    // "A|B|C"
 * CanonicalPrinter.print(parser.parseExpression("NOT NOT A"));        // "~~A"
 * }</pre>
 *
 * <p>Printing is total: every well-formed tree has exactly one canonical rendering.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class CanonicalPrinter {

    private CanonicalPrinter() {}

    /**
     * Renders an expression tree.
     *
     * @param node the root of the tree
     * @return the canonical expression string
     */
    public static String print(ExpressionNode node) {
        Objects.requireNonNull(node, "Expression cannot be null");
        StringBuilder out = new StringBuilder();
        render(node, out);
        return out.toString();
    }

    /**
     * Renders an equation as {@code lhs=expression}.
     *
     * @param equation the equation to render
     * @return the canonical equation string
     */
    public static String print(Equation equation) {
        Objects.requireNonNull(equation, "Equation cannot be null");
        StringBuilder out = new StringBuilder(equation.lhs()).append('=');
        render(equation.expression(), out);
        return out.toString();
    }

    private static void render(ExpressionNode node, StringBuilder out) {
        if (node instanceof ExpressionNode.Leaf leaf) {
            out.append(leaf.name());
        } else if (node instanceof ExpressionNode.UnaryOp unary) {
            out.append(unary.kind().getSymbol());
            renderOperand(unary.child(), unary.child() instanceof ExpressionNode.BinaryOp, out);
        } else if (node instanceof ExpressionNode.BinaryOp binary) {
            int precedence = binary.precedence();
            renderOperand(binary.left(), binary.left().precedence() < precedence, out);
            out.append(binary.kind().getSymbol());
            renderOperand(binary.right(), binary.right().precedence() <= precedence, out);
        }
    }

    private static void renderOperand(ExpressionNode operand, boolean parenthesize, StringBuilder out) {
        if (parenthesize) out.append('(');
        render(operand, out);
        if (parenthesize) out.append(')');
    }
}
