package io.github.cyfko.eqschema.core.api;

import io.github.cyfko.eqschema.core.config.PatternConfig;

import java.util.Objects;

/**
 * Node of a parsed boolean expression tree.
 * <p>
 * A tree is built once by the parser and never modified afterwards. Every node
 * exclusively owns its children, so trees are acyclic and can be shared freely between
 * threads. Parentheses from the source text leave no trace in the tree: they only
 * decide how nodes are grouped.
 * </p>
 *
 * <p><strong>Example:</strong> {@code A AND (B OR NOT C)} parses to</p>
 * <pre>{@code
 * new BinaryOp(OperatorKind.AND,
 *     new Leaf("A"),
 *     new BinaryOp(OperatorKind.OR,
 *         new Leaf("B"),
 *         new UnaryOp(OperatorKind.NOT, new Leaf("C"))))
 * }</pre>
 *
 * <p>Nodes are records, so two trees are {@code equals} exactly when they have the same
 * shape, operators and variable names in the same operand order.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface ExpressionNode permits ExpressionNode.Leaf, ExpressionNode.UnaryOp, ExpressionNode.BinaryOp {

    /**
     * Precedence reported by nodes that are never split by a surrounding operator.
     */
    int ATOMIC_PRECEDENCE = Integer.MAX_VALUE;

    /**
     * Returns how tightly this node binds when it appears as an operand.
     *
     * @return the operator precedence, or {@link #ATOMIC_PRECEDENCE} for leaves
     */
    int precedence();

    /**
     * A variable reference, spelled exactly as the user wrote it. The name must match
     * {@link PatternConfig#IDENTIFIER_PATTERN}.
     *
     * @param name the variable name, case preserved
     */
    record Leaf(String name) implements ExpressionNode {
        public Leaf {
            if (!PatternConfig.isIdentifier(name)) {
                throw new IllegalArgumentException("Variable name must be an identifier, got: " + name);
            }
        }

        @Override
        public int precedence() {
            return ATOMIC_PRECEDENCE;
        }
    }

    /**
     * A prefix operator applied to one operand.
     *
     * @param kind  a unary operator kind
     * @param child the operand
     */
    record UnaryOp(OperatorKind kind, ExpressionNode child) implements ExpressionNode {
        public UnaryOp {
            Objects.requireNonNull(kind, "Operator kind cannot be null");
            Objects.requireNonNull(child, "Operand cannot be null");
            if (!kind.isUnary()) {
                throw new IllegalArgumentException("Operator " + kind + " is not unary");
            }
        }

        @Override
        public int precedence() {
            return kind.getPrecedence();
        }
    }

    /**
     * A binary operator applied to two operands.
     *
     * @param kind  a binary operator kind
     * @param left  the left operand
     * @param right the right operand
     */
    record BinaryOp(OperatorKind kind, ExpressionNode left, ExpressionNode right) implements ExpressionNode {
        public BinaryOp {
            Objects.requireNonNull(kind, "Operator kind cannot be null");
            Objects.requireNonNull(left, "Left operand cannot be null");
            Objects.requireNonNull(right, "Right operand cannot be null");
            if (!kind.isBinary()) {
                throw new IllegalArgumentException("Operator " + kind + " is not binary");
            }
        }

        @Override
        public int precedence() {
            return kind.getPrecedence();
        }
    }
}
