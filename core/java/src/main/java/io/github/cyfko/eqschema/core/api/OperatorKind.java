package io.github.cyfko.eqschema.core.api;

/**
 * The closed set of logical operators understood by the equation grammar.
 * <p>
 * Each operator carries its arity, its binding strength and the symbol used in the
 * canonical schema:
 * </p>
 * <table border="1">
 * <caption>Operator reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Canonical symbol</th><th>Arity</th><th>Precedence</th><th>Associativity</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>NOT</td><td>~</td><td>1</td><td>4</td><td>Prefix</td></tr>
 * <tr><td>AND</td><td>&amp;</td><td>2</td><td>3</td><td>Left</td></tr>
 * <tr><td>XOR</td><td>^</td><td>2</td><td>2</td><td>Left</td></tr>
 * <tr><td>OR</td><td>|</td><td>2</td><td>1</td><td>Left</td></tr>
 * </tbody>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum OperatorKind {

    /** Logical negation: "~" */
    NOT("~", 1, 4),

    /** Logical conjunction: "&amp;" */
    AND("&", 2, 3),

    /** Exclusive disjunction: "^" */
    XOR("^", 2, 2),

    /** Logical disjunction: "|" */
    OR("|", 2, 1);

    /**
     * Precedence of the loosest binary operator.
     */
    public static final int LOWEST_PRECEDENCE = 1;

    private final String symbol;
    private final int arity;
    private final int precedence;

    OperatorKind(String symbol, int arity, int precedence) {
        this.symbol = symbol;
        this.arity = arity;
        this.precedence = precedence;
    }

    /**
     * Returns the symbol emitted for this operator in the canonical schema.
     *
     * @return the canonical symbol
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Returns the number of operands the operator requires.
     *
     * @return 1 for {@link #NOT}, 2 otherwise
     */
    public int getArity() {
        return arity;
    }

    /**
     * Returns the binding strength; higher binds tighter.
     *
     * @return the precedence level
     */
    public int getPrecedence() {
        return precedence;
    }

    public boolean isUnary() {
        return arity == 1;
    }

    public boolean isBinary() {
        return arity == 2;
    }
}
