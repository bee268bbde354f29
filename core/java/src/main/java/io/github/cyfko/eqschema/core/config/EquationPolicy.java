package io.github.cyfko.eqschema.core.config;

/**
 * Configuration for equation parsing: recognized aliases and input complexity limits.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: Maximum character length of the equation (default: 5000)</li>
 *   <li><strong>maxNestingDepth</strong>: Maximum depth of nested parentheses and negations (default: 256)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * EquationPolicy policy = EquationPolicy.defaults();
 *
 * // Strict (for untrusted input)
 * EquationPolicy policy = EquationPolicy.strict();
 *
 * // Relaxed (for generated equations)
 * EquationPolicy policy = EquationPolicy.relaxed();
 *
 * // Custom
 * EquationPolicy policy = EquationPolicy.builder()
 *     .maxExpressionLength(20000)
 *     .aliasTable(AliasTable.builder().alias("&&", OperatorKind.AND).build())
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in limit violation messages
 * @param maxExpressionLength maximum character length of the equation text
 * @param maxNestingDepth     maximum nesting depth of the expression tree
 * @param aliasTable          the operator spellings to recognize
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EquationPolicy(
    String policyName,
    int maxExpressionLength,
    int maxNestingDepth,
    AliasTable aliasTable
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public EquationPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        if (aliasTable == null) {
            throw new IllegalArgumentException("aliasTable is required");
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Expression Length: 5000 characters</li>
     *   <li>Max Nesting Depth: 256</li>
     *   <li>Aliases: {@link AliasTable#defaults()}</li>
     * </ul>
     *
     * @return default configuration
     */
    public static EquationPolicy defaults() {
        return new EquationPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 256, AliasTable.defaults());
    }

    /**
     * Strict configuration for equations typed by end users of a public service.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Max Nesting Depth: 64</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static EquationPolicy strict() {
        return new EquationPolicy(PolicyName.STRICT_POLICY.name(), 1000, 64, AliasTable.defaults());
    }

    /**
     * Relaxed configuration for trusted, machine-generated equations.
     * <ul>
     *   <li>Max Expression Length: 10000 characters</li>
     *   <li>Max Nesting Depth: 1024</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static EquationPolicy relaxed() {
        return new EquationPolicy(PolicyName.RELAXED_POLICY.name(), 10000, 1024, AliasTable.defaults());
    }

    /**
     * Creates a custom configuration; unset parameters keep their default values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxNestingDepth = 256;
        private AliasTable _aliasTable = AliasTable.defaults();

        private Builder() {}

        public EquationPolicy build() {
            return new EquationPolicy(_policyName, _maxExpressionLength, _maxNestingDepth, _aliasTable);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
        public Builder aliasTable(AliasTable aliasTable) { this._aliasTable = aliasTable; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
