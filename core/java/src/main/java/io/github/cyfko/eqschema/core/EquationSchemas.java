package io.github.cyfko.eqschema.core;

import io.github.cyfko.eqschema.core.api.Equation;
import io.github.cyfko.eqschema.core.api.EquationCanonicalizer;
import io.github.cyfko.eqschema.core.api.EquationParser;
import io.github.cyfko.eqschema.core.api.ExpressionNode;
import io.github.cyfko.eqschema.core.cache.BoundedLRUCache;
import io.github.cyfko.eqschema.core.config.CachePolicy;
import io.github.cyfko.eqschema.core.config.EquationPolicy;
import io.github.cyfko.eqschema.core.exception.EquationFormatException;
import io.github.cyfko.eqschema.core.exception.EquationSyntaxException;
import io.github.cyfko.eqschema.core.exception.LexException;
import io.github.cyfko.eqschema.core.exception.ParseException;
import io.github.cyfko.eqschema.core.impl.BasicEquationParser;
import io.github.cyfko.eqschema.core.printing.CanonicalPrinter;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * High-level facade producing {@link EquationCanonicalizer} instances.
 * <p>
 * Combines an {@link EquationParser} with the {@link CanonicalPrinter} and an optional
 * result cache, turning any accepted notation of an equation into the canonical schema
 * consumed by truth table, evaluation and satisfiability tooling.
 * </p>
 *
 * <p><strong>Pipeline:</strong></p>
 * <ol>
 *   <li><strong>Split:</strong> locate the single {@code =} and validate the left-hand identifier</li>
 *   <li><strong>Tokenize:</strong> classify words and symbols of the right-hand side through the alias table</li>
 *   <li><strong>Parse:</strong> build the expression tree by precedence climbing</li>
 *   <li><strong>Print:</strong> emit {@code lhs=expression} with canonical symbols and minimal parentheses</li>
 * </ol>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * // One-off conversion with default settings
 * String schema = EquationSchemas.canonicalize("F = A AND (B OR C)");   // "F=A&(B|C)"
 *
 * // Configured instance, reused across requests
 * EquationCanonicalizer canonicalizer = EquationSchemas.of(EquationPolicy.strict(), CachePolicy.strict());
 * Equation eq = canonicalizer.parse("F = not A xor B");
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>{@link LexException} - unrecognized character or invalid identifier</li>
 *   <li>{@link ParseException} - malformed expression structure</li>
 *   <li>{@link EquationFormatException} - missing or repeated {@code =}, invalid left side</li>
 * </ul>
 *
 * <p>All instances are immutable apart from their internal cache and can be shared between threads.</p>
 *
 * @see EquationParser
 * @see CanonicalPrinter
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EquationSchemas {

    private static final EquationCanonicalizer DEFAULT = of();

    private EquationSchemas() {}

    /**
     * Canonicalizes an equation with the shared default canonicalizer.
     *
     * @param rawEquation the equation text
     * @return the canonical schema string
     * @throws EquationSyntaxException if the equation cannot be read
     */
    public static String canonicalize(String rawEquation) {
        return DEFAULT.canonicalize(rawEquation);
    }

    /**
     * Creates a canonicalizer with {@link EquationPolicy#defaults()} and {@link CachePolicy#defaults()}.
     *
     * @return a new canonicalizer
     */
    public static EquationCanonicalizer of() {
        return of(new BasicEquationParser(), CachePolicy.defaults());
    }

    /**
     * Creates a canonicalizer with the given parsing policy and the default cache policy.
     *
     * @param policy the parsing policy. Must not be null.
     * @return a new canonicalizer
     */
    public static EquationCanonicalizer of(EquationPolicy policy) {
        return of(new BasicEquationParser(policy), CachePolicy.defaults());
    }

    /**
     * Creates a canonicalizer with the given parsing and cache policies.
     *
     * @param policy      the parsing policy. Must not be null.
     * @param cachePolicy the cache policy. Must not be null.
     * @return a new canonicalizer
     */
    public static EquationCanonicalizer of(EquationPolicy policy, CachePolicy cachePolicy) {
        return of(new BasicEquationParser(policy), cachePolicy);
    }

    /**
     * Creates a canonicalizer around a custom parser.
     *
     * @param parser      the parser to use. Must not be null.
     * @param cachePolicy the cache policy. Must not be null.
     * @return a new canonicalizer
     * @throws NullPointerException if any parameter is null
     */
    public static EquationCanonicalizer of(EquationParser parser, CachePolicy cachePolicy) {
        return new DefaultEquationCanonicalizer(parser, cachePolicy);
    }

    /**
     * Default {@link EquationCanonicalizer}: parses, prints, and remembers successful results.
     */
    static final class DefaultEquationCanonicalizer implements EquationCanonicalizer {
        private static final Logger log = Logger.getLogger(DefaultEquationCanonicalizer.class.getName());

        private final EquationParser parser;
        private final BoundedLRUCache<String, String> cache;

        DefaultEquationCanonicalizer(EquationParser parser, CachePolicy cachePolicy) {
            this.parser = Objects.requireNonNull(parser, "Equation parser cannot be null");
            Objects.requireNonNull(cachePolicy, "Cache policy cannot be null");
            this.cache = cachePolicy.<String>newCache().orElse(null);
        }

        @Override
        public String canonicalize(String rawEquation) {
            if (cache == null || rawEquation == null) {
                return render(rawEquation);
            }

            String schema = cache.computeIfAbsent(rawEquation, this::render);
            log.fine(() -> cache.getStats());
            return schema;
        }

        @Override
        public Equation parse(String rawEquation) {
            return parser.parse(rawEquation);
        }

        @Override
        public ExpressionNode parseExpression(String expression) {
            return parser.parseExpression(expression);
        }

        /**
         * Returns cache statistics.
         *
         * @return map of statistics, or {@code enabled=false} when caching is off
         */
        Map<String, Object> getCacheStats() {
            if (cache == null) {
                return Map.of("enabled", false);
            }

            return Map.of(
                    "enabled", true,
                    "size", cache.size(),
                    "maxSize", cache.getMaxSize(),
                    "hits", cache.getHitCount(),
                    "misses", cache.getMissCount()
            );
        }

        private String render(String rawEquation) {
            String schema = CanonicalPrinter.print(parser.parse(rawEquation));
            log.fine(() -> String.format("Canonicalized '%s' -> '%s'", rawEquation, schema));
            return schema;
        }
    }
}
