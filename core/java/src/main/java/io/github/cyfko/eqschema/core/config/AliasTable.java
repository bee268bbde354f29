package io.github.cyfko.eqschema.core.config;

import io.github.cyfko.eqschema.core.api.OperatorKind;

import java.util.*;

/**
 * Immutable mapping from every accepted spelling of an operator to its {@link OperatorKind}.
 * <p>
 * The default table recognizes:
 * </p>
 * <table border="1">
 * <caption>Default aliases</caption>
 * <thead>
 * <tr><th>Kind</th><th>Words</th><th>Symbols</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>NOT</td><td>NOT, not</td><td>~ !</td></tr>
 * <tr><td>AND</td><td>AND, and</td><td>&amp; *</td></tr>
 * <tr><td>OR</td><td>OR, or</td><td>| +</td></tr>
 * <tr><td>XOR</td><td>XOR, xor</td><td>^</td></tr>
 * </tbody>
 * </table>
 * <p>
 * Word spellings are case-sensitive ({@code Not} is a variable name), symbols match
 * exactly. The {@code =} separator is not an operator and is answered by
 * {@link #resolveEquals(String)}.
 * </p>
 *
 * <h2>Registering aliases</h2>
 * <pre>{@code
 * AliasTable table = AliasTable.builder()
 *     .alias("AndAlso", OperatorKind.AND)
 *     .alias("&&", OperatorKind.AND)
 *     .alias("||", OperatorKind.OR)
 *     .build();
 * }</pre>
 * <p>
 * A builder starts from the default spellings and produces a new table; the shared
 * {@link #defaults()} instance never changes. Symbolic aliases are matched longest first,
 * so {@code &&} is read as one operator when registered.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AliasTable {

    /**
     * The equality / assignment separator.
     */
    public static final String EQUALS = "=";

    private static final AliasTable DEFAULTS = new Builder().build();

    private final Map<String, OperatorKind> words;
    private final Map<String, OperatorKind> symbols;
    private final int longestSymbol;

    private AliasTable(Map<String, OperatorKind> words, Map<String, OperatorKind> symbols) {
        this.words = Collections.unmodifiableMap(new LinkedHashMap<>(words));
        this.symbols = Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
        this.longestSymbol = symbols.keySet().stream().mapToInt(String::length).max().orElse(0);
    }

    /**
     * Returns the process-wide table holding the default spellings only.
     *
     * @return the shared default table
     */
    public static AliasTable defaults() {
        return DEFAULTS;
    }

    /**
     * Creates a builder pre-populated with the default spellings.
     *
     * @return a new {@link Builder}
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves a spelling to the operator it denotes.
     *
     * @param spelling a word or symbol as written by the user
     * @return the operator kind, or empty if the spelling is not an operator
     */
    public Optional<OperatorKind> resolveOperator(String spelling) {
        if (spelling == null || spelling.isEmpty()) return Optional.empty();
        OperatorKind kind = words.get(spelling);
        return kind != null ? Optional.of(kind) : Optional.ofNullable(symbols.get(spelling));
    }

    /**
     * Tells whether a spelling is the equation separator.
     *
     * @param spelling the text to test
     * @return {@code true} only for {@code =}
     */
    public boolean resolveEquals(String spelling) {
        return EQUALS.equals(spelling);
    }

    /**
     * Finds the longest symbolic alias starting at {@code offset} and ending before {@code limit}.
     *
     * @param input  the text being scanned
     * @param offset the scan position
     * @param limit  exclusive end of the scanned region
     * @return the matched symbol, or {@code null} if none starts there
     */
    public String matchSymbol(CharSequence input, int offset, int limit) {
        int max = Math.min(longestSymbol, limit - offset);
        for (int length = max; length > 0; length--) {
            String candidate = input.subSequence(offset, offset + length).toString();
            if (symbols.containsKey(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Returns every spelling bound to the given operator, words first.
     *
     * @param kind the operator kind
     * @return the spellings in registration order
     */
    public Set<String> spellingsOf(OperatorKind kind) {
        Objects.requireNonNull(kind, "Operator kind cannot be null");
        Set<String> result = new LinkedHashSet<>();
        words.forEach((spelling, k) -> { if (k == kind) result.add(spelling); });
        symbols.forEach((spelling, k) -> { if (k == kind) result.add(spelling); });
        return Collections.unmodifiableSet(result);
    }

    @Override
    public String toString() {
        return "AliasTable[words=" + words.keySet() + ", symbols=" + symbols.keySet() + "]";
    }

    public static final class Builder {
        private final Map<String, OperatorKind> _words = new LinkedHashMap<>();
        private final Map<String, OperatorKind> _symbols = new LinkedHashMap<>();

        private Builder() {
            alias("NOT", OperatorKind.NOT).alias("not", OperatorKind.NOT).alias("~", OperatorKind.NOT).alias("!", OperatorKind.NOT);
            alias("AND", OperatorKind.AND).alias("and", OperatorKind.AND).alias("&", OperatorKind.AND).alias("*", OperatorKind.AND);
            alias("OR", OperatorKind.OR).alias("or", OperatorKind.OR).alias("|", OperatorKind.OR).alias("+", OperatorKind.OR);
            alias("XOR", OperatorKind.XOR).alias("xor", OperatorKind.XOR).alias("^", OperatorKind.XOR);
        }

        /**
         * Registers an additional spelling.
         *
         * @param spelling an identifier-shaped word, or a run of symbol characters
         * @param kind     the operator the spelling denotes
         * @return this builder
         * @throws IllegalArgumentException if the spelling is malformed or already bound to another operator
         */
        public Builder alias(String spelling, OperatorKind kind) {
            Objects.requireNonNull(spelling, "Alias spelling cannot be null");
            Objects.requireNonNull(kind, "Operator kind cannot be null");

            Map<String, OperatorKind> target;
            if (PatternConfig.IDENTIFIER_PATTERN.matcher(spelling).matches()) {
                target = _words;
            } else if (isSymbolic(spelling)) {
                target = _symbols;
            } else {
                throw new IllegalArgumentException("Invalid alias spelling [" + spelling
                        + "]: expected an identifier-like word or a run of symbol characters");
            }

            OperatorKind previous = target.putIfAbsent(spelling, kind);
            if (previous != null && previous != kind) {
                throw new IllegalArgumentException("Alias [" + spelling + "] is already registered for " + previous);
            }
            return this;
        }

        public AliasTable build() {
            return new AliasTable(_words, _symbols);
        }

        private static boolean isSymbolic(String spelling) {
            if (spelling.isEmpty()) return false;
            for (int i = 0; i < spelling.length(); i++) {
                char c = spelling.charAt(i);
                if (Character.isLetterOrDigit(c) || Character.isWhitespace(c) || PatternConfig.isStructural(c)) {
                    return false;
                }
            }
            return true;
        }
    }
}
