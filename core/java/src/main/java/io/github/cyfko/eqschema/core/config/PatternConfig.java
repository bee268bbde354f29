package io.github.cyfko.eqschema.core.config;

import java.util.regex.Pattern;

/**
 * Character classes and patterns shared by the tokenizer, the alias table and the expression model.
 * <p>
 * Identifiers start with an ASCII letter, followed by ASCII letters or digits. Variable
 * names are case-sensitive and kept exactly as written.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class PatternConfig {
    private PatternConfig() {}

    private static final String IDENTIFIER_FORM = "[A-Za-z][A-Za-z0-9]*";

    /**
     * Pattern matching a complete identifier.
     * <p>
     * Example valid: "A", "out1", "carryIn"
     * Example invalid: "1A", "a_b", "x-y"
     * </p>
     */
    public static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^" + IDENTIFIER_FORM + "$");

    /**
     * @param text candidate variable or result name, may be null
     * @return whether {@code text} is a complete identifier
     */
    public static boolean isIdentifier(String text) {
        return text != null && IDENTIFIER_PATTERN.matcher(text).matches();
    }

    public static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    public static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    public static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    /**
     * Tells whether the character is reserved for grouping or assignment and therefore
     * can never be part of an operator alias.
     *
     * @param c the character to test
     * @return {@code true} for {@code (}, {@code )} and {@code =}
     */
    public static boolean isStructural(char c) {
        return c == '(' || c == ')' || c == '=';
    }
}
