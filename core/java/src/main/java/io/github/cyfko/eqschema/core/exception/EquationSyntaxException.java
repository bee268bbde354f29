package io.github.cyfko.eqschema.core.exception;

/**
 * Base type of every failure raised while reading an equation.
 * <p>
 * The three concrete subtypes identify the stage that rejected the input, so callers
 * can react to the failure kind with a plain {@code catch} clause instead of inspecting
 * message text:
 * </p>
 * <ul>
 *   <li>{@link LexException}: the text contains a character or word that cannot be tokenized</li>
 *   <li>{@link ParseException}: the tokens do not form a well-structured expression</li>
 *   <li>{@link EquationFormatException}: the {@code lhs = rhs} shape itself is wrong</li>
 * </ul>
 *
 * <p><strong>Error reporting:</strong></p>
 * <pre>{@code
 * try {
 *     String schema = EquationSchemas.canonicalize(userInput);
 * } catch (EquationSyntaxException e) {
 *     highlight(userInput, e.position(), e.offendingText());
 *     showMessage(e.getMessage());
 * }
 * }</pre>
 *
 * <p>All failures are deterministic for a given input: retrying the same text always
 * fails the same way.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class EquationSyntaxException extends RuntimeException {

    /**
     * Marker position used when the failure is not tied to a single character.
     */
    public static final int UNKNOWN_POSITION = -1;

    private final int position;
    private final String offendingText;

    /**
     * Creates an exception located at the given offset.
     *
     * @param message       the message describing the failure
     * @param position      zero-based character offset in the equation text, or {@link #UNKNOWN_POSITION}
     * @param offendingText the text that triggered the failure, may be {@code null}
     */
    protected EquationSyntaxException(String message, int position, String offendingText) {
        super(message);
        this.position = position;
        this.offendingText = offendingText;
    }

    /**
     * Creates an exception located at the given offset, wrapping an underlying failure.
     *
     * @param message       the message describing the failure
     * @param position      zero-based character offset in the equation text, or {@link #UNKNOWN_POSITION}
     * @param offendingText the text that triggered the failure, may be {@code null}
     * @param cause         the original failure
     */
    protected EquationSyntaxException(String message, int position, String offendingText, Throwable cause) {
        super(message, cause);
        this.position = position;
        this.offendingText = offendingText;
    }

    /**
     * Returns the zero-based offset of the failure in the full equation text.
     *
     * @return the offset, or {@link #UNKNOWN_POSITION} when the failure is not localized
     */
    public int position() {
        return position;
    }

    /**
     * Returns the substring or token spelling responsible for the failure.
     *
     * @return the offending text, or {@code null} when the failure happened at end of input
     */
    public String offendingText() {
        return offendingText;
    }
}
