package io.github.cyfko.eqschema.core.exception;

/**
 * Thrown when the text does not have the shape {@code <identifier> = <expression>}.
 * <p>
 * Raised when the {@code =} separator is missing or repeated, when the left-hand side
 * is not exactly one valid identifier, and when the input is blank or exceeds the
 * configured length limit.
 * </p>
 *
 * <pre>{@code
 * schemas.canonicalize("NOT A");        // → "Missing '=' separator in equation"
 * schemas.canonicalize("F = A = B");    // → "Duplicated '=' separator at position 6"
 * schemas.canonicalize("F G = A");      // → "Left-hand side 'F G' must be a single identifier"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class EquationFormatException extends EquationSyntaxException {

    /**
     * @param message       the message describing the failure
     * @param position      offset of the offending text, or {@link #UNKNOWN_POSITION}
     * @param offendingText the offending text, may be {@code null}
     */
    public EquationFormatException(String message, int position, String offendingText) {
        super(message, position, offendingText);
    }

    /**
     * @param message       the message describing the failure
     * @param position      offset of the offending text, or {@link #UNKNOWN_POSITION}
     * @param offendingText the offending text, may be {@code null}
     * @param cause         the underlying failure (for instance a {@link LexException} on the left side)
     */
    public EquationFormatException(String message, int position, String offendingText, Throwable cause) {
        super(message, position, offendingText, cause);
    }
}
