package io.github.cyfko.eqschema.core.exception;

/**
 * Thrown when the equation text contains something the tokenizer cannot classify.
 * <p>
 * Typical causes:
 * </p>
 * <pre>{@code
 * tokenizer.tokenize("A # B");   // → "Unexpected character '#' at position 2"
 * tokenizer.tokenize("A & 1B");  // → "Invalid identifier '1B' at position 4: identifiers must start with a letter"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class LexException extends EquationSyntaxException {

    /**
     * @param message       the message describing the failure
     * @param position      offset of the offending character
     * @param offendingText the offending character or word
     */
    public LexException(String message, int position, String offendingText) {
        super(message, position, offendingText);
    }
}
