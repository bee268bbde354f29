package io.github.cyfko.eqschema.core.exception;

import io.github.cyfko.eqschema.core.api.OperatorKind;
import io.github.cyfko.eqschema.core.lexing.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EquationSyntaxExceptionTest {

    @Test
    @DisplayName("LexException should expose message, position and offending text")
    void shouldCreateLexException() {
        // When
        LexException exception = new LexException("Unexpected character '#' at position 4", 4, "#");

        // Then
        assertEquals("Unexpected character '#' at position 4", exception.getMessage());
        assertEquals(4, exception.position());
        assertEquals("#", exception.offendingText());
        assertNull(exception.getCause());
    }

    @Test
    @DisplayName("ParseException should take offending text from its token")
    void shouldCreateParseExceptionFromToken() {
        // Given
        Token token = Token.operator("AND", OperatorKind.AND, 4);

        // When
        ParseException exception = new ParseException("missing operand", token, 4);

        // Then
        assertSame(token, exception.token());
        assertEquals("AND", exception.offendingText());
        assertEquals(4, exception.position());
    }

    @Test
    @DisplayName("ParseException at end of input should have no token")
    void shouldCreateParseExceptionAtEndOfInput() {
        ParseException exception = new ParseException("Expression is empty", null, 0);

        assertNull(exception.token());
        assertNull(exception.offendingText());
    }

    @Test
    @DisplayName("EquationFormatException should keep its cause")
    void shouldCreateEquationFormatExceptionWithCause() {
        // Given
        LexException cause = new LexException("bad", 0, "1");

        // When
        EquationFormatException exception = new EquationFormatException("invalid lhs", 0, "1F", cause);

        // Then
        assertSame(cause, exception.getCause());
        assertEquals("1F", exception.offendingText());
    }

    @Test
    @DisplayName("All kinds should be unchecked EquationSyntaxExceptions")
    void shouldShareUncheckedBaseType() {
        assertInstanceOf(EquationSyntaxException.class, new LexException("m", 0, "x"));
        assertInstanceOf(EquationSyntaxException.class, new ParseException("m", null, 0));
        assertInstanceOf(EquationSyntaxException.class,
                new EquationFormatException("m", EquationSyntaxException.UNKNOWN_POSITION, null));
        assertInstanceOf(RuntimeException.class, new LexException("m", 0, "x"));
    }
}
