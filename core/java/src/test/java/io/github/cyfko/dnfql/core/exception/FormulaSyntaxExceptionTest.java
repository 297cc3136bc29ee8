package io.github.cyfko.dnfql.core.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormulaSyntaxExceptionTest {

    @Test
    @DisplayName("Should create FormulaSyntaxException with message")
    void shouldCreateWithMessage() {
        // When
        FormulaSyntaxException exception = new FormulaSyntaxException("Formula is empty");

        // Then
        assertEquals("Formula is empty", exception.getMessage());
        assertNull(exception.getCause());
        assertEquals(-1, exception.getPosition());
        assertNull(exception.getNear());
    }

    @Test
    @DisplayName("Should create FormulaSyntaxException with message and cause")
    void shouldCreateWithMessageAndCause() {
        // Given
        Throwable cause = new IllegalArgumentException("Root cause");

        // When
        FormulaSyntaxException exception = new FormulaSyntaxException("Invalid literal", cause);

        // Then
        assertEquals("Invalid literal", exception.getMessage());
        assertSame(cause, exception.getCause());
        assertEquals(-1, exception.getPosition());
    }

    @Test
    @DisplayName("Should carry position and context")
    void shouldCarryPositionAndContext() {
        FormulaSyntaxException exception = new FormulaSyntaxException("Unexpected token ')'", 4, "A & )", null);

        assertEquals(4, exception.getPosition());
        assertEquals("A & )", exception.getNear());
        assertNull(exception.getCause());
    }

    @Test
    @DisplayName("Should be unchecked")
    void shouldBeUnchecked() {
        assertInstanceOf(RuntimeException.class, new FormulaSyntaxException("test"));
    }
}
