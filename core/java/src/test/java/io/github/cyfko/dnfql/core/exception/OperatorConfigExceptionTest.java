package io.github.cyfko.dnfql.core.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class OperatorConfigExceptionTest {

    @Test
    @DisplayName("Should create OperatorConfigException with message")
    void shouldCreateWithMessage() {
        OperatorConfigException exception = new OperatorConfigException("Missing required roles: [AND]");

        assertEquals("Missing required roles: [AND]", exception.getMessage());
        assertNull(exception.getCause());
        assertInstanceOf(RuntimeException.class, exception);
    }

    @Test
    @DisplayName("Should keep the I/O cause")
    void shouldKeepCause() {
        IOException cause = new IOException("disk");

        OperatorConfigException exception = new OperatorConfigException("Could not load", cause);

        assertSame(cause, exception.getCause());
    }
}
