package io.github.cyfko.dnfql.core.exception;

/**
 * Exception thrown when an operator configuration is malformed or incomplete.
 * <p>
 * Raised while loading or validating an {@link io.github.cyfko.dnfql.core.config.OperatorConfig}:
 * unreadable documents, documents that are not JSON objects, missing or empty required roles,
 * blank tokens, or a token claimed by two roles. It is fatal for the current operation and is
 * never retried automatically.
 * </p>
 *
 * <p><strong>Usage Examples:</strong></p>
 * <pre>{@code
 * throw new OperatorConfigException("Missing required roles: [OR]");
 * throw new OperatorConfigException("Duplicate token '&' in roles AND and OR");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class OperatorConfigException extends RuntimeException {

    /**
     * Creates a new OperatorConfigException with detailed message.
     *
     * @param message explanation of the validation failure
     */
    public OperatorConfigException(String message) {
        super(message);
    }

    /**
     * Creates a new OperatorConfigException with detailed message and cause.
     *
     * @param message explanation of the failure
     * @param cause underlying exception (I/O or JSON processing errors)
     */
    public OperatorConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
