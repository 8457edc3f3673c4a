package io.keeplast.core;

/**
 * Raised by a {@link Value} implementation when a copy or release fails.
 * The resolver treats it as fatal for the row being accepted and keeps the
 * previous winner.
 */
public class ValueException extends RuntimeException {

    public ValueException(String message) {
        super(message);
    }

    public ValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
