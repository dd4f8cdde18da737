package io.parlance.core.exception;

import java.io.Serial;

/// Thrown when a result cannot be read as named properties for destructuring.
public class StructuredValueException extends Exception {
    @Serial private static final long serialVersionUID = 2950187314466032789L;

    public StructuredValueException(String message) {
        super(message);
    }

    public StructuredValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
