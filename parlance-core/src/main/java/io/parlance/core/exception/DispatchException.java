package io.parlance.core.exception;

import java.io.Serial;

/// Thrown when no implementation of a verb structurally matches a sentence.
public class DispatchException extends Exception {
    @Serial private static final long serialVersionUID = -2301544890981716623L;

    public DispatchException(String message) {
        super(message);
    }
}
