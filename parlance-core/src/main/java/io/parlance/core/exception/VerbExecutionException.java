package io.parlance.core.exception;

import java.io.Serial;

/// Thrown by a verb action that could not complete.
public class VerbExecutionException extends Exception {
    @Serial private static final long serialVersionUID = -7762905120738134415L;

    public VerbExecutionException(String message) {
        super(message);
    }

    public VerbExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
