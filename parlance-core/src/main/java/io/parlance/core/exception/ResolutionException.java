package io.parlance.core.exception;

import java.io.Serial;

/// Thrown when a role value cannot be turned into what the verb needs,
/// including a reference to a variable that was never stored.
public class ResolutionException extends Exception {
    @Serial private static final long serialVersionUID = 6628410393355202075L;

    public ResolutionException(String message) {
        super(message);
    }
}
