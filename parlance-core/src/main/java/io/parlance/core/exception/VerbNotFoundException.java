package io.parlance.core.exception;

import java.io.Serial;

public class VerbNotFoundException extends Exception {
    @Serial private static final long serialVersionUID = 4127705317962810354L;

    public VerbNotFoundException(String message) {
        super(message);
    }
}
