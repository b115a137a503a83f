package com.ripple.resilience.exception;

import java.util.OptionalInt;

/**
 * Non-retryable failure, typically a client-side or validation error.
 */
public class PermanentException extends ResilienceException {

    private final Integer status;

    public PermanentException(String dependency, String message) {
        this(dependency, message, null, null);
    }

    public PermanentException(String dependency, String message, Integer status, Throwable cause) {
        super(dependency, message, cause);
        this.status = status;
    }

    public OptionalInt getStatus() {
        return status == null ? OptionalInt.empty() : OptionalInt.of(status);
    }
}
