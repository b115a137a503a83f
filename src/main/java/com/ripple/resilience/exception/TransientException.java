package com.ripple.resilience.exception;

import java.util.OptionalInt;

/**
 * Retryable failure: timeout, connection failure or a server-side status.
 */
public class TransientException extends ResilienceException {

    private final Integer status;

    public TransientException(String dependency, String message) {
        this(dependency, message, null, null);
    }

    public TransientException(String dependency, String message, Throwable cause) {
        this(dependency, message, null, cause);
    }

    public TransientException(String dependency, String message, Integer status, Throwable cause) {
        super(dependency, message, cause);
        this.status = status;
    }

    public OptionalInt getStatus() {
        return status == null ? OptionalInt.empty() : OptionalInt.of(status);
    }
}
