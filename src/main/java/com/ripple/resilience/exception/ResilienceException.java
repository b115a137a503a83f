package com.ripple.resilience.exception;

import lombok.Getter;

/**
 * Base type for every error raised by the resilience layer.
 * Each error carries the name of the dependency it concerns.
 */
@Getter
public class ResilienceException extends RuntimeException {

    private final String dependency;

    public ResilienceException(String dependency, String message) {
        super(message);
        this.dependency = dependency;
    }

    public ResilienceException(String dependency, String message, Throwable cause) {
        super(message, cause);
        this.dependency = dependency;
    }
}
