package com.ripple.resilience.exception;

/**
 * No fallback provider produced a result. The cause is the terminal error of the primary call.
 */
public class FallbackExhaustedException extends ResilienceException {

    public FallbackExhaustedException(String dependency, Throwable originalError) {
        super(dependency, String.format("Dependency '%s' is unavailable and no fallback produced a result: %s",
            dependency, originalError.getMessage()), originalError);
    }
}
