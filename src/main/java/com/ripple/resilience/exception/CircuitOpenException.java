package com.ripple.resilience.exception;

import com.ripple.resilience.breaker.CircuitState;
import lombok.Getter;

/**
 * Admission was denied by the circuit breaker before any call was attempted.
 */
@Getter
public class CircuitOpenException extends ResilienceException {

    private final CircuitState state;

    public CircuitOpenException(String dependency, CircuitState state, Throwable lastError) {
        super(dependency, String.format("Circuit breaker '%s' is %s, request rejected", dependency, state), lastError);
        this.state = state;
    }
}
