package com.ripple.resilience.breaker;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
