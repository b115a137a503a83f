package com.ripple.resilience.breaker;

@FunctionalInterface
public interface StateTransitionListener {

    StateTransitionListener NONE = (name, from, to) -> { };

    void onTransition(String breakerName, CircuitState from, CircuitState to);
}
