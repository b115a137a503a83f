package com.ripple.resilience.metrics;

/**
 * Terminal outcome of one protected call, used as the {@code outcome} metric label.
 */
public enum CallOutcome {
    SUCCESS("success"),
    FAILURE("failure"),
    CIRCUIT_OPEN("circuit_open"),
    FALLBACK_USED("fallback_used");

    private final String label;

    CallOutcome(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
