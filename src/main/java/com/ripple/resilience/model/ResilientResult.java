package com.ripple.resilience.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a protected call. Results served by a fallback provider are flagged as
 * degraded and name the provider in {@code source}.
 */
@Value
@Builder
public class ResilientResult {

    public static final String PRIMARY_SOURCE = "primary";

    DependencyResponse response;
    boolean degraded;
    String source;
    int attempts;

    public static ResilientResult fresh(DependencyResponse response, int attempts) {
        return new ResilientResult(response, false, PRIMARY_SOURCE, attempts);
    }

    public static ResilientResult degraded(DependencyResponse response, String provider, int attempts) {
        return new ResilientResult(response, true, provider, attempts);
    }
}
