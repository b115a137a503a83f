package com.ripple.resilience.breaker;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of a breaker, taken under its lock.
 */
@Value
@Builder
public class CircuitBreakerSnapshot {
    String name;
    CircuitState state;
    int failureCount;
    int successCount;
    int totalCalls;
    int consecutiveSuccesses;
    boolean trialInFlight;
    Instant openedAt;
    Instant lastFailureAt;
}
