package com.ripple.resilience.breaker;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Thresholds for a single circuit breaker.
 *
 * <p>{@code failureThreshold} is an absolute number of failures among the last
 * {@code windowSize} recorded outcomes, not a ratio.
 */
@Value
public class CircuitBreakerConfig {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final int DEFAULT_SUCCESS_THRESHOLD = 2;
    public static final Duration DEFAULT_OPEN_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_WINDOW_SIZE = 100;

    int failureThreshold;
    int successThreshold;
    Duration openTimeout;
    int windowSize;

    @Builder(toBuilder = true)
    private CircuitBreakerConfig(Integer failureThreshold, Integer successThreshold,
                                 Duration openTimeout, Integer windowSize) {
        this.failureThreshold = failureThreshold != null ? failureThreshold : DEFAULT_FAILURE_THRESHOLD;
        this.successThreshold = successThreshold != null ? successThreshold : DEFAULT_SUCCESS_THRESHOLD;
        this.openTimeout = openTimeout != null ? openTimeout : DEFAULT_OPEN_TIMEOUT;
        this.windowSize = windowSize != null ? windowSize : DEFAULT_WINDOW_SIZE;

        if (this.failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        if (this.successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be at least 1");
        }
        if (this.windowSize < this.failureThreshold) {
            throw new IllegalArgumentException("windowSize must not be smaller than failureThreshold");
        }
        if (this.openTimeout.isNegative()) {
            throw new IllegalArgumentException("openTimeout must not be negative");
        }
    }

    public static CircuitBreakerConfig defaults() {
        return builder().build();
    }
}
