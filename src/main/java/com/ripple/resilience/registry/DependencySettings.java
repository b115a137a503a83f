package com.ripple.resilience.registry;

import com.ripple.resilience.breaker.CircuitBreakerConfig;
import com.ripple.resilience.client.CancellationPolicy;
import com.ripple.resilience.client.TimeoutConfig;
import com.ripple.resilience.retry.RetryPolicy;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the registry needs to build the resilient client of one dependency.
 */
@Value
@Builder(toBuilder = true)
public class DependencySettings {

    @Builder.Default
    CircuitBreakerConfig circuitBreaker = CircuitBreakerConfig.defaults();

    @Builder.Default
    RetryPolicy retryPolicy = RetryPolicy.defaults();

    @Builder.Default
    TimeoutConfig timeouts = TimeoutConfig.defaults();

    @Builder.Default
    CancellationPolicy cancellationPolicy = CancellationPolicy.RECORD_FAILURE;

    /** Root URL of the dependency; only needed by HTTP transports. */
    String baseUrl;

    /** Sent as {@code X-Service-Auth} on every outgoing call when set. */
    String serviceAuthSecret;

    public static DependencySettings defaults() {
        return builder().build();
    }
}
