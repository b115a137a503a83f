package com.ripple.resilience.client;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Per-attempt timeout budget handed to the transport.
 */
@Value
public class TimeoutConfig {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);

    Duration connectTimeout;
    Duration readTimeout;

    @Builder(toBuilder = true)
    private TimeoutConfig(Duration connectTimeout, Duration readTimeout) {
        this.connectTimeout = connectTimeout != null ? connectTimeout : DEFAULT_CONNECT_TIMEOUT;
        this.readTimeout = readTimeout != null ? readTimeout : DEFAULT_READ_TIMEOUT;
        if (this.connectTimeout.isNegative() || this.connectTimeout.isZero()
            || this.readTimeout.isNegative() || this.readTimeout.isZero()) {
            throw new IllegalArgumentException("timeouts must be positive");
        }
    }

    public static TimeoutConfig defaults() {
        return builder().build();
    }
}
