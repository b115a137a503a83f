package com.ripple.resilience.fallback;

import com.ripple.resilience.breaker.CircuitState;
import com.ripple.resilience.model.DependencyRequest;
import lombok.Builder;
import lombok.Value;

/**
 * What a fallback provider knows about the failed call.
 */
@Value
@Builder
public class FallbackContext {
    String dependency;
    DependencyRequest request;
    Throwable error;
    int attempts;
    CircuitState circuitState;
}
