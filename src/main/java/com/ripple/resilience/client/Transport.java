package com.ripple.resilience.client;

import com.ripple.resilience.model.DependencyRequest;
import com.ripple.resilience.model.DependencyResponse;

import java.time.Duration;

/**
 * Performs one remote call, with no retry or breaker logic of its own.
 *
 * <p>Failures must be classified: {@link com.ripple.resilience.exception.TransientException}
 * for anything worth retrying, {@link com.ripple.resilience.exception.PermanentException}
 * otherwise.
 */
@FunctionalInterface
public interface Transport {

    DependencyResponse send(DependencyRequest request, Duration connectTimeout, Duration readTimeout);
}
