package com.ripple.resilience.fallback;

import com.ripple.resilience.model.DependencyRequest;
import com.ripple.resilience.model.DependencyResponse;

import java.util.Optional;

/**
 * Supplies a degraded response when the primary call path is exhausted.
 *
 * <p>Implementations are shared by every concurrent call to a dependency and must be
 * thread-safe. They should be fast and local; the resilience layer does not bound them.
 */
public interface FallbackProvider {

    String name();

    Optional<DependencyResponse> attempt(FallbackContext context);

    /**
     * Called after every fresh response from the dependency. Providers that serve
     * last-known-good data use this to refresh it.
     */
    default void onSuccess(DependencyRequest request, DependencyResponse response) {
    }
}
