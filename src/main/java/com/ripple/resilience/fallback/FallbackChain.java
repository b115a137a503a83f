package com.ripple.resilience.fallback;

import com.ripple.resilience.exception.FallbackExhaustedException;
import com.ripple.resilience.model.DependencyRequest;
import com.ripple.resilience.model.DependencyResponse;
import com.ripple.resilience.model.ResilientResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Ordered list of fallback providers. The first provider that returns a response wins;
 * a provider that throws is treated as having no result.
 */
@Slf4j
public class FallbackChain {

    private final List<FallbackProvider> providers;

    public FallbackChain(List<FallbackProvider> providers) {
        this.providers = providers == null ? List.of() : List.copyOf(providers);
    }

    public static FallbackChain empty() {
        return new FallbackChain(List.of());
    }

    public List<FallbackProvider> getProviders() {
        return providers;
    }

    /**
     * @return a degraded result from the first provider that produced one
     * @throws FallbackExhaustedException wrapping the original error if none did
     */
    public ResilientResult resolve(FallbackContext context) {
        for (FallbackProvider provider : providers) {
            Optional<DependencyResponse> response;
            try {
                response = provider.attempt(context);
            } catch (RuntimeException e) {
                log.warn("Fallback provider '{}' failed for {}: {}",
                    provider.name(), context.getDependency(), e.getMessage(), e);
                continue;
            }
            if (response != null && response.isPresent()) {
                log.warn("Using fallback '{}' for {}: {}",
                    provider.name(), context.getDependency(), context.getError().getMessage());
                return ResilientResult.degraded(response.get(), provider.name(), context.getAttempts());
            }
            log.debug("Fallback provider '{}' had no result for {}", provider.name(), context.getDependency());
        }
        throw new FallbackExhaustedException(context.getDependency(), context.getError());
    }

    public void onSuccess(DependencyRequest request, DependencyResponse response) {
        for (FallbackProvider provider : providers) {
            try {
                provider.onSuccess(request, response);
            } catch (RuntimeException e) {
                log.warn("Fallback provider '{}' failed to record a fresh response: {}",
                    provider.name(), e.getMessage(), e);
            }
        }
    }
}
