package com.ripple.resilience.config;

import com.ripple.resilience.fallback.CachedResponseFallbackProvider;
import com.ripple.resilience.fallback.FallbackProvider;
import com.ripple.resilience.fallback.StaticResponseFallbackProvider;
import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a dependency's fallback chain from configuration: the last-known-good cache
 * first, then the static default payload.
 */
@RequiredArgsConstructor
public class FallbackProviderFactory {

    private final ResilienceProperties properties;
    private final Clock clock;

    public List<FallbackProvider> create(String dependency) {
        ResilienceProperties.Fallback fallback = properties.fallbackFor(dependency);
        List<FallbackProvider> providers = new ArrayList<>();
        if (fallback.getCache().isEnabled()) {
            providers.add(new CachedResponseFallbackProvider(
                fallback.getCache().getTtl(), fallback.getCache().getMaxEntries(), clock));
        }
        if (fallback.getStaticResponse().isEnabled()) {
            providers.add(new StaticResponseFallbackProvider(
                fallback.getStaticResponse().getStatus(), fallback.getStaticResponse().getBody()));
        }
        return providers;
    }
}
