package com.ripple.resilience.config;

import com.ripple.resilience.breaker.MutableClock;
import com.ripple.resilience.client.CancellationPolicy;
import com.ripple.resilience.fallback.CachedResponseFallbackProvider;
import com.ripple.resilience.fallback.FallbackProvider;
import com.ripple.resilience.fallback.StaticResponseFallbackProvider;
import com.ripple.resilience.registry.DependencySettings;
import com.ripple.resilience.retry.JitterStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ResiliencePropertiesTest {

    private ResilienceProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ResilienceProperties();
        properties.getDefaults().setFailureThreshold(4);
        properties.getDefaults().setMaxRetries(2);
        properties.getDefaults().setJitter(JitterStrategy.EQUAL);

        ResilienceProperties.Dependency fraud = new ResilienceProperties.Dependency();
        fraud.setBaseUrl("http://fraud.internal");
        fraud.setServiceAuthSecret("s3cret");
        fraud.setReadTimeout(Duration.ofSeconds(10));
        fraud.setMaxRetries(0);
        fraud.setCancellationPolicy(CancellationPolicy.EXCLUDE);
        ResilienceProperties.Fallback fallback = new ResilienceProperties.Fallback();
        fallback.getStaticResponse().setBody("{\"risk_score\":50,\"requires_review\":true}");
        fraud.setFallback(fallback);
        properties.getDependencies().put("fraud-detection", fraud);
    }

    @Test
    void testSettingsFor_OverridesOnTopOfDefaults() {
        // When
        DependencySettings settings = properties.settingsFor("fraud-detection");

        // Then
        assertEquals(0, settings.getRetryPolicy().getMaxRetries());
        assertEquals(JitterStrategy.EQUAL, settings.getRetryPolicy().getJitterStrategy());
        assertEquals(4, settings.getCircuitBreaker().getFailureThreshold());
        assertEquals(Duration.ofSeconds(10), settings.getTimeouts().getReadTimeout());
        assertEquals(Duration.ofSeconds(5), settings.getTimeouts().getConnectTimeout());
        assertEquals(CancellationPolicy.EXCLUDE, settings.getCancellationPolicy());
        assertEquals("http://fraud.internal", settings.getBaseUrl());
        assertEquals("s3cret", settings.getServiceAuthSecret());
    }

    @Test
    void testSettingsFor_UndeclaredUsesDefaults() {
        // When
        DependencySettings settings = properties.settingsFor("search-service");

        // Then
        assertEquals(2, settings.getRetryPolicy().getMaxRetries());
        assertEquals(4, settings.getCircuitBreaker().getFailureThreshold());
        assertEquals(CancellationPolicy.RECORD_FAILURE, settings.getCancellationPolicy());
        assertNull(settings.getBaseUrl());
    }

    @Test
    void testFallbackProviderFactory_BuildsConfiguredChain() {
        // Given
        properties.getDefaults().getFallback().getCache().setEnabled(true);
        FallbackProviderFactory factory = new FallbackProviderFactory(properties,
            new MutableClock(Instant.parse("2024-01-01T00:00:00Z")));

        // When
        List<FallbackProvider> fraud = factory.create("fraud-detection");
        List<FallbackProvider> search = factory.create("search-service");

        // Then
        assertEquals(List.of(StaticResponseFallbackProvider.NAME), names(fraud));
        assertEquals(List.of(CachedResponseFallbackProvider.NAME), names(search));
    }

    private static List<String> names(List<FallbackProvider> providers) {
        return providers.stream().map(FallbackProvider::name).collect(Collectors.toList());
    }
}
