package com.ripple.resilience.registry;

import com.ripple.resilience.breaker.CircuitBreakerConfig;
import com.ripple.resilience.breaker.CircuitBreakerSnapshot;
import com.ripple.resilience.breaker.CircuitState;
import com.ripple.resilience.client.ResilientClient;
import com.ripple.resilience.client.Transport;
import com.ripple.resilience.client.TransportFactory;
import com.ripple.resilience.fallback.StaticResponseFallbackProvider;
import com.ripple.resilience.metrics.MetricsSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResilienceRegistryTest {

    @Mock
    private TransportFactory transportFactory;

    @Mock
    private Transport transport;

    @Mock
    private MetricsSink metricsSink;

    private ResilienceRegistry registry;

    @BeforeEach
    void setUp() {
        DependencySettings fraudSettings = DependencySettings.builder()
            .circuitBreaker(CircuitBreakerConfig.builder().failureThreshold(2).build())
            .baseUrl("http://fraud.internal")
            .build();
        registry = ResilienceRegistry.builder()
            .dependency("fraud-detection", fraudSettings,
                List.of(new StaticResponseFallbackProvider(200, "{\"risk_score\":50}")))
            .transportFactory(transportFactory)
            .metricsSink(metricsSink)
            .build();
    }

    @Test
    void testGet_CreatesEntryOnceAndReusesIt() {
        // Given
        when(transportFactory.create(eq("search-service"), any())).thenReturn(transport);

        // When
        ResilientClient first = registry.get("search-service");
        ResilientClient second = registry.get("search-service");

        // Then
        assertSame(first, second);
        assertSame(first.getBreaker(), second.getBreaker());
        verify(transportFactory, times(1)).create(eq("search-service"), any());
    }

    @Test
    void testGet_AppliesOverridesOrDefaults() {
        // Given
        when(transportFactory.create(any(), any())).thenReturn(transport);

        // When
        ResilientClient fraud = registry.get("fraud-detection");
        ResilientClient search = registry.get("search-service");

        // Then
        assertEquals(2, fraud.getBreaker().getConfig().getFailureThreshold());
        assertEquals(StaticResponseFallbackProvider.NAME, fraud.getFallbackChain().getProviders().get(0).name());
        assertEquals(CircuitBreakerConfig.DEFAULT_FAILURE_THRESHOLD, search.getBreaker().getConfig().getFailureThreshold());
        assertTrue(search.getFallbackChain().getProviders().isEmpty());
        assertTrue(registry.isDeclared("fraud-detection"));
        assertFalse(registry.isDeclared("search-service"));
        verify(transportFactory).create(eq("fraud-detection"), eq(registry.settingsFor("fraud-detection")));
    }

    @Test
    void testListStates_SortedByName() {
        // Given
        when(transportFactory.create(any(), any())).thenReturn(transport);
        registry.get("search-service");
        registry.get("auth-service");
        registry.get("fraud-detection");

        // When
        SortedMap<String, CircuitBreakerSnapshot> states = registry.listStates();

        // Then
        assertEquals(List.of("auth-service", "fraud-detection", "search-service"), List.copyOf(states.keySet()));
        assertTrue(states.values().stream().allMatch(s -> s.getState() == CircuitState.CLOSED));
    }

    @Test
    void testReset_ClosesOpenBreakerAndIsIdempotent() {
        // Given
        when(transportFactory.create(any(), any())).thenReturn(transport);
        ResilientClient client = registry.get("fraud-detection");
        client.getBreaker().recordFailure();
        client.getBreaker().recordFailure();
        assertEquals(CircuitState.OPEN, client.getBreaker().getState());

        // When
        boolean first = registry.reset("fraud-detection");
        boolean second = registry.reset("fraud-detection");

        // Then
        assertTrue(first);
        assertTrue(second);
        CircuitBreakerSnapshot snapshot = registry.find("fraud-detection").orElseThrow();
        assertEquals(CircuitState.CLOSED, snapshot.getState());
        assertEquals(0, snapshot.getFailureCount());
    }

    @Test
    void testReset_UnknownDependencyIsNoOp() {
        assertFalse(registry.reset("unknown-service"));
        assertTrue(registry.find("unknown-service").isEmpty());
        assertTrue(registry.listStates().isEmpty());
    }

    @Test
    void testStateChange_EmitsMetric() {
        // Given
        when(transportFactory.create(any(), any())).thenReturn(transport);
        ResilientClient client = registry.get("fraud-detection");

        // When
        client.getBreaker().recordFailure();
        client.getBreaker().recordFailure();

        // Then
        verify(metricsSink).increment(MetricsSink.STATE_CHANGES,
            Map.of("dependency", "fraud-detection", "state", "open"));
    }
}
