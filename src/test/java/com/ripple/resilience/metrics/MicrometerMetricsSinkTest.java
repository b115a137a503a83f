package com.ripple.resilience.metrics;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsSinkTest {

    private MeterRegistry meterRegistry;
    private MicrometerMetricsSink sink;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        sink = new MicrometerMetricsSink(meterRegistry);
    }

    @Test
    void testIncrement_CountsPerLabelSet() {
        // When
        sink.increment(MetricsSink.REQUESTS, Map.of("dependency", "fraud-detection", "outcome", "success"));
        sink.increment(MetricsSink.REQUESTS, Map.of("dependency", "fraud-detection", "outcome", "success"));
        sink.increment(MetricsSink.REQUESTS, Map.of("dependency", "fraud-detection", "outcome", "fallback_used"));

        // Then
        assertEquals(2.0, meterRegistry.get(MetricsSink.REQUESTS)
            .tags("dependency", "fraud-detection", "outcome", "success").counter().count());
        assertEquals(1.0, meterRegistry.get(MetricsSink.REQUESTS)
            .tags("outcome", "fallback_used").counter().count());
    }

    @Test
    void testObserve_RecordsDuration() {
        // When
        sink.observe(MetricsSink.REQUEST_DURATION, 0.25, Map.of("dependency", "fraud-detection", "outcome", "success"));
        sink.observe(MetricsSink.REQUEST_DURATION, 0.75, Map.of("dependency", "fraud-detection", "outcome", "success"));

        // Then
        DistributionSummary summary = meterRegistry.get(MetricsSink.REQUEST_DURATION)
            .tag("dependency", "fraud-detection").summary();
        assertEquals(2, summary.count());
        assertEquals(1.0, summary.totalAmount(), 1e-9);
    }

    @Test
    void testIncrement_ConflictingMeterTypeIsSwallowed() {
        // Given
        sink.observe("resilience.conflict", 1.0, Map.of());

        // When & Then
        assertDoesNotThrow(() -> sink.increment("resilience.conflict", Map.of()));
    }
}
