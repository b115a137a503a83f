package com.ripple.resilience.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link MetricsSink} backed by a Micrometer {@link MeterRegistry}. Counters map to
 * {@link Counter}s and histograms to {@link DistributionSummary}s.
 */
@Slf4j
@RequiredArgsConstructor
public class MicrometerMetricsSink implements MetricsSink {

    private final MeterRegistry meterRegistry;

    @Override
    public void increment(String counterName, Map<String, String> labels) {
        try {
            Counter.builder(counterName)
                .tags(toTags(labels))
                .register(meterRegistry)
                .increment();
        } catch (RuntimeException e) {
            log.debug("Failed to increment counter {}: {}", counterName, e.getMessage());
        }
    }

    @Override
    public void observe(String histogramName, double value, Map<String, String> labels) {
        try {
            DistributionSummary.builder(histogramName)
                .baseUnit("seconds")
                .tags(toTags(labels))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(value);
        } catch (RuntimeException e) {
            log.debug("Failed to record histogram {}: {}", histogramName, e.getMessage());
        }
    }

    private static Tags toTags(Map<String, String> labels) {
        return Tags.of(labels.entrySet().stream()
            .map(e -> Tag.of(e.getKey(), e.getValue()))
            .collect(Collectors.toList()));
    }
}
