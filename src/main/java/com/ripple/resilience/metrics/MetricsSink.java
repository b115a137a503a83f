package com.ripple.resilience.metrics;

import java.util.Map;

/**
 * Fire-and-forget metrics emission. Implementations must never throw into the call path.
 */
public interface MetricsSink {

    String REQUESTS = "resilience.requests";
    String REQUEST_DURATION = "resilience.request.duration";
    String RETRIES = "resilience.retries";
    String ATTEMPT_FAILURES = "resilience.attempt.failures";
    String STATE_CHANGES = "resilience.state.changes";

    MetricsSink NOOP = new MetricsSink() {
        @Override
        public void increment(String counterName, Map<String, String> labels) {
        }

        @Override
        public void observe(String histogramName, double value, Map<String, String> labels) {
        }
    };

    void increment(String counterName, Map<String, String> labels);

    void observe(String histogramName, double value, Map<String, String> labels);
}
