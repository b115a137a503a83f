package com.ripple.resilience.controller;

import com.ripple.resilience.client.TransportFactory;
import com.ripple.resilience.exception.TransientException;
import com.ripple.resilience.model.DependencyRequest;
import com.ripple.resilience.model.DependencyResponse;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Replaces the HTTP transport with one whose answers are set per test.
 */
@TestConfiguration
public class StubTransportConfiguration {

    @Bean
    public StubTransport stubTransport() {
        return new StubTransport();
    }

    @Bean
    @Primary
    public TransportFactory stubTransportFactory(StubTransport stubTransport) {
        return (dependency, settings) -> (request, connectTimeout, readTimeout) ->
            stubTransport.handle(dependency, request);
    }

    public static class StubTransport {
        private final Map<String, Function<DependencyRequest, DependencyResponse>> behaviors = new ConcurrentHashMap<>();
        private final List<DependencyRequest> received = new CopyOnWriteArrayList<>();

        public void respond(String dependency, Function<DependencyRequest, DependencyResponse> behavior) {
            behaviors.put(dependency, behavior);
        }

        public void fail(String dependency, int status) {
            respond(dependency, request -> {
                throw new TransientException(dependency, "Error calling " + dependency + ": " + status, status, null);
            });
        }

        public List<DependencyRequest> received() {
            return received;
        }

        public void clear() {
            behaviors.clear();
            received.clear();
        }

        private DependencyResponse handle(String dependency, DependencyRequest request) {
            received.add(request);
            Function<DependencyRequest, DependencyResponse> behavior = behaviors.get(dependency);
            if (behavior == null) {
                throw new TransientException(dependency, dependency + " is unavailable or slow: connection refused");
            }
            return behavior.apply(request);
        }
    }
}
