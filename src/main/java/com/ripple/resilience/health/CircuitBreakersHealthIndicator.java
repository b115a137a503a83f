package com.ripple.resilience.health;

import com.ripple.resilience.breaker.CircuitBreakerSnapshot;
import com.ripple.resilience.breaker.CircuitState;
import com.ripple.resilience.registry.ResilienceRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reports breakers that are not closed. The service stays UP while breakers are open,
 * since calls are still answered by fallbacks.
 */
@Component
@RequiredArgsConstructor
public class CircuitBreakersHealthIndicator implements HealthIndicator {

    private final ResilienceRegistry registry;

    @Override
    public Health health() {
        Map<String, CircuitBreakerSnapshot> states = registry.listStates();
        List<String> open = states.values().stream()
            .filter(s -> s.getState() == CircuitState.OPEN)
            .map(CircuitBreakerSnapshot::getName)
            .collect(Collectors.toList());
        List<String> halfOpen = states.values().stream()
            .filter(s -> s.getState() == CircuitState.HALF_OPEN)
            .map(CircuitBreakerSnapshot::getName)
            .collect(Collectors.toList());

        return Health.up()
            .withDetail("breakers", states.size())
            .withDetail("open", open)
            .withDetail("halfOpen", halfOpen)
            .build();
    }
}
