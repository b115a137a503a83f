package com.ripple.resilience.controller;

import com.ripple.resilience.breaker.CircuitBreakerSnapshot;
import com.ripple.resilience.exception.UnknownDependencyException;
import com.ripple.resilience.registry.ResilienceRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Operator view of the circuit breakers, with manual reset for recovery.
 */
@RestController
@RequestMapping("/api/circuit-breakers")
@RequiredArgsConstructor
@Slf4j
public class CircuitBreakerController {

    private final ResilienceRegistry registry;

    @GetMapping
    public ResponseEntity<Map<String, CircuitBreakerSnapshot>> listStates() {
        log.debug("Retrieving all circuit breaker states");
        return ResponseEntity.ok(registry.listStates());
    }

    @GetMapping("/{name}")
    public ResponseEntity<CircuitBreakerSnapshot> getState(@PathVariable String name) {
        return ResponseEntity.ok(registry.find(name)
            .orElseThrow(() -> new UnknownDependencyException(name)));
    }

    @PostMapping("/{name}/reset")
    public ResponseEntity<CircuitBreakerSnapshot> reset(@PathVariable String name) {
        log.info("Reset requested for circuit breaker {}", name);
        if (!registry.reset(name)) {
            throw new UnknownDependencyException(name);
        }
        return ResponseEntity.ok(registry.find(name)
            .orElseThrow(() -> new UnknownDependencyException(name)));
    }
}
