package com.ripple.resilience.service;

import com.ripple.resilience.exception.UnknownDependencyException;
import com.ripple.resilience.model.DependencyRequest;
import com.ripple.resilience.model.ResilientResult;
import com.ripple.resilience.registry.ResilienceRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Forwards calls to declared dependencies through their resilient clients.
 *
 * <p>Thread-Safety: stateless apart from the injected registry, which is safe for
 * concurrent use. Each request runs on its own servlet thread, so a caller waiting on a
 * slow dependency or a retry backoff never holds up other callers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProxyService {

    private final ResilienceRegistry registry;

    /**
     * @throws UnknownDependencyException if the dependency was not declared in configuration
     */
    public ResilientResult forward(String dependency, DependencyRequest request) {
        if (!registry.isDeclared(dependency)) {
            throw new UnknownDependencyException(dependency);
        }
        log.info("Proxying {} {} to {} [correlationId={}]",
            request.getMethod(), request.getPath(), dependency, request.getCorrelationId());

        ResilientResult result = registry.get(dependency).execute(request);

        if (result.isDegraded()) {
            log.warn("Served degraded response for {} from '{}' [correlationId={}]",
                dependency, result.getSource(), request.getCorrelationId());
        } else {
            log.info("Successful proxy to {}: {} after {} attempts",
                dependency, result.getResponse().getStatus(), result.getAttempts());
        }
        return result;
    }
}
