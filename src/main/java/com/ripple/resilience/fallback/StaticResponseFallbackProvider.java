package com.ripple.resilience.fallback;

import com.ripple.resilience.model.DependencyResponse;

import java.util.Optional;

/**
 * Always answers with the same configured payload, typically a safe default.
 */
public class StaticResponseFallbackProvider implements FallbackProvider {

    public static final String NAME = "static";

    private final DependencyResponse response;

    public StaticResponseFallbackProvider(int status, String body) {
        this.response = DependencyResponse.builder()
            .status(status)
            .header("Content-Type", "application/json")
            .body(body)
            .build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<DependencyResponse> attempt(FallbackContext context) {
        return Optional.of(response);
    }
}
