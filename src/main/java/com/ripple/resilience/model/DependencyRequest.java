package com.ripple.resilience.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A call to a remote dependency, independent of how the transport encodes it.
 */
@Value
@Builder(toBuilder = true)
public class DependencyRequest {

    @Builder.Default
    String method = "GET";

    @Builder.Default
    String path = "/";

    @Singular
    Map<String, String> queryParams;

    @Singular
    Map<String, String> headers;

    String body;

    String correlationId;

    public boolean isIdempotentRead() {
        return "GET".equalsIgnoreCase(method) || "HEAD".equalsIgnoreCase(method);
    }
}
