package com.ripple.resilience.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder(toBuilder = true)
public class DependencyResponse {

    int status;

    @Singular
    Map<String, String> headers;

    String body;

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}
