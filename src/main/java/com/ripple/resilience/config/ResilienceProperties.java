package com.ripple.resilience.config;

import com.ripple.resilience.breaker.CircuitBreakerConfig;
import com.ripple.resilience.client.CancellationPolicy;
import com.ripple.resilience.client.TimeoutConfig;
import com.ripple.resilience.registry.DependencySettings;
import com.ripple.resilience.retry.JitterStrategy;
import com.ripple.resilience.retry.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Resilience settings bound from {@code resilience.*}.
 *
 * <p>{@code resilience.defaults.*} applies to every dependency. Each entry under
 * {@code resilience.dependencies.<name>.*} declares a dependency; any field it leaves
 * unset is inherited from the defaults.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "resilience")
public class ResilienceProperties {

    @Valid
    @NotNull
    private Defaults defaults = new Defaults();

    @Valid
    private Map<String, Dependency> dependencies = new LinkedHashMap<>();

    public DependencySettings defaultSettings() {
        return resolve(new Dependency());
    }

    public DependencySettings settingsFor(String name) {
        return resolve(dependencies.getOrDefault(name, new Dependency()));
    }

    public Fallback fallbackFor(String name) {
        Dependency dependency = dependencies.get(name);
        if (dependency == null || dependency.getFallback() == null) {
            return defaults.getFallback();
        }
        return dependency.getFallback();
    }

    private DependencySettings resolve(Dependency dependency) {
        CircuitBreakerConfig breaker = CircuitBreakerConfig.builder()
            .failureThreshold(pick(dependency.getFailureThreshold(), defaults.getFailureThreshold()))
            .successThreshold(pick(dependency.getSuccessThreshold(), defaults.getSuccessThreshold()))
            .openTimeout(pick(dependency.getOpenTimeout(), defaults.getOpenTimeout()))
            .windowSize(pick(dependency.getWindowSize(), defaults.getWindowSize()))
            .build();

        RetryPolicy retryPolicy = RetryPolicy.builder()
            .maxRetries(pick(dependency.getMaxRetries(), defaults.getMaxRetries()))
            .baseDelay(pick(dependency.getBaseDelay(), defaults.getBaseDelay()))
            .maxDelay(pick(dependency.getMaxDelay(), defaults.getMaxDelay()))
            .jitterStrategy(pick(dependency.getJitter(), defaults.getJitter()))
            .retryableStatuses(pick(dependency.getRetryableStatuses(), defaults.getRetryableStatuses()))
            .build();

        TimeoutConfig timeouts = TimeoutConfig.builder()
            .connectTimeout(pick(dependency.getConnectTimeout(), defaults.getConnectTimeout()))
            .readTimeout(pick(dependency.getReadTimeout(), defaults.getReadTimeout()))
            .build();

        return DependencySettings.builder()
            .circuitBreaker(breaker)
            .retryPolicy(retryPolicy)
            .timeouts(timeouts)
            .cancellationPolicy(pick(dependency.getCancellationPolicy(), defaults.getCancellationPolicy()))
            .baseUrl(dependency.getBaseUrl())
            .serviceAuthSecret(dependency.getServiceAuthSecret())
            .build();
    }

    private static <T> T pick(T override, T fallback) {
        return override != null ? override : fallback;
    }

    @Data
    public static class Defaults {
        @Min(1)
        private int failureThreshold = CircuitBreakerConfig.DEFAULT_FAILURE_THRESHOLD;

        @Min(1)
        private int successThreshold = CircuitBreakerConfig.DEFAULT_SUCCESS_THRESHOLD;

        @NotNull
        private Duration openTimeout = CircuitBreakerConfig.DEFAULT_OPEN_TIMEOUT;

        @Min(1)
        private int windowSize = CircuitBreakerConfig.DEFAULT_WINDOW_SIZE;

        @Min(0)
        private int maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;

        @NotNull
        private Duration baseDelay = RetryPolicy.DEFAULT_BASE_DELAY;

        @NotNull
        private Duration maxDelay = RetryPolicy.DEFAULT_MAX_DELAY;

        @NotNull
        private JitterStrategy jitter = JitterStrategy.FULL;

        @NotNull
        private Set<Integer> retryableStatuses = new LinkedHashSet<>(RetryPolicy.DEFAULT_RETRYABLE_STATUSES);

        @NotNull
        private Duration connectTimeout = TimeoutConfig.DEFAULT_CONNECT_TIMEOUT;

        @NotNull
        private Duration readTimeout = TimeoutConfig.DEFAULT_READ_TIMEOUT;

        @NotNull
        private CancellationPolicy cancellationPolicy = CancellationPolicy.RECORD_FAILURE;

        @Valid
        @NotNull
        private Fallback fallback = new Fallback();
    }

    /**
     * Per-dependency overrides. {@code null} means "inherit the default".
     */
    @Data
    public static class Dependency {
        private String baseUrl;
        private String serviceAuthSecret;

        @Min(1)
        private Integer failureThreshold;

        @Min(1)
        private Integer successThreshold;

        private Duration openTimeout;

        @Min(1)
        private Integer windowSize;

        @Min(0)
        private Integer maxRetries;

        private Duration baseDelay;
        private Duration maxDelay;
        private JitterStrategy jitter;
        private Set<Integer> retryableStatuses;
        private Duration connectTimeout;
        private Duration readTimeout;
        private CancellationPolicy cancellationPolicy;

        @Valid
        private Fallback fallback;
    }

    @Data
    public static class Fallback {
        @Valid
        @NotNull
        private Cache cache = new Cache();

        @Valid
        @NotNull
        private StaticResponse staticResponse = new StaticResponse();
    }

    @Data
    public static class Cache {
        private boolean enabled = false;

        @NotNull
        private Duration ttl = Duration.ofHours(1);

        @Min(1)
        private int maxEntries = 1000;
    }

    @Data
    public static class StaticResponse {
        @Min(100)
        private int status = 200;

        /** Payload returned when everything else failed. Disabled while unset. */
        private String body;

        public boolean isEnabled() {
            return body != null;
        }
    }
}
