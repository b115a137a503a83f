package com.ripple.resilience.registry;

import com.ripple.resilience.breaker.CircuitBreaker;
import com.ripple.resilience.breaker.CircuitBreakerSnapshot;
import com.ripple.resilience.breaker.StateTransitionListener;
import com.ripple.resilience.client.BackoffSleeper;
import com.ripple.resilience.client.ResilientClient;
import com.ripple.resilience.client.TransportFactory;
import com.ripple.resilience.fallback.FallbackChain;
import com.ripple.resilience.fallback.FallbackProvider;
import com.ripple.resilience.metrics.MetricsSink;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Owns one circuit breaker, retry policy, fallback chain and timeout budget per named
 * dependency, and hands out the {@link ResilientClient} bound to them.
 *
 * <p>Entries are created on first lookup and live as long as the registry. Settings come
 * from the overrides supplied at construction, or the defaults otherwise. The only runtime
 * mutation is {@link #reset(String)}.
 */
@Slf4j
public class ResilienceRegistry {

    private final DependencySettings defaults;
    private final Map<String, DependencySettings> overrides;
    private final Map<String, List<FallbackProvider>> fallbacks;
    private final Function<String, List<FallbackProvider>> defaultFallbacks;
    private final TransportFactory transportFactory;
    private final MetricsSink metricsSink;
    private final Clock clock;
    private final BackoffSleeper sleeper;
    private final ConcurrentHashMap<String, ResilientClient> clients = new ConcurrentHashMap<>();

    private ResilienceRegistry(Builder builder) {
        this.defaults = builder.defaults;
        this.overrides = Map.copyOf(builder.overrides);
        this.fallbacks = Map.copyOf(builder.fallbacks);
        this.defaultFallbacks = builder.defaultFallbacks;
        this.transportFactory = Objects.requireNonNull(builder.transportFactory, "transportFactory must not be null");
        this.metricsSink = builder.metricsSink;
        this.clock = builder.clock;
        this.sleeper = builder.sleeper;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the client bound to {@code dependency}, creating its entry if needed.
     */
    public ResilientClient get(String dependency) {
        Objects.requireNonNull(dependency, "dependency must not be null");
        return clients.computeIfAbsent(dependency, this::createClient);
    }

    /**
     * Whether the dependency was configured explicitly rather than created with defaults.
     */
    public boolean isDeclared(String dependency) {
        return overrides.containsKey(dependency);
    }

    public Set<String> declaredDependencies() {
        return overrides.keySet();
    }

    public DependencySettings settingsFor(String dependency) {
        return overrides.getOrDefault(dependency, defaults);
    }

    public SortedMap<String, CircuitBreakerSnapshot> listStates() {
        SortedMap<String, CircuitBreakerSnapshot> states = new TreeMap<>();
        clients.forEach((name, client) -> states.put(name, client.getBreaker().snapshot()));
        return Collections.unmodifiableSortedMap(states);
    }

    public Optional<CircuitBreakerSnapshot> find(String dependency) {
        return Optional.ofNullable(clients.get(dependency)).map(client -> client.getBreaker().snapshot());
    }

    /**
     * Forces the named breaker to {@code CLOSED}, whatever its prior state.
     *
     * @return {@code false} if no entry exists for the dependency, in which case nothing happens
     */
    public boolean reset(String dependency) {
        ResilientClient client = clients.get(dependency);
        if (client == null) {
            log.debug("Reset requested for unknown dependency {}", dependency);
            return false;
        }
        client.getBreaker().reset();
        return true;
    }

    private ResilientClient createClient(String dependency) {
        DependencySettings settings = settingsFor(dependency);
        List<FallbackProvider> providers = fallbacks.containsKey(dependency)
            ? fallbacks.get(dependency)
            : defaultFallbacks.apply(dependency);

        CircuitBreaker breaker = new CircuitBreaker(dependency, settings.getCircuitBreaker(), clock, stateChangeEmitter());
        log.info("Registering dependency {} (declared={}, fallbacks={})",
            dependency, isDeclared(dependency), providers.stream().map(FallbackProvider::name).collect(Collectors.toList()));

        return ResilientClient.builder()
            .dependency(dependency)
            .breaker(breaker)
            .retryPolicy(settings.getRetryPolicy())
            .fallbackChain(new FallbackChain(providers))
            .timeoutConfig(settings.getTimeouts())
            .transport(transportFactory.create(dependency, settings))
            .metricsSink(metricsSink)
            .sleeper(sleeper)
            .cancellationPolicy(settings.getCancellationPolicy())
            .build();
    }

    private StateTransitionListener stateChangeEmitter() {
        return (name, from, to) -> {
            log.info("Circuit breaker '{}' changed state {} -> {}", name, from, to);
            metricsSink.increment(MetricsSink.STATE_CHANGES,
                Map.of("dependency", name, "state", to.name().toLowerCase(Locale.ROOT)));
        };
    }

    public static final class Builder {
        private DependencySettings defaults = DependencySettings.defaults();
        private final Map<String, DependencySettings> overrides = new HashMap<>();
        private final Map<String, List<FallbackProvider>> fallbacks = new HashMap<>();
        private Function<String, List<FallbackProvider>> defaultFallbacks = dependency -> List.of();
        private TransportFactory transportFactory;
        private MetricsSink metricsSink = MetricsSink.NOOP;
        private Clock clock = Clock.systemUTC();
        private BackoffSleeper sleeper = BackoffSleeper.THREAD_SLEEP;

        private Builder() {
        }

        public Builder defaults(DependencySettings defaults) {
            this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
            return this;
        }

        public Builder dependency(String name, DependencySettings settings) {
            return dependency(name, settings, null);
        }

        /**
         * Declares a dependency with its own settings. A {@code null} provider list means the
         * default fallbacks apply.
         */
        public Builder dependency(String name, DependencySettings settings, List<FallbackProvider> providers) {
            Objects.requireNonNull(name, "name must not be null");
            overrides.put(name, Objects.requireNonNull(settings, "settings must not be null"));
            if (providers != null) {
                fallbacks.put(name, List.copyOf(providers));
            }
            return this;
        }

        public Builder defaultFallbacks(Function<String, List<FallbackProvider>> defaultFallbacks) {
            this.defaultFallbacks = Objects.requireNonNull(defaultFallbacks, "defaultFallbacks must not be null");
            return this;
        }

        public Builder transportFactory(TransportFactory transportFactory) {
            this.transportFactory = transportFactory;
            return this;
        }

        public Builder metricsSink(MetricsSink metricsSink) {
            this.metricsSink = Objects.requireNonNull(metricsSink, "metricsSink must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder sleeper(BackoffSleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public ResilienceRegistry build() {
            return new ResilienceRegistry(this);
        }
    }
}
