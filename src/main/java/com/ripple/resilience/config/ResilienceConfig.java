package com.ripple.resilience.config;

import com.ripple.resilience.client.TransportFactory;
import com.ripple.resilience.metrics.MetricsSink;
import com.ripple.resilience.metrics.MicrometerMetricsSink;
import com.ripple.resilience.registry.ResilienceRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the resilience layer: one {@link ResilienceRegistry} for the process, fed by
 * {@link ResilienceProperties}, reporting to Micrometer.
 *
 * <p>The registry is the single owner of every circuit breaker. Components that call
 * remote dependencies get it injected and ask it for the client of a dependency by name.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ResilienceProperties.class)
public class ResilienceConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricsSink metricsSink(MeterRegistry meterRegistry) {
        return new MicrometerMetricsSink(meterRegistry);
    }

    @Bean
    public FallbackProviderFactory fallbackProviderFactory(ResilienceProperties properties, Clock clock) {
        return new FallbackProviderFactory(properties, clock);
    }

    @Bean
    public ResilienceRegistry resilienceRegistry(ResilienceProperties properties,
                                                 TransportFactory transportFactory,
                                                 FallbackProviderFactory fallbackProviderFactory,
                                                 MetricsSink metricsSink,
                                                 Clock clock) {
        ResilienceRegistry.Builder builder = ResilienceRegistry.builder()
            .defaults(properties.defaultSettings())
            .defaultFallbacks(fallbackProviderFactory::create)
            .transportFactory(transportFactory)
            .metricsSink(metricsSink)
            .clock(clock);
        properties.getDependencies().keySet().forEach(name ->
            builder.dependency(name, properties.settingsFor(name), fallbackProviderFactory.create(name)));

        ResilienceRegistry registry = builder.build();
        // declared dependencies are visible on the control surface before their first call
        registry.declaredDependencies().forEach(registry::get);
        log.info("Resilience registry configured with dependencies {}", registry.declaredDependencies());
        return registry;
    }
}
