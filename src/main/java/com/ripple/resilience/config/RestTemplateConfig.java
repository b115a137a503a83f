package com.ripple.resilience.config;

import com.ripple.resilience.client.RestTemplateTransportFactory;
import com.ripple.resilience.client.TransportFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * HTTP transport for dependencies. Connect and read timeouts are applied per dependency
 * from {@code resilience.*.connect-timeout} and {@code read-timeout}.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public TransportFactory transportFactory() {
        return new RestTemplateTransportFactory();
    }
}
