package com.ripple.resilience.client;

import com.ripple.resilience.registry.DependencySettings;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Builds a {@link RestTemplateTransport} per dependency. Each {@link RestTemplate} gets its
 * own request factory carrying the attempt's connect and read timeouts.
 */
public class RestTemplateTransportFactory implements TransportFactory {

    @Override
    public Transport create(String dependency, DependencySettings settings) {
        return new RestTemplateTransport(
            dependency,
            settings.getBaseUrl(),
            settings.getServiceAuthSecret(),
            settings.getRetryPolicy(),
            RestTemplateTransportFactory::restTemplate);
    }

    static RestTemplate restTemplate(TimeoutConfig timeouts) {
        RestTemplate restTemplate = new RestTemplate();
        restTemplate.setRequestFactory(clientHttpRequestFactory(timeouts));
        return restTemplate;
    }

    private static ClientHttpRequestFactory clientHttpRequestFactory(TimeoutConfig timeouts) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) timeouts.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) timeouts.getReadTimeout().toMillis());
        return factory;
    }
}
