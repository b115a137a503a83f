package com.ripple.resilience.client;

import com.ripple.resilience.exception.PermanentException;
import com.ripple.resilience.exception.TransientException;
import com.ripple.resilience.model.DependencyRequest;
import com.ripple.resilience.model.DependencyResponse;
import com.ripple.resilience.retry.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * HTTP transport over {@link RestTemplate}.
 *
 * <p>Failures are classified for the retry policy:
 * <ul>
 *   <li>connect/read timeouts and refused connections ({@link ResourceAccessException}): transient</li>
 *   <li>statuses listed as retryable by the policy (408, 429, 5xx by default): transient</li>
 *   <li>any other 4xx: permanent</li>
 * </ul>
 *
 * <p>One {@link RestTemplate} is kept per timeout pair, since timeouts are fixed on the
 * request factory.
 */
@Slf4j
public class RestTemplateTransport implements Transport {

    public static final String SERVICE_AUTH_HEADER = "X-Service-Auth";
    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private static final Set<String> STRIPPED_HEADERS = Set.of("host", "content-length", "authorization");

    private final String dependency;
    private final String baseUrl;
    private final String serviceAuthSecret;
    private final RetryPolicy retryPolicy;
    private final Function<TimeoutConfig, RestTemplate> restTemplateFactory;
    private final Map<TimeoutConfig, RestTemplate> restTemplates = new ConcurrentHashMap<>();

    public RestTemplateTransport(String dependency, String baseUrl, String serviceAuthSecret,
                                 RetryPolicy retryPolicy, Function<TimeoutConfig, RestTemplate> restTemplateFactory) {
        this.dependency = dependency;
        this.baseUrl = baseUrl;
        this.serviceAuthSecret = serviceAuthSecret;
        this.retryPolicy = retryPolicy;
        this.restTemplateFactory = restTemplateFactory;
        if (baseUrl != null && (serviceAuthSecret == null || serviceAuthSecret.isBlank())) {
            log.warn("Service auth secret not configured for {}, calls are sent without X-Service-Auth", dependency);
        }
    }

    @Override
    public DependencyResponse send(DependencyRequest request, Duration connectTimeout, Duration readTimeout) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new PermanentException(dependency, "No base URL configured for " + dependency);
        }
        URI uri = buildUri(request);
        HttpMethod method = HttpMethod.resolve(request.getMethod().toUpperCase(Locale.ROOT));
        if (method == null) {
            throw new PermanentException(dependency, "Unsupported HTTP method: " + request.getMethod());
        }
        TimeoutConfig timeouts = TimeoutConfig.builder()
            .connectTimeout(connectTimeout)
            .readTimeout(readTimeout)
            .build();
        RestTemplate restTemplate = restTemplates.computeIfAbsent(timeouts, restTemplateFactory);

        try {
            log.debug("Calling {} {} {}", dependency, method, uri);
            ResponseEntity<String> response = restTemplate.exchange(uri, method,
                new HttpEntity<>(request.getBody(), buildHeaders(request)), String.class);
            return toResponse(response);
        } catch (RestClientResponseException e) {
            int status = e.getRawStatusCode();
            if (retryPolicy.isRetryableStatus(status) || status >= 500) {
                log.warn("Retryable status {} from {}", status, dependency);
                throw new TransientException(dependency,
                    "Error calling " + dependency + ": " + status + " " + e.getStatusText(), status, e);
            }
            log.warn("HTTP error calling {}: {} - {}", dependency, status, e.getStatusText());
            throw new PermanentException(dependency,
                "Error calling " + dependency + ": " + status + " " + e.getStatusText(), status, e);
        } catch (ResourceAccessException e) {
            log.warn("Timeout or connection error accessing {}: {}", dependency, e.getMessage());
            throw new TransientException(dependency, dependency + " is unavailable or slow: " + e.getMessage(), e);
        } catch (RestClientException e) {
            log.warn("Error calling {}: {}", dependency, e.getMessage());
            throw new TransientException(dependency, "Error calling " + dependency + ": " + e.getMessage(), e);
        }
    }

    private URI buildUri(DependencyRequest request) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl).path(request.getPath());
        request.getQueryParams().forEach(builder::queryParam);
        return builder.encode().build().toUri();
    }

    private HttpHeaders buildHeaders(DependencyRequest request) {
        HttpHeaders headers = new HttpHeaders();
        request.getHeaders().forEach((name, value) -> {
            if (!STRIPPED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                headers.set(name, value);
            }
        });
        if (request.getCorrelationId() != null) {
            headers.set(CORRELATION_ID_HEADER, request.getCorrelationId());
        }
        if (serviceAuthSecret != null && !serviceAuthSecret.isBlank()) {
            headers.set(SERVICE_AUTH_HEADER, serviceAuthSecret);
        }
        return headers;
    }

    private static DependencyResponse toResponse(ResponseEntity<String> response) {
        DependencyResponse.DependencyResponseBuilder builder = DependencyResponse.builder()
            .status(response.getStatusCodeValue())
            .body(response.getBody());
        if (response.getHeaders().getContentType() != null) {
            builder.header(HttpHeaders.CONTENT_TYPE, response.getHeaders().getContentType().toString());
        }
        return builder.build();
    }
}
