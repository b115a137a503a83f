package com.ripple.resilience.controller;

import com.ripple.resilience.client.RestTemplateTransport;
import com.ripple.resilience.model.DependencyRequest;
import com.ripple.resilience.model.DependencyResponse;
import com.ripple.resilience.model.ResilientResult;
import com.ripple.resilience.service.ProxyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriUtils;

import javax.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;

/**
 * Routes {@code /api/proxy/{dependency}/**} to the dependency through its resilient client.
 * Degraded responses are flagged with {@code X-Degraded: true}.
 */
@RestController
@RequestMapping("/api/proxy")
@RequiredArgsConstructor
@Slf4j
public class ProxyController {

    public static final String DEGRADED_HEADER = "X-Degraded";
    public static final String SERVED_BY_HEADER = "X-Served-By";

    private final ProxyService proxyService;

    @RequestMapping("/{dependency}/**")
    public ResponseEntity<String> proxy(@PathVariable String dependency,
                                        @RequestParam Map<String, String> queryParams,
                                        @RequestHeader HttpHeaders headers,
                                        @RequestBody(required = false) String body,
                                        HttpServletRequest request) {
        String correlationId = headers.getFirst(RestTemplateTransport.CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        DependencyRequest dependencyRequest = DependencyRequest.builder()
            .method(request.getMethod())
            .path(remainingPath(request, dependency))
            .queryParams(queryParams)
            .headers(headers.toSingleValueMap())
            .body(body)
            .correlationId(correlationId)
            .build();

        ResilientResult result = proxyService.forward(dependency, dependencyRequest);
        DependencyResponse response = result.getResponse();

        HttpHeaders responseHeaders = new HttpHeaders();
        response.getHeaders().forEach(responseHeaders::set);
        responseHeaders.set(DEGRADED_HEADER, String.valueOf(result.isDegraded()));
        responseHeaders.set(SERVED_BY_HEADER, result.getSource());
        responseHeaders.set(RestTemplateTransport.CORRELATION_ID_HEADER, correlationId);

        return ResponseEntity.status(response.getStatus())
            .headers(responseHeaders)
            .body(response.getBody());
    }

    /**
     * Path after the dependency segment, decoded. The transport encodes it again when it
     * builds the outgoing URI.
     */
    private static String remainingPath(HttpServletRequest request, String dependency) {
        String prefix = request.getContextPath() + "/api/proxy/" + dependency;
        String uri = request.getRequestURI();
        String path = uri.length() > prefix.length() ? uri.substring(prefix.length()) : "";
        return path.isEmpty() ? "/" : UriUtils.decode(path, StandardCharsets.UTF_8);
    }
}
