package com.ripple.resilience.controller;

import com.ripple.resilience.exception.PermanentException;
import com.ripple.resilience.model.DependencyRequest;
import com.ripple.resilience.model.DependencyResponse;
import com.ripple.resilience.registry.ResilienceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = {
    "resilience.defaults.base-delay=1ms",
    "resilience.defaults.max-delay=5ms",
    "resilience.dependencies.recommendation-service.max-delay=5ms",
    "resilience.dependencies.inventory-service.base-url=http://localhost:8010"
})
@AutoConfigureMockMvc
@Import(StubTransportConfiguration.class)
class ProxyControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ResilienceRegistry registry;

    @Autowired
    private StubTransportConfiguration.StubTransport stubTransport;

    @BeforeEach
    void setUp() {
        stubTransport.clear();
        registry.declaredDependencies().forEach(registry::reset);
    }

    @Test
    void testProxy_Success() throws Exception {
        // Given
        stubTransport.respond("recommendation-service", request -> DependencyResponse.builder()
            .status(200)
            .header("Content-Type", "application/json")
            .body("{\"recommendations\":[7,8]}")
            .build());

        // When & Then
        mockMvc.perform(get("/api/proxy/recommendation-service/recommendations/42")
                .param("limit", "10")
                .header("X-Correlation-ID", "corr-1"))
            .andExpect(status().isOk())
            .andExpect(header().string(ProxyController.DEGRADED_HEADER, "false"))
            .andExpect(header().string(ProxyController.SERVED_BY_HEADER, "primary"))
            .andExpect(header().string("X-Correlation-ID", "corr-1"))
            .andExpect(jsonPath("$.recommendations[0]").value(7));

        DependencyRequest forwarded = stubTransport.received().get(0);
        assertEquals("GET", forwarded.getMethod());
        assertEquals("/recommendations/42", forwarded.getPath());
        assertEquals("10", forwarded.getQueryParams().get("limit"));
        assertEquals("corr-1", forwarded.getCorrelationId());
    }

    @Test
    void testProxy_EncodedPathSegmentForwardedDecoded() throws Exception {
        // Given
        stubTransport.respond("recommendation-service", request -> DependencyResponse.builder()
            .status(200)
            .body("[]")
            .build());

        // When
        mockMvc.perform(get(URI.create("/api/proxy/recommendation-service/search/red%20shoes")))
            .andExpect(status().isOk());

        // Then
        assertEquals("/search/red shoes", stubTransport.received().get(0).getPath());
    }

    @Test
    void testProxy_FailingDependency_StaticFallback() throws Exception {
        // Given
        stubTransport.fail("fraud-detection", 503);

        // When & Then
        mockMvc.perform(post("/api/proxy/fraud-detection/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":100}"))
            .andExpect(status().isOk())
            .andExpect(header().string(ProxyController.DEGRADED_HEADER, "true"))
            .andExpect(header().string(ProxyController.SERVED_BY_HEADER, "static"))
            .andExpect(jsonPath("$.risk_score").value(50))
            .andExpect(jsonPath("$.requires_review").value(true));

        assertEquals(4, stubTransport.received().size());
        assertEquals("{\"amount\":100}", stubTransport.received().get(0).getBody());
    }

    @Test
    void testProxy_FailingDependency_ServesCachedResponse() throws Exception {
        // Given
        stubTransport.respond("recommendation-service", request -> DependencyResponse.builder()
            .status(200)
            .body("{\"recommendations\":[1,2,3]}")
            .build());
        mockMvc.perform(get("/api/proxy/recommendation-service/products/popular").param("limit", "5"))
            .andExpect(status().isOk());
        stubTransport.fail("recommendation-service", 502);

        // When & Then
        mockMvc.perform(get("/api/proxy/recommendation-service/products/popular").param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(header().string(ProxyController.DEGRADED_HEADER, "true"))
            .andExpect(header().string(ProxyController.SERVED_BY_HEADER, "cache"))
            .andExpect(jsonPath("$.recommendations[2]").value(3));
    }

    @Test
    void testProxy_NoFallback_ServiceUnavailable() throws Exception {
        // Given
        stubTransport.fail("inventory-service", 500);

        // When & Then
        mockMvc.perform(get("/api/proxy/inventory-service/stock/sku-1")
                .header("X-Correlation-ID", "corr-9"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.type").value("service_unavailable"))
            .andExpect(jsonPath("$.message").value("Service inventory-service is temporarily unavailable"))
            .andExpect(jsonPath("$.dependency").value("inventory-service"))
            .andExpect(jsonPath("$.correlationId").value("corr-9"));
    }

    @Test
    void testProxy_UnknownDependency_NotFound() throws Exception {
        mockMvc.perform(get("/api/proxy/payments-ledger/entries"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.type").value("not_found"))
            .andExpect(jsonPath("$.dependency").value("payments-ledger"));

        assertTrue(stubTransport.received().isEmpty());
        assertFalse(registry.find("payments-ledger").isPresent());
    }

    @Test
    void testProxy_PermanentErrorNotRetried() throws Exception {
        // Given
        stubTransport.respond("inventory-service", request -> {
            throw new PermanentException("inventory-service", "Error calling inventory-service: 404", 404, null);
        });

        // When & Then
        mockMvc.perform(get("/api/proxy/inventory-service/stock/unknown"))
            .andExpect(status().isServiceUnavailable());
        assertEquals(1, stubTransport.received().size());
    }
}
