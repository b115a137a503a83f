package com.ripple.resilience.exception;

import com.ripple.resilience.client.RestTemplateTransport;
import com.ripple.resilience.model.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import javax.servlet.http.HttpServletRequest;
import java.time.Instant;

/**
 * Maps resilience errors to the JSON error envelope returned by the service.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(FallbackExhaustedException.class)
    public ResponseEntity<ErrorResponse> handleFallbackExhausted(FallbackExhaustedException e, HttpServletRequest request) {
        log.error("Dependency {} unavailable: {}", e.getDependency(), e.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "service_unavailable",
            String.format("Service %s is temporarily unavailable", e.getDependency()), e.getDependency(), request);
    }

    @ExceptionHandler(CallCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(CallCancelledException e, HttpServletRequest request) {
        log.warn("Call to {} cancelled: {}", e.getDependency(), e.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "cancelled", e.getMessage(), e.getDependency(), request);
    }

    @ExceptionHandler(UnknownDependencyException.class)
    public ResponseEntity<ErrorResponse> handleUnknownDependency(UnknownDependencyException e, HttpServletRequest request) {
        log.warn("Unknown dependency requested: {}", e.getDependency());
        return build(HttpStatus.NOT_FOUND, "not_found", e.getMessage(), e.getDependency(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e, HttpServletRequest request) {
        log.error("Unexpected error handling {}: {}", request.getRequestURI(), e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "An unexpected error occurred", null, request);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String type, String message,
                                                       String dependency, HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.builder()
            .type(type)
            .message(message)
            .dependency(dependency)
            .correlationId(request.getHeader(RestTemplateTransport.CORRELATION_ID_HEADER))
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }
}
