package com.ripple.resilience.client;

import com.ripple.resilience.breaker.CircuitBreaker;
import com.ripple.resilience.exception.CallCancelledException;
import com.ripple.resilience.exception.CircuitOpenException;
import com.ripple.resilience.exception.FallbackExhaustedException;
import com.ripple.resilience.exception.PermanentException;
import com.ripple.resilience.exception.TransientException;
import com.ripple.resilience.fallback.FallbackChain;
import com.ripple.resilience.fallback.FallbackContext;
import com.ripple.resilience.metrics.CallOutcome;
import com.ripple.resilience.metrics.MetricsSink;
import com.ripple.resilience.model.DependencyRequest;
import com.ripple.resilience.model.DependencyResponse;
import com.ripple.resilience.model.ResilientResult;
import com.ripple.resilience.retry.RetryPolicy;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Protected entry point for calls to one dependency.
 *
 * <p>Each call goes through the circuit breaker, then the transport, retrying transient
 * failures with backoff while the breaker keeps admitting attempts. When the primary path
 * is exhausted the fallback chain is consulted.
 *
 * <p>Thread-Safety: instances are shared by all callers of a dependency. The only shared
 * mutable state is the breaker, which guards itself. The transport call and the backoff
 * sleep run on the caller's thread with no lock held.
 */
@Slf4j
@Getter
public class ResilientClient {

    private final String dependency;
    private final CircuitBreaker breaker;
    private final RetryPolicy retryPolicy;
    private final FallbackChain fallbackChain;
    private final TimeoutConfig timeoutConfig;
    private final Transport transport;
    private final MetricsSink metricsSink;
    private final BackoffSleeper sleeper;
    private final CancellationPolicy cancellationPolicy;

    @Builder
    private ResilientClient(String dependency, CircuitBreaker breaker, RetryPolicy retryPolicy,
                            FallbackChain fallbackChain, TimeoutConfig timeoutConfig, Transport transport,
                            MetricsSink metricsSink, BackoffSleeper sleeper, CancellationPolicy cancellationPolicy) {
        this.dependency = Objects.requireNonNull(dependency, "dependency must not be null");
        this.breaker = Objects.requireNonNull(breaker, "breaker must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaults();
        this.fallbackChain = fallbackChain != null ? fallbackChain : FallbackChain.empty();
        this.timeoutConfig = timeoutConfig != null ? timeoutConfig : TimeoutConfig.defaults();
        this.metricsSink = metricsSink != null ? metricsSink : MetricsSink.NOOP;
        this.sleeper = sleeper != null ? sleeper : BackoffSleeper.THREAD_SLEEP;
        this.cancellationPolicy = cancellationPolicy != null ? cancellationPolicy : CancellationPolicy.RECORD_FAILURE;
    }

    public ResilientResult execute(DependencyRequest request) {
        return execute(request, true);
    }

    /**
     * Executes one logical call.
     *
     * @param request the call to make
     * @param allowRetries {@code false} limits the call to a single attempt
     * @return a fresh result, or a degraded one served by a fallback provider
     * @throws FallbackExhaustedException if the call failed and no fallback produced a result
     * @throws CallCancelledException if the calling thread was interrupted, reported as a {@code failure} outcome
     */
    public ResilientResult execute(DependencyRequest request, boolean allowRetries) {
        Objects.requireNonNull(request, "request must not be null");
        int maxRetries = allowRetries ? retryPolicy.getMaxRetries() : 0;
        int attempts = 0;
        RuntimeException lastError = null;

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                emitOutcome(CallOutcome.FAILURE);
                throw new CallCancelledException(dependency, lastError);
            }

            Optional<CircuitBreaker.Permission> permission = breaker.tryAcquirePermission();
            if (permission.isEmpty()) {
                log.warn("Circuit breaker open for {}, failing fast after {} attempts", dependency, attempts);
                CircuitOpenException rejection = new CircuitOpenException(dependency, breaker.getState(), lastError);
                return fallback(request, rejection, attempts);
            }

            if (attempts > 0) {
                log.info("Retry attempt {}/{} for {}", attempts, maxRetries, dependency);
            }

            try {
                DependencyResponse response = send(request, permission.get());
                attempts++;
                fallbackChain.onSuccess(request, response);
                emitOutcome(CallOutcome.SUCCESS);
                log.debug("Call to {} succeeded with status {} after {} attempts",
                    dependency, response.getStatus(), attempts);
                return ResilientResult.fresh(response, attempts);
            } catch (CallCancelledException e) {
                emitOutcome(CallOutcome.FAILURE);
                throw e;
            } catch (RuntimeException e) {
                attempts++;
                lastError = e;
                log.warn("Call to {} failed (attempt {}/{}): {}", dependency, attempts, maxRetries + 1, e.getMessage());
            }

            int failedAttempt = attempts - 1;
            if (failedAttempt >= maxRetries || !retryPolicy.isRetryable(lastError)) {
                return fallback(request, lastError, attempts);
            }

            Duration delay = retryPolicy.computeDelay(failedAttempt);
            emit(() -> metricsSink.increment(MetricsSink.RETRIES, Map.of("dependency", dependency)));
            log.debug("Waiting {} ms before retrying {}", delay.toMillis(), dependency);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                emitOutcome(CallOutcome.FAILURE);
                throw new CallCancelledException(dependency, e);
            }
        }
    }

    private DependencyResponse send(DependencyRequest request, CircuitBreaker.Permission permission) {
        long start = System.nanoTime();
        try {
            DependencyResponse response = transport.send(request,
                timeoutConfig.getConnectTimeout(), timeoutConfig.getReadTimeout());
            if (response == null) {
                throw new PermanentException(dependency, "Transport returned no response");
            }
            breaker.onSuccess(permission);
            observeDuration(start, CallOutcome.SUCCESS);
            return response;
        } catch (RuntimeException e) {
            observeDuration(start, CallOutcome.FAILURE);
            if (isCancellation(e)) {
                resolveCancelled(permission);
                throw new CallCancelledException(dependency, e);
            }
            breaker.onFailure(permission);
            emit(() -> metricsSink.increment(MetricsSink.ATTEMPT_FAILURES,
                Map.of("dependency", dependency, "error", errorLabel(e))));
            throw e;
        } catch (Error e) {
            // an unresolved trial permission would keep the breaker half-open for good
            breaker.onFailure(permission);
            emitOutcome(CallOutcome.FAILURE);
            log.error("Transport for {} failed with {}", dependency, e.toString());
            throw e;
        }
    }

    private ResilientResult fallback(DependencyRequest request, RuntimeException error, int attempts) {
        FallbackContext context = FallbackContext.builder()
            .dependency(dependency)
            .request(request)
            .error(error)
            .attempts(attempts)
            .circuitState(breaker.getState())
            .build();
        try {
            ResilientResult result = fallbackChain.resolve(context);
            emitOutcome(CallOutcome.FALLBACK_USED);
            return result;
        } catch (FallbackExhaustedException e) {
            emitOutcome(error instanceof CircuitOpenException ? CallOutcome.CIRCUIT_OPEN : CallOutcome.FAILURE);
            log.error("All retries and fallbacks exhausted for {} after {} attempts: {}",
                dependency, attempts, error.getMessage());
            throw e;
        }
    }

    private void resolveCancelled(CircuitBreaker.Permission permission) {
        Thread.currentThread().interrupt();
        if (cancellationPolicy == CancellationPolicy.RECORD_FAILURE) {
            log.warn("Call to {} cancelled, recording it as a failure", dependency);
            breaker.onFailure(permission);
        } else {
            log.info("Call to {} cancelled, outcome excluded", dependency);
            breaker.releasePermission(permission);
        }
    }

    private static boolean isCancellation(Throwable error) {
        if (Thread.currentThread().isInterrupted() || error instanceof CancellationException) {
            return true;
        }
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }

    private static String errorLabel(RuntimeException error) {
        if (error instanceof TransientException) {
            return "transient";
        }
        if (error instanceof PermanentException) {
            return "permanent";
        }
        return "unexpected";
    }

    private void emitOutcome(CallOutcome outcome) {
        emit(() -> metricsSink.increment(MetricsSink.REQUESTS,
            Map.of("dependency", dependency, "outcome", outcome.label())));
    }

    private void observeDuration(long startNanos, CallOutcome outcome) {
        double seconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        emit(() -> metricsSink.observe(MetricsSink.REQUEST_DURATION, seconds,
            Map.of("dependency", dependency, "outcome", outcome.label())));
    }

    private void emit(Runnable emission) {
        try {
            emission.run();
        } catch (RuntimeException e) {
            log.debug("Metrics emission failed for {}: {}", dependency, e.getMessage());
        }
    }
}
