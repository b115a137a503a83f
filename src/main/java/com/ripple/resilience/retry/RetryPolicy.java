package com.ripple.resilience.retry;

import com.ripple.resilience.exception.TransientException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Stateless retry arithmetic: which errors may be retried and how long to wait before
 * the next attempt.
 *
 * <p>Attempts are numbered from 0 (the first call). After a failed attempt {@code n} the
 * caller may retry while {@code n < maxRetries}, so at most {@code maxRetries + 1} calls
 * are made.
 */
@Value
public class RetryPolicy {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(100);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);
    public static final Set<Integer> DEFAULT_RETRYABLE_STATUSES = Set.of(408, 429, 500, 502, 503, 504);

    int maxRetries;
    Duration baseDelay;
    Duration maxDelay;
    JitterStrategy jitterStrategy;
    Set<Integer> retryableStatuses;
    DoubleSupplier random;

    @Builder(toBuilder = true)
    private RetryPolicy(Integer maxRetries, Duration baseDelay, Duration maxDelay,
                        JitterStrategy jitterStrategy, Set<Integer> retryableStatuses, DoubleSupplier random) {
        this.maxRetries = maxRetries != null ? maxRetries : DEFAULT_MAX_RETRIES;
        this.baseDelay = baseDelay != null ? baseDelay : DEFAULT_BASE_DELAY;
        this.maxDelay = maxDelay != null ? maxDelay : DEFAULT_MAX_DELAY;
        this.jitterStrategy = jitterStrategy != null ? jitterStrategy : JitterStrategy.FULL;
        this.retryableStatuses = retryableStatuses != null ? Set.copyOf(retryableStatuses) : DEFAULT_RETRYABLE_STATUSES;
        this.random = random != null ? random : () -> ThreadLocalRandom.current().nextDouble();

        if (this.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (this.baseDelay.isNegative() || this.maxDelay.isNegative()) {
            throw new IllegalArgumentException("retry delays must not be negative");
        }
        if (this.maxDelay.compareTo(this.baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be smaller than baseDelay");
        }
    }

    public static RetryPolicy defaults() {
        return builder().build();
    }

    /**
     * {@code min(maxDelay, baseDelay * 2^attempt)}, before jitter.
     */
    public Duration computeBaseDelay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative");
        }
        double nanos = baseDelay.toNanos() * Math.pow(2, attempt);
        if (nanos >= maxDelay.toNanos()) {
            return maxDelay;
        }
        return Duration.ofNanos((long) nanos);
    }

    /**
     * Backoff to wait after the given failed attempt, with jitter applied.
     */
    public Duration computeDelay(int attempt) {
        Duration base = computeBaseDelay(attempt);
        double factor = jitterStrategy.factor(random.getAsDouble());
        return Duration.ofNanos((long) (base.toNanos() * factor));
    }

    /**
     * Transient errors are retryable. Permanent, circuit-open and unclassified errors are not.
     */
    public boolean isRetryable(Throwable error) {
        return error instanceof TransientException;
    }

    public boolean isRetryableStatus(int status) {
        return retryableStatuses.contains(status);
    }

    public boolean shouldRetry(int attempt, Throwable error) {
        Objects.requireNonNull(error, "error must not be null");
        return attempt < maxRetries && isRetryable(error);
    }
}
