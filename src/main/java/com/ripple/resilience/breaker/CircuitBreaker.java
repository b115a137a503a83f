package com.ripple.resilience.breaker;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Circuit breaker for a single remote dependency.
 *
 * <pre>
 *     CLOSED ──(failures in window >= threshold)──> OPEN
 *        ^                                           │
 *        │                                  (open timeout elapsed,
 *  (success threshold                        first caller gets the
 *   consecutive trials)                         trial permit)
 *        │                                           │
 *        └────────────── HALF_OPEN <─────────────────┘
 *                           │
 *                       (failure)
 *                           └──────> OPEN
 * </pre>
 *
 * <p>Failures are counted over the last {@code windowSize} outcomes, by call count rather
 * than wall-clock time. While {@code HALF_OPEN} exactly one trial call may be in flight;
 * every other caller is rejected as if the circuit were open.
 *
 * <p>Thread-safety: all state is guarded by a per-breaker {@link ReentrantLock}. The lock
 * only covers the bookkeeping in this class, never the protected call itself. Transition
 * listeners are notified after the lock has been released.
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final StateTransitionListener listener;
    private final ReentrantLock lock = new ReentrantLock();

    private final Deque<Boolean> outcomeWindow;
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private int consecutiveSuccesses;
    private boolean trialInFlight;
    private Instant openedAt;
    private Instant lastFailureAt;
    // bumped on every state change and reset; trial permissions from an older generation are ignored
    private long generation;

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC(), StateTransitionListener.NONE);
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock, StateTransitionListener listener) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.listener = listener != null ? listener : StateTransitionListener.NONE;
        this.outcomeWindow = new ArrayDeque<>(config.getWindowSize());
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Asks whether a call may proceed. Equivalent to {@code tryAcquirePermission().isPresent()}.
     */
    public boolean allowRequest() {
        return tryAcquirePermission().isPresent();
    }

    /**
     * Admits a call, or returns empty if the circuit rejects it.
     *
     * <p>When the open timeout has elapsed, the first caller moves the breaker to
     * {@code HALF_OPEN} and receives the trial permission. The trial must be resolved
     * through {@link #onSuccess}, {@link #onFailure} or {@link #releasePermission}.
     */
    public Optional<Permission> tryAcquirePermission() {
        Transition transition = null;
        Permission permission;
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    permission = new Permission(false, generation);
                    break;
                case OPEN:
                    if (!openTimeoutElapsed()) {
                        return Optional.empty();
                    }
                    transition = transitionTo(CircuitState.HALF_OPEN);
                    consecutiveSuccesses = 0;
                    trialInFlight = true;
                    permission = new Permission(true, generation);
                    break;
                case HALF_OPEN:
                    if (trialInFlight) {
                        return Optional.empty();
                    }
                    trialInFlight = true;
                    permission = new Permission(true, generation);
                    break;
                default:
                    throw new IllegalStateException("Unknown state: " + state);
            }
        } finally {
            lock.unlock();
        }
        notifyListener(transition);
        return Optional.of(permission);
    }

    /**
     * Records a success against the current state. While {@code HALF_OPEN} the outcome is
     * treated as the trial's.
     */
    public void recordSuccess() {
        recordOutcome(true, null);
    }

    /**
     * Records a failure against the current state. While {@code HALF_OPEN} the outcome is
     * treated as the trial's.
     */
    public void recordFailure() {
        recordOutcome(false, null);
    }

    public void onSuccess(Permission permission) {
        recordOutcome(true, Objects.requireNonNull(permission, "permission must not be null"));
    }

    public void onFailure(Permission permission) {
        recordOutcome(false, Objects.requireNonNull(permission, "permission must not be null"));
    }

    /**
     * Gives back a permission without recording any outcome. Releasing the trial permission
     * lets the next caller try the dependency.
     */
    public void releasePermission(Permission permission) {
        Objects.requireNonNull(permission, "permission must not be null");
        lock.lock();
        try {
            if (isCurrentTrial(permission) && state == CircuitState.HALF_OPEN) {
                trialInFlight = false;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forces the breaker to {@code CLOSED} and clears the window, counters and trial permit.
     */
    public void reset() {
        Transition transition;
        lock.lock();
        try {
            transition = transitionTo(CircuitState.CLOSED);
            generation++;
            clearWindow();
            consecutiveSuccesses = 0;
            trialInFlight = false;
            openedAt = null;
            lastFailureAt = null;
        } finally {
            lock.unlock();
        }
        log.info("Circuit breaker '{}' manually reset", name);
        notifyListener(transition);
    }

    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            return CircuitBreakerSnapshot.builder()
                .name(name)
                .state(state)
                .failureCount(failureCount)
                .successCount(successCount)
                .totalCalls(outcomeWindow.size())
                .consecutiveSuccesses(consecutiveSuccesses)
                .trialInFlight(trialInFlight)
                .openedAt(openedAt)
                .lastFailureAt(lastFailureAt)
                .build();
        } finally {
            lock.unlock();
        }
    }

    private void recordOutcome(boolean success, Permission permission) {
        Transition transition = null;
        lock.lock();
        try {
            append(success);
            if (!success) {
                lastFailureAt = clock.instant();
            }
            // Outcomes of calls admitted before the circuit tripped, or before a reset, never drive half-open transitions.
            boolean trialOutcome = permission == null || isCurrentTrial(permission);

            switch (state) {
                case CLOSED:
                    if (!success && failureCount >= config.getFailureThreshold()) {
                        log.warn("Circuit breaker '{}' opening (failures={}/{})",
                            name, failureCount, config.getWindowSize());
                        transition = open();
                    }
                    break;
                case HALF_OPEN:
                    if (!trialOutcome) {
                        break;
                    }
                    if (success) {
                        consecutiveSuccesses++;
                        trialInFlight = false;
                        if (consecutiveSuccesses >= config.getSuccessThreshold()) {
                            log.info("Circuit breaker '{}' closing (consecutive successes={})",
                                name, consecutiveSuccesses);
                            transition = transitionTo(CircuitState.CLOSED);
                            clearWindow();
                            consecutiveSuccesses = 0;
                            openedAt = null;
                        }
                    } else {
                        log.warn("Circuit breaker '{}' failed during recovery, going back to OPEN", name);
                        transition = open();
                    }
                    break;
                case OPEN:
                    // late outcome of a call admitted before the circuit opened
                    break;
                default:
                    throw new IllegalStateException("Unknown state: " + state);
            }
        } finally {
            lock.unlock();
        }
        notifyListener(transition);
    }

    private boolean isCurrentTrial(Permission permission) {
        return permission.isTrial() && permission.generation == generation;
    }

    private Transition open() {
        Transition transition = transitionTo(CircuitState.OPEN);
        openedAt = clock.instant();
        consecutiveSuccesses = 0;
        trialInFlight = false;
        return transition;
    }

    private boolean openTimeoutElapsed() {
        if (openedAt == null) {
            return true;
        }
        Duration elapsed = Duration.between(openedAt, clock.instant());
        return elapsed.compareTo(config.getOpenTimeout()) >= 0;
    }

    private void append(boolean success) {
        if (outcomeWindow.size() == config.getWindowSize()) {
            boolean evicted = outcomeWindow.removeFirst();
            if (evicted) {
                successCount--;
            } else {
                failureCount--;
            }
        }
        outcomeWindow.addLast(success);
        if (success) {
            successCount++;
        } else {
            failureCount++;
        }
    }

    private void clearWindow() {
        outcomeWindow.clear();
        failureCount = 0;
        successCount = 0;
    }

    private Transition transitionTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        if (previous != next) {
            generation++;
        }
        if (previous == CircuitState.OPEN && next == CircuitState.HALF_OPEN) {
            log.info("Circuit breaker '{}' entering HALF_OPEN state (attempting recovery)", name);
        }
        return previous == next ? null : new Transition(previous, next);
    }

    private void notifyListener(Transition transition) {
        if (transition == null) {
            return;
        }
        try {
            listener.onTransition(name, transition.from, transition.to);
        } catch (RuntimeException e) {
            log.warn("State transition listener failed for breaker '{}': {}", name, e.getMessage(), e);
        }
    }

    /**
     * Admission granted by {@link #tryAcquirePermission()}. Only the trial permission issued
     * in the current {@code HALF_OPEN} period can close or reopen the circuit.
     */
    public static final class Permission {
        private final boolean trial;
        private final long generation;

        private Permission(boolean trial, long generation) {
            this.trial = trial;
            this.generation = generation;
        }

        public boolean isTrial() {
            return trial;
        }
    }

    private static final class Transition {
        private final CircuitState from;
        private final CircuitState to;

        private Transition(CircuitState from, CircuitState to) {
            this.from = from;
            this.to = to;
        }
    }
}
