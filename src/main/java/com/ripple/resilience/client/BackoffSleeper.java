package com.ripple.resilience.client;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Suspends the calling thread between retry attempts.
 */
@FunctionalInterface
public interface BackoffSleeper {

    BackoffSleeper THREAD_SLEEP = delay -> TimeUnit.NANOSECONDS.sleep(delay.toNanos());

    void sleep(Duration delay) throws InterruptedException;
}
