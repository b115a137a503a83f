package com.ripple.resilience.client;

/**
 * How an attempt cancelled by the caller is reported to the circuit breaker.
 * Either way the trial permit, if held, is released.
 */
public enum CancellationPolicy {

    /** The remote state is unknown, so count the attempt as a failure. */
    RECORD_FAILURE,

    /** Leave the outcome window untouched. */
    EXCLUDE
}
