package com.ripple.resilience.exception;

public class CallCancelledException extends ResilienceException {

    public CallCancelledException(String dependency, Throwable cause) {
        super(dependency, String.format("Call to '%s' was cancelled by the caller", dependency), cause);
    }
}
