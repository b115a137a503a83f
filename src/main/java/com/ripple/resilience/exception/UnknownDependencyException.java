package com.ripple.resilience.exception;

public class UnknownDependencyException extends ResilienceException {

    public UnknownDependencyException(String dependency) {
        super(dependency, "Unknown dependency: " + dependency);
    }
}
