package com.ripple.resilience.retry;

/**
 * How the exponential delay is randomized before sleeping.
 */
public enum JitterStrategy {

    /** Uniform over {@code [0, delay]}. */
    FULL {
        @Override
        double factor(double random) {
            return random;
        }
    },

    /** Uniform over {@code [delay / 2, delay]}. */
    EQUAL {
        @Override
        double factor(double random) {
            return 0.5 + random * 0.5;
        }
    },

    NONE {
        @Override
        double factor(double random) {
            return 1.0;
        }
    };

    /**
     * @param random a value in {@code [0, 1)}
     * @return the multiplier applied to the computed delay
     */
    abstract double factor(double random);
}
