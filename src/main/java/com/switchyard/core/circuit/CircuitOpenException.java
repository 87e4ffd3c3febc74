package com.switchyard.core.circuit;

import java.time.Duration;

/**
 * Thrown when a call is rejected because the circuit is open.
 */
public class CircuitOpenException extends CircuitBreakerException {

    private final Duration retryAfter;

    public CircuitOpenException(String circuitName, Duration retryAfter) {
        super(circuitName, "Circuit " + circuitName + " is OPEN, retry in " + retryAfter.toMillis() + "ms");
        this.retryAfter = retryAfter;
    }

    /** Remaining cool-down at the time of rejection. */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
