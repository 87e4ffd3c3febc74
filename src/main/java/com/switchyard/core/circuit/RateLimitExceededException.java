package com.switchyard.core.circuit;

/**
 * Thrown when a circuit's per-minute call cap is exhausted.
 */
public class RateLimitExceededException extends CircuitBreakerException {

    private final int callsPerMinute;

    public RateLimitExceededException(String circuitName, int callsPerMinute) {
        super(circuitName, "Rate limit exceeded for " + circuitName + " (" + callsPerMinute + " calls/min)");
        this.callsPerMinute = callsPerMinute;
    }

    public int getCallsPerMinute() {
        return callsPerMinute;
    }
}
