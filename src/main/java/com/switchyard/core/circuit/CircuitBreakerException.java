package com.switchyard.core.circuit;

/**
 * Base type for every error raised by {@link CircuitBreakerRegistry#call}.
 */
public abstract class CircuitBreakerException extends RuntimeException {

    private final String circuitName;

    protected CircuitBreakerException(String circuitName, String message) {
        super(message);
        this.circuitName = circuitName;
    }

    protected CircuitBreakerException(String circuitName, String message, Throwable cause) {
        super(message, cause);
        this.circuitName = circuitName;
    }

    public String getCircuitName() {
        return circuitName;
    }
}
