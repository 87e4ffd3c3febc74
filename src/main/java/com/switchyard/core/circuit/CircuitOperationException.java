package com.switchyard.core.circuit;

/**
 * Thrown when the protected operation itself failed. The underlying error is the cause.
 */
public class CircuitOperationException extends CircuitBreakerException {

    public CircuitOperationException(String circuitName, Throwable cause) {
        super(circuitName, "Operation on circuit " + circuitName + " failed: " + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
