package com.switchyard.core.circuit;

/**
 * States of a circuit breaker.
 */
public enum CircuitState {
    /** Calls pass through normally. */
    CLOSED("closed"),
    /** Calls are rejected without invoking the operation. */
    OPEN("open"),
    /** Trial state: calls pass through to test recovery. */
    HALF_OPEN("half_open");

    private final String value;

    CircuitState(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
