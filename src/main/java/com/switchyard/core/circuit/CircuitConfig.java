package com.switchyard.core.circuit;

import java.time.Duration;

/**
 * Thresholds for one circuit.
 *
 * @param failureThreshold consecutive failures that open the circuit
 * @param successThreshold consecutive half-open successes that close it again
 * @param coolDown         time an open circuit rejects calls before allowing a trial
 * @param callsPerMinute   admitted calls allowed in any rolling 60 second window
 */
public record CircuitConfig(
    int failureThreshold,
    int successThreshold,
    Duration coolDown,
    int callsPerMinute
) {
    public static final int DEFAULT_FAILURE_THRESHOLD = 3;
    public static final int DEFAULT_SUCCESS_THRESHOLD = 2;
    public static final Duration DEFAULT_COOL_DOWN = Duration.ofSeconds(60);
    public static final int DEFAULT_CALLS_PER_MINUTE = 10;

    public CircuitConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be positive: " + failureThreshold);
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be positive: " + successThreshold);
        }
        if (coolDown == null || coolDown.isNegative()) {
            throw new IllegalArgumentException("coolDown must be zero or positive");
        }
        if (callsPerMinute < 1) {
            throw new IllegalArgumentException("callsPerMinute must be positive: " + callsPerMinute);
        }
    }

    public static CircuitConfig defaults() {
        return new CircuitConfig(DEFAULT_FAILURE_THRESHOLD, DEFAULT_SUCCESS_THRESHOLD,
                DEFAULT_COOL_DOWN, DEFAULT_CALLS_PER_MINUTE);
    }

    public static CircuitConfig of(int failureThreshold, int successThreshold,
                                   int coolDownSeconds, int callsPerMinute) {
        return new CircuitConfig(failureThreshold, successThreshold,
                Duration.ofSeconds(coolDownSeconds), callsPerMinute);
    }
}
