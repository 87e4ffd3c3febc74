package com.switchyard.core.circuit;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Point-in-time view of a circuit, as reported by {@link CircuitBreakerRegistry#getCircuitStatus()}.
 *
 * @param state                current state
 * @param failures             consecutive failures
 * @param successes            consecutive successes
 * @param totalCalls           calls that reached the protected operation
 * @param lastFailure          time of the last failed call (nullable)
 * @param lastSuccess          time of the last successful call (nullable)
 * @param openedAt             time the circuit last opened (nullable unless open / half-open)
 * @param callsInWindow        admitted calls in the current rolling minute
 */
public record CircuitStatus(
    @JsonProperty("state") String state,
    @JsonProperty("failures") int failures,
    @JsonProperty("successes") int successes,
    @JsonProperty("total_calls") long totalCalls,
    @JsonProperty("last_failure") Instant lastFailure,
    @JsonProperty("last_success") Instant lastSuccess,
    @JsonProperty("opened_at") Instant openedAt,
    @JsonProperty("calls_in_window") int callsInWindow
) {}
