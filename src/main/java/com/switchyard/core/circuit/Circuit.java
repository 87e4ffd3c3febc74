package com.switchyard.core.circuit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * State machine for one named dependency.
 * <p>
 * Every method that reads or changes state is {@code synchronized}, so a transition and
 * its counter updates happen as one step. The protected operation itself runs outside
 * the monitor, between {@link #acquirePermission()} and {@link #onSuccess()} /
 * {@link #onFailure()}.
 */
class Circuit {

    private static final Logger log = LoggerFactory.getLogger(Circuit.class);

    static final Duration RATE_WINDOW = Duration.ofMinutes(1);

    /**
     * Notified after a state change, still inside the circuit's monitor.
     */
    @FunctionalInterface
    interface TransitionListener {
        void onTransition(String circuit, CircuitState from, CircuitState to);
    }

    private final String name;
    private final CircuitConfig config;
    private final Clock clock;
    private final TransitionListener listener;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private long totalCalls;
    private Instant lastFailure;
    private Instant lastSuccess;
    private Instant openedAt;
    private final Deque<Instant> admittedCalls = new ArrayDeque<>();

    Circuit(String name, CircuitConfig config, Clock clock, TransitionListener listener) {
        this.name = name;
        this.config = config;
        this.clock = clock;
        this.listener = listener;
    }

    String name() {
        return name;
    }

    CircuitConfig config() {
        return config;
    }

    /**
     * Admits a call or rejects it. The rate limit is checked first and does not touch
     * the failure/success counters. An open circuit whose cool-down has elapsed moves
     * to half-open here.
     *
     * @throws RateLimitExceededException if the rolling minute is full
     * @throws CircuitOpenException       if the circuit is open and still cooling down
     */
    synchronized void acquirePermission() {
        Instant now = clock.instant();
        evictExpired(now);
        if (admittedCalls.size() >= config.callsPerMinute()) {
            throw new RateLimitExceededException(name, config.callsPerMinute());
        }
        admittedCalls.addLast(now);

        if (state == CircuitState.OPEN) {
            Instant retryAt = openedAt.plus(config.coolDown());
            if (now.isBefore(retryAt)) {
                throw new CircuitOpenException(name, Duration.between(now, retryAt));
            }
            consecutiveSuccesses = 0;
            transitionTo(CircuitState.HALF_OPEN);
            log.info("Circuit {} entering half-open state", name);
        }
    }

    synchronized void onSuccess() {
        totalCalls++;
        lastSuccess = clock.instant();
        consecutiveFailures = 0;
        consecutiveSuccesses++;

        if (state == CircuitState.HALF_OPEN && consecutiveSuccesses >= config.successThreshold()) {
            openedAt = null;
            consecutiveSuccesses = 0;
            transitionTo(CircuitState.CLOSED);
            log.info("Circuit {} CLOSED (recovered)", name);
        }
    }

    synchronized void onFailure() {
        Instant now = clock.instant();
        totalCalls++;
        lastFailure = now;
        consecutiveSuccesses = 0;
        consecutiveFailures++;

        if (state == CircuitState.HALF_OPEN) {
            openedAt = now;
            transitionTo(CircuitState.OPEN);
            log.warn("Circuit {} re-OPENED after failed trial call", name);
        } else if (state == CircuitState.CLOSED && consecutiveFailures >= config.failureThreshold()) {
            openedAt = now;
            transitionTo(CircuitState.OPEN);
            log.warn("Circuit {} OPENED after {} consecutive failures", name, consecutiveFailures);
        }
    }

    synchronized void reset() {
        CircuitState previous = state;
        state = CircuitState.CLOSED;
        consecutiveFailures = 0;
        consecutiveSuccesses = 0;
        totalCalls = 0;
        lastFailure = null;
        lastSuccess = null;
        openedAt = null;
        admittedCalls.clear();
        if (previous != CircuitState.CLOSED) {
            listener.onTransition(name, previous, CircuitState.CLOSED);
        }
    }

    synchronized CircuitState state() {
        return state;
    }

    synchronized CircuitStatus snapshot() {
        // Count without evicting so that reading status never mutates the circuit.
        Instant windowStart = clock.instant().minus(RATE_WINDOW);
        int inWindow = (int) admittedCalls.stream().filter(t -> t.isAfter(windowStart)).count();
        return new CircuitStatus(state.value(), consecutiveFailures, consecutiveSuccesses, totalCalls,
                lastFailure, lastSuccess, openedAt, inWindow);
    }

    private void evictExpired(Instant now) {
        Instant windowStart = now.minus(RATE_WINDOW);
        while (!admittedCalls.isEmpty() && !admittedCalls.peekFirst().isAfter(windowStart)) {
            admittedCalls.pollFirst();
        }
    }

    private void transitionTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        listener.onTransition(name, previous, next);
    }
}
