package com.switchyard.core.circuit;

import com.switchyard.core.events.EventBus;
import com.switchyard.core.events.SwitchyardEvent;
import com.switchyard.core.metrics.SwitchyardMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerRegistryTest {

    private MutableClock clock;
    private EventBus eventBus;
    private SimpleMeterRegistry meterRegistry;
    private CircuitBreakerRegistry registry;
    private List<SwitchyardEvent> events;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        eventBus = new EventBus();
        meterRegistry = new SimpleMeterRegistry();
        registry = new CircuitBreakerRegistry(CircuitConfig.defaults(), clock, eventBus,
                new SwitchyardMetrics(meterRegistry));
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
        // Scenario circuit "x": opens after 3 failures, closes after 2 trial successes, 1s cool-down.
        registry.register("x", new CircuitConfig(3, 2, Duration.ofSeconds(1), 100));
    }

    private void failOnce(String name) {
        assertThrows(CircuitOperationException.class,
                () -> registry.call(name, () -> { throw new IOException("connection refused"); }));
    }

    private void tripX() {
        failOnce("x");
        failOnce("x");
        failOnce("x");
    }

    @Nested
    @DisplayName("closed state")
    class ClosedState {

        @Test
        @DisplayName("returns the operation's result")
        void returnsResult() {
            assertEquals("bom", registry.call("x", () -> "bom"));
            assertEquals(CircuitState.CLOSED, registry.getState("x"));
        }

        @Test
        @DisplayName("wraps a failure and keeps the cause")
        void wrapsFailure() {
            var error = assertThrows(CircuitOperationException.class,
                    () -> registry.call("x", () -> { throw new IOException("timeout"); }));
            assertEquals("x", error.getCircuitName());
            assertInstanceOf(IOException.class, error.getCause());
            assertEquals(1, registry.getCircuitStatus().get("x").failures());
        }

        @Test
        @DisplayName("stays closed below the failure threshold")
        void staysClosedBelowThreshold() {
            failOnce("x");
            failOnce("x");
            assertEquals(CircuitState.CLOSED, registry.getState("x"));
        }

        @Test
        @DisplayName("a success resets the consecutive failure count")
        void successResetsFailures() {
            failOnce("x");
            failOnce("x");
            registry.call("x", () -> "ok");
            failOnce("x");
            failOnce("x");
            assertEquals(CircuitState.CLOSED, registry.getState("x"));
            assertEquals(2, registry.getCircuitStatus().get("x").failures());
        }

        @Test
        @DisplayName("opens on the third consecutive failure")
        void opensAtThreshold() {
            tripX();
            assertEquals(CircuitState.OPEN, registry.getState("x"));
            assertNotNull(registry.getCircuitStatus().get("x").openedAt());
        }
    }

    @Nested
    @DisplayName("open state")
    class OpenState {

        @Test
        @DisplayName("rejects without invoking the operation")
        void rejectsWithoutInvoking() {
            tripX();
            var invoked = new AtomicInteger();

            var error = assertThrows(CircuitOpenException.class,
                    () -> registry.call("x", () -> invoked.incrementAndGet()));

            assertEquals(0, invoked.get());
            assertEquals("x", error.getCircuitName());
            assertEquals(Duration.ofSeconds(1), error.getRetryAfter());
        }

        @Test
        @DisplayName("still rejects 1 ms before the cool-down elapses")
        void rejectsJustBeforeCoolDown() {
            tripX();
            clock.advance(Duration.ofMillis(999));

            var error = assertThrows(CircuitOpenException.class, () -> registry.call("x", () -> "ok"));
            assertEquals(Duration.ofMillis(1), error.getRetryAfter());
            assertEquals(CircuitState.OPEN, registry.getState("x"));
        }

        @Test
        @DisplayName("admits a trial call exactly at the cool-down boundary")
        void admitsAtBoundary() {
            tripX();
            clock.advance(Duration.ofSeconds(1));

            assertEquals("ok", registry.call("x", () -> "ok"));
            assertEquals(CircuitState.HALF_OPEN, registry.getState("x"));
        }

        @Test
        @DisplayName("rejected calls do not count as failures")
        void rejectionsAreNotFailures() {
            tripX();
            long totalBefore = registry.getCircuitStatus().get("x").totalCalls();
            assertThrows(CircuitOpenException.class, () -> registry.call("x", () -> "ok"));
            assertEquals(totalBefore, registry.getCircuitStatus().get("x").totalCalls());
        }
    }

    @Nested
    @DisplayName("half-open state")
    class HalfOpenState {

        @BeforeEach
        void openAndCoolDown() {
            tripX();
            clock.advance(Duration.ofSeconds(1));
        }

        @Test
        @DisplayName("closes after success-threshold consecutive successes")
        void closesAfterSuccesses() {
            registry.call("x", () -> "first");
            assertEquals(CircuitState.HALF_OPEN, registry.getState("x"));

            registry.call("x", () -> "second");
            assertEquals(CircuitState.CLOSED, registry.getState("x"));
            assertNull(registry.getCircuitStatus().get("x").openedAt());
        }

        @Test
        @DisplayName("any failure re-opens with a fresh cool-down")
        void failureReopens() {
            registry.call("x", () -> "ok");
            failOnce("x");

            assertEquals(CircuitState.OPEN, registry.getState("x"));
            assertEquals(clock.instant(), registry.getCircuitStatus().get("x").openedAt());
            assertThrows(CircuitOpenException.class, () -> registry.call("x", () -> "ok"));
        }

        @Test
        @DisplayName("publishes the full transition sequence")
        void publishesTransitions() {
            registry.call("x", () -> "ok");
            registry.call("x", () -> "ok");

            var transitions = events.stream()
                    .map(SwitchyardEvent::eventType)
                    .filter(t -> !t.equals("circuit.rejected"))
                    .toList();
            assertEquals(List.of("circuit.open", "circuit.half_open", "circuit.closed"), transitions);
        }
    }

    @Nested
    @DisplayName("rate limiting")
    class RateLimiting {

        @BeforeEach
        void registerLimited() {
            registry.register("trading", new CircuitConfig(3, 2, Duration.ofSeconds(60), 2));
        }

        @Test
        @DisplayName("rejects calls beyond the per-minute cap")
        void rejectsBeyondCap() {
            registry.call("trading", () -> 1);
            registry.call("trading", () -> 2);

            var invoked = new AtomicInteger();
            var error = assertThrows(RateLimitExceededException.class,
                    () -> registry.call("trading", () -> invoked.incrementAndGet()));
            assertEquals(0, invoked.get());
            assertEquals(2, error.getCallsPerMinute());
        }

        @Test
        @DisplayName("rate-limit rejections leave failure counters alone")
        void doesNotTouchFailureCounters() {
            registry.call("trading", () -> 1);
            registry.call("trading", () -> 2);
            assertThrows(RateLimitExceededException.class, () -> registry.call("trading", () -> 3));

            var status = registry.getCircuitStatus().get("trading");
            assertEquals(0, status.failures());
            assertEquals("closed", status.state());
        }

        @Test
        @DisplayName("calls older than one minute leave the window")
        void windowSlides() {
            registry.call("trading", () -> 1);
            registry.call("trading", () -> 2);
            clock.advance(Duration.ofSeconds(60));

            assertEquals(3, registry.call("trading", () -> 3));
        }

        @Test
        @DisplayName("calls rejected by an open circuit still use up the window")
        void openRejectionsCountTowardWindow() {
            registry.register("desktop", new CircuitConfig(1, 1, Duration.ofSeconds(60), 3));
            failOnce("desktop");
            assertThrows(CircuitOpenException.class, () -> registry.call("desktop", () -> 1));
            assertThrows(CircuitOpenException.class, () -> registry.call("desktop", () -> 1));

            assertEquals(3, registry.getCircuitStatus().get("desktop").callsInWindow());
            assertThrows(RateLimitExceededException.class, () -> registry.call("desktop", () -> 1));
            assertEquals(3, registry.getCircuitStatus().get("desktop").callsInWindow());
        }
    }

    @Nested
    @DisplayName("fallback and async")
    class FallbackAndAsync {

        @Test
        @DisplayName("fallback receives the failure and supplies the result")
        void fallbackOnFailure() {
            String result = registry.callWithFallback("x",
                    () -> { throw new IOException("down"); },
                    e -> "cached:" + e.getClass().getSimpleName());
            assertEquals("cached:CircuitOperationException", result);
        }

        @Test
        @DisplayName("fallback covers an open circuit")
        void fallbackWhenOpen() {
            tripX();
            assertEquals("cached", registry.callWithFallback("x", () -> "live", e -> "cached"));
        }

        @Test
        @DisplayName("async success is recorded when the future completes")
        void asyncSuccess() throws Exception {
            var future = registry.callAsync("x", () -> CompletableFuture.completedFuture("done"));
            assertEquals("done", future.get());
            assertEquals(1, registry.getCircuitStatus().get("x").successes());
        }

        @Test
        @DisplayName("async failure counts towards opening the circuit")
        void asyncFailure() {
            for (int i = 0; i < 3; i++) {
                var future = registry.<String>callAsync("x",
                        () -> CompletableFuture.failedFuture(new IOException("refused")));
                var error = assertThrows(ExecutionException.class, future::get);
                assertInstanceOf(CircuitOperationException.class, error.getCause());
                assertInstanceOf(IOException.class, error.getCause().getCause());
            }
            assertEquals(CircuitState.OPEN, registry.getState("x"));
        }

        @Test
        @DisplayName("async call on an open circuit fails without invoking the supplier")
        void asyncRejected() {
            tripX();
            var invoked = new AtomicInteger();
            var future = registry.callAsync("x", () -> {
                invoked.incrementAndGet();
                return CompletableFuture.completedFuture("never");
            });
            var error = assertThrows(ExecutionException.class, future::get);
            assertInstanceOf(CircuitOpenException.class, error.getCause());
            assertEquals(0, invoked.get());
        }
    }

    @Nested
    @DisplayName("registry management")
    class Management {

        @Test
        @DisplayName("unknown names are registered with the default config on first use")
        void implicitRegistration() {
            assertFalse(registry.isRegistered("desktop"));
            registry.call("desktop", () -> "ok");
            assertTrue(registry.isRegistered("desktop"));
            assertEquals(CircuitConfig.defaults(), registry.getConfig("desktop"));
        }

        @Test
        @DisplayName("circuits are independent")
        void independentCircuits() {
            tripX();
            assertEquals("ok", registry.call("cad", () -> "ok"));
            assertEquals(CircuitState.CLOSED, registry.getState("cad"));
        }

        @Test
        @DisplayName("reset closes an open circuit and clears counters")
        void resetClosesCircuit() {
            tripX();
            assertTrue(registry.reset("x"));

            var status = registry.getCircuitStatus().get("x");
            assertEquals("closed", status.state());
            assertEquals(0, status.failures());
            assertEquals(0, status.totalCalls());
            assertEquals("ok", registry.call("x", () -> "ok"));
        }

        @Test
        @DisplayName("reset of an unknown circuit returns false")
        void resetUnknown() {
            assertFalse(registry.reset("nope"));
            assertNull(registry.getState("nope"));
        }

        @Test
        @DisplayName("reading status twice yields identical snapshots")
        void statusIsIdempotent() {
            tripX();
            registry.call("cad", () -> "ok");

            var first = registry.getCircuitStatus();
            var second = registry.getCircuitStatus();
            assertEquals(first, second);
            assertEquals(List.of("cad", "x"), List.copyOf(first.keySet()));
        }
    }

    @Nested
    @DisplayName("events and metrics")
    class EventsAndMetrics {

        @Test
        @DisplayName("opening publishes circuit.open with from/to states")
        void openEvent() {
            tripX();
            var open = events.stream().filter(e -> e.eventType().equals("circuit.open")).findFirst().orElseThrow();
            assertEquals("x", open.source());
            assertEquals("closed", open.payload().get("from"));
            assertEquals("open", open.payload().get("to"));
        }

        @Test
        @DisplayName("rejections are counted by reason")
        void rejectionMetrics() {
            tripX();
            assertThrows(CircuitOpenException.class, () -> registry.call("x", () -> "ok"));

            var counter = meterRegistry.find("switchyard.circuit.rejections")
                    .tag("circuit", "x").tag("reason", "open").counter();
            assertNotNull(counter);
            assertEquals(1.0, counter.count());
        }

        @Test
        @DisplayName("transitions are counted by target state")
        void transitionMetrics() {
            tripX();
            var counter = meterRegistry.find("switchyard.circuit.transitions")
                    .tag("circuit", "x").tag("state", "open").counter();
            assertNotNull(counter);
            assertEquals(1.0, counter.count());
        }
    }
}
