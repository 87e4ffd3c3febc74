package com.switchyard.core.circuit;

import com.switchyard.core.events.EventBus;
import com.switchyard.core.events.SwitchyardEvent;
import com.switchyard.core.logging.MdcContext;
import com.switchyard.core.metrics.SwitchyardMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Named, independent circuit breakers for unreliable dependencies (paid model APIs,
 * desktop CAD automation, trading terminals).
 *
 * <p>Usage:
 * <pre>{@code
 * registry.register("cad", CircuitConfig.of(5, 2, 60, 10));
 * var bom = registry.call("cad", () -> desktop.getBom(path));
 * var safe = registry.callWithFallback("cad", () -> desktop.getBom(path), e -> cachedBom);
 * }</pre>
 *
 * <p>Circuits never share state. A name that was never registered is registered on
 * first use with the default config.
 */
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final ConcurrentHashMap<String, Circuit> circuits = new ConcurrentHashMap<>();
    private final CircuitConfig defaultConfig;
    private final Clock clock;
    private final EventBus eventBus;
    private final SwitchyardMetrics metrics;

    public CircuitBreakerRegistry(CircuitBreakerProperties properties, Clock clock,
                                  EventBus eventBus, SwitchyardMetrics metrics) {
        this(properties.defaultConfig(), clock, eventBus, metrics);
        for (String name : properties.getCircuits().keySet()) {
            register(name, properties.configFor(name));
        }
    }

    public CircuitBreakerRegistry(CircuitConfig defaultConfig, Clock clock) {
        this(defaultConfig, clock, new EventBus(), null);
    }

    public CircuitBreakerRegistry() {
        this(CircuitConfig.defaults(), Clock.systemUTC());
    }

    CircuitBreakerRegistry(CircuitConfig defaultConfig, Clock clock, EventBus eventBus,
                           SwitchyardMetrics metrics) {
        this.defaultConfig = defaultConfig;
        this.clock = clock;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Registers (or replaces) a circuit. Replacing discards the old circuit's state.
     */
    public void register(String name, CircuitConfig config) {
        circuits.put(name, new Circuit(name, config, clock, this::onTransition));
        log.info("Registered circuit: {} (failureThreshold={}, successThreshold={}, coolDown={}s, callsPerMinute={})",
                name, config.failureThreshold(), config.successThreshold(),
                config.coolDown().toSeconds(), config.callsPerMinute());
    }

    public boolean isRegistered(String name) {
        return circuits.containsKey(name);
    }

    /**
     * Runs {@code operation} through the named circuit.
     *
     * @return the operation's result
     * @throws RateLimitExceededException if the circuit's per-minute cap is exhausted
     * @throws CircuitOpenException       if the circuit is open and still cooling down
     * @throws CircuitOperationException  if the operation itself failed (cause attached)
     */
    public <T> T call(String name, CircuitOperation<T> operation) {
        Circuit circuit = circuit(name);
        admit(circuit);
        T result;
        try {
            result = operation.execute();
        } catch (Exception e) {
            circuit.onFailure();
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.debug("Call on circuit {} failed: {}", name, e.getMessage());
            throw new CircuitOperationException(name, e);
        }
        circuit.onSuccess();
        return result;
    }

    /**
     * Like {@link #call} but never throws a {@link CircuitBreakerException}: an open
     * circuit, an exhausted rate limit and a failed operation all resolve to
     * {@code fallback}. An exception thrown by the fallback itself propagates.
     */
    public <T> T callWithFallback(String name, CircuitOperation<T> operation,
                                  Function<? super CircuitBreakerException, ? extends T> fallback) {
        try {
            return call(name, operation);
        } catch (CircuitBreakerException e) {
            log.warn("Circuit {} interrupted/failed: {}. Executing fallback.", name, e.getMessage());
            return fallback.apply(e);
        }
    }

    /**
     * Asynchronous variant of {@link #call}. Rejections complete the returned future
     * exceptionally right away without invoking {@code operation}; the outcome of the
     * operation's future is recorded when it completes.
     */
    public <T> CompletableFuture<T> callAsync(String name, Supplier<? extends CompletionStage<T>> operation) {
        Circuit circuit = circuit(name);
        try {
            admit(circuit);
        } catch (CircuitBreakerException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletionStage<T> stage;
        try {
            stage = operation.get();
        } catch (RuntimeException e) {
            circuit.onFailure();
            return CompletableFuture.failedFuture(new CircuitOperationException(name, e));
        }

        var result = new CompletableFuture<T>();
        stage.whenComplete((value, error) -> {
            if (error == null) {
                circuit.onSuccess();
                result.complete(value);
            } else {
                circuit.onFailure();
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                result.completeExceptionally(new CircuitOperationException(name, cause));
            }
        });
        return result;
    }

    /**
     * Manually closes a circuit and clears its counters.
     *
     * @return false if no circuit with that name exists
     */
    public boolean reset(String name) {
        Circuit circuit = circuits.get(name);
        if (circuit == null) {
            return false;
        }
        circuit.reset();
        log.info("Circuit {} manually reset", name);
        return true;
    }

    public CircuitState getState(String name) {
        Circuit circuit = circuits.get(name);
        return circuit == null ? null : circuit.state();
    }

    public CircuitConfig getConfig(String name) {
        Circuit circuit = circuits.get(name);
        return circuit == null ? null : circuit.config();
    }

    /**
     * Snapshot of all circuits, sorted by name. Reading status never changes state.
     */
    public Map<String, CircuitStatus> getCircuitStatus() {
        var status = new TreeMap<String, CircuitStatus>();
        circuits.forEach((name, circuit) -> status.put(name, circuit.snapshot()));
        return status;
    }

    private Circuit circuit(String name) {
        return circuits.computeIfAbsent(name, n -> {
            log.info("Registered circuit: {} (implicit, default config)", n);
            return new Circuit(n, defaultConfig, clock, this::onTransition);
        });
    }

    private void admit(Circuit circuit) {
        try {
            circuit.acquirePermission();
        } catch (RateLimitExceededException e) {
            log.warn("Rejected call on circuit {}: rate limit of {} calls/min reached",
                    circuit.name(), e.getCallsPerMinute());
            onRejected(circuit.name(), "rate_limited");
            throw e;
        } catch (CircuitOpenException e) {
            log.warn("Rejected call on circuit {}: open for another {}ms",
                    circuit.name(), e.getRetryAfter().toMillis());
            onRejected(circuit.name(), "open");
            throw e;
        }
    }

    private void onRejected(String circuit, String reason) {
        if (metrics != null) {
            metrics.recordCircuitRejection(circuit, reason);
        }
        eventBus.publish(SwitchyardEvent.of("circuit.rejected", circuit, null, Map.of("reason", reason)));
    }

    private void onTransition(String circuit, CircuitState from, CircuitState to) {
        MdcContext.setCircuit(circuit);
        try {
            if (metrics != null) {
                metrics.recordCircuitTransition(circuit, to.value());
            }
            eventBus.publish(SwitchyardEvent.of("circuit." + to.value(), circuit, null,
                    Map.of("from", from.value(), "to", to.value())));
        } finally {
            MdcContext.clearCircuit();
        }
    }
}
