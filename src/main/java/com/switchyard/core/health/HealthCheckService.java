package com.switchyard.core.health;

import com.switchyard.core.circuit.CircuitBreakerRegistry;
import com.switchyard.core.circuit.CircuitState;
import com.switchyard.core.circuit.CircuitStatus;
import com.switchyard.core.orchestrator.Orchestrator;
import com.switchyard.core.queue.ChannelStatus;
import com.switchyard.core.queue.DispatchQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final Orchestrator orchestrator;
    private final DispatchQueue dispatchQueue;
    private final CircuitBreakerRegistry circuitBreakers;

    public HealthCheckService(@Autowired(required = false) Orchestrator orchestrator,
                              @Autowired(required = false) DispatchQueue dispatchQueue,
                              @Autowired(required = false) CircuitBreakerRegistry circuitBreakers) {
        this.orchestrator = orchestrator;
        this.dispatchQueue = dispatchQueue;
        this.circuitBreakers = circuitBreakers;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkOrchestrator());
        results.add(checkQueue());
        results.add(checkCircuits());
        return results;
    }

    /** True unless some component is DOWN. */
    public static boolean isHealthy(List<HealthStatus> statuses) {
        return statuses.stream().noneMatch(s -> s.status() == HealthStatus.Status.DOWN);
    }

    private HealthStatus checkOrchestrator() {
        if (orchestrator == null) {
            return new HealthStatus("orchestrator", HealthStatus.Status.DOWN,
                    "Orchestrator not available", Map.of());
        }
        var registered = new TreeMap<String, String>();
        orchestrator.getAgentStatus().forEach((category, state) -> {
            if ("registered".equals(state)) {
                registered.put(category, state);
            }
        });
        if (registered.isEmpty()) {
            return new HealthStatus("orchestrator", HealthStatus.Status.DEGRADED,
                    "No handlers registered", Map.of());
        }
        return new HealthStatus("orchestrator", HealthStatus.Status.UP,
                registered.size() + " handler(s) registered", registered);
    }

    private HealthStatus checkQueue() {
        if (dispatchQueue == null) {
            return new HealthStatus("queue", HealthStatus.Status.DOWN,
                    "Dispatch queue not available", Map.of());
        }
        try {
            var paused = new TreeMap<String, String>();
            int pending = 0;
            int running = 0;
            Map<String, ChannelStatus> status = dispatchQueue.getQueueStatus();
            for (var entry : status.entrySet()) {
                pending += entry.getValue().pending();
                running += entry.getValue().running();
                if (entry.getValue().paused()) {
                    paused.put(entry.getKey(), "paused");
                }
            }
            String detail = status.size() + " channel(s), " + pending + " pending, " + running + " running";
            if (!paused.isEmpty()) {
                return new HealthStatus("queue", HealthStatus.Status.DEGRADED,
                        detail + "; paused: " + String.join(", ", paused.keySet()), paused);
            }
            return new HealthStatus("queue", HealthStatus.Status.UP, detail, Map.of());
        } catch (Exception e) {
            log.warn("Queue health check failed: {}", e.getMessage());
            return new HealthStatus("queue", HealthStatus.Status.DOWN,
                    "Queue error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkCircuits() {
        if (circuitBreakers == null) {
            return new HealthStatus("circuits", HealthStatus.Status.DOWN,
                    "Circuit breaker registry not available", Map.of());
        }
        var states = new TreeMap<String, String>();
        Map<String, CircuitStatus> status = circuitBreakers.getCircuitStatus();
        status.forEach((name, s) -> states.put(name, s.state()));

        if (states.containsValue(CircuitState.OPEN.value())) {
            return new HealthStatus("circuits", HealthStatus.Status.DOWN,
                    "Open: " + namesIn(states, CircuitState.OPEN), states);
        }
        if (states.containsValue(CircuitState.HALF_OPEN.value())) {
            return new HealthStatus("circuits", HealthStatus.Status.DEGRADED,
                    "Recovering: " + namesIn(states, CircuitState.HALF_OPEN), states);
        }
        return new HealthStatus("circuits", HealthStatus.Status.UP,
                states.size() + " circuit(s) closed", states);
    }

    private static String namesIn(Map<String, String> states, CircuitState state) {
        return String.join(", ", states.entrySet().stream()
                .filter(e -> state.value().equals(e.getValue()))
                .map(Map.Entry::getKey)
                .toList());
    }
}
