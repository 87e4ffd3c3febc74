package com.switchyard.core.agents;

import com.switchyard.core.circuit.CircuitBreakerRegistry;
import com.switchyard.core.circuit.CircuitStatus;
import com.switchyard.core.model.AgentCategory;
import com.switchyard.core.model.HandlerOutcome;
import com.switchyard.core.orchestrator.CategorizedAgent;
import com.switchyard.core.queue.ChannelStatus;
import com.switchyard.core.queue.DispatchQueue;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Handles {@code system} requests by reporting dispatch queue and circuit breaker state.
 * A message mentioning "circuit" returns only circuits, one mentioning "queue" only queues.
 */
public class SystemStatusAgent implements CategorizedAgent {

    private final DispatchQueue dispatchQueue;
    private final CircuitBreakerRegistry circuitBreakers;

    public SystemStatusAgent(DispatchQueue dispatchQueue, CircuitBreakerRegistry circuitBreakers) {
        this.dispatchQueue = dispatchQueue;
        this.circuitBreakers = circuitBreakers;
    }

    @Override
    public AgentCategory category() {
        return AgentCategory.SYSTEM;
    }

    @Override
    public HandlerOutcome process(String message, Map<String, Object> context) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        boolean circuitsOnly = lower.contains("circuit") && !lower.contains("queue");
        boolean queuesOnly = lower.contains("queue") && !lower.contains("circuit");

        var report = new LinkedHashMap<String, Object>();
        if (!circuitsOnly) {
            Map<String, ChannelStatus> queues = dispatchQueue.getQueueStatus();
            report.put("queues", queues);
        }
        if (!queuesOnly) {
            Map<String, CircuitStatus> circuits = circuitBreakers.getCircuitStatus();
            report.put("circuits", circuits);
            long open = circuits.values().stream().filter(s -> "open".equals(s.state())).count();
            report.put("open_circuits", open);
        }
        return HandlerOutcome.success(report);
    }
}
