package com.switchyard.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for routing, channel dispatch and circuit breaking.
 */
public class SwitchyardMetrics {

    private final MeterRegistry registry;

    public SwitchyardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRoute(String category, boolean success) {
        Counter.builder("switchyard.route.total")
                .tag("category", category)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordTaskExecution(String channel, long ms) {
        Timer.builder("switchyard.task.duration")
                .tag("channel", channel)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a task reaching a terminal state.
     *
     * @param channel channel the task ran on
     * @param status  "completed", "failed" or "cancelled"
     */
    public void recordTaskOutcome(String channel, String status) {
        Counter.builder("switchyard.task.outcomes")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordTaskRetry(String channel) {
        Counter.builder("switchyard.task.retries")
                .description("Failed task attempts that were requeued")
                .tag("channel", channel)
                .register(registry)
                .increment();
    }

    public void recordCircuitTransition(String circuit, String toState) {
        Counter.builder("switchyard.circuit.transitions")
                .tag("circuit", circuit)
                .tag("state", toState)
                .register(registry)
                .increment();
    }

    /**
     * Records a call rejected without invoking the protected operation.
     *
     * @param reason "open" or "rate_limited"
     */
    public void recordCircuitRejection(String circuit, String reason) {
        Counter.builder("switchyard.circuit.rejections")
                .tag("circuit", circuit)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
