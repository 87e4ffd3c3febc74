package com.switchyard.dispatch.cli;

import com.switchyard.core.circuit.CircuitBreakerRegistry;
import com.switchyard.core.orchestrator.Orchestrator;
import com.switchyard.core.queue.DispatchQueue;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: switchyard status
 * <p>
 * Prints handler registrations, dispatch channels and circuit breaker state.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show handlers, queues and circuits")
@Component
public class StatusCommand implements Runnable {

    @Option(names = {"--history", "-n"}, description = "Recent results to show (default: ${DEFAULT-VALUE})",
            defaultValue = "10")
    private int historyLimit;

    private final Orchestrator orchestrator;
    private final DispatchQueue dispatchQueue;
    private final CircuitBreakerRegistry circuitBreakers;

    public StatusCommand(Orchestrator orchestrator, DispatchQueue dispatchQueue,
                         CircuitBreakerRegistry circuitBreakers) {
        this.orchestrator = orchestrator;
        this.dispatchQueue = dispatchQueue;
        this.circuitBreakers = circuitBreakers;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        System.out.println();
        System.out.println("HANDLERS");
        var bindings = orchestrator.getChannelBindings();
        orchestrator.getAgentStatus().forEach((category, state) -> {
            String channel = bindings.get(category);
            System.out.printf("  %-10s %s%s%n", category, state, channel == null ? "" : " (channel " + channel + ")");
        });

        var queues = dispatchQueue.getQueueStatus();
        if (!queues.isEmpty()) {
            System.out.println();
            System.out.printf("  %-16s %-8s %-8s %-6s %s%n", "CHANNEL", "PENDING", "RUNNING", "LIMIT", "STATE");
            System.out.println("  " + "-".repeat(50));
            queues.forEach((name, s) -> System.out.printf("  %-16s %-8d %-8d %-6d %s%n",
                    name, s.pending(), s.running(), s.concurrency(), s.paused() ? "paused" : "active"));
        }

        var circuits = circuitBreakers.getCircuitStatus();
        if (!circuits.isEmpty()) {
            System.out.println();
            System.out.printf("  %-16s %-10s %-9s %s%n", "CIRCUIT", "STATE", "FAILURES", "CALLS");
            System.out.println("  " + "-".repeat(50));
            circuits.forEach((name, s) -> ConsoleOutput.circuit(name, s.state(), s.failures(), s.totalCalls()));
        }

        var history = orchestrator.getTaskHistory(historyLimit);
        if (!history.isEmpty()) {
            System.out.println();
            ConsoleOutput.info("Recent results (" + history.size() + "):");
            for (var entry : history) {
                if (entry.success()) {
                    ConsoleOutput.success(entry.agent());
                } else {
                    ConsoleOutput.error(entry.agent() + ": " + entry.error());
                }
            }
        }
    }
}
