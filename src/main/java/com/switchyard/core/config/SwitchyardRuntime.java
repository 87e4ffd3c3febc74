package com.switchyard.core.config;

import com.switchyard.core.agents.SystemStatusAgent;
import com.switchyard.core.circuit.CircuitBreakerRegistry;
import com.switchyard.core.circuit.CircuitConfig;
import com.switchyard.core.events.EventBus;
import com.switchyard.core.orchestrator.IntentClassifier;
import com.switchyard.core.orchestrator.Orchestrator;
import com.switchyard.core.orchestrator.OrchestratorProperties;
import com.switchyard.core.queue.DispatchQueue;
import com.switchyard.core.queue.QueueProperties;
import com.switchyard.core.router.ModelRouter;

import java.time.Clock;

/**
 * One process's worth of dispatch state: orchestrator, dispatch queue, circuit breakers
 * and model router. Spring builds a single instance in {@link RuntimeConfig}; standalone
 * callers and tests use {@link #create()}.
 */
public class SwitchyardRuntime implements AutoCloseable {

    private final Orchestrator orchestrator;
    private final DispatchQueue dispatchQueue;
    private final CircuitBreakerRegistry circuitBreakers;
    private final ModelRouter modelRouter;
    private final EventBus eventBus;

    public SwitchyardRuntime(Orchestrator orchestrator, DispatchQueue dispatchQueue,
                             CircuitBreakerRegistry circuitBreakers, ModelRouter modelRouter,
                             EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.dispatchQueue = dispatchQueue;
        this.circuitBreakers = circuitBreakers;
        this.modelRouter = modelRouter;
        this.eventBus = eventBus;
    }

    public static SwitchyardRuntime create() {
        return create(Clock.systemUTC());
    }

    /**
     * Default wiring without Spring: default properties, the built-in trading, cad and
     * desktop circuits, and the system status handler.
     */
    public static SwitchyardRuntime create(Clock clock) {
        var eventBus = new EventBus();
        var breakers = new CircuitBreakerRegistry(CircuitConfig.defaults(), clock);
        breakers.register("trading", CircuitConfig.of(3, 2, 60, 5));
        breakers.register("cad", CircuitConfig.of(5, 2, 60, 10));
        breakers.register("desktop", CircuitConfig.of(10, 2, 60, 60));
        var queue = new DispatchQueue(new QueueProperties(), eventBus, null, clock);
        var orchestrator = new Orchestrator(new IntentClassifier(), queue, new OrchestratorProperties(), eventBus, null);
        var systemAgent = new SystemStatusAgent(queue, breakers);
        orchestrator.registerHandler(systemAgent.category(), systemAgent);
        return new SwitchyardRuntime(orchestrator, queue, breakers, new ModelRouter(), eventBus);
    }

    public Orchestrator orchestrator() { return orchestrator; }
    public DispatchQueue dispatchQueue() { return dispatchQueue; }
    public CircuitBreakerRegistry circuitBreakers() { return circuitBreakers; }
    public ModelRouter modelRouter() { return modelRouter; }
    public EventBus eventBus() { return eventBus; }

    @Override
    public void close() {
        dispatchQueue.close();
    }
}
