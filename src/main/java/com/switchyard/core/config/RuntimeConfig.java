package com.switchyard.core.config;

import com.switchyard.core.agents.SystemStatusAgent;
import com.switchyard.core.circuit.CircuitBreakerProperties;
import com.switchyard.core.circuit.CircuitBreakerRegistry;
import com.switchyard.core.events.EventBus;
import com.switchyard.core.metrics.SwitchyardMetrics;
import com.switchyard.core.orchestrator.CategorizedAgent;
import com.switchyard.core.orchestrator.IntentClassifier;
import com.switchyard.core.orchestrator.Orchestrator;
import com.switchyard.core.orchestrator.OrchestratorProperties;
import com.switchyard.core.queue.DispatchQueue;
import com.switchyard.core.queue.QueueProperties;
import com.switchyard.core.router.ComplexityClassifier;
import com.switchyard.core.router.DomainDetector;
import com.switchyard.core.router.ModelRouter;
import com.switchyard.core.router.RouterProperties;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class RuntimeConfig {

    @Bean
    public Clock switchyardClock() {
        return Clock.systemUTC();
    }

    @Bean
    public EventBus eventBus() {
        return new EventBus();
    }

    @Bean
    public SwitchyardMetrics switchyardMetrics(MeterRegistry meterRegistry) {
        return new SwitchyardMetrics(meterRegistry);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(CircuitBreakerProperties properties, Clock clock,
                                                         EventBus eventBus, SwitchyardMetrics metrics) {
        return new CircuitBreakerRegistry(properties, clock, eventBus, metrics);
    }

    @Bean(destroyMethod = "close")
    public DispatchQueue dispatchQueue(QueueProperties properties, EventBus eventBus,
                                       SwitchyardMetrics metrics, Clock clock) {
        return new DispatchQueue(properties, eventBus, metrics, clock);
    }

    @Bean
    public IntentClassifier intentClassifier(OrchestratorProperties properties) {
        return IntentClassifier.fromProperties(properties);
    }

    @Bean
    public SystemStatusAgent systemStatusAgent(DispatchQueue dispatchQueue, CircuitBreakerRegistry circuitBreakers) {
        return new SystemStatusAgent(dispatchQueue, circuitBreakers);
    }

    /**
     * Every {@link CategorizedAgent} bean in the context is registered under its category.
     */
    @Bean
    public Orchestrator orchestrator(IntentClassifier classifier, DispatchQueue dispatchQueue,
                                     OrchestratorProperties properties, EventBus eventBus,
                                     SwitchyardMetrics metrics, List<CategorizedAgent> agents) {
        var orchestrator = new Orchestrator(classifier, dispatchQueue, properties, eventBus, metrics);
        for (CategorizedAgent agent : agents) {
            orchestrator.registerHandler(agent.category(), agent);
        }
        return orchestrator;
    }

    @Bean
    public ComplexityClassifier complexityClassifier(RouterProperties properties) {
        return new ComplexityClassifier(properties);
    }

    @Bean
    public DomainDetector domainDetector(RouterProperties properties) {
        return new DomainDetector(properties);
    }

    @Bean
    public ModelRouter modelRouter(ComplexityClassifier classifier, DomainDetector domainDetector) {
        return new ModelRouter(classifier, domainDetector);
    }

    @Bean(destroyMethod = "")
    public SwitchyardRuntime switchyardRuntime(Orchestrator orchestrator, DispatchQueue dispatchQueue,
                                               CircuitBreakerRegistry circuitBreakers, ModelRouter modelRouter,
                                               EventBus eventBus) {
        return new SwitchyardRuntime(orchestrator, dispatchQueue, circuitBreakers, modelRouter, eventBus);
    }
}
