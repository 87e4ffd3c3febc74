package com.switchyard.core.health;

import com.switchyard.core.circuit.CircuitBreakerRegistry;
import com.switchyard.core.circuit.CircuitConfig;
import com.switchyard.core.circuit.MutableClock;
import com.switchyard.core.model.AgentCategory;
import com.switchyard.core.model.HandlerOutcome;
import com.switchyard.core.orchestrator.IntentClassifier;
import com.switchyard.core.orchestrator.Orchestrator;
import com.switchyard.core.orchestrator.OrchestratorProperties;
import com.switchyard.core.queue.DispatchQueue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HealthCheckServiceTest {

    private MutableClock clock;
    private DispatchQueue queue;
    private CircuitBreakerRegistry breakers;
    private Orchestrator orchestrator;
    private HealthCheckService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        queue = new DispatchQueue();
        breakers = new CircuitBreakerRegistry(CircuitConfig.defaults(), clock);
        orchestrator = new Orchestrator(new IntentClassifier(), queue, new OrchestratorProperties());
        service = new HealthCheckService(orchestrator, queue, breakers);
    }

    @AfterEach
    void tearDown() {
        queue.close();
    }

    private HealthStatus component(String name) {
        return service.checkAll().stream()
                .filter(s -> name.equals(s.component()))
                .findFirst()
                .orElseThrow();
    }

    private void trip(String circuit) {
        for (int i = 0; i < CircuitConfig.DEFAULT_FAILURE_THRESHOLD; i++) {
            assertThrows(RuntimeException.class,
                    () -> breakers.call(circuit, () -> { throw new IOException("down"); }));
        }
    }

    @Test
    @DisplayName("All components null -> all DOWN")
    void allComponentsNullAllDown() {
        List<HealthStatus> results = new HealthCheckService(null, null, null).checkAll();

        assertEquals(3, results.size());
        for (var status : results) {
            assertEquals(HealthStatus.Status.DOWN, status.status(),
                    status.component() + " should be DOWN when null");
        }
        assertFalse(HealthCheckService.isHealthy(results));
    }

    @Test
    @DisplayName("checkAll returns orchestrator, queue, circuits components")
    void checkAllReturnsAllComponents() {
        var components = service.checkAll().stream().map(HealthStatus::component).toList();
        assertEquals(List.of("orchestrator", "queue", "circuits"), components);
    }

    @Test
    @DisplayName("No handlers -> orchestrator DEGRADED, one handler -> UP")
    void orchestratorStatus() {
        assertEquals(HealthStatus.Status.DEGRADED, component("orchestrator").status());

        orchestrator.registerHandler(AgentCategory.GENERAL, (m, c) -> HandlerOutcome.success("ok"));
        var status = component("orchestrator");
        assertEquals(HealthStatus.Status.UP, status.status());
        assertEquals("registered", status.metadata().get("general"));
    }

    @Test
    @DisplayName("Paused channel -> queue DEGRADED")
    void pausedChannelDegraded() {
        queue.register("cad", (c, p) -> "ok", 1);
        assertEquals(HealthStatus.Status.UP, component("queue").status());

        queue.pause("cad");
        var status = component("queue");
        assertEquals(HealthStatus.Status.DEGRADED, status.status());
        assertTrue(status.detail().contains("cad"));
    }

    @Test
    @DisplayName("Open circuit -> circuits DOWN, half-open -> DEGRADED, closed -> UP")
    void circuitStates() {
        breakers.register("trading", CircuitConfig.defaults());
        assertEquals(HealthStatus.Status.UP, component("circuits").status());

        trip("trading");
        var down = component("circuits");
        assertEquals(HealthStatus.Status.DOWN, down.status());
        assertEquals("open", down.metadata().get("trading"));
        assertFalse(HealthCheckService.isHealthy(service.checkAll()));

        clock.advance(Duration.ofSeconds(60));
        breakers.call("trading", () -> "ok");
        assertEquals(HealthStatus.Status.DEGRADED, component("circuits").status());

        breakers.call("trading", () -> "ok");
        assertEquals(HealthStatus.Status.UP, component("circuits").status());
    }
}
