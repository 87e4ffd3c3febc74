package com.switchyard.core.queue;

import com.switchyard.core.circuit.CircuitBreakerRegistry;
import com.switchyard.core.circuit.CircuitConfig;
import com.switchyard.core.circuit.CircuitOpenException;
import com.switchyard.core.circuit.CircuitState;
import com.switchyard.core.model.TaskPriority;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class GuardedChannelHandlerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private CircuitBreakerRegistry breakers;
    private DispatchQueue queue;

    @BeforeEach
    void setUp() {
        breakers = new CircuitBreakerRegistry(CircuitConfig.defaults(), Clock.systemUTC());
        breakers.register("desktop", CircuitConfig.of(2, 1, 60, 60));
        queue = new DispatchQueue();
    }

    @AfterEach
    void tearDown() {
        queue.close();
    }

    @Test
    @DisplayName("passes results through a closed circuit")
    void passesThrough() throws Exception {
        var handler = new GuardedChannelHandler(breakers, "desktop", (command, payload) -> "clicked " + command);
        assertEquals("clicked save", handler.handle("save", Map.of()));
        assertEquals("desktop", handler.getCircuitName());
    }

    @Test
    @DisplayName("rethrows the delegate's own exception")
    void unwrapsOperationFailure() {
        var handler = new GuardedChannelHandler(breakers, "desktop",
                (command, payload) -> { throw new IOException("window not found"); });

        var error = assertThrows(IOException.class, () -> handler.handle("save", Map.of()));
        assertEquals("window not found", error.getMessage());
    }

    @Test
    @DisplayName("queued tasks fail fast once the circuit opens")
    void failsFastWhenOpen() {
        var invocations = new AtomicInteger();
        queue.register("desktop", new GuardedChannelHandler(breakers, "desktop", (command, payload) -> {
            invocations.incrementAndGet();
            throw new IOException("automation server down");
        }), 1);

        for (int i = 0; i < 2; i++) {
            String id = queue.submit("desktop", "click", Map.of(), TaskPriority.NORMAL, 0);
            var error = assertThrows(TaskFailedException.class, () -> queue.awaitResult(id, WAIT));
            assertEquals("automation server down", error.getMessage());
        }
        assertEquals(CircuitState.OPEN, breakers.getState("desktop"));

        String rejected = queue.submit("desktop", "click", Map.of(), TaskPriority.NORMAL, 0);
        var error = assertThrows(TaskFailedException.class, () -> queue.awaitResult(rejected, WAIT));
        assertTrue(error.getMessage().contains("OPEN"), error.getMessage());
        assertEquals(2, invocations.get());
    }

    @Test
    @DisplayName("an open circuit surfaces as CircuitOpenException to direct callers")
    void openCircuitDirect() {
        breakers.register("cad", CircuitConfig.of(1, 1, 60, 60));
        var handler = new GuardedChannelHandler(breakers, "cad",
                (command, payload) -> { throw new IOException("crash"); });

        assertThrows(IOException.class, () -> handler.handle("rebuild", Map.of()));
        assertThrows(CircuitOpenException.class, () -> handler.handle("rebuild", Map.of()));
    }
}
