package com.switchyard.dispatch.api;

import com.switchyard.core.health.HealthCheckService;
import com.switchyard.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("GET /health returns 200 when all components are UP")
    void allUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("orchestrator", HealthStatus.Status.UP, "2 handler(s) registered", Map.of()),
                new HealthStatus("queue", HealthStatus.Status.UP, "1 channel(s)", Map.of()),
                new HealthStatus("circuits", HealthStatus.Status.UP, "3 circuit(s) closed", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.queue.status").value("UP"));
    }

    @Test
    @DisplayName("GET /health returns 200 DEGRADED for a paused channel")
    void degraded() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("queue", HealthStatus.Status.DEGRADED, "paused: cad", Map.of("cad", "paused"))));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components.queue.metadata.cad").value("paused"));
    }

    @Test
    @DisplayName("GET /health returns 503 when a circuit is open")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("orchestrator", HealthStatus.Status.UP, "ok", Map.of()),
                new HealthStatus("circuits", HealthStatus.Status.DOWN, "Open: trading", Map.of("trading", "open"))));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.circuits.detail").value("Open: trading"));
    }
}
