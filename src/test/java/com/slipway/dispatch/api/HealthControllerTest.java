package com.slipway.dispatch.api;

import com.slipway.core.health.HealthCheckService;
import com.slipway.core.health.HealthStatus;
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
    @DisplayName("GET /health returns 200 and the worst status when no component is down")
    void healthy() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("docker", HealthStatus.Status.UP, "Docker 27.1.1", Map.of("activeEnvironments", "0")),
                new HealthStatus("archive", HealthStatus.Status.DEGRADED, "No runs yet", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components.docker.status").value("UP"))
                .andExpect(jsonPath("$.components.docker.metadata.activeEnvironments").value("0"))
                .andExpect(jsonPath("$.components.archive.metadata").doesNotExist());
    }

    @Test
    @DisplayName("GET /health returns 503 when a component is down")
    void unhealthy() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("docker", HealthStatus.Status.DOWN, "Cannot reach daemon", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.docker.detail").value("Cannot reach daemon"));
    }
}
