package com.slipway.core.health;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.PingCmd;
import com.slipway.core.engine.PipelineRunService;
import com.slipway.core.model.PipelineDefinition;
import com.slipway.sandbox.FakeEnvironmentProvisioner;
import com.slipway.secrets.InMemorySecretStore;
import com.slipway.secrets.SecretResolver;
import com.slipway.secrets.SecretsProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream()
                .filter(s -> name.equals(s.component()))
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("All components null -> all DOWN")
    void allComponentsNullAllDown() {
        var service = new HealthCheckService(null, null, null, null);
        List<HealthStatus> results = service.checkAll();

        assertEquals(List.of("pipeline", "docker", "secrets"), results.stream().map(HealthStatus::component).toList());
        for (var status : results) {
            assertEquals(HealthStatus.Status.DOWN, status.status(),
                    status.component() + " should be DOWN when null");
        }
    }

    @Test
    @DisplayName("Reachable daemon -> docker UP with active environment count")
    void dockerUp() {
        var dockerClient = mock(DockerClient.class);
        when(dockerClient.pingCmd()).thenReturn(mock(PingCmd.class));
        var service = new HealthCheckService(dockerClient, new FakeEnvironmentProvisioner(), null, null);

        var docker = component(service.checkAll(), "docker");
        assertEquals(HealthStatus.Status.UP, docker.status());
        assertEquals("0", docker.metadata().get("activeEnvironments"));
    }

    @Test
    @DisplayName("Ping failure -> docker DOWN")
    void dockerDown() {
        var dockerClient = mock(DockerClient.class);
        var ping = mock(PingCmd.class);
        when(dockerClient.pingCmd()).thenReturn(ping);
        when(ping.exec()).thenThrow(new RuntimeException("connection refused"));
        var service = new HealthCheckService(dockerClient, new FakeEnvironmentProvisioner(), null, null);

        var docker = component(service.checkAll(), "docker");
        assertEquals(HealthStatus.Status.DOWN, docker.status());
        assertTrue(docker.detail().contains("connection refused"));
    }

    @Test
    @DisplayName("Configured pipeline and secrets -> UP")
    void pipelineAndSecretsUp() {
        var runService = mock(PipelineRunService.class);
        when(runService.definition()).thenReturn(new PipelineDefinition("registry.local/app", List.of(), null, null));
        when(runService.activeCount()).thenReturn(2);
        var resolver = new SecretResolver(new SecretsProperties(), new InMemorySecretStore(Map.of()));
        var service = new HealthCheckService(null, null, resolver, runService);

        var results = service.checkAll();
        var pipeline = component(results, "pipeline");
        assertEquals(HealthStatus.Status.UP, pipeline.status());
        assertEquals("2", pipeline.metadata().get("activeRuns"));
        assertEquals("Secret store: memory", component(results, "secrets").detail());
    }
}
