package com.slipway.core.health;

import com.github.dockerjava.api.DockerClient;
import com.slipway.core.engine.PipelineRunService;
import com.slipway.sandbox.EnvironmentProvisioner;
import com.slipway.secrets.SecretResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DockerClient dockerClient;
    private final EnvironmentProvisioner provisioner;
    private final SecretResolver secretResolver;
    private final PipelineRunService runService;

    public HealthCheckService(
            @Autowired(required = false) DockerClient dockerClient,
            @Autowired(required = false) EnvironmentProvisioner provisioner,
            @Autowired(required = false) SecretResolver secretResolver,
            @Autowired(required = false) PipelineRunService runService) {
        this.dockerClient = dockerClient;
        this.provisioner = provisioner;
        this.secretResolver = secretResolver;
        this.runService = runService;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkPipeline());
        results.add(checkDocker());
        results.add(checkSecrets());
        return results;
    }

    private HealthStatus checkPipeline() {
        if (runService == null) {
            return HealthStatus.down("pipeline", "Pipeline not configured");
        }
        var definition = runService.definition();
        return HealthStatus.up("pipeline",
                definition.stages().size() + " stage(s) for " + definition.repository(),
                Map.of("activeRuns", String.valueOf(runService.activeCount())));
    }

    private HealthStatus checkDocker() {
        if (dockerClient == null || provisioner == null) {
            return HealthStatus.down("docker", "No environment provisioner configured");
        }
        try {
            dockerClient.pingCmd().exec();
            return HealthStatus.up("docker",
                    "Docker daemon reachable",
                    Map.of("activeEnvironments", String.valueOf(provisioner.activeCount())));
        } catch (Exception e) {
            log.warn("Docker health check failed: {}", e.getMessage());
            return HealthStatus.down("docker", "Docker error: " + e.getMessage());
        }
    }

    private HealthStatus checkSecrets() {
        if (secretResolver == null) {
            return HealthStatus.down("secrets", "No secret store configured");
        }
        return HealthStatus.up("secrets",
                "Secret store: " + secretResolver.storeName(), Map.of());
    }
}
