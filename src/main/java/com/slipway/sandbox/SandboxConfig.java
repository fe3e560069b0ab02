package com.slipway.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SandboxConfig {

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    @Bean
    @ConditionalOnProperty(name = "slipway.sandbox.provider", havingValue = "docker", matchIfMissing = true)
    public DockerClient dockerClient(SandboxProperties properties) {
        String dockerHost = properties.getDockerHost();
        if (dockerHost == null || dockerHost.isBlank()) {
            dockerHost = System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
        }
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    @ConditionalOnProperty(name = "slipway.sandbox.provider", havingValue = "docker", matchIfMissing = true)
    public EnvironmentProvisioner dockerEnvironmentProvisioner(DockerClient dockerClient,
                                                               SandboxProperties properties) {
        return new DockerEnvironmentProvisioner(dockerClient, properties);
    }
}
