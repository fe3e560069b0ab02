package com.slipway.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.ExecCreateCmdResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Volume;
import com.slipway.core.exception.ProvisionException;
import com.slipway.core.exception.RunAbortedException;
import com.slipway.core.model.Capability;
import com.slipway.core.model.EnvironmentSpec;
import com.slipway.core.model.MountRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Docker-backed EnvironmentProvisioner. Each stage attempt gets its own container.
 *
 * <p>Each container is configured with:
 * <ul>
 *   <li>Only the bind mounts the stage declares, plus the Docker socket when the stage
 *       holds {@link Capability#DOCKER_SOCKET}</li>
 *   <li>No environment variables; secrets travel per exec, never on the container</li>
 *   <li>Memory and CPU limits from {@link SandboxProperties}</li>
 *   <li>An idle entrypoint so stage actions can exec commands into it</li>
 * </ul>
 */
public class DockerEnvironmentProvisioner implements EnvironmentProvisioner {

    private static final Logger log = LoggerFactory.getLogger(DockerEnvironmentProvisioner.class);

    static final List<String> IDLE_ENTRYPOINT = List.of("tail", "-f", "/dev/null");
    static final String DOCKER_SOCKET_TARGET = "/var/run/docker.sock";

    private final DockerClient dockerClient;
    private final SandboxProperties properties;

    /** Container ids acquired and not yet released. */
    private final Set<String> active = ConcurrentHashMap.newKeySet();

    public DockerEnvironmentProvisioner(DockerClient dockerClient, SandboxProperties properties) {
        this.dockerClient = dockerClient;
        this.properties = properties;
    }

    @Override
    public EnvironmentHandle acquire(EnvironmentRequest request) {
        EnvironmentSpec spec = request.spec();
        String stage = request.stageName();
        String containerName = properties.getNamePrefix() + "-" + request.runNumber()
                + "-" + stage + "-" + request.attempt();

        List<Bind> binds;
        try {
            ensureImage(stage, spec.image());
            binds = resolveBinds(stage, spec);
        } catch (ProvisionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProvisionException(stage,
                    "Container runtime unavailable for " + containerName + ": " + e.getMessage(), e);
        }

        log.info("Acquiring environment {} for stage {} (image: {})", containerName, stage, spec.image());

        // Clean up any stale container left by a crashed orchestrator
        try {
            dockerClient.removeContainerCmd(containerName).withForce(true).exec();
            log.debug("Removed stale container {}", containerName);
        } catch (NotFoundException ignored) {
            // Container doesn't exist, normal case
        } catch (RuntimeException e) {
            log.debug("Could not remove stale container {}: {}", containerName, e.getMessage());
        }

        var hostConfig = HostConfig.newHostConfig()
                .withBinds(binds.toArray(new Bind[0]))
                .withMemory((long) properties.getMemoryLimitMb() * 1024 * 1024)
                .withCpuCount((long) properties.getCpuCount());

        List<String> entrypoint = spec.entrypointOverride().isEmpty()
                ? IDLE_ENTRYPOINT
                : spec.entrypointOverride();

        String containerId;
        try {
            var response = dockerClient.createContainerCmd(spec.image())
                    .withName(containerName)
                    .withHostConfig(hostConfig)
                    .withEntrypoint(entrypoint.toArray(new String[0]))
                    .withWorkingDir(spec.workingDir())
                    .withLabels(Map.of(
                            "slipway.run", String.valueOf(request.runNumber()),
                            "slipway.stage", stage))
                    .exec();
            containerId = response.getId();
        } catch (RuntimeException e) {
            throw new ProvisionException(stage,
                    "Cannot create environment " + containerName + ": " + e.getMessage(), e);
        }

        try {
            dockerClient.startContainerCmd(containerId).exec();
        } catch (RuntimeException e) {
            removeQuietly(containerId);
            throw new ProvisionException(stage,
                    "Cannot start environment " + containerName + ": " + e.getMessage(), e);
        }

        active.add(containerId);
        log.info("Environment {} started (container {})", containerName, containerId);
        return new DockerHandle(containerId, containerName, stage, spec);
    }

    @Override
    public void release(EnvironmentHandle handle) {
        String containerId = handle.handleId();
        if (!active.remove(containerId)) {
            log.debug("Environment {} already released", containerId);
            return;
        }
        try {
            dockerClient.stopContainerCmd(containerId)
                    .withTimeout(properties.getStopTimeoutSeconds())
                    .exec();
        } catch (Exception e) {
            log.debug("Container {} may already be stopped: {}", containerId, e.getMessage());
        }
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
            log.info("Environment for stage {} released (container {})", handle.stageName(), containerId);
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", containerId);
        } catch (Exception e) {
            log.warn("Failed to remove container {}", containerId, e);
        }
    }

    @Override
    public int activeCount() {
        return active.size();
    }

    CommandResult exec(DockerHandle handle, List<String> command, Map<String, String> env) {
        var envList = new ArrayList<String>();
        env.forEach((k, v) -> envList.add(k + "=" + v));

        ExecCreateCmdResponse created;
        try {
            created = dockerClient.execCreateCmd(handle.handleId())
                    .withCmd(command.toArray(new String[0]))
                    .withEnv(envList)
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .exec();
        } catch (RuntimeException e) {
            throw new ProvisionException(handle.stageName(),
                    "Cannot exec in environment " + handle.containerName() + ": " + e.getMessage(), e);
        }

        var output = new StringBuilder();
        try {
            dockerClient.execStartCmd(created.getId())
                    .exec(new ResultCallback.Adapter<Frame>() {
                        @Override
                        public void onNext(Frame frame) {
                            synchronized (output) {
                                output.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                            }
                        }
                    }).awaitCompletion();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunAbortedException(handle.stageName(),
                    "Interrupted while running " + command.get(0));
        }

        Long exitCode = dockerClient.inspectExecCmd(created.getId()).exec().getExitCodeLong();
        synchronized (output) {
            return new CommandResult(exitCode != null ? exitCode.intValue() : -1, output.toString());
        }
    }

    private void ensureImage(String stage, String image) {
        switch (properties.getPullPolicy()) {
            case ALWAYS -> pull(stage, image);
            case NEVER -> {
                if (!imagePresent(image)) {
                    throw new ProvisionException(stage,
                            "Image " + image + " is not present locally and pulling is disabled");
                }
            }
            default -> {
                if (!imagePresent(image)) {
                    pull(stage, image);
                }
            }
        }
    }

    private boolean imagePresent(String image) {
        try {
            dockerClient.inspectImageCmd(image).exec();
            return true;
        } catch (NotFoundException e) {
            return false;
        }
    }

    private void pull(String stage, String image) {
        log.info("Pulling image {} for stage {}", image, stage);
        boolean completed;
        try {
            completed = dockerClient.pullImageCmd(image)
                    .exec(new PullImageResultCallback())
                    .awaitCompletion(properties.getPullTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProvisionException(stage, "Interrupted while pulling image " + image, e);
        } catch (RuntimeException e) {
            throw new ProvisionException(stage, "Cannot obtain image " + image + ": " + e.getMessage(), e);
        }
        if (!completed) {
            throw new ProvisionException(stage, "Timed out pulling image " + image);
        }
    }

    private List<Bind> resolveBinds(String stage, EnvironmentSpec spec) {
        var binds = new ArrayList<Bind>();
        for (MountRequest mount : spec.mounts()) {
            String hostPath = Path.of(mount.hostPath()).toAbsolutePath().normalize().toString();
            verifyHostPath(stage, hostPath);
            binds.add(new Bind(hostPath, new Volume(mount.containerPath()),
                    mount.readOnly() ? AccessMode.ro : AccessMode.rw));
        }
        if (spec.grants(Capability.DOCKER_SOCKET)) {
            String socket = properties.getDockerSocketPath();
            verifyHostPath(stage, socket);
            binds.add(new Bind(socket, new Volume(DOCKER_SOCKET_TARGET), AccessMode.rw));
        }
        return binds;
    }

    private void verifyHostPath(String stage, String hostPath) {
        if (properties.isVerifyMounts() && !Files.exists(Path.of(hostPath))) {
            throw new ProvisionException(stage, "Required mount is unavailable: " + hostPath);
        }
    }

    private void removeQuietly(String containerId) {
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
        } catch (Exception e) {
            log.warn("Failed to remove container {} after failed start", containerId, e);
        }
    }

    /** Handle bound to one container; exec is routed back through the provisioner. */
    final class DockerHandle implements EnvironmentHandle {

        private final String containerId;
        private final String containerName;
        private final String stageName;
        private final EnvironmentSpec spec;

        DockerHandle(String containerId, String containerName, String stageName, EnvironmentSpec spec) {
            this.containerId = containerId;
            this.containerName = containerName;
            this.stageName = stageName;
            this.spec = spec;
        }

        @Override
        public String handleId() {
            return containerId;
        }

        @Override
        public String stageName() {
            return stageName;
        }

        @Override
        public EnvironmentSpec spec() {
            return spec;
        }

        String containerName() {
            return containerName;
        }

        @Override
        public CommandResult exec(List<String> command, Map<String, String> env) {
            return DockerEnvironmentProvisioner.this.exec(this, command, env);
        }

        @Override
        public String toString() {
            return containerName;
        }
    }
}
