package com.slipway.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.*;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.InternalServerErrorException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.StreamType;
import com.slipway.core.exception.ProvisionException;
import com.slipway.core.model.Capability;
import com.slipway.core.model.EnvironmentSpec;
import com.slipway.core.model.MountRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DockerEnvironmentProvisioner.
 *
 * <p>The docker-java fluent builders are mocked with RETURNS_SELF so each test stubs only
 * the terminal {@code exec()} calls it cares about.
 */
class DockerEnvironmentProvisionerTest {

    private DockerClient dockerClient;
    private SandboxProperties properties;
    private DockerEnvironmentProvisioner provisioner;

    @BeforeEach
    void setUp() {
        dockerClient = mock(DockerClient.class);
        properties = new SandboxProperties();
        properties.getSandbox().setVerifyMounts(false);
        provisioner = new DockerEnvironmentProvisioner(dockerClient, properties);
        mockInspectImage(true);
        when(dockerClient.removeContainerCmd(anyString())).thenAnswer(inv -> mock(RemoveContainerCmd.class, RETURNS_SELF));
        when(dockerClient.stopContainerCmd(anyString())).thenAnswer(inv -> mock(StopContainerCmd.class, RETURNS_SELF));
    }

    private static EnvironmentRequest request(EnvironmentSpec spec) {
        return new EnvironmentRequest(7, "build", 1, spec);
    }

    // ── acquire ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("acquire")
    class AcquireTests {

        @Test
        @DisplayName("creates and starts a named container with an idle entrypoint")
        void createsAndStartsContainer() {
            var createCmd = mockCreateContainerCmd("container-abc");
            var startCmd = mockStart("container-abc");

            var handle = provisioner.acquire(request(EnvironmentSpec.of("docker:27-cli")));

            assertEquals("container-abc", handle.handleId());
            assertEquals("build", handle.stageName());
            verify(dockerClient).createContainerCmd("docker:27-cli");
            verify(createCmd).withName("slipway-7-build-1");
            verify(createCmd).withEntrypoint("tail", "-f", "/dev/null");
            verify(createCmd).withWorkingDir("/workspace");
            verify(startCmd).exec();
            assertEquals(1, provisioner.activeCount());
        }

        @Test
        @DisplayName("removes a stale container with the same name first")
        void removesStaleContainer() {
            mockCreateContainerCmd("container-abc");
            mockStart("container-abc");

            provisioner.acquire(request(EnvironmentSpec.of("docker:27-cli")));

            verify(dockerClient).removeContainerCmd("slipway-7-build-1");
        }

        @Test
        @DisplayName("uses the entrypoint override when one is given")
        void entrypointOverride() {
            var createCmd = mockCreateContainerCmd("container-abc");
            mockStart("container-abc");
            var spec = new EnvironmentSpec("alpine:3.20", List.of(), "/app", List.of("sleep", "3600"), Set.of());

            provisioner.acquire(request(spec));

            verify(createCmd).withEntrypoint("sleep", "3600");
            verify(createCmd).withWorkingDir("/app");
        }

        @Test
        @DisplayName("does not mount the Docker socket without the capability")
        void noSocketWithoutCapability() {
            var createCmd = mockCreateContainerCmd("container-abc");
            mockStart("container-abc");

            provisioner.acquire(request(EnvironmentSpec.of("docker:27-cli")));

            assertEquals(0, capturedHostConfig(createCmd).getBinds().length);
        }

        @Test
        @DisplayName("mounts the Docker socket when the capability is granted")
        void socketWithCapability() {
            var createCmd = mockCreateContainerCmd("container-abc");
            mockStart("container-abc");
            var spec = new EnvironmentSpec("docker:27-cli", List.of(), null, List.of(),
                    Set.of(Capability.DOCKER_SOCKET));

            provisioner.acquire(request(spec));

            Bind[] binds = capturedHostConfig(createCmd).getBinds();
            assertEquals(1, binds.length);
            assertEquals("/var/run/docker.sock", binds[0].getPath());
            assertEquals("/var/run/docker.sock", binds[0].getVolume().getPath());
        }

        @Test
        @DisplayName("binds declared mounts with their access mode")
        void bindsDeclaredMounts(@TempDir Path workspace) {
            properties.getSandbox().setVerifyMounts(true);
            var createCmd = mockCreateContainerCmd("container-abc");
            mockStart("container-abc");
            var spec = new EnvironmentSpec("docker:27-cli",
                    List.of(new MountRequest(workspace.toString(), "/workspace", true)), null, List.of(), Set.of());

            provisioner.acquire(request(spec));

            Bind[] binds = capturedHostConfig(createCmd).getBinds();
            assertEquals(1, binds.length);
            assertEquals(workspace.toAbsolutePath().normalize().toString(), binds[0].getPath());
            assertEquals(AccessMode.ro, binds[0].getAccessMode());
        }

        @Test
        @DisplayName("applies memory and CPU limits")
        void appliesLimits() {
            var createCmd = mockCreateContainerCmd("container-abc");
            mockStart("container-abc");

            provisioner.acquire(request(EnvironmentSpec.of("docker:27-cli")));

            var hostConfig = capturedHostConfig(createCmd);
            assertEquals(4096L * 1024 * 1024, hostConfig.getMemory());
            assertEquals(2L, hostConfig.getCpuCount());
        }

        @Test
        @DisplayName("fails with ProvisionException when a required mount is missing")
        void missingMount() {
            properties.getSandbox().setVerifyMounts(true);
            var spec = new EnvironmentSpec("docker:27-cli",
                    List.of(new MountRequest("/does/not/exist/slipway", "/workspace", false)),
                    null, List.of(), Set.of());

            var e = assertThrows(ProvisionException.class, () -> provisioner.acquire(request(spec)));
            assertTrue(e.getMessage().contains("/does/not/exist/slipway"));
            verify(dockerClient, never()).createContainerCmd(anyString());
        }

        @Test
        @DisplayName("removes the container and fails when it cannot start")
        void startFailureRemovesContainer() {
            mockCreateContainerCmd("container-abc");
            var startCmd = mock(StartContainerCmd.class);
            when(dockerClient.startContainerCmd("container-abc")).thenReturn(startCmd);
            when(startCmd.exec()).thenThrow(new DockerException("port already allocated", 500));

            assertThrows(ProvisionException.class,
                    () -> provisioner.acquire(request(EnvironmentSpec.of("docker:27-cli"))));
            verify(dockerClient).removeContainerCmd("container-abc");
            assertEquals(0, provisioner.activeCount());
        }
    }

    // ── image policy ─────────────────────────────────────────────────

    @Nested
    @DisplayName("image pull policy")
    class PullPolicyTests {

        @Test
        @DisplayName("NEVER fails when the image is not present locally")
        void neverPullFailsWhenAbsent() {
            properties.getSandbox().setPullPolicy(SandboxProperties.PullPolicy.NEVER);
            mockInspectImage(false);

            var e = assertThrows(ProvisionException.class,
                    () -> provisioner.acquire(request(EnvironmentSpec.of("docker:27-cli"))));
            assertTrue(e.getMessage().contains("not present locally"));
            verify(dockerClient, never()).pullImageCmd(anyString());
        }

        @Test
        @DisplayName("an unreachable daemon during the image check is a ProvisionException")
        void daemonErrorDuringImageCheck() {
            var inspectCmd = mock(InspectImageCmd.class);
            when(dockerClient.inspectImageCmd(anyString())).thenReturn(inspectCmd);
            when(inspectCmd.exec()).thenThrow(new InternalServerErrorException("Cannot connect to the Docker daemon"));

            var e = assertThrows(ProvisionException.class,
                    () -> provisioner.acquire(request(EnvironmentSpec.of("docker:27-cli"))));
            assertTrue(e.getMessage().contains("Cannot connect to the Docker daemon"));
            assertInstanceOf(InternalServerErrorException.class, e.getCause());
            verify(dockerClient, never()).createContainerCmd(anyString());
            assertEquals(0, provisioner.activeCount());
        }

        @Test
        @DisplayName("IF_NOT_PRESENT pulls a missing image")
        void pullsMissingImage() {
            mockInspectImage(false);
            var pullCmd = mockPull();
            mockCreateContainerCmd("container-abc");
            mockStart("container-abc");

            provisioner.acquire(request(EnvironmentSpec.of("docker:27-cli")));

            verify(dockerClient).pullImageCmd("docker:27-cli");
            verify(pullCmd).exec(any());
        }

        @Test
        @DisplayName("IF_NOT_PRESENT skips the pull for a local image")
        void skipsPullForLocalImage() {
            mockCreateContainerCmd("container-abc");
            mockStart("container-abc");

            provisioner.acquire(request(EnvironmentSpec.of("docker:27-cli")));

            verify(dockerClient, never()).pullImageCmd(anyString());
        }

        @Test
        @DisplayName("a failing pull surfaces as ProvisionException")
        void pullFailure() {
            mockInspectImage(false);
            when(dockerClient.pullImageCmd(anyString())).thenThrow(new NotFoundException("manifest unknown"));

            assertThrows(ProvisionException.class,
                    () -> provisioner.acquire(request(EnvironmentSpec.of("docker:27-cli"))));
        }
    }

    // ── release ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("release")
    class ReleaseTests {

        @Test
        @DisplayName("stops and removes the container once")
        void releaseIsIdempotent() {
            mockCreateContainerCmd("container-abc");
            mockStart("container-abc");
            var handle = provisioner.acquire(request(EnvironmentSpec.of("docker:27-cli")));

            provisioner.release(handle);
            provisioner.release(handle);

            verify(dockerClient, times(1)).stopContainerCmd("container-abc");
            verify(dockerClient, times(1)).removeContainerCmd("container-abc");
            assertEquals(0, provisioner.activeCount());
        }

        @Test
        @DisplayName("never throws when the container already died")
        void releaseSwallowsRuntimeErrors() {
            mockCreateContainerCmd("container-abc");
            mockStart("container-abc");
            var handle = provisioner.acquire(request(EnvironmentSpec.of("docker:27-cli")));
            when(dockerClient.stopContainerCmd("container-abc")).thenThrow(new NotFoundException("gone"));
            when(dockerClient.removeContainerCmd("container-abc")).thenThrow(new DockerException("daemon error", 500));

            assertDoesNotThrow(() -> provisioner.release(handle));
            assertEquals(0, provisioner.activeCount());
        }
    }

    // ── exec ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("exec")
    class ExecTests {

        @Test
        @DisplayName("runs the command with per-exec environment and returns output and exit code")
        void execCapturesOutput() {
            mockCreateContainerCmd("container-abc");
            mockStart("container-abc");
            var handle = provisioner.acquire(request(EnvironmentSpec.of("docker:27-cli")));
            var execCreate = mockExec("container-abc", "exec-1", "Login Succeeded\n", 0L);

            var result = handle.exec(List.of("docker", "login"), Map.of("REGISTRY_PASSWORD", "pw"));

            assertTrue(result.succeeded());
            assertEquals("Login Succeeded\n", result.output());
            verify(execCreate).withCmd("docker", "login");
            verify(execCreate).withEnv(List.of("REGISTRY_PASSWORD=pw"));
        }

        @Test
        @DisplayName("reports a non-zero exit code")
        void execNonZeroExit() {
            mockCreateContainerCmd("container-abc");
            mockStart("container-abc");
            var handle = provisioner.acquire(request(EnvironmentSpec.of("docker:27-cli")));
            mockExec("container-abc", "exec-2", "no such file\n", 1L);

            var result = handle.exec(List.of("test", "-d", "/nope"));

            assertFalse(result.succeeded());
            assertEquals(1, result.exitCode());
            assertEquals("no such file", result.lastLine());
        }
    }

    // ── helpers ──────────────────────────────────────────────────────

    private CreateContainerCmd mockCreateContainerCmd(String containerId) {
        var createCmd = mock(CreateContainerCmd.class, RETURNS_SELF);
        when(dockerClient.createContainerCmd(anyString())).thenReturn(createCmd);

        var createResponse = mock(CreateContainerResponse.class);
        when(createResponse.getId()).thenReturn(containerId);
        when(createCmd.exec()).thenReturn(createResponse);

        return createCmd;
    }

    private StartContainerCmd mockStart(String containerId) {
        var startCmd = mock(StartContainerCmd.class);
        when(dockerClient.startContainerCmd(containerId)).thenReturn(startCmd);
        return startCmd;
    }

    private HostConfig capturedHostConfig(CreateContainerCmd createCmd) {
        ArgumentCaptor<HostConfig> captor = ArgumentCaptor.forClass(HostConfig.class);
        verify(createCmd).withHostConfig(captor.capture());
        return captor.getValue();
    }

    private void mockInspectImage(boolean present) {
        var inspectCmd = mock(InspectImageCmd.class);
        when(dockerClient.inspectImageCmd(anyString())).thenReturn(inspectCmd);
        if (present) {
            when(inspectCmd.exec()).thenReturn(mock(InspectImageResponse.class));
        } else {
            when(inspectCmd.exec()).thenThrow(new NotFoundException("No such image"));
        }
    }

    private PullImageCmd mockPull() {
        var pullCmd = mock(PullImageCmd.class, RETURNS_SELF);
        when(dockerClient.pullImageCmd(anyString())).thenReturn(pullCmd);
        // exec(callback) returns the same callback; completing it releases awaitCompletion().
        doAnswer(invocation -> {
            var callback = (PullImageResultCallback) invocation.getArgument(0);
            callback.onComplete();
            return callback;
        }).when(pullCmd).exec(any());
        return pullCmd;
    }

    @SuppressWarnings("unchecked")
    private ExecCreateCmd mockExec(String containerId, String execId, String output, Long exitCode) {
        var execCreate = mock(ExecCreateCmd.class, RETURNS_SELF);
        when(dockerClient.execCreateCmd(containerId)).thenReturn(execCreate);
        var created = mock(ExecCreateCmdResponse.class);
        when(created.getId()).thenReturn(execId);
        when(execCreate.exec()).thenReturn(created);

        var execStart = mock(ExecStartCmd.class, RETURNS_SELF);
        when(dockerClient.execStartCmd(execId)).thenReturn(execStart);
        doAnswer(invocation -> {
            var callback = (ResultCallback.Adapter<Frame>) invocation.getArgument(0);
            callback.onNext(new Frame(StreamType.STDOUT, output.getBytes(StandardCharsets.UTF_8)));
            callback.onComplete();
            return callback;
        }).when(execStart).exec(any());

        var inspectCmd = mock(InspectExecCmd.class);
        when(dockerClient.inspectExecCmd(execId)).thenReturn(inspectCmd);
        var inspected = mock(InspectExecResponse.class);
        when(inspected.getExitCodeLong()).thenReturn(exitCode);
        when(inspectCmd.exec()).thenReturn(inspected);
        return execCreate;
    }
}
