package com.slipway.artifact;

import com.slipway.core.exception.BuildException;
import com.slipway.core.logging.StageLog;
import com.slipway.core.model.BuildAction;
import com.slipway.core.model.SourceRef;
import com.slipway.sandbox.CommandResult;
import com.slipway.sandbox.FakeEnvironmentProvisioner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactBuilderTest {

    private static final String IMAGE_ID = "sha256:" + "ab".repeat(32);
    private static final String COMMIT = "0123456789abcdef0123456789abcdef01234567";
    private static final String REPO_URL = "https://git.example.com/team/app.git";
    private static final SourceRef WORKSPACE_SOURCE = new SourceRef("", "main", COMMIT);
    private static final SourceRef PUSHED_SOURCE = new SourceRef(REPO_URL, "main", COMMIT);

    private final FakeEnvironmentProvisioner provisioner = new FakeEnvironmentProvisioner();
    private final ArtifactBuilder builder = new ArtifactBuilder();
    private final List<String> logLines = new ArrayList<>();
    private final StageLog log = new StageLog(logLines::add, s -> s);

    /** Answers like a healthy build environment whose workspace HEAD is {@code head}. */
    private FakeEnvironmentProvisioner healthy(String head) {
        return provisioner.respondWith((command, env) -> switch (command.get(0) + " " + command.get(1)) {
            case "git -c" -> new CommandResult(0, head + "\n");
            case "docker build" -> new CommandResult(0, "Step 1/2 : FROM alpine\nSuccessfully built 1234");
            case "docker image" -> new CommandResult(0, IMAGE_ID + "\n");
            default -> new CommandResult(0, "");
        });
    }

    private List<List<String>> commands() {
        return provisioner.execs().stream().map(FakeEnvironmentProvisioner.ExecCall::command).toList();
    }

    @Nested
    @DisplayName("Building a pushed commit")
    class PushedCommitTests {

        @Test
        @DisplayName("builds from the repository pinned to the run's commit")
        void buildsPinnedCommit() {
            healthy("ignored");

            var artifact = builder.build(provisioner.handle("build"), PUSHED_SOURCE,
                    new BuildAction(".", null), "registry.local/team/app", 42, log);

            assertEquals(IMAGE_ID, artifact.digest());
            var commands = commands();
            assertEquals(List.of("docker", "build",
                    "-f", "Dockerfile",
                    "-t", "registry.local/team/app:42",
                    "--label", ArtifactBuilder.REVISION_LABEL + "=" + COMMIT,
                    REPO_URL + "#" + COMMIT), commands.get(0));
            assertTrue(commands.stream().noneMatch(c -> c.get(0).equals("git") || c.get(0).equals("test")),
                    "the mounted workspace plays no part in a pushed build");
        }

        @Test
        @DisplayName("a context directory becomes a subdirectory of the pinned context")
        void subdirectoryContext() {
            var action = new BuildAction("./services/api/", "Dockerfile.ci");

            assertEquals(REPO_URL + "#" + COMMIT + ":services/api",
                    ArtifactBuilder.remoteContext("build", PUSHED_SOURCE, action));
        }

        @Test
        @DisplayName("an absolute context directory cannot be resolved inside the repository")
        void absoluteContextRejected() {
            var e = assertThrows(BuildException.class, () -> builder.build(provisioner.handle("build"),
                    PUSHED_SOURCE, new BuildAction("/workspace", null), "app", 1, log));

            assertTrue(e.getMessage().contains("/workspace"));
            assertTrue(provisioner.execs().isEmpty());
        }

        @Test
        @DisplayName("a commit the daemon cannot fetch fails the build with the fetch error")
        void unfetchableCommit() {
            provisioner.respondWith((command, env) -> new CommandResult(1,
                    "ERROR: failed to solve: failed to read dockerfile: unable to checkout " + COMMIT));

            var e = assertThrows(BuildException.class, () -> builder.build(provisioner.handle("build"),
                    PUSHED_SOURCE, new BuildAction(null, null), "app", 1, log));

            assertTrue(e.getMessage().contains("unable to checkout"));
            assertTrue(e.getMessage().contains("01234567"));
            assertEquals(1, provisioner.execs().size());
        }
    }

    @Nested
    @DisplayName("Building the mounted workspace")
    class WorkspaceTests {

        @Test
        @DisplayName("tags the image with the run number and returns its image id as digest")
        void buildsAndInspects() {
            healthy(COMMIT);

            var artifact = builder.build(provisioner.handle("build"), WORKSPACE_SOURCE,
                    new BuildAction("/workspace", null), "registry.local/team/app", 42, log);

            assertEquals("registry.local/team/app", artifact.repository());
            assertEquals("42", artifact.versionTag());
            assertEquals(IMAGE_ID, artifact.digest());

            var commands = commands();
            assertEquals(List.of("test", "-d", "/workspace"), commands.get(0));
            assertEquals(List.of("git", "-c", "safe.directory=*", "-C", "/workspace",
                    "rev-parse", "--verify", "HEAD"), commands.get(1));
            assertEquals(List.of("docker", "build",
                    "-f", "/workspace/Dockerfile",
                    "-t", "registry.local/team/app:42",
                    "--label", ArtifactBuilder.REVISION_LABEL + "=" + COMMIT,
                    "/workspace"), commands.get(2));
            assertEquals(List.of("docker", "image", "inspect", "--format", "{{.Id}}",
                    "registry.local/team/app:42"), commands.get(3));
        }

        @Test
        @DisplayName("an abbreviated commit matches the workspace HEAD it abbreviates")
        void abbreviatedCommit() {
            healthy(COMMIT);

            var artifact = builder.build(provisioner.handle("build"), new SourceRef("", "main", "0123456"),
                    new BuildAction(null, null), "app", 1, log);

            assertEquals(IMAGE_ID, artifact.digest());
        }

        @Test
        @DisplayName("a workspace checked out at another commit is not built")
        void workspaceAtOtherCommit() {
            healthy("fedcba9876543210fedcba9876543210fedcba98");

            var e = assertThrows(BuildException.class, () -> builder.build(provisioner.handle("build"),
                    WORKSPACE_SOURCE, new BuildAction(null, null), "app", 1, log));

            assertTrue(e.getMessage().contains("fedcba98"));
            assertTrue(commands().stream().noneMatch(c -> c.get(0).equals("docker")));
        }

        @Test
        @DisplayName("a workspace whose revision cannot be read is not built")
        void unreadableRevision() {
            provisioner.respondWith((command, env) -> command.get(0).equals("git")
                    ? new CommandResult(127, "sh: git: not found")
                    : new CommandResult(0, ""));

            var e = assertThrows(BuildException.class, () -> builder.build(provisioner.handle("build"),
                    WORKSPACE_SOURCE, new BuildAction(null, null), "app", 1, log));

            assertTrue(e.getMessage().contains("git: not found"));
        }

        @Test
        @DisplayName("build output lands in the stage log")
        void buildOutputLogged() {
            healthy(COMMIT);

            builder.build(provisioner.handle("build"), WORKSPACE_SOURCE, new BuildAction(null, null), "app", 1, log);

            assertTrue(logLines.contains("Step 1/2 : FROM alpine"));
            assertTrue(logLines.stream().anyMatch(l -> l.startsWith("Built app:1")));
        }

        @Test
        @DisplayName("a missing build context fails before docker build runs")
        void missingContext() {
            provisioner.respondWith((command, env) -> new CommandResult(command.get(0).equals("test") ? 1 : 0, ""));

            var e = assertThrows(BuildException.class, () -> builder.build(provisioner.handle("build"),
                    WORKSPACE_SOURCE, new BuildAction("missing", null), "app", 1, log));

            assertTrue(e.getMessage().contains("missing"));
            assertEquals(1, provisioner.execs().size());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("a failing docker build raises BuildException with the output tail")
        void failedBuild() {
            provisioner.respondWith((command, env) -> command.get(0).equals("docker")
                    ? new CommandResult(1, "Step 3/5 : RUN make\nmake: *** [all] Error 2")
                    : new CommandResult(0, ""));

            var e = assertThrows(BuildException.class, () -> builder.build(provisioner.handle("build"),
                    PUSHED_SOURCE, new BuildAction(null, null), "app", 1, log));

            assertTrue(e.getMessage().contains("Error 2"));
            assertFalse(e.isTransient());
        }

        @Test
        @DisplayName("an image id that is not a sha256 digest is rejected")
        void badImageId() {
            provisioner.respondWith((command, env) -> command.get(1).equals("image")
                    ? new CommandResult(0, "not-a-digest")
                    : new CommandResult(0, ""));

            assertThrows(BuildException.class, () -> builder.build(provisioner.handle("build"),
                    PUSHED_SOURCE, new BuildAction(null, null), "app", 1, log));
        }
    }

    @Test
    @DisplayName("dockerfile paths resolve against the build context")
    void dockerfilePath() {
        assertEquals("./Dockerfile", ArtifactBuilder.dockerfilePath(new BuildAction(null, null)));
        assertEquals("ctx/Dockerfile.ci", ArtifactBuilder.dockerfilePath(new BuildAction("ctx/", "Dockerfile.ci")));
        assertEquals("/abs/Dockerfile", ArtifactBuilder.dockerfilePath(new BuildAction("ctx", "/abs/Dockerfile")));
    }
}
