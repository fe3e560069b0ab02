package com.slipway.artifact;

import com.slipway.core.exception.BuildException;
import com.slipway.core.logging.StageLog;
import com.slipway.core.model.Artifact;
import com.slipway.core.model.BuildAction;
import com.slipway.core.model.SourceRef;
import com.slipway.sandbox.EnvironmentHandle;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds the run's image inside a build environment and reads back its content digest.
 * The image is tagged with the run number; the digest is the artifact's identity.
 *
 * <p>With a repository URL the build context is the repository at the run's commit.
 * Without one the mounted workspace is built, and only if its HEAD is that commit.
 */
@Component
public class ArtifactBuilder {

    static final String REVISION_LABEL = "org.opencontainers.image.revision";

    private static final Pattern IMAGE_ID = Pattern.compile("sha256:[a-f0-9]{64}");

    public Artifact build(EnvironmentHandle env, SourceRef source, BuildAction action,
                          String repository, long runNumber, StageLog log) {
        String stage = env.stageName();
        String versionTag = String.valueOf(runNumber);
        String reference = repository + ":" + versionTag;

        List<String> command;
        if (source.repositoryUrl().isBlank()) {
            verifyWorkspace(env, source, action);
            log.info("Building " + reference + " from workspace " + action.contextDir()
                    + " at " + source.shortCommit());
            command = List.of("docker", "build",
                    "-f", dockerfilePath(action),
                    "-t", reference,
                    "--label", REVISION_LABEL + "=" + source.commit(),
                    action.contextDir());
        } else {
            String context = remoteContext(stage, source, action);
            log.info("Building " + reference + " from " + source.repositoryUrl() + " at " + source.shortCommit());
            command = List.of("docker", "build",
                    "-f", action.dockerfile(),
                    "-t", reference,
                    "--label", REVISION_LABEL + "=" + source.commit(),
                    context);
        }

        var built = env.exec(command);
        log.output(built.output());
        if (!built.succeeded()) {
            throw new BuildException(stage,
                    "docker build of " + source.shortCommit() + " exited with " + built.exitCode()
                            + ": " + built.tail(10));
        }

        var inspected = env.exec(List.of("docker", "image", "inspect", "--format", "{{.Id}}", reference));
        String digest = inspected.lastLine();
        if (!inspected.succeeded() || !IMAGE_ID.matcher(digest).matches()) {
            throw new BuildException(stage, "Cannot read image id of " + reference + ": " + inspected.tail(3));
        }

        log.info("Built " + reference + " " + digest);
        return new Artifact(repository, versionTag, digest);
    }

    /**
     * Git build context pinned to the run's commit, e.g.
     * {@code https://git.example.com/team/app.git#<sha>:services/api}. The daemon fetches it,
     * so the build environment never sees any other revision.
     */
    static String remoteContext(String stage, SourceRef source, BuildAction action) {
        String dir = action.contextDir();
        if (dir.startsWith("/")) {
            throw new BuildException(stage,
                    "Build context must be relative to the repository root, was " + dir);
        }
        String subdir = dir.replaceAll("^(\\./)+", "").replaceAll("/+$", "");
        String context = source.repositoryUrl() + "#" + source.commit();
        return subdir.isEmpty() || subdir.equals(".") ? context : context + ":" + subdir;
    }

    /** A mounted workspace must already sit at the requested commit. */
    private static void verifyWorkspace(EnvironmentHandle env, SourceRef source, BuildAction action) {
        String stage = env.stageName();
        var context = env.exec(List.of("test", "-d", action.contextDir()));
        if (!context.succeeded()) {
            throw new BuildException(stage, "Build context not found: " + action.contextDir());
        }
        var head = env.exec(List.of("git", "-c", "safe.directory=*", "-C", action.contextDir(),
                "rev-parse", "--verify", "HEAD"));
        if (!head.succeeded()) {
            throw new BuildException(stage,
                    "Cannot read the workspace revision (exit " + head.exitCode() + "): " + head.tail(3));
        }
        String actual = head.lastLine();
        if (!actual.startsWith(source.commit()) || source.commit().length() < 7) {
            throw new BuildException(stage,
                    "Workspace is at " + shortSha(actual) + ", not " + source.shortCommit());
        }
    }

    private static String shortSha(String sha) {
        return sha.length() > 8 ? sha.substring(0, 8) : sha;
    }

    static String dockerfilePath(BuildAction action) {
        if (action.dockerfile().startsWith("/")) {
            return action.dockerfile();
        }
        return action.contextDir().endsWith("/")
                ? action.contextDir() + action.dockerfile()
                : action.contextDir() + "/" + action.dockerfile();
    }
}
