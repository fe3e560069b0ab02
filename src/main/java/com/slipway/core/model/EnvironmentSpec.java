package com.slipway.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Set;

/**
 * Describes the isolated environment a stage runs in.
 *
 * @param image              execution image reference, e.g. {@code docker:27-cli}
 * @param mounts             host paths to bind-mount
 * @param workingDir         working directory inside the environment
 * @param entrypointOverride replaces the image entrypoint; empty keeps the environment idle for exec
 * @param capabilities       privileged grants, see {@link Capability}
 */
public record EnvironmentSpec(
    String image,
    List<MountRequest> mounts,
    String workingDir,
    List<String> entrypointOverride,
    Set<Capability> capabilities
) implements Serializable {

    public EnvironmentSpec {
        if (image == null || image.isBlank()) {
            throw new IllegalArgumentException("image is required");
        }
        mounts = mounts != null ? List.copyOf(mounts) : List.of();
        workingDir = workingDir != null && !workingDir.isBlank() ? workingDir : "/workspace";
        entrypointOverride = entrypointOverride != null ? List.copyOf(entrypointOverride) : List.of();
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
    }

    public static EnvironmentSpec of(String image) {
        return new EnvironmentSpec(image, List.of(), null, List.of(), Set.of());
    }

    public boolean grants(Capability capability) {
        return capabilities.contains(capability);
    }
}
