package com.slipway.core.model;

import java.io.Serializable;

/**
 * A host path to bind-mount into a stage environment.
 */
public record MountRequest(
    String hostPath,
    String containerPath,
    boolean readOnly
) implements Serializable {

    public MountRequest {
        if (hostPath == null || hostPath.isBlank()) {
            throw new IllegalArgumentException("hostPath is required");
        }
        if (containerPath == null || !containerPath.startsWith("/")) {
            throw new IllegalArgumentException("containerPath must be absolute: " + containerPath);
        }
    }
}
