package com.slipway.core.model;

/**
 * Privileged host resources a stage environment may be granted.
 * Nothing here is granted implicitly: a stage lists what it needs.
 */
public enum Capability {
    /** Bind-mounts the host container runtime's control socket into the environment. */
    DOCKER_SOCKET
}
