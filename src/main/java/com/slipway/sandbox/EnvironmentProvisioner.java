package com.slipway.sandbox;

/**
 * Creates and tears down isolated stage environments.
 * Implementations: DockerEnvironmentProvisioner.
 */
public interface EnvironmentProvisioner {

    /**
     * Creates and starts an environment for one stage attempt.
     *
     * @return a handle the caller must pass to {@link #release} exactly once
     * @throws com.slipway.core.exception.ProvisionException if the image cannot be obtained,
     *         a required mount is unavailable, or the runtime refuses the request
     */
    EnvironmentHandle acquire(EnvironmentRequest request);

    /**
     * Stops and removes the environment. Idempotent and never throws, including when the
     * environment's process already exited abnormally.
     */
    void release(EnvironmentHandle handle);

    /** Number of environments acquired and not yet released. */
    int activeCount();
}
