package com.slipway.sandbox;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pairs one {@link EnvironmentProvisioner#acquire} with exactly one
 * {@link EnvironmentProvisioner#release}, on every exit path of a try-with-resources block.
 */
public final class ScopedEnvironment implements AutoCloseable {

    private final EnvironmentProvisioner provisioner;
    private final EnvironmentHandle handle;
    private final Runnable beforeRelease;
    private final AtomicBoolean released = new AtomicBoolean(false);

    private ScopedEnvironment(EnvironmentProvisioner provisioner, EnvironmentHandle handle, Runnable beforeRelease) {
        this.provisioner = provisioner;
        this.handle = handle;
        this.beforeRelease = beforeRelease;
    }

    /**
     * Acquires an environment. If acquisition throws there is nothing to release.
     *
     * @param beforeRelease hook run just before release, e.g. to record the RELEASING state
     */
    public static ScopedEnvironment acquire(EnvironmentProvisioner provisioner,
                                            EnvironmentRequest request,
                                            Runnable beforeRelease) {
        return new ScopedEnvironment(provisioner, provisioner.acquire(request), beforeRelease);
    }

    public EnvironmentHandle handle() {
        return handle;
    }

    @Override
    public void close() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        try {
            beforeRelease.run();
        } finally {
            provisioner.release(handle);
        }
    }
}
