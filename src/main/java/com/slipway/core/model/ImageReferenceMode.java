package com.slipway.core.model;

/**
 * Which image reference the deployment target is told to run.
 */
public enum ImageReferenceMode {

    /** The floating {@code latest} tag; the target re-pulls it on every rollout. */
    LATEST,

    /** The run's immutable version tag. */
    VERSION;

    public static final String LATEST_TAG = "latest";

    public String resolve(String repository, Artifact artifact) {
        if (this == VERSION) {
            if (artifact == null) {
                throw new IllegalStateException("VERSION image references need an artifact from a build stage");
            }
            return artifact.reference();
        }
        return repository + ":" + LATEST_TAG;
    }
}
