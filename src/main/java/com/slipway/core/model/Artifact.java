package com.slipway.core.model;

import java.io.Serializable;

/**
 * A built image. Identity is the content digest; tags are pointers.
 *
 * @param repository image repository, e.g. {@code registry.example.com/team/app}
 * @param versionTag the run number the artifact was built for
 * @param digest     content digest ({@code sha256:...})
 */
public record Artifact(
    String repository,
    String versionTag,
    String digest
) implements Serializable {

    public Artifact {
        if (repository == null || repository.isBlank()) {
            throw new IllegalArgumentException("repository is required");
        }
        if (versionTag == null || versionTag.isBlank()) {
            throw new IllegalArgumentException("versionTag is required");
        }
        if (digest == null || !digest.startsWith("sha256:")) {
            throw new IllegalArgumentException("digest must be a sha256 digest: " + digest);
        }
    }

    /** {@code repository:versionTag}. */
    public String reference() {
        return repository + ":" + versionTag;
    }

    public String reference(String tag) {
        return repository + ":" + tag;
    }
}
