package com.slipway.core.model;

import java.io.Serializable;

/**
 * The source revision a run was triggered for.
 *
 * @param repositoryUrl clone URL of the source repository (may be empty for local runs)
 * @param branch        branch name without the {@code refs/heads/} prefix
 * @param commit        full commit SHA
 */
public record SourceRef(
    String repositoryUrl,
    String branch,
    String commit
) implements Serializable {

    public SourceRef {
        if (branch == null || branch.isBlank()) {
            throw new IllegalArgumentException("branch is required");
        }
        if (commit == null || commit.isBlank()) {
            throw new IllegalArgumentException("commit is required");
        }
        repositoryUrl = repositoryUrl != null ? repositoryUrl : "";
    }

    public String shortCommit() {
        return commit.length() > 8 ? commit.substring(0, 8) : commit;
    }
}
