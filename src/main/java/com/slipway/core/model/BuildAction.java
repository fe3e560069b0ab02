package com.slipway.core.model;

/**
 * Builds the run's artifact from a build context inside the environment.
 *
 * @param contextDir build context, relative to the environment's working directory
 * @param dockerfile Dockerfile path, relative to the context
 */
public record BuildAction(String contextDir, String dockerfile) implements StageAction {

    public BuildAction {
        contextDir = contextDir != null && !contextDir.isBlank() ? contextDir : ".";
        dockerfile = dockerfile != null && !dockerfile.isBlank() ? dockerfile : "Dockerfile";
    }

    @Override
    public Kind kind() {
        return Kind.BUILD;
    }
}
