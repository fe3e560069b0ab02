package com.slipway.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * The configured pipeline every run is stamped from.
 */
public record PipelineDefinition(
    String repository,
    List<StageSpec> stages,
    DeploymentTarget target,
    ImageReferenceMode imageReferenceMode
) implements Serializable {

    public PipelineDefinition {
        stages = List.copyOf(stages);
        imageReferenceMode = imageReferenceMode != null ? imageReferenceMode : ImageReferenceMode.LATEST;
    }
}
