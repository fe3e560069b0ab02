package com.slipway.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Immutable context of one run, handed to every stage in place of ambient pipeline state.
 *
 * @param runNumber          monotonically increasing build number
 * @param source             the revision being built
 * @param repository         image repository artifacts are tagged under
 * @param stages             ordered stage list, frozen at creation
 * @param target             deployment target for trigger stages (nullable when no trigger stage)
 * @param imageReferenceMode which tag the target is asked to run
 * @param createdAt          when the trigger fired
 */
public record PipelineRun(
    long runNumber,
    SourceRef source,
    String repository,
    List<StageSpec> stages,
    DeploymentTarget target,
    ImageReferenceMode imageReferenceMode,
    Instant createdAt
) implements Serializable {

    public PipelineRun {
        if (runNumber < 1) {
            throw new IllegalArgumentException("runNumber must be positive");
        }
        stages = List.copyOf(stages);
    }

    public static PipelineRun of(PipelineDefinition definition, long runNumber, SourceRef source) {
        return new PipelineRun(runNumber, source, definition.repository(), definition.stages(),
                definition.target(), definition.imageReferenceMode(), Instant.now());
    }
}
