package com.slipway.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a run: what the REST API returns, the CLI prints and the archive stores.
 *
 * @param publishedReferences image references pushed by a publish stage
 * @param deploymentId        identifier of the convergence request, when a trigger stage succeeded
 * @param error               redacted failure reason for FAILED and ABORTED runs
 */
public record RunSummary(
    long runNumber,
    String branch,
    String commit,
    RunStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    long durationMs,
    List<StageRecord> stages,
    Artifact artifact,
    List<String> publishedReferences,
    String deploymentId,
    String error
) {
    public RunSummary {
        stages = stages != null ? List.copyOf(stages) : List.of();
        publishedReferences = publishedReferences != null ? List.copyOf(publishedReferences) : List.of();
    }

    public StageRecord stage(String name) {
        return stages.stream()
                .filter(s -> s.name().equals(name))
                .findFirst()
                .orElse(null);
    }
}
