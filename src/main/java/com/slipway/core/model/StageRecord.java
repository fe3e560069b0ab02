package com.slipway.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of one stage's progress. Log lines are already redacted.
 */
public record StageRecord(
    String name,
    StageAction.Kind action,
    StageState state,
    int attempts,
    Instant startedAt,
    Instant finishedAt,
    long durationMs,
    String errorType,
    String errorMessage,
    List<String> log
) {
    public StageRecord {
        log = log != null ? List.copyOf(log) : List.of();
    }
}
