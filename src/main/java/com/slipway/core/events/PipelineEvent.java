package com.slipway.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted on every run and stage transition, used for SSE streaming and log collectors.
 *
 * @param eventType e.g. "run.started", "stage.state", "stage.failed", "run.completed"
 * @param runNumber the run this event belongs to
 * @param stage     the stage this event relates to (nullable for run-level events)
 * @param payload   status, duration and other key-value data; never contains secret values
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    String eventType,
    long runNumber,
    String stage,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
