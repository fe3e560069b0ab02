package com.slipway.core.engine;

import com.slipway.artifact.PublishAck;
import com.slipway.core.events.EventBus;
import com.slipway.core.events.PipelineEvent;
import com.slipway.core.exception.PipelineException;
import com.slipway.core.logging.StageLog;
import com.slipway.core.metrics.PipelineMetrics;
import com.slipway.core.model.Artifact;
import com.slipway.core.model.PipelineRun;
import com.slipway.core.model.RunStatus;
import com.slipway.core.model.RunSummary;
import com.slipway.core.model.StageAction;
import com.slipway.core.model.StageRecord;
import com.slipway.core.model.StageSpec;
import com.slipway.core.model.StageState;
import com.slipway.deploy.DeploymentAck;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Mutable progress of one run. Every transition is recorded here, published on the
 * {@link EventBus} and reflected in metrics. {@link #summary()} gives a consistent snapshot
 * for the REST API, the CLI and the archive.
 */
public class RunTracker {

    static final int MAX_LOG_LINES = 500;

    private final PipelineRun run;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;

    private final Object lock = new Object();
    private final Map<String, StageProgress> stages = new LinkedHashMap<>();
    private RunStatus status = RunStatus.PENDING;
    private Instant startedAt;
    private Instant finishedAt;
    private Artifact artifact;
    private List<String> publishedReferences = List.of();
    private String deploymentId;
    private String error;

    public RunTracker(PipelineRun run, EventBus eventBus, PipelineMetrics metrics) {
        this.run = run;
        this.eventBus = eventBus;
        this.metrics = metrics;
        for (StageSpec stage : run.stages()) {
            stages.put(stage.name(), new StageProgress(stage.name(), stage.action().kind()));
        }
    }

    public PipelineRun run() {
        return run;
    }

    public RunStatus status() {
        synchronized (lock) {
            return status;
        }
    }

    void runStarted() {
        synchronized (lock) {
            status = RunStatus.RUNNING;
            startedAt = Instant.now();
        }
        publish("run.started", null, Map.of(
                "status", RunStatus.RUNNING.name(),
                "branch", run.source().branch(),
                "commit", run.source().commit(),
                "stages", List.copyOf(stages.keySet())));
    }

    void stageStarted(String stage, int attempt) {
        synchronized (lock) {
            var progress = stages.get(stage);
            progress.attempts = attempt;
            if (progress.startedAt == null) {
                progress.startedAt = Instant.now();
            }
        }
        publish("stage.started", stage, Map.of("attempt", attempt, "action", stages.get(stage).action.name()));
    }

    void stageState(String stage, StageState state) {
        int attempt;
        synchronized (lock) {
            var progress = stages.get(stage);
            progress.state = state;
            attempt = progress.attempts;
        }
        publish("stage.state", stage, Map.of("state", state.name(), "attempt", attempt));
    }

    void stageRetrying(String stage, int failedAttempt, Duration backoff, PipelineException cause) {
        synchronized (lock) {
            stages.get(stage).log.add("Attempt " + failedAttempt + " failed: " + cause.getMessage());
        }
        metrics.incrementRetries(stage, cause.errorType());
        publish("stage.retrying", stage, Map.of(
                "attempt", failedAttempt,
                "nextAttempt", failedAttempt + 1,
                "backoffMs", backoff.toMillis(),
                "errorType", cause.errorType(),
                "error", cause.getMessage() != null ? cause.getMessage() : ""));
    }

    void stageSucceeded(String stage) {
        StageProgress progress;
        long durationMs;
        synchronized (lock) {
            progress = stages.get(stage);
            progress.state = StageState.SUCCEEDED;
            progress.finishedAt = Instant.now();
            durationMs = progress.durationMs();
        }
        metrics.recordStage(stage, StageState.SUCCEEDED.name(), durationMs);
        metrics.recordAttempts(stage, progress.attempts);
        publish("stage.completed", stage, Map.of(
                "state", StageState.SUCCEEDED.name(),
                "attempts", progress.attempts,
                "durationMs", durationMs));
    }

    /**
     * @param terminal {@link StageState#FAILED} or {@link StageState#ABORTED}
     */
    void stageFinished(String stage, StageState terminal, PipelineException cause) {
        StageProgress progress;
        long durationMs;
        synchronized (lock) {
            progress = stages.get(stage);
            progress.state = terminal;
            progress.finishedAt = Instant.now();
            progress.errorType = cause.errorType();
            progress.errorMessage = cause.getMessage();
            durationMs = progress.durationMs();
        }
        metrics.recordStage(stage, terminal.name(), durationMs);
        metrics.recordAttempts(stage, progress.attempts);
        publish("stage.failed", stage, Map.of(
                "state", terminal.name(),
                "attempts", progress.attempts,
                "durationMs", durationMs,
                "errorType", cause.errorType(),
                "error", cause.getMessage() != null ? cause.getMessage() : ""));
    }

    void stageSkipped(String stage) {
        synchronized (lock) {
            stages.get(stage).state = StageState.SKIPPED;
        }
        publish("stage.state", stage, Map.of("state", StageState.SKIPPED.name(), "attempt", 0));
    }

    void artifactBuilt(Artifact built) {
        synchronized (lock) {
            artifact = built;
        }
    }

    void published(PublishAck ack) {
        synchronized (lock) {
            publishedReferences = ack.pushedReferences();
        }
    }

    void deployed(DeploymentAck ack) {
        synchronized (lock) {
            deploymentId = ack.deploymentId();
        }
    }

    void runFinished(RunStatus outcome, String failure) {
        long durationMs;
        synchronized (lock) {
            status = outcome;
            error = failure;
            finishedAt = Instant.now();
            durationMs = startedAt != null ? Duration.between(startedAt, finishedAt).toMillis() : 0;
        }
        metrics.recordRunResult(outcome.name());
        String eventType = switch (outcome) {
            case SUCCEEDED -> "run.completed";
            case ABORTED -> "run.aborted";
            default -> "run.failed";
        };
        var payload = new HashMap<String, Object>();
        payload.put("status", outcome.name());
        payload.put("durationMs", durationMs);
        if (failure != null) {
            payload.put("error", failure);
        }
        publish(eventType, null, payload);
    }

    /** A log for one stage; every line passes through {@code redactor} before it is kept. */
    StageLog logFor(String stage, UnaryOperator<String> redactor) {
        return new StageLog(line -> appendLog(stage, line), redactor);
    }

    public RunSummary summary() {
        synchronized (lock) {
            var records = new ArrayList<StageRecord>(stages.size());
            for (var progress : stages.values()) {
                records.add(progress.toRecord());
            }
            long durationMs = startedAt != null && finishedAt != null
                    ? Duration.between(startedAt, finishedAt).toMillis()
                    : 0;
            return new RunSummary(run.runNumber(), run.source().branch(), run.source().commit(), status,
                    run.createdAt(), startedAt, finishedAt, durationMs, records, artifact,
                    publishedReferences, deploymentId, error);
        }
    }

    private void appendLog(String stage, String line) {
        synchronized (lock) {
            var log = stages.get(stage).log;
            if (log.size() >= MAX_LOG_LINES) {
                log.remove(0);
            }
            log.add(line);
        }
    }

    private void publish(String eventType, String stage, Map<String, Object> payload) {
        eventBus.publish(new PipelineEvent(eventType, run.runNumber(), stage, payload, Instant.now()));
    }

    private static final class StageProgress {
        private final String name;
        private final StageAction.Kind action;
        private StageState state = StageState.PENDING;
        private int attempts;
        private Instant startedAt;
        private Instant finishedAt;
        private String errorType;
        private String errorMessage;
        private final List<String> log = new ArrayList<>();

        StageProgress(String name, StageAction.Kind action) {
            this.name = name;
            this.action = action;
        }

        long durationMs() {
            return startedAt != null && finishedAt != null
                    ? Duration.between(startedAt, finishedAt).toMillis()
                    : 0;
        }

        StageRecord toRecord() {
            return new StageRecord(name, action, state, attempts, startedAt, finishedAt, durationMs(),
                    errorType, errorMessage, log);
        }
    }
}
