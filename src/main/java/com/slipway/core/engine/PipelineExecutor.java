package com.slipway.core.engine;

import com.slipway.artifact.ArtifactBuilder;
import com.slipway.artifact.RegistryPublisher;
import com.slipway.core.events.EventBus;
import com.slipway.core.exception.BuildException;
import com.slipway.core.exception.PipelineException;
import com.slipway.core.exception.ProvisionException;
import com.slipway.core.exception.PublishException;
import com.slipway.core.exception.RunAbortedException;
import com.slipway.core.exception.StageTimeoutException;
import com.slipway.core.exception.TriggerException;
import com.slipway.core.logging.MdcContext;
import com.slipway.core.logging.StageLog;
import com.slipway.core.metrics.PipelineMetrics;
import com.slipway.core.model.Artifact;
import com.slipway.core.model.BuildAction;
import com.slipway.core.model.PipelineRun;
import com.slipway.core.model.PublishAction;
import com.slipway.core.model.RetryPolicy;
import com.slipway.core.model.RunStatus;
import com.slipway.core.model.RunSummary;
import com.slipway.core.model.StageAction;
import com.slipway.core.model.StageSpec;
import com.slipway.core.model.StageState;
import com.slipway.core.model.TriggerAction;
import com.slipway.deploy.DeploymentTrigger;
import com.slipway.sandbox.EnvironmentHandle;
import com.slipway.sandbox.EnvironmentProvisioner;
import com.slipway.sandbox.EnvironmentRequest;
import com.slipway.sandbox.ScopedEnvironment;
import com.slipway.secrets.ResolvedSecrets;
import com.slipway.secrets.SecretResolver;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Walks a run's stages in declared order. Per stage: acquire an environment, resolve the
 * declared secrets, run the action under the stage timeout, release the environment.
 * The first failure skips every later stage. The built {@link Artifact} is the only state
 * carried from one stage to the next.
 *
 * <p>Stage state machine:
 * {@code ACQUIRING -> SECRET_RESOLVING -> EXECUTING -> RELEASING -> SUCCEEDED | FAILED | ABORTED}.
 * A retry runs the whole sequence again in a fresh environment.
 */
@Service
public class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    private final EnvironmentProvisioner provisioner;
    private final SecretResolver secretResolver;
    private final ArtifactBuilder artifactBuilder;
    private final RegistryPublisher registryPublisher;
    private final DeploymentTrigger deploymentTrigger;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;

    private final AtomicInteger workerCount = new AtomicInteger();
    private final ExecutorService workers = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "stage-worker-" + workerCount.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public PipelineExecutor(EnvironmentProvisioner provisioner,
                            SecretResolver secretResolver,
                            ArtifactBuilder artifactBuilder,
                            RegistryPublisher registryPublisher,
                            DeploymentTrigger deploymentTrigger,
                            EventBus eventBus,
                            PipelineMetrics metrics) {
        this.provisioner = provisioner;
        this.secretResolver = secretResolver;
        this.artifactBuilder = artifactBuilder;
        this.registryPublisher = registryPublisher;
        this.deploymentTrigger = deploymentTrigger;
        this.eventBus = eventBus;
        this.metrics = metrics;
        metrics.gaugeActiveEnvironments(provisioner::activeCount);
    }

    public RunSummary execute(PipelineRun run, RunControl control) {
        return execute(run, control, new RunTracker(run, eventBus, metrics));
    }

    /**
     * Runs every stage of {@code run} and returns the terminal summary. Never throws for
     * stage failures; they are reflected in the summary's status.
     */
    public RunSummary execute(PipelineRun run, RunControl control, RunTracker tracker) {
        MdcContext.setRun(run.runNumber());
        try {
            tracker.runStarted();
            log.info("Run {} started for {}@{} ({} stages)", run.runNumber(),
                    run.source().branch(), run.source().shortCommit(), run.stages().size());

            var outputs = new StageOutputs();
            RunStatus outcome = RunStatus.SUCCEEDED;
            String error = null;
            List<StageSpec> stages = run.stages();

            for (int i = 0; i < stages.size(); i++) {
                StageSpec stage = stages.get(i);
                if (control.isCancelled()) {
                    outcome = RunStatus.ABORTED;
                    error = control.reason();
                    skipFrom(tracker, stages, i);
                    break;
                }
                try {
                    runStage(run, stage, control, tracker, outputs);
                } catch (RunAbortedException e) {
                    outcome = RunStatus.ABORTED;
                    error = e.getMessage();
                    skipFrom(tracker, stages, i + 1);
                    break;
                } catch (PipelineException e) {
                    outcome = RunStatus.FAILED;
                    error = stage.name() + ": " + e.getMessage();
                    skipFrom(tracker, stages, i + 1);
                    break;
                }
            }

            tracker.runFinished(outcome, error);
            if (outcome == RunStatus.SUCCEEDED) {
                log.info("Run {} succeeded", run.runNumber());
            } else {
                log.warn("Run {} {}: {}", run.runNumber(), outcome.name().toLowerCase(), error);
            }
            return tracker.summary();
        } finally {
            MdcContext.clear();
        }
    }

    private void runStage(PipelineRun run, StageSpec stage, RunControl control,
                          RunTracker tracker, StageOutputs outputs) {
        RetryPolicy policy = stage.retryPolicy();
        for (int attempt = 1; ; attempt++) {
            MdcContext.setStage(run.runNumber(), stage.name(), attempt);
            try {
                attemptStage(run, stage, attempt, control, tracker, outputs);
                tracker.stageSucceeded(stage.name());
                log.info("Stage {} succeeded (attempt {})", stage.name(), attempt);
                return;
            } catch (PipelineException e) {
                if (e instanceof RunAbortedException || control.isCancelled()) {
                    var aborted = e instanceof RunAbortedException r
                            ? r
                            : new RunAbortedException(stage.name(), control.reason());
                    tracker.stageFinished(stage.name(), StageState.ABORTED, aborted);
                    log.warn("Stage {} aborted: {}", stage.name(), aborted.getMessage());
                    throw aborted;
                }
                if (attempt < policy.maxAttempts() && isRetryable(e, policy)) {
                    Duration backoff = policy.backoffBefore(attempt + 1);
                    log.warn("Stage {} attempt {}/{} failed ({}), retrying in {}ms: {}", stage.name(), attempt,
                            policy.maxAttempts(), e.errorType(), backoff.toMillis(), e.getMessage());
                    tracker.stageRetrying(stage.name(), attempt, backoff, e);
                    if (control.awaitCancellation(backoff)) {
                        var aborted = new RunAbortedException(stage.name(), control.reason());
                        tracker.stageFinished(stage.name(), StageState.ABORTED, aborted);
                        throw aborted;
                    }
                    continue;
                }
                tracker.stageFinished(stage.name(), StageState.FAILED, e);
                log.error("Stage {} failed after {} attempt(s) ({}): {}",
                        stage.name(), attempt, e.errorType(), e.getMessage());
                throw e;
            } finally {
                MdcContext.clearStage();
            }
        }
    }

    static boolean isRetryable(PipelineException e, RetryPolicy policy) {
        if (e instanceof StageTimeoutException) {
            return false;
        }
        if (e instanceof ProvisionException) {
            return policy.retryProvisioning();
        }
        return e.isTransient();
    }

    /**
     * One attempt of one stage. Failures outside the worker thread (acquire, secret
     * resolution, release) surface as {@link PipelineException} like those inside it.
     */
    private void attemptStage(PipelineRun run, StageSpec stage, int attempt, RunControl control,
                              RunTracker tracker, StageOutputs outputs) {
        try {
            attemptInEnvironment(run, stage, attempt, control, tracker, outputs);
        } catch (PipelineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw wrap(stage, e);
        }
    }

    private void attemptInEnvironment(PipelineRun run, StageSpec stage, int attempt, RunControl control,
                                      RunTracker tracker, StageOutputs outputs) {
        String name = stage.name();
        tracker.stageStarted(name, attempt);
        tracker.stageState(name, StageState.ACQUIRING);

        var request = new EnvironmentRequest(run.runNumber(), name, attempt, stage.environment());
        try (var scoped = acquire(request, tracker)) {
            metrics.recordEnvironment("acquire");
            tracker.stageState(name, StageState.SECRET_RESOLVING);

            try (var secrets = secretResolver.resolve(name, stage.secretScopes())) {
                var redactor = secrets.redactor();
                tracker.stageState(name, StageState.EXECUTING);
                StageLog stageLog = tracker.logFor(name, redactor::redact);
                try {
                    runWithTimeout(stage, control,
                            () -> dispatch(run, stage, scoped.handle(), secrets, stageLog, tracker, outputs));
                } catch (PipelineException e) {
                    throw e.redact(redactor::redact);
                }
            }
        }
    }

    private ScopedEnvironment acquire(EnvironmentRequest request, RunTracker tracker) {
        String name = request.stageName();
        try {
            return ScopedEnvironment.acquire(provisioner, request, () -> {
                tracker.stageState(name, StageState.RELEASING);
                metrics.recordEnvironment("release");
            });
        } catch (PipelineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProvisionException(name, "Cannot acquire environment: " + e.getMessage(), e);
        }
    }

    private void dispatch(PipelineRun run, StageSpec stage, EnvironmentHandle env, ResolvedSecrets secrets,
                          StageLog stageLog, RunTracker tracker, StageOutputs outputs) {
        StageAction action = stage.action();
        if (action instanceof BuildAction build) {
            Artifact artifact = artifactBuilder.build(env, run.source(), build, run.repository(),
                    run.runNumber(), stageLog);
            outputs.artifact = artifact;
            tracker.artifactBuilt(artifact);
        } else if (action instanceof PublishAction publish) {
            tracker.published(registryPublisher.publish(env, outputs.artifact, publish, secrets, stageLog));
        } else if (action instanceof TriggerAction trigger) {
            tracker.deployed(deploymentTrigger.trigger(stage.name(), run, outputs.artifact, trigger,
                    secrets, stageLog));
        }
    }

    private void runWithTimeout(StageSpec stage, RunControl control, Runnable action) {
        Duration timeout = stage.retryPolicy().timeout();
        var mdc = MDC.getCopyOfContextMap();
        Future<?> future = workers.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                action.run();
            } finally {
                MDC.clear();
            }
        });
        control.bind(future);
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StageTimeoutException(stage.name(), timeout);
        } catch (CancellationException e) {
            throw new RunAbortedException(stage.name(), control.reason());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PipelineException pipelineException) {
                throw pipelineException;
            }
            throw wrap(stage, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RunAbortedException(stage.name(), "Interrupted");
        } finally {
            control.unbind();
        }
    }

    /** Non-pipeline failures fail the stage under the action's own exception type. */
    static PipelineException wrap(StageSpec stage, Throwable cause) {
        String message = "Unexpected " + cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return switch (stage.action().kind()) {
            case BUILD -> new BuildException(stage.name(), message, cause);
            case PUBLISH -> PublishException.unexpected(stage.name(), cause);
            case TRIGGER -> new TriggerException(stage.name(), message, cause);
        };
    }

    private static void skipFrom(RunTracker tracker, List<StageSpec> stages, int from) {
        for (int i = from; i < stages.size(); i++) {
            tracker.stageSkipped(stages.get(i).name());
        }
    }

    @PreDestroy
    void shutdown() {
        workers.shutdownNow();
    }

    /** What earlier stages handed forward. */
    private static final class StageOutputs {
        private volatile Artifact artifact;
    }
}
