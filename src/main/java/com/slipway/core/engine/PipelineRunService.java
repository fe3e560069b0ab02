package com.slipway.core.engine;

import com.slipway.core.events.EventBus;
import com.slipway.core.metrics.PipelineMetrics;
import com.slipway.core.model.PipelineDefinition;
import com.slipway.core.model.PipelineRun;
import com.slipway.core.model.RunStatus;
import com.slipway.core.model.RunSummary;
import com.slipway.core.model.SourceRef;
import com.slipway.core.persistence.RunArchive;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Starts runs, numbers them, and keeps track of the ones in flight.
 *
 * <p>Runs execute concurrently on a bounded pool; stages within a run stay strictly
 * sequential. Terminal runs are archived and then evicted from memory.
 */
@Service
public class PipelineRunService {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunService.class);

    private final PipelineDefinition definition;
    private final PipelineExecutor executor;
    private final RunArchive archive;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;
    private final PipelineProperties properties;

    private final AtomicLong runCounter;
    private final ConcurrentHashMap<Long, ActiveRun> activeRuns = new ConcurrentHashMap<>();
    private final AtomicInteger threadCount = new AtomicInteger();
    private final ExecutorService runPool;

    public PipelineRunService(PipelineDefinition definition,
                              PipelineExecutor executor,
                              RunArchive archive,
                              EventBus eventBus,
                              PipelineMetrics metrics,
                              PipelineProperties properties) {
        this.definition = definition;
        this.executor = executor;
        this.archive = archive;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.runCounter = new AtomicLong(archive.latestRunNumber());
        this.runPool = Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrentRuns()), r -> {
            Thread t = new Thread(r, "pipeline-run-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queues a run for {@code source} and returns immediately.
     *
     * @return the new run's summary, status {@link RunStatus#PENDING}
     */
    public RunSummary submit(SourceRef source) {
        var active = register(source);
        RunSummary queued = active.tracker.summary();
        CompletableFuture
                .supplyAsync(() -> executor.execute(active.run, active.control, active.tracker), runPool)
                .whenComplete((summary, error) -> complete(active, error));
        return queued;
    }

    /** Executes a run on the calling thread. Used by the CLI. */
    public RunSummary runNow(SourceRef source) {
        var active = register(source);
        Throwable failure = null;
        try {
            return executor.execute(active.run, active.control, active.tracker);
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            complete(active, failure);
        }
    }

    public Optional<RunSummary> find(long runNumber) {
        var active = activeRuns.get(runNumber);
        if (active != null) {
            return Optional.of(active.tracker.summary());
        }
        return archive.find(runNumber);
    }

    /** Most recent runs first, in-flight and archived. */
    public List<RunSummary> list(int limit) {
        var result = new ArrayList<RunSummary>();
        var seen = new HashSet<Long>();
        for (var active : activeRuns.values()) {
            var summary = active.tracker.summary();
            result.add(summary);
            seen.add(summary.runNumber());
        }
        for (var archived : archive.list(limit)) {
            if (seen.add(archived.runNumber())) {
                result.add(archived);
            }
        }
        result.sort(Comparator.comparingLong(RunSummary::runNumber).reversed());
        return result.size() > limit ? List.copyOf(result.subList(0, limit)) : result;
    }

    /**
     * Requests cancellation of an in-flight run.
     *
     * @return false if the run is not active (unknown or already terminal)
     */
    public boolean cancel(long runNumber, String reason) {
        var active = activeRuns.get(runNumber);
        if (active == null) {
            return false;
        }
        log.info("Cancelling run {}: {}", runNumber, reason);
        active.control.cancel(reason);
        return true;
    }

    public int activeCount() {
        return activeRuns.size();
    }

    public PipelineDefinition definition() {
        return definition;
    }

    private ActiveRun register(SourceRef source) {
        var run = PipelineRun.of(definition, nextRunNumber(), source);
        if (properties.isSupersedeRunning()) {
            supersede(run);
        }
        var active = new ActiveRun(run, new RunTracker(run, eventBus, metrics), new RunControl());
        activeRuns.put(run.runNumber(), active);
        log.info("Run {} queued for {}@{}", run.runNumber(), source.branch(), source.shortCommit());
        return active;
    }

    private synchronized long nextRunNumber() {
        long runNumber = runCounter.incrementAndGet();
        try {
            archive.recordRunNumber(runNumber);
        } catch (IOException e) {
            log.warn("Cannot record run number {}; it may be reissued after a restart: {}",
                    runNumber, e.getMessage());
        }
        return runNumber;
    }

    private void supersede(PipelineRun newer) {
        for (var active : activeRuns.values()) {
            if (active.run.source().branch().equals(newer.source().branch())
                    && active.run.runNumber() < newer.runNumber()) {
                cancel(active.run.runNumber(), "Superseded by run " + newer.runNumber());
            }
        }
    }

    private void complete(ActiveRun active, Throwable error) {
        long runNumber = active.run.runNumber();
        if (error != null) {
            log.error("Run {} terminated unexpectedly", runNumber, error);
        }
        try {
            archive.save(active.tracker.summary());
        } catch (IOException e) {
            log.warn("Failed to archive run {}: {}", runNumber, e.getMessage());
        } finally {
            activeRuns.remove(runNumber);
        }
    }

    @PreDestroy
    void shutdown() {
        activeRuns.values().forEach(active -> active.control.cancel("Orchestrator shutting down"));
        runPool.shutdownNow();
    }

    private static final class ActiveRun {
        private final PipelineRun run;
        private final RunTracker tracker;
        private final RunControl control;

        ActiveRun(PipelineRun run, RunTracker tracker, RunControl control) {
            this.run = run;
            this.tracker = tracker;
            this.control = control;
        }
    }
}
