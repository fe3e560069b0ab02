package com.slipway.dispatch.api;

import com.slipway.core.events.EventBus;
import com.slipway.core.events.PipelineEvent;
import com.slipway.core.model.RunSummary;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Streams a run's {@link EventBus} events to SSE clients.
 * <p>
 * A stream subscribes before it looks at the run's status, so a run finishing while the
 * client connects still closes the stream: either the terminal event arrives through the
 * subscription or the status check sees the finished run and sends its summary.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Long enough for a run with several slow stages. */
    private static final long DEFAULT_TIMEOUT_MS = TimeUnit.MINUTES.toMillis(60);

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private static final Set<String> TERMINAL_EVENTS = Set.of("run.completed", "run.failed", "run.aborted");

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<RunStream> openStreams = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeats = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeats.scheduleAtFixedRate(() -> openStreams.forEach(RunStream::heartbeat),
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeats.shutdownNow();
        openStreams.forEach(RunStream::close);
    }

    /**
     * Follows an in-flight run until its terminal event.
     *
     * @param currentStatus looks the run up again once the subscription is in place
     */
    public SseEmitter follow(long runNumber, Supplier<Optional<RunSummary>> currentStatus) {
        var stream = new RunStream(runNumber, new SseEmitter(timeoutMs));
        openStreams.add(stream);
        stream.subscription = eventBus.subscribe(runNumber, stream::forward);
        if (stream.closed.get()) {
            stream.detach();
        }

        SseEmitter emitter = stream.emitter;
        emitter.onCompletion(stream::detach);
        emitter.onTimeout(() -> {
            log.debug("SSE stream for run {} timed out", runNumber);
            stream.detach();
        });
        emitter.onError(ex -> {
            log.debug("SSE stream for run {} failed: {}", runNumber, ex.getMessage());
            stream.detach();
        });
        stream.send(SseEmitter.event().comment("connected"));

        Optional<RunSummary> current = currentStatus.get();
        if (current.isEmpty()) {
            stream.close();
        } else if (current.get().status().isTerminal()) {
            log.debug("Run {} finished while the stream was opening", runNumber);
            stream.finish(summaryEvent(current.get()));
        } else {
            log.info("SSE stream opened for run {} (timeout={}ms)", runNumber, timeoutMs);
        }
        return emitter;
    }

    /**
     * Emitter for a run that already finished: one {@code run.summary} event, then complete.
     */
    public SseEmitter replayFinished(RunSummary summary) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        try {
            emitter.send(summaryEvent(summary));
            emitter.complete();
        } catch (IOException e) {
            emitter.completeWithError(e);
        }
        return emitter;
    }

    public int activeEmitterCount() {
        return openStreams.size();
    }

    private static SseEmitter.SseEventBuilder summaryEvent(RunSummary summary) {
        return SseEmitter.event().name("run.summary").data(summary);
    }

    private static Map<String, Object> payloadOf(PipelineEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("runNumber", event.runNumber());
        if (event.stage() != null) {
            data.put("stage", event.stage());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    /** One client following one run. Closes exactly once. */
    private final class RunStream {

        private final long runNumber;
        private final SseEmitter emitter;
        private final AtomicBoolean closed = new AtomicBoolean();
        private volatile EventBus.Subscription subscription;

        RunStream(long runNumber, SseEmitter emitter) {
            this.runNumber = runNumber;
            this.emitter = emitter;
        }

        void forward(PipelineEvent event) {
            var frame = SseEmitter.event().name(event.eventType()).data(payloadOf(event));
            if (TERMINAL_EVENTS.contains(event.eventType())) {
                finish(frame);
            } else if (!closed.get()) {
                send(frame);
            }
        }

        void heartbeat() {
            if (!closed.get()) {
                send(SseEmitter.event().comment("heartbeat"));
            }
        }

        /** Sends the last frame and completes, unless another path already did. */
        void finish(SseEmitter.SseEventBuilder last) {
            if (closed.compareAndSet(false, true)) {
                send(last);
                emitter.complete();
                detach();
            }
        }

        void close() {
            if (closed.compareAndSet(false, true)) {
                emitter.complete();
                detach();
            }
        }

        void detach() {
            closed.set(true);
            var current = subscription;
            if (current != null) {
                current.unsubscribe();
            }
            openStreams.remove(this);
        }

        void send(SseEmitter.SseEventBuilder frame) {
            try {
                synchronized (emitter) {
                    emitter.send(frame);
                }
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropped SSE frame for run {}: {}", runNumber, e.getMessage());
            }
        }
    }
}
