package com.slipway.dispatch.api;

import com.slipway.core.engine.PipelineRunService;
import com.slipway.core.model.RunSummary;
import com.slipway.core.model.SourceRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for run status, manual triggers and cancellation.
 */
@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final PipelineRunService runService;
    private final SseStreamingService sseStreamingService;

    public RunController(PipelineRunService runService, SseStreamingService sseStreamingService) {
        this.runService = runService;
        this.sseStreamingService = sseStreamingService;
    }

    @GetMapping
    public List<RunSummary> list(@RequestParam(defaultValue = "20") int limit) {
        return runService.list(Math.max(1, Math.min(limit, 200)));
    }

    /**
     * POST /api/v1/runs: start a run for an explicit branch and commit. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> trigger(@RequestBody RunRequest request) {
        if (request.branch() == null || request.branch().isBlank()
                || request.commit() == null || request.commit().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "branch and commit are required"));
        }
        var summary = runService.submit(new SourceRef(request.repositoryUrl(), request.branch(), request.commit()));
        log.info("Manual trigger accepted as run {}", summary.runNumber());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("run_number", summary.runNumber());
        response.put("status", summary.status().name());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @GetMapping("/{runNumber}")
    public ResponseEntity<RunSummary> get(@PathVariable long runNumber) {
        return runService.find(runNumber)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{runNumber}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable long runNumber) {
        if (runService.cancel(runNumber, "Cancelled via API")) {
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(Map.of("run_number", runNumber, "status", "CANCELLING"));
        }
        var existing = runService.find(runNumber);
        if (existing.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                "error", "Run " + runNumber + " already finished",
                "status", existing.get().status().name()));
    }

    /**
     * GET /api/v1/runs/{n}/events: SSE stream of stage transitions. A finished run
     * yields its summary once.
     */
    @GetMapping(value = "/{runNumber}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> events(@PathVariable long runNumber) {
        var summary = runService.find(runNumber);
        if (summary.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (summary.get().status().isTerminal()) {
            return ResponseEntity.ok(sseStreamingService.replayFinished(summary.get()));
        }
        return ResponseEntity.ok(sseStreamingService.follow(runNumber, () -> runService.find(runNumber)));
    }
}
