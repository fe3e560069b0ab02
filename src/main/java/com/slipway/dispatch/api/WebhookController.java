package com.slipway.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slipway.core.engine.PipelineProperties;
import com.slipway.core.engine.PipelineRunService;
import com.slipway.core.model.SourceRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Source-control push webhook. One accepted push starts one run.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private static final String BRANCH_PREFIX = "refs/heads/";
    private static final String NULL_COMMIT = "0000000000000000000000000000000000000000";

    private final PipelineRunService runService;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;

    public WebhookController(PipelineRunService runService, PipelineProperties properties,
                             ObjectMapper objectMapper) {
        this.runService = runService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * POST /api/v1/webhooks/push, GitHub push payload ({@code ref}, {@code after},
     * {@code repository.clone_url}). Returns 202 with the run number, or 200 when ignored.
     */
    @PostMapping("/push")
    public ResponseEntity<Map<String, Object>> push(
            @RequestBody(required = false) byte[] body,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestHeader(value = "X-GitHub-Event", required = false) String event) {
        byte[] payload = body != null ? body : new byte[0];

        String secret = properties.getWebhookSecret();
        if (secret != null && !secret.isBlank() && !WebhookSignature.verify(secret, payload, signature)) {
            log.warn("Rejected webhook with invalid signature");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "Invalid signature"));
        }

        if ("ping".equals(event)) {
            return ResponseEntity.ok(Map.of("status", "pong"));
        }
        if (event != null && !"push".equals(event)) {
            return ignored("event " + event + " does not start runs");
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(payload);
        } catch (IOException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Malformed JSON payload"));
        }
        if (json == null || !json.hasNonNull("ref") || !json.hasNonNull("after")) {
            return ResponseEntity.badRequest().body(Map.of("error", "Push payload needs 'ref' and 'after'"));
        }

        String ref = json.get("ref").asText();
        String commit = json.get("after").asText();
        if (!ref.startsWith(BRANCH_PREFIX)) {
            return ignored(ref + " is not a branch");
        }
        if (json.path("deleted").asBoolean(false) || NULL_COMMIT.equals(commit)) {
            return ignored("branch deleted");
        }
        String branch = ref.substring(BRANCH_PREFIX.length());
        if (!properties.acceptsBranch(branch)) {
            return ignored("branch " + branch + " is not built");
        }

        var source = new SourceRef(json.path("repository").path("clone_url").asText(""), branch, commit);
        var summary = runService.submit(source);
        log.info("Push to {}@{} accepted as run {}", branch, source.shortCommit(), summary.runNumber());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("run_number", summary.runNumber());
        response.put("status", summary.status().name());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    private ResponseEntity<Map<String, Object>> ignored(String reason) {
        log.info("Ignoring webhook: {}", reason);
        return ResponseEntity.ok(Map.of("status", "ignored", "reason", reason));
    }
}
