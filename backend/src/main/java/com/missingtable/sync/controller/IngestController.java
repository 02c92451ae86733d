package com.missingtable.sync.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.missingtable.sync.dto.IngestionOutcome;
import com.missingtable.sync.messaging.MatchMessagePublisher;
import com.missingtable.sync.model.DeadLetterCategory;
import com.missingtable.sync.service.RetryingIngestionExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/ingest")
@CrossOrigin(origins = "*")
public class IngestController {

    private static final Logger log = LoggerFactory.getLogger(IngestController.class);

    private final RetryingIngestionExecutor executor;
    private final ObjectProvider<MatchMessagePublisher> publisher;

    public IngestController(RetryingIngestionExecutor executor, ObjectProvider<MatchMessagePublisher> publisher) {
        this.executor = executor;
        this.publisher = publisher;
    }

    /** Reconciles one message in the request thread and reports the outcome. */
    @PostMapping(value = "/matches", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> ingest(@RequestBody JsonNode payload) {
        IngestionOutcome outcome = executor.execute(payload);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", !outcome.isDeadLettered());
        body.put("attempts", outcome.attempts());
        body.put("detail", outcome.detail());
        if (outcome.isDeadLettered()) {
            body.put("deadLetterId", outcome.deadLetterId());
            body.put("category", outcome.deadLetterCategory().label());
            HttpStatus status = outcome.deadLetterCategory() == DeadLetterCategory.VALIDATION
                    ? HttpStatus.BAD_REQUEST : HttpStatus.UNPROCESSABLE_ENTITY;
            return ResponseEntity.status(status).body(body);
        }
        body.put("action", outcome.action().name());
        body.put("matchId", outcome.matchId());
        return ResponseEntity.ok(body);
    }

    @PostMapping(value = "/matches/async", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> enqueue(@RequestBody JsonNode payload) {
        MatchMessagePublisher pub = publisher.getIfAvailable();
        if (pub == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("success", false, "message", "Queue ingestion is disabled"));
        }
        try {
            pub.publish(payload);
        } catch (RuntimeException ex) {
            log.error("[Ingest][RMQ] publish failed", ex);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("success", false, "message", "Queue unavailable: " + ex.getMessage()));
        }
        return ResponseEntity.accepted().body(Map.of("success", true, "message", "Queued"));
    }
}
