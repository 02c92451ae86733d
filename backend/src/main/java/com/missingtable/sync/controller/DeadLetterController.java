package com.missingtable.sync.controller;

import com.missingtable.sync.dto.DeadLetterDTO;
import com.missingtable.sync.dto.IngestionOutcome;
import com.missingtable.sync.service.DeadLetterReplayService;
import com.missingtable.sync.service.DeadLetterService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api/dead-letters")
@CrossOrigin(origins = "*")
public class DeadLetterController {

    private final DeadLetterService deadLetterService;
    private final DeadLetterReplayService replayService;

    public DeadLetterController(DeadLetterService deadLetterService, DeadLetterReplayService replayService) {
        this.deadLetterService = deadLetterService;
        this.replayService = replayService;
    }

    @GetMapping
    public List<DeadLetterDTO> list(@RequestParam(value = "unresolved", defaultValue = "true") boolean unresolved) {
        return deadLetterService.list(unresolved);
    }

    @PostMapping("/{id}/replay")
    public ResponseEntity<Map<String, Object>> replay(@PathVariable("id") Long id,
                                                      @RequestParam(value = "actor", defaultValue = "admin") String actor) {
        IngestionOutcome outcome;
        try {
            outcome = replayService.replay(id, actor);
        } catch (NoSuchElementException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("success", false, "message", e.getMessage()));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", !outcome.isDeadLettered());
        body.put("detail", outcome.detail());
        if (outcome.isDeadLettered()) {
            body.put("deadLetterId", outcome.deadLetterId());
        } else {
            body.put("action", outcome.action().name());
            body.put("matchId", outcome.matchId());
        }
        return ResponseEntity.ok(body);
    }
}
