package com.missingtable.sync.controller;

import com.missingtable.sync.dto.ConflictEntryDTO;
import com.missingtable.sync.service.ConflictService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api/conflicts")
@CrossOrigin(origins = "*")
public class ConflictController {

    private final ConflictService conflictService;

    public ConflictController(ConflictService conflictService) {
        this.conflictService = conflictService;
    }

    @GetMapping
    public List<ConflictEntryDTO> list(@RequestParam(value = "open", defaultValue = "true") boolean open) {
        return conflictService.list(open);
    }

    @GetMapping("/matches/{matchId}")
    public List<ConflictEntryDTO> forMatch(@PathVariable("matchId") Long matchId) {
        return conflictService.forMatch(matchId);
    }

    @PostMapping("/matches/{matchId}/unlock")
    public ResponseEntity<Map<String, Object>> unlock(@PathVariable("matchId") Long matchId,
                                                      @RequestParam("actor") String actor) {
        if (actor == null || actor.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("success", false, "message", "actor is required"));
        }
        try {
            int resolved = conflictService.unlock(matchId, actor.trim());
            return ResponseEntity.ok(Map.of("success", true, "matchId", matchId, "resolvedConflicts", resolved));
        } catch (NoSuchElementException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @PostMapping("/{conflictId}/dismiss")
    public ResponseEntity<Map<String, Object>> dismiss(@PathVariable("conflictId") Long conflictId,
                                                       @RequestParam("actor") String actor) {
        if (actor == null || actor.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("success", false, "message", "actor is required"));
        }
        try {
            conflictService.dismiss(conflictId, actor.trim());
            return ResponseEntity.ok(Map.of("success", true, "conflictId", conflictId));
        } catch (NoSuchElementException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("success", false, "message", e.getMessage()));
        }
    }
}
