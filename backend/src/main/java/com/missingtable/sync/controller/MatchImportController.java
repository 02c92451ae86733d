package com.missingtable.sync.controller;

import com.missingtable.sync.dto.ImportRunSummaryDTO;
import com.missingtable.sync.model.ImportError;
import com.missingtable.sync.model.ImportRun;
import com.missingtable.sync.model.MatchSource;
import com.missingtable.sync.repository.ImportErrorRepository;
import com.missingtable.sync.repository.ImportRunRepository;
import com.missingtable.sync.service.MatchCsvImportService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/matches/import")
@CrossOrigin(origins = "*")
public class MatchImportController {

    private final MatchCsvImportService importService;
    private final ImportRunRepository importRunRepository;
    private final ImportErrorRepository importErrorRepository;

    public MatchImportController(MatchCsvImportService importService,
                                 ImportRunRepository importRunRepository,
                                 ImportErrorRepository importErrorRepository) {
        this.importService = importService;
        this.importRunRepository = importRunRepository;
        this.importErrorRepository = importErrorRepository;
    }

    @PostMapping(value = "/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> importCsv(@RequestParam("file") MultipartFile file,
                                       @RequestParam(value = "source", defaultValue = "manual") String source,
                                       @RequestParam(value = "actor", required = false) String actor) throws Exception {
        MatchSource parsed = MatchSource.fromWire(source).orElse(null);
        if (parsed == null) {
            return ResponseEntity.badRequest().body(Map.of("success", false, "message", "Unknown source: " + source));
        }
        try {
            return ResponseEntity.ok(importService.importCsv(file, parsed, actor));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("success", false, "message", e.getMessage()));
        }
    }

    @GetMapping("/runs")
    public List<ImportRunSummaryDTO> runs() {
        return importRunRepository.findTop20ByOrderByStartedAtDesc().stream().map(this::toDto).toList();
    }

    @GetMapping("/runs/{id}/errors")
    public List<Map<String, Object>> errors(@PathVariable("id") Long id) {
        List<ImportError> errors = importErrorRepository.findByImportRunId(id);
        return errors.stream().map(e -> Map.<String, Object>of(
                "row", e.getRowNumber(),
                "reason", e.getReason() == null ? "" : e.getReason(),
                "deadLetterId", e.getDeadLetterId() == null ? -1L : e.getDeadLetterId()
        )).toList();
    }

    private ImportRunSummaryDTO toDto(ImportRun r) {
        return new ImportRunSummaryDTO(r.getId(), r.getStatus(), r.getFilename(), r.getRowsTotal(),
                r.getRowsCreated(), r.getRowsUpdated(), r.getRowsSkipped(), r.getRowsConflicted(),
                r.getRowsFailed(), r.getStartedAt(), r.getFinishedAt(), List.of());
    }
}
