package com.missingtable.sync.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.missingtable.sync.dto.ImportRunSummaryDTO;
import com.missingtable.sync.dto.IngestionOutcome;
import com.missingtable.sync.model.ImportError;
import com.missingtable.sync.model.ImportRun;
import com.missingtable.sync.model.MatchSource;
import com.missingtable.sync.repository.ImportErrorRepository;
import com.missingtable.sync.repository.ImportRunRepository;
import com.missingtable.sync.util.Hashes;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bulk entry path: each CSV row becomes one match message (header names are message
 * field names, aliases included) and runs through {@link RetryingIngestionExecutor}
 * on its own. A bad row never aborts the file.
 */
@Service
public class MatchCsvImportService {
    private static final Logger log = LoggerFactory.getLogger(MatchCsvImportService.class);

    private final RetryingIngestionExecutor executor;
    private final ImportRunRepository importRunRepository;
    private final ImportErrorRepository importErrorRepository;
    private final ObjectMapper objectMapper;

    public MatchCsvImportService(RetryingIngestionExecutor executor,
                                 ImportRunRepository importRunRepository,
                                 ImportErrorRepository importErrorRepository,
                                 ObjectMapper objectMapper) {
        this.executor = executor;
        this.importRunRepository = importRunRepository;
        this.importErrorRepository = importErrorRepository;
        this.objectMapper = objectMapper;
    }

    public ImportRunSummaryDTO importCsv(MultipartFile file, MatchSource source, String actor) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        if (file.isEmpty()) {
            throw new IllegalArgumentException("CSV file is empty");
        }
        try (Reader reader = new BufferedReader(new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8))) {
            return importCsv(reader, file.getOriginalFilename(), Hashes.sha256Hex(file.getBytes()), source, actor);
        }
    }

    public ImportRunSummaryDTO importCsv(String content, String filename, MatchSource source, String actor) throws IOException {
        return importCsv(new StringReader(content), filename, Hashes.sha256Hex(content), source, actor);
    }

    private ImportRunSummaryDTO importCsv(Reader reader, String filename, String fileHash,
                                          MatchSource source, String actor) throws IOException {
        MatchSource effectiveSource = source == null ? MatchSource.MANUAL : source;
        ImportRun run = new ImportRun();
        run.setFileHash(fileHash);
        run.setFilename(filename);
        run.setSource(effectiveSource);
        run.setCreatedBy(actor != null && !actor.isBlank() ? actor : effectiveSource.tag());
        run.setStartedAt(Instant.now());
        run.setStatus("IN_PROGRESS");
        run = importRunRepository.save(run);

        int total = 0, created = 0, updated = 0, skipped = 0, conflicted = 0, failed = 0;
        List<String> messages = new ArrayList<>();

        CSVFormat fmt = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .build();
        int rowNum = 1; // header is row 1
        String parseFailure = null;
        try (CSVParser parser = new CSVParser(reader, fmt)) {
            for (CSVRecord rec : parser) {
                rowNum++;
                total++;
                ObjectNode payload = toPayload(rec, effectiveSource, actor);
                IngestionOutcome outcome;
                try {
                    outcome = executor.execute(payload);
                } catch (RuntimeException ex) {
                    // dead-letter write itself failed; keep the row in the import log
                    log.error("[Import][Row] row {} could not be recorded", rowNum, ex);
                    failed++;
                    saveError(run, rowNum, payload.toString(), ex.getMessage(), null);
                    messages.add("Row " + rowNum + ": " + ex.getMessage());
                    continue;
                }
                if (outcome.isDeadLettered()) {
                    failed++;
                    saveError(run, rowNum, payload.toString(), outcome.detail(), outcome.deadLetterId());
                    messages.add("Row " + rowNum + ": " + outcome.detail());
                    continue;
                }
                switch (outcome.action()) {
                    case CREATE -> created++;
                    case UPDATE -> updated++;
                    case CONFLICT -> conflicted++;
                    default -> skipped++;
                }
            }
        } catch (IOException | RuntimeException ex) {
            // malformed input surfaces from the record iterator as an unchecked exception
            parseFailure = "CSV parsing stopped after row " + rowNum + ": " + ex.getMessage();
            log.error("[Import][Row] run={} file={} {}", run.getId(), filename, parseFailure, ex);
            saveError(run, rowNum + 1, null, parseFailure, null);
            messages.add(parseFailure);
        }

        run.setRowsTotal(total);
        run.setRowsCreated(created);
        run.setRowsUpdated(updated);
        run.setRowsSkipped(skipped);
        run.setRowsConflicted(conflicted);
        run.setRowsFailed(failed);
        run.setFinishedAt(Instant.now());
        if (parseFailure != null) {
            run.setStatus("FAILED");
        } else {
            run.setStatus(failed > 0 ? "COMPLETED_WITH_ERRORS" : "COMPLETED");
        }
        run = importRunRepository.save(run);
        log.info("[Import][Done] run={} file={} total={} created={} updated={} skipped={} conflicts={} failed={}",
                run.getId(), filename, total, created, updated, skipped, conflicted, failed);

        return new ImportRunSummaryDTO(run.getId(), run.getStatus(), filename, total, created, updated,
                skipped, conflicted, failed, run.getStartedAt(), run.getFinishedAt(), messages);
    }

    private ObjectNode toPayload(CSVRecord rec, MatchSource source, String actor) {
        ObjectNode node = objectMapper.createObjectNode();
        for (Map.Entry<String, String> e : rec.toMap().entrySet()) {
            String value = e.getValue();
            if (value == null || value.isBlank()) continue;
            node.put(e.getKey().trim(), value.trim());
        }
        if (!node.has("source")) node.put("source", source.tag());
        if (actor != null && !actor.isBlank() && !node.has("actor")) node.put("actor", actor);
        return node;
    }

    private void saveError(ImportRun run, int rowNum, String payload, String reason, Long deadLetterId) {
        ImportError err = new ImportError();
        err.setImportRun(run);
        err.setRowNumber(rowNum);
        err.setPayload(payload);
        err.setReason(reason);
        err.setDeadLetterId(deadLetterId);
        err.setCreatedAt(Instant.now());
        importErrorRepository.save(err);
    }
}
