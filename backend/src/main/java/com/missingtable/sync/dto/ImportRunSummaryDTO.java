package com.missingtable.sync.dto;

import java.time.Instant;
import java.util.List;

public class ImportRunSummaryDTO {
    private Long id;
    private String status;
    private String filename;
    private Integer rowsTotal;
    private Integer created;
    private Integer updated;
    private Integer skipped;
    private Integer conflicts;
    private Integer failed;
    private Instant startedAt;
    private Instant finishedAt;
    private List<String> errors;

    public ImportRunSummaryDTO() {}

    public ImportRunSummaryDTO(Long id, String status, String filename, Integer rowsTotal, Integer created,
                               Integer updated, Integer skipped, Integer conflicts, Integer failed,
                               Instant startedAt, Instant finishedAt, List<String> errors) {
        this.id = id;
        this.status = status;
        this.filename = filename;
        this.rowsTotal = rowsTotal;
        this.created = created;
        this.updated = updated;
        this.skipped = skipped;
        this.conflicts = conflicts;
        this.failed = failed;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.errors = errors;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }
    public Integer getRowsTotal() { return rowsTotal; }
    public void setRowsTotal(Integer rowsTotal) { this.rowsTotal = rowsTotal; }
    public Integer getCreated() { return created; }
    public void setCreated(Integer created) { this.created = created; }
    public Integer getUpdated() { return updated; }
    public void setUpdated(Integer updated) { this.updated = updated; }
    public Integer getSkipped() { return skipped; }
    public void setSkipped(Integer skipped) { this.skipped = skipped; }
    public Integer getConflicts() { return conflicts; }
    public void setConflicts(Integer conflicts) { this.conflicts = conflicts; }
    public Integer getFailed() { return failed; }
    public void setFailed(Integer failed) { this.failed = failed; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
    public List<String> getErrors() { return errors; }
    public void setErrors(List<String> errors) { this.errors = errors; }
}
