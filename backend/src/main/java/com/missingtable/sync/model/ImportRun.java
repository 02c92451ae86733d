package com.missingtable.sync.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "import_runs", indexes = {
        @Index(name = "idx_import_runs_file_hash", columnList = "file_hash")
})
public class ImportRun {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "file_hash", length = 128, nullable = false)
    private String fileHash;

    @Column(length = 255)
    private String filename;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", length = 16, nullable = false)
    private MatchSource source = MatchSource.MANUAL;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "rows_total")
    private Integer rowsTotal = 0;

    @Column(name = "rows_created")
    private Integer rowsCreated = 0;

    @Column(name = "rows_updated")
    private Integer rowsUpdated = 0;

    @Column(name = "rows_skipped")
    private Integer rowsSkipped = 0;

    @Column(name = "rows_conflicted")
    private Integer rowsConflicted = 0;

    @Column(name = "rows_failed")
    private Integer rowsFailed = 0;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(length = 32)
    private String status = "IN_PROGRESS";

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getFileHash() { return fileHash; }
    public void setFileHash(String fileHash) { this.fileHash = fileHash; }
    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }
    public MatchSource getSource() { return source; }
    public void setSource(MatchSource source) { this.source = source; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public Integer getRowsTotal() { return rowsTotal; }
    public void setRowsTotal(Integer rowsTotal) { this.rowsTotal = rowsTotal; }
    public Integer getRowsCreated() { return rowsCreated; }
    public void setRowsCreated(Integer rowsCreated) { this.rowsCreated = rowsCreated; }
    public Integer getRowsUpdated() { return rowsUpdated; }
    public void setRowsUpdated(Integer rowsUpdated) { this.rowsUpdated = rowsUpdated; }
    public Integer getRowsSkipped() { return rowsSkipped; }
    public void setRowsSkipped(Integer rowsSkipped) { this.rowsSkipped = rowsSkipped; }
    public Integer getRowsConflicted() { return rowsConflicted; }
    public void setRowsConflicted(Integer rowsConflicted) { this.rowsConflicted = rowsConflicted; }
    public Integer getRowsFailed() { return rowsFailed; }
    public void setRowsFailed(Integer rowsFailed) { this.rowsFailed = rowsFailed; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
}
