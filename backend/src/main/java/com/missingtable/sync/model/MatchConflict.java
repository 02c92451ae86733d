package com.missingtable.sync.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "match_conflicts", indexes = {
        @Index(name = "idx_match_conflicts_match", columnList = "match_id"),
        @Index(name = "idx_match_conflicts_open", columnList = "resolved")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_match_conflicts_open_fingerprint", columnNames = {"match_id", "fingerprint"})
})
public class MatchConflict {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "match_id", nullable = false)
    private Long matchId;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 32)
    private ConflictReason reason;

    @Column(name = "stored_value", columnDefinition = "TEXT", nullable = false)
    private String storedValue;

    @Column(name = "incoming_value", columnDefinition = "TEXT", nullable = false)
    private String incomingValue;

    // Cleared on resolution so the same divergence may be raised again later
    @Column(name = "fingerprint", length = 128)
    private String fingerprint;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;

    @Column(name = "resolved", nullable = false)
    private boolean resolved;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolved_by", length = 100)
    private String resolvedBy;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getMatchId() { return matchId; }
    public void setMatchId(Long matchId) { this.matchId = matchId; }
    public ConflictReason getReason() { return reason; }
    public void setReason(ConflictReason reason) { this.reason = reason; }
    public String getStoredValue() { return storedValue; }
    public void setStoredValue(String storedValue) { this.storedValue = storedValue; }
    public String getIncomingValue() { return incomingValue; }
    public void setIncomingValue(String incomingValue) { this.incomingValue = incomingValue; }
    public String getFingerprint() { return fingerprint; }
    public void setFingerprint(String fingerprint) { this.fingerprint = fingerprint; }
    public Instant getDetectedAt() { return detectedAt; }
    public void setDetectedAt(Instant detectedAt) { this.detectedAt = detectedAt; }
    public boolean isResolved() { return resolved; }
    public void setResolved(boolean resolved) { this.resolved = resolved; }
    public Instant getResolvedAt() { return resolvedAt; }
    public void setResolvedAt(Instant resolvedAt) { this.resolvedAt = resolvedAt; }
    public String getResolvedBy() { return resolvedBy; }
    public void setResolvedBy(String resolvedBy) { this.resolvedBy = resolvedBy; }
}
