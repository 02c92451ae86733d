package com.missingtable.sync.model;

import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "admin_audit", indexes = {
        @Index(name = "idx_admin_audit_ts", columnList = "audited_at")
})
public class AdminAudit {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "audited_at", nullable = false)
    private LocalDateTime auditedAt;

    @Column(name = "action", length = 64, nullable = false)
    private String action; // unlock, dismiss-conflict, replay-dead-letter

    @Column(name = "actor", length = 100)
    private String actor;

    @Column(name = "match_id")
    private Long matchId;

    @Column(name = "params", columnDefinition = "text")
    private String params;

    @Column(name = "affected_count")
    private Long affectedCount;

    @PrePersist
    public void prePersist() {
        if (auditedAt == null) auditedAt = LocalDateTime.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public LocalDateTime getAuditedAt() { return auditedAt; }
    public void setAuditedAt(LocalDateTime auditedAt) { this.auditedAt = auditedAt; }

    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }

    public String getActor() { return actor; }
    public void setActor(String actor) { this.actor = actor; }

    public Long getMatchId() { return matchId; }
    public void setMatchId(Long matchId) { this.matchId = matchId; }

    public String getParams() { return params; }
    public void setParams(String params) { this.params = params; }

    public Long getAffectedCount() { return affectedCount; }
    public void setAffectedCount(Long affectedCount) { this.affectedCount = affectedCount; }
}
