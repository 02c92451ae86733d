package com.missingtable.sync.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A reconciled match row. Writes go through {@code MatchPersistenceAdapter} as conditional
 * SQL statements; this mapping is used for reads. {@code updated_at} is maintained by the
 * database on every update and is never written from the application.
 */
@Entity
@Table(name = "matches", indexes = {
        @Index(name = "idx_matches_date", columnList = "match_date"),
        @Index(name = "idx_matches_status", columnList = "match_status")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_matches_external_match_id", columnNames = {"external_match_id"}),
        @UniqueConstraint(name = "uk_matches_natural_key", columnNames = {"natural_key"})
})
public class Match {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "external_match_id", length = 255)
    private String externalMatchId;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "home_team_id", nullable = false, foreignKey = @ForeignKey(name = "fk_match_home_team"))
    private Team homeTeam;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "away_team_id", nullable = false, foreignKey = @ForeignKey(name = "fk_match_away_team"))
    private Team awayTeam;

    @Column(name = "match_date", nullable = false)
    private LocalDate date;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "season_id", nullable = false, foreignKey = @ForeignKey(name = "fk_match_season"))
    private Season season;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "age_group_id", nullable = false, foreignKey = @ForeignKey(name = "fk_match_age_group"))
    private AgeGroup ageGroup;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "match_type_id", nullable = false, foreignKey = @ForeignKey(name = "fk_match_match_type"))
    private MatchType matchType;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "division_id", foreignKey = @ForeignKey(name = "fk_match_division"))
    private Division division;

    @Column(name = "natural_key", nullable = false, length = 255)
    private String naturalKey;

    @Column(name = "home_score")
    private Integer homeScore;

    @Column(name = "away_score")
    private Integer awayScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_status", nullable = false, length = 16)
    private MatchStatus status = MatchStatus.SCHEDULED;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 16)
    private MatchSource source = MatchSource.MANUAL;

    @Column(name = "score_locked", nullable = false)
    private boolean locked;

    @Column(name = "scheduled_kickoff")
    private Instant scheduledKickoff;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "updated_by", length = 100)
    private String updatedBy;

    @Column(name = "created_at", insertable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", insertable = false, updatable = false)
    private Instant updatedAt;

    @Version
    @Column(nullable = false)
    private long version;

    public Match() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getExternalMatchId() { return externalMatchId; }
    public void setExternalMatchId(String externalMatchId) { this.externalMatchId = externalMatchId; }

    public Team getHomeTeam() { return homeTeam; }
    public void setHomeTeam(Team homeTeam) { this.homeTeam = homeTeam; }

    public Team getAwayTeam() { return awayTeam; }
    public void setAwayTeam(Team awayTeam) { this.awayTeam = awayTeam; }

    public LocalDate getDate() { return date; }
    public void setDate(LocalDate date) { this.date = date; }

    public Season getSeason() { return season; }
    public void setSeason(Season season) { this.season = season; }

    public AgeGroup getAgeGroup() { return ageGroup; }
    public void setAgeGroup(AgeGroup ageGroup) { this.ageGroup = ageGroup; }

    public MatchType getMatchType() { return matchType; }
    public void setMatchType(MatchType matchType) { this.matchType = matchType; }

    public Division getDivision() { return division; }
    public void setDivision(Division division) { this.division = division; }

    public String getNaturalKey() { return naturalKey; }
    public void setNaturalKey(String naturalKey) { this.naturalKey = naturalKey; }

    public Integer getHomeScore() { return homeScore; }
    public void setHomeScore(Integer homeScore) { this.homeScore = homeScore; }

    public Integer getAwayScore() { return awayScore; }
    public void setAwayScore(Integer awayScore) { this.awayScore = awayScore; }

    public MatchStatus getStatus() { return status; }
    public void setStatus(MatchStatus status) { this.status = status; }

    public MatchSource getSource() { return source; }
    public void setSource(MatchSource source) { this.source = source; }

    public boolean isLocked() { return locked; }
    public void setLocked(boolean locked) { this.locked = locked; }

    public Instant getScheduledKickoff() { return scheduledKickoff; }
    public void setScheduledKickoff(Instant scheduledKickoff) { this.scheduledKickoff = scheduledKickoff; }

    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }

    public String getUpdatedBy() { return updatedBy; }
    public void setUpdatedBy(String updatedBy) { this.updatedBy = updatedBy; }

    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public long getVersion() { return version; }
    public void setVersion(long version) { this.version = version; }
}
