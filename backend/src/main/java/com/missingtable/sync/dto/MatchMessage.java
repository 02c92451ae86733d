package com.missingtable.sync.dto;

import com.missingtable.sync.model.MatchSource;
import com.missingtable.sync.model.MatchStatus;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Normalized inbound match message produced by {@code MatchMessageValidator}. Reference
 * fields still hold the producer's identifiers; they are resolved to ids later.
 */
public class MatchMessage {
    private String homeTeam;
    private String awayTeam;
    private LocalDate date;
    private String season;
    private String ageGroup;
    private String matchType;
    private String division;

    private MatchStatus status;
    private Integer homeScore;
    private Integer awayScore;

    private String externalMatchId;
    private MatchSource source;
    private Instant scheduledKickoff;
    private String actor;

    public MatchMessage() {}

    public MatchMessage(String homeTeam, String awayTeam, LocalDate date,
                        String season, String ageGroup, String matchType, String division,
                        MatchStatus status, Integer homeScore, Integer awayScore,
                        String externalMatchId, MatchSource source) {
        this.homeTeam = homeTeam;
        this.awayTeam = awayTeam;
        this.date = date;
        this.season = season;
        this.ageGroup = ageGroup;
        this.matchType = matchType;
        this.division = division;
        this.status = status;
        this.homeScore = homeScore;
        this.awayScore = awayScore;
        this.externalMatchId = externalMatchId;
        this.source = source;
    }

    public boolean hasScores() {
        return homeScore != null && awayScore != null;
    }

    public boolean hasExternalId() {
        return externalMatchId != null && !externalMatchId.isBlank();
    }

    /** created_by / updated_by value: the acting user when known, else the source tag. */
    public String auditActor() {
        return (actor != null && !actor.isBlank()) ? actor : source.tag();
    }

    public String describe() {
        return homeTeam + " vs " + awayTeam + " on " + date + (hasExternalId() ? " (ext " + externalMatchId + ")" : "");
    }

    public String getHomeTeam() { return homeTeam; }
    public void setHomeTeam(String homeTeam) { this.homeTeam = homeTeam; }
    public String getAwayTeam() { return awayTeam; }
    public void setAwayTeam(String awayTeam) { this.awayTeam = awayTeam; }
    public LocalDate getDate() { return date; }
    public void setDate(LocalDate date) { this.date = date; }
    public String getSeason() { return season; }
    public void setSeason(String season) { this.season = season; }
    public String getAgeGroup() { return ageGroup; }
    public void setAgeGroup(String ageGroup) { this.ageGroup = ageGroup; }
    public String getMatchType() { return matchType; }
    public void setMatchType(String matchType) { this.matchType = matchType; }
    public String getDivision() { return division; }
    public void setDivision(String division) { this.division = division; }
    public MatchStatus getStatus() { return status; }
    public void setStatus(MatchStatus status) { this.status = status; }
    public Integer getHomeScore() { return homeScore; }
    public void setHomeScore(Integer homeScore) { this.homeScore = homeScore; }
    public Integer getAwayScore() { return awayScore; }
    public void setAwayScore(Integer awayScore) { this.awayScore = awayScore; }
    public String getExternalMatchId() { return externalMatchId; }
    public void setExternalMatchId(String externalMatchId) { this.externalMatchId = externalMatchId; }
    public MatchSource getSource() { return source; }
    public void setSource(MatchSource source) { this.source = source; }
    public Instant getScheduledKickoff() { return scheduledKickoff; }
    public void setScheduledKickoff(Instant scheduledKickoff) { this.scheduledKickoff = scheduledKickoff; }
    public String getActor() { return actor; }
    public void setActor(String actor) { this.actor = actor; }
}
