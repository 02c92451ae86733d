package com.missingtable.sync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.missingtable.sync.dto.MatchMessage;
import com.missingtable.sync.exception.ValidationException;
import com.missingtable.sync.model.MatchSource;
import com.missingtable.sync.model.MatchStatus;
import com.missingtable.sync.util.KickoffTimes;
import com.missingtable.sync.util.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Turns a raw producer payload into a {@link MatchMessage}, collecting every problem
 * before rejecting. Errors end in a {@link ValidationException}; warnings are only logged.
 */
@Service
public class MatchMessageValidator {
    private static final Logger log = LoggerFactory.getLogger(MatchMessageValidator.class);

    // producer-facing name -> internal name
    static final Map<String, String> FIELD_ALIASES;
    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("date", "match_date");
        m.put("score_home", "home_score");
        m.put("score_away", "away_score");
        m.put("status", "match_status");
        m.put("match_id", "external_match_id");
        FIELD_ALIASES = Collections.unmodifiableMap(m);
    }

    private static final String VALID_STATUSES = Arrays.stream(MatchStatus.values())
            .map(MatchStatus::wireValue).collect(Collectors.joining(", "));

    public static class ValidationIssue {
        public enum Level { ERROR, WARNING }
        private final Level level;
        private final String field;
        private final String message;

        public ValidationIssue(Level level, String field, String message) {
            this.level = level;
            this.field = field;
            this.message = message;
        }
        public Level getLevel() { return level; }
        public String getField() { return field; }
        public String getMessage() { return message; }
    }

    private final ZoneId sourceZone;

    public MatchMessageValidator(@Value("${sync.ingest.source-zone:America/New_York}") String sourceZone) {
        this.sourceZone = ZoneId.of(sourceZone);
    }

    public MatchMessage validate(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new ValidationException("payload", "must be a JSON object");
        }
        List<ValidationIssue> issues = new ArrayList<>();
        ObjectNode node = canonicalize((ObjectNode) payload, issues);

        MatchMessage msg = new MatchMessage();
        msg.setHomeTeam(identifier(node, "home_team", true, issues));
        msg.setAwayTeam(identifier(node, "away_team", true, issues));
        msg.setSeason(identifier(node, "season", true, issues));
        msg.setAgeGroup(identifier(node, "age_group", true, issues));
        msg.setMatchType(identifier(node, "match_type", true, issues));
        msg.setDivision(identifier(node, "division", false, issues));
        msg.setDate(matchDate(node, issues));
        msg.setStatus(status(node, issues));
        msg.setSource(source(node, issues));
        msg.setHomeScore(score(node, "home_score", issues));
        msg.setAwayScore(score(node, "away_score", issues));
        msg.setExternalMatchId(identifier(node, "external_match_id", false, issues));
        msg.setActor(identifier(node, "actor", false, issues));

        checkTeams(msg, issues);
        checkScores(node, msg, issues);
        kickoff(node, msg, issues);

        if (msg.getSeason() != null && msg.getSeason().length() < 4) {
            issues.add(warn("season", "looks too short: '" + msg.getSeason() + "'"));
        }

        List<ValidationIssue> warnings = issues.stream()
                .filter(i -> i.getLevel() == ValidationIssue.Level.WARNING).toList();
        for (ValidationIssue w : warnings) {
            log.warn("[Ingest][Validation] {} {}", w.getField(), w.getMessage());
        }
        Map<String, String> errors = new LinkedHashMap<>();
        issues.stream()
                .filter(i -> i.getLevel() == ValidationIssue.Level.ERROR)
                .forEach(i -> errors.merge(i.getField(), i.getMessage(), (a, b) -> a + "; " + b));
        if (!errors.isEmpty()) {
            log.info("[Ingest][Validation] rejected message: {}", errors);
            throw new ValidationException(errors);
        }
        return msg;
    }

    /** Copies the payload with producer aliases renamed. An internal name present alongside its alias wins. */
    ObjectNode canonicalize(ObjectNode payload, List<ValidationIssue> issues) {
        ObjectNode node = payload.deepCopy();
        for (Map.Entry<String, String> alias : FIELD_ALIASES.entrySet()) {
            JsonNode aliased = node.remove(alias.getKey());
            if (aliased == null) continue;
            if (node.has(alias.getValue())) {
                issues.add(warn(alias.getValue(), "both '" + alias.getKey() + "' and '" + alias.getValue()
                        + "' present; keeping '" + alias.getValue() + "'"));
            } else {
                node.set(alias.getValue(), aliased);
            }
        }
        return node;
    }

    // text or integer identifiers; blank strings count as absent
    private String identifier(JsonNode node, String field, boolean required, List<ValidationIssue> issues) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            if (required) issues.add(err(field, "is required"));
            return null;
        }
        if (v.isIntegralNumber()) return v.asText();
        if (!v.isTextual()) {
            issues.add(err(field, "must be a string"));
            return null;
        }
        String text = v.asText().trim();
        if (text.isEmpty()) {
            if (required) issues.add(err(field, "must not be blank"));
            return null;
        }
        return text;
    }

    private LocalDate matchDate(JsonNode node, List<ValidationIssue> issues) {
        String raw = identifier(node, "match_date", true, issues);
        if (raw == null) return null;
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException ignored) {
            // fall through to datetime forms
        }
        try {
            return OffsetDateTime.parse(raw).toLocalDate();
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return LocalDateTime.parse(raw).toLocalDate();
        } catch (DateTimeParseException e) {
            issues.add(err("match_date", "must be an ISO date (YYYY-MM-DD), got '" + raw + "'"));
            return null;
        }
    }

    private MatchStatus status(JsonNode node, List<ValidationIssue> issues) {
        String raw = identifier(node, "match_status", true, issues);
        if (raw == null) return null;
        Optional<MatchStatus> status = MatchStatus.fromWire(raw);
        if (status.isEmpty()) {
            issues.add(err("match_status", "must be one of [" + VALID_STATUSES + "], got '" + raw + "'"));
        }
        return status.orElse(null);
    }

    private MatchSource source(JsonNode node, List<ValidationIssue> issues) {
        String raw = identifier(node, "source", true, issues);
        if (raw == null) return null;
        Optional<MatchSource> source = MatchSource.fromWire(raw);
        if (source.isEmpty()) {
            issues.add(err("source", "must be manual, automated or match-scraper, got '" + raw + "'"));
        }
        return source.orElse(null);
    }

    private Integer score(JsonNode node, String field, List<ValidationIssue> issues) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        Integer value = null;
        if (v.isIntegralNumber() && v.canConvertToInt()) {
            value = v.intValue();
        } else if (v.isTextual() && v.asText().trim().matches("-?\\d{1,9}")) {
            value = Integer.parseInt(v.asText().trim());
        } else if (v.isTextual() && v.asText().isBlank()) {
            return null;
        }
        if (value == null) {
            issues.add(err(field, "must be an integer"));
            return null;
        }
        if (value < 0) {
            issues.add(err(field, "cannot be negative"));
            return null;
        }
        return value;
    }

    private void checkTeams(MatchMessage msg, List<ValidationIssue> issues) {
        if (msg.getHomeTeam() == null || msg.getAwayTeam() == null) return;
        if (NameNormalizer.normalize(msg.getHomeTeam()).equals(NameNormalizer.normalize(msg.getAwayTeam()))) {
            issues.add(err("away_team", "must differ from home_team"));
        }
    }

    private void checkScores(JsonNode node, MatchMessage msg, List<ValidationIssue> issues) {
        boolean homeGiven = present(node, "home_score");
        boolean awayGiven = present(node, "away_score");
        if (homeGiven != awayGiven) {
            issues.add(err(homeGiven ? "away_score" : "home_score", "must be provided together with the other score"));
        }
        if (msg.getStatus() == MatchStatus.COMPLETED && !homeGiven && !awayGiven) {
            issues.add(err("home_score", "is required when match_status is completed"));
            issues.add(err("away_score", "is required when match_status is completed"));
        }
    }

    private void kickoff(JsonNode node, MatchMessage msg, List<ValidationIssue> issues) {
        String raw = identifier(node, "match_time", false, issues);
        if (raw == null) return;
        Optional<LocalTime> time = KickoffTimes.parseTime(raw);
        if (time.isEmpty()) {
            issues.add(err("match_time", "must be HH:mm, got '" + raw + "'"));
            return;
        }
        if (msg.getDate() != null) {
            msg.setScheduledKickoff(KickoffTimes.toUtc(msg.getDate(), time.get(), sourceZone));
        }
    }

    private static boolean present(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && !v.isNull() && !(v.isTextual() && v.asText().isBlank());
    }

    private static ValidationIssue err(String field, String message) {
        return new ValidationIssue(ValidationIssue.Level.ERROR, field, message);
    }

    private static ValidationIssue warn(String field, String message) {
        return new ValidationIssue(ValidationIssue.Level.WARNING, field, message);
    }
}
