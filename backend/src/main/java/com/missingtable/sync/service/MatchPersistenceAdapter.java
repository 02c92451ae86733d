package com.missingtable.sync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.missingtable.sync.dto.MatchMessage;
import com.missingtable.sync.dto.MatchSnapshot;
import com.missingtable.sync.dto.ResolvedReferences;
import com.missingtable.sync.exception.IdentityRaceException;
import com.missingtable.sync.exception.PermanentIngestionException;
import com.missingtable.sync.model.MatchSource;
import com.missingtable.sync.util.Hashes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conditional writes against the match tables. Every statement either applies completely
 * or reports that another writer got there first ({@link IdentityRaceException}), so the
 * caller can re-run the whole unit of work against fresh state.
 */
@Repository
public class MatchPersistenceAdapter {
    private static final Logger log = LoggerFactory.getLogger(MatchPersistenceAdapter.class);

    private static final String INSERT_MATCH = """
            INSERT INTO matches (external_match_id, home_team_id, away_team_id, match_date, season_id,
                                 age_group_id, match_type_id, division_id, natural_key, home_score, away_score,
                                 match_status, source, score_locked, scheduled_kickoff, created_by, updated_by, version)
            VALUES (:externalId, :homeTeamId, :awayTeamId, :matchDate, :seasonId,
                    :ageGroupId, :matchTypeId, :divisionId, :naturalKey, :homeScore, :awayScore,
                    :status, :source, :locked, :kickoff, :actor, :actor, 0)
            """;

    // null incoming scores/kickoff keep what is stored
    private static final String UPDATE_MATCH = """
            UPDATE matches
               SET match_status = :status,
                   home_score = COALESCE(:homeScore, home_score),
                   away_score = COALESCE(:awayScore, away_score),
                   scheduled_kickoff = COALESCE(:kickoff, scheduled_kickoff),
                   external_match_id = COALESCE(external_match_id, :externalId),
                   source = :source,
                   score_locked = :locked,
                   updated_by = :actor,
                   version = version + 1
             WHERE id = :id AND version = :version
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public MatchPersistenceAdapter(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public long insert(MatchMessage message, ResolvedReferences refs, String naturalKey, boolean lock) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("externalId", message.hasExternalId() ? message.getExternalMatchId() : null, Types.VARCHAR)
                .addValue("homeTeamId", refs.homeTeamId())
                .addValue("awayTeamId", refs.awayTeamId())
                .addValue("matchDate", message.getDate(), Types.DATE)
                .addValue("seasonId", refs.seasonId())
                .addValue("ageGroupId", refs.ageGroupId())
                .addValue("matchTypeId", refs.matchTypeId())
                .addValue("divisionId", refs.divisionId(), Types.BIGINT)
                .addValue("naturalKey", naturalKey)
                .addValue("homeScore", message.getHomeScore(), Types.INTEGER)
                .addValue("awayScore", message.getAwayScore(), Types.INTEGER)
                .addValue("status", message.getStatus().name())
                .addValue("source", message.getSource().name())
                .addValue("locked", lock)
                .addValue("kickoff", timestamp(message.getScheduledKickoff()), Types.TIMESTAMP)
                .addValue("actor", message.auditActor());
        KeyHolder keys = new GeneratedKeyHolder();
        try {
            jdbc.update(INSERT_MATCH, params, keys, new String[]{"id"});
        } catch (DuplicateKeyException e) {
            throw new IdentityRaceException("Match " + message.describe() + " was created concurrently", e);
        } catch (DataIntegrityViolationException e) {
            throw new PermanentIngestionException("Match " + message.describe() + " violates a table constraint", e);
        }
        Number id = keys.getKey();
        if (id == null) {
            throw new PermanentIngestionException("Insert of " + message.describe() + " returned no id");
        }
        return id.longValue();
    }

    public void update(MatchSnapshot existing, MatchMessage message, boolean lock, boolean adoptExternalId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", existing.id())
                .addValue("version", existing.version())
                .addValue("status", message.getStatus().name())
                .addValue("homeScore", message.hasScores() ? message.getHomeScore() : null, Types.INTEGER)
                .addValue("awayScore", message.hasScores() ? message.getAwayScore() : null, Types.INTEGER)
                .addValue("kickoff", timestamp(message.getScheduledKickoff()), Types.TIMESTAMP)
                .addValue("externalId", adoptExternalId ? message.getExternalMatchId() : null, Types.VARCHAR)
                // a locked row stays attributed to its manual editor
                .addValue("source", (lock ? MatchSource.MANUAL : message.getSource()).name())
                .addValue("locked", lock)
                .addValue("actor", message.auditActor());
        int rows;
        try {
            rows = jdbc.update(UPDATE_MATCH, params);
        } catch (DuplicateKeyException e) {
            throw new IdentityRaceException("External id " + message.getExternalMatchId()
                    + " was taken by another row while adopting it on match " + existing.id(), e);
        }
        if (rows == 0) {
            throw new IdentityRaceException("Match " + existing.id() + " changed since version " + existing.version());
        }
    }

    /**
     * Records an open conflict unless the same divergence is already open for the match.
     *
     * @return the new conflict id, or null when an identical open conflict exists
     */
    public Long recordConflict(ReconciliationDecision decision) {
        MatchSnapshot stored = decision.existing();
        String storedJson = toJson(storedView(stored));
        String incomingJson = toJson(incomingView(decision.incoming()));
        String fingerprint = Hashes.sha256Hex(stored.id() + "|" + decision.conflictReason() + "|" + incomingJson);

        Integer open = jdbc.queryForObject(
                "SELECT COUNT(*) FROM match_conflicts WHERE match_id = :matchId AND fingerprint = :fp",
                new MapSqlParameterSource().addValue("matchId", stored.id()).addValue("fp", fingerprint),
                Integer.class);
        if (open != null && open > 0) {
            log.debug("[Ingest][Conflict] duplicate divergence on match {} already open", stored.id());
            return null;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("matchId", stored.id())
                .addValue("reason", decision.conflictReason().name())
                .addValue("storedValue", storedJson)
                .addValue("incomingValue", incomingJson)
                .addValue("fp", fingerprint)
                .addValue("detectedAt", Timestamp.from(Instant.now()), Types.TIMESTAMP);
        KeyHolder keys = new GeneratedKeyHolder();
        try {
            jdbc.update("""
                    INSERT INTO match_conflicts (match_id, reason, stored_value, incoming_value, fingerprint, detected_at, resolved)
                    VALUES (:matchId, :reason, :storedValue, :incomingValue, :fp, :detectedAt, false)
                    """, params, keys, new String[]{"id"});
        } catch (DuplicateKeyException e) {
            throw new IdentityRaceException("Conflict on match " + stored.id() + " was recorded concurrently", e);
        }
        Number id = keys.getKey();
        return id == null ? null : id.longValue();
    }

    public int unlock(long matchId, String actor) {
        return jdbc.update("""
                UPDATE matches SET score_locked = false, updated_by = :actor, version = version + 1
                 WHERE id = :id
                """, new MapSqlParameterSource().addValue("id", matchId).addValue("actor", actor));
    }

    public int resolveOpenConflicts(long matchId, String actor) {
        return jdbc.update("""
                UPDATE match_conflicts
                   SET resolved = true, resolved_at = :now, resolved_by = :actor, fingerprint = NULL
                 WHERE match_id = :matchId AND resolved = false
                """, new MapSqlParameterSource()
                .addValue("matchId", matchId)
                .addValue("actor", actor)
                .addValue("now", Timestamp.from(Instant.now()), Types.TIMESTAMP));
    }

    public int resolveConflict(long conflictId, String actor) {
        return jdbc.update("""
                UPDATE match_conflicts
                   SET resolved = true, resolved_at = :now, resolved_by = :actor, fingerprint = NULL
                 WHERE id = :id AND resolved = false
                """, new MapSqlParameterSource()
                .addValue("id", conflictId)
                .addValue("actor", actor)
                .addValue("now", Timestamp.from(Instant.now()), Types.TIMESTAMP));
    }

    private static Map<String, Object> storedView(MatchSnapshot s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", s.status().wireValue());
        m.put("home_score", s.homeScore());
        m.put("away_score", s.awayScore());
        m.put("source", s.source().tag());
        m.put("locked", s.locked());
        return m;
    }

    private static Map<String, Object> incomingView(MatchMessage msg) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", msg.getStatus().wireValue());
        m.put("home_score", msg.getHomeScore());
        m.put("away_score", msg.getAwayScore());
        m.put("source", msg.getSource().tag());
        m.put("external_match_id", msg.getExternalMatchId());
        return m;
    }

    private String toJson(Object o) {
        try {
            return objectMapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new PermanentIngestionException("Cannot serialize conflict values", e);
        }
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
