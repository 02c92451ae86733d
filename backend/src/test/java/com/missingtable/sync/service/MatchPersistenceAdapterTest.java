package com.missingtable.sync.service;

import com.missingtable.sync.dto.MatchMessage;
import com.missingtable.sync.dto.MatchSnapshot;
import com.missingtable.sync.dto.ResolvedReferences;
import com.missingtable.sync.exception.IdentityRaceException;
import com.missingtable.sync.model.ConflictReason;
import com.missingtable.sync.model.MatchSource;
import com.missingtable.sync.model.MatchStatus;
import com.missingtable.sync.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class MatchPersistenceAdapterTest {

    @Autowired private MatchPersistenceAdapter adapter;
    @Autowired private JdbcTemplate jdbcTemplate;

    private TestDatabase db;
    private ResolvedReferences refs;
    private final LocalDate date = LocalDate.of(2025, 10, 4);

    @BeforeEach
    void setUp() {
        db = new TestDatabase(jdbcTemplate);
        db.reset();
        db.seedStandard();
        long season = jdbcTemplate.queryForObject("SELECT id FROM seasons WHERE name = '2025-2026'", Long.class);
        long ageGroup = jdbcTemplate.queryForObject("SELECT id FROM age_groups WHERE name = 'U14'", Long.class);
        long matchType = jdbcTemplate.queryForObject("SELECT id FROM match_types WHERE name = 'League'", Long.class);
        refs = new ResolvedReferences(db.teamId("Team A"), db.teamId("Team B"), season, ageGroup, matchType, null);
    }

    private MatchMessage message(MatchStatus status, Integer home, Integer away, MatchSource source) {
        return new MatchMessage("Team A", "Team B", date, "2025-2026", "U14", "League", null,
                status, home, away, null, source);
    }

    @Test
    void secondInsertOfSameNaturalKeyIsARace() {
        MatchMessage msg = message(MatchStatus.SCHEDULED, null, null, MatchSource.AUTOMATED);
        adapter.insert(msg, refs, refs.naturalKey(date), false);

        assertThatThrownBy(() -> adapter.insert(msg, refs, refs.naturalKey(date), false))
                .isInstanceOf(IdentityRaceException.class);
    }

    @Test
    void staleVersionUpdateIsARace() {
        MatchMessage msg = message(MatchStatus.SCHEDULED, null, null, MatchSource.AUTOMATED);
        long id = adapter.insert(msg, refs, refs.naturalKey(date), false);
        MatchSnapshot v0 = new MatchSnapshot(id, null, MatchStatus.SCHEDULED, null, null, MatchSource.AUTOMATED, false, null, 0L);

        adapter.update(v0, message(MatchStatus.COMPLETED, 1, 0, MatchSource.AUTOMATED), false, false);

        assertThatThrownBy(() -> adapter.update(v0, message(MatchStatus.CANCELLED, null, null, MatchSource.AUTOMATED), false, false))
                .isInstanceOf(IdentityRaceException.class);
        assertThat(db.match(id).get("match_status")).isEqualTo("COMPLETED");
    }

    @Test
    void updateWithoutScoresKeepsStoredScores() {
        long id = adapter.insert(message(MatchStatus.COMPLETED, 4, 2, MatchSource.AUTOMATED), refs, refs.naturalKey(date), false);
        MatchSnapshot v0 = new MatchSnapshot(id, null, MatchStatus.COMPLETED, 4, 2, MatchSource.AUTOMATED, false, null, 0L);

        adapter.update(v0, message(MatchStatus.COMPLETED, null, null, MatchSource.MANUAL), true, false);

        assertThat(db.match(id).get("home_score")).isEqualTo(4);
        assertThat(db.match(id).get("score_locked")).isEqualTo(true);
        assertThat(db.match(id).get("source")).isEqualTo("MANUAL");
    }

    @Test
    void sameDivergenceIsRecordedOnceUntilResolved() {
        long id = adapter.insert(message(MatchStatus.COMPLETED, 3, 1, MatchSource.MANUAL), refs, refs.naturalKey(date), true);
        MatchSnapshot stored = new MatchSnapshot(id, null, MatchStatus.COMPLETED, 3, 1, MatchSource.MANUAL, true, null, 0L);
        MatchMessage incoming = message(MatchStatus.COMPLETED, 2, 1, MatchSource.AUTOMATED);
        ReconciliationDecision decision = new ReconciliationDecision(ReconciliationAction.CONFLICT, stored, incoming,
                true, false, ConflictReason.LOCKED_DIVERGENCE, "diverged");

        assertThat(adapter.recordConflict(decision)).isNotNull();
        assertThat(adapter.recordConflict(decision)).isNull();
        assertThat(db.openConflicts(id)).isEqualTo(1);

        assertThat(adapter.resolveOpenConflicts(id, "admin")).isEqualTo(1);
        assertThat(adapter.recordConflict(decision)).isNotNull();
        assertThat(db.count("match_conflicts")).isEqualTo(2);
    }
}
