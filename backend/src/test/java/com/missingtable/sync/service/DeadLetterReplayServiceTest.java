package com.missingtable.sync.service;

import com.missingtable.sync.dto.DeadLetterDTO;
import com.missingtable.sync.dto.IngestionOutcome;
import com.missingtable.sync.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class DeadLetterReplayServiceTest {

    @Autowired private RetryingIngestionExecutor executor;
    @Autowired private DeadLetterReplayService replayService;
    @Autowired private DeadLetterService deadLetterService;
    @Autowired private JdbcTemplate jdbcTemplate;

    private TestDatabase db;

    private static final String PAYLOAD = "{\"home_team\":\"Team A\",\"away_team\":\"Late Joiners\","
            + "\"match_date\":\"2025-10-04\",\"season\":\"2025-2026\",\"age_group\":\"U14\","
            + "\"match_type\":\"League\",\"match_status\":\"scheduled\",\"source\":\"match-scraper\"}";

    @BeforeEach
    void setUp() {
        db = new TestDatabase(jdbcTemplate);
        db.reset();
        db.seedStandard();
    }

    @Test
    void replaySucceedsOnceTheMissingReferenceExists() {
        IngestionOutcome failed = executor.execute(PAYLOAD);
        assertThat(failed.isDeadLettered()).isTrue();
        assertThat(deadLetterService.list(true)).hasSize(1);

        db.team("Late Joiners");
        IngestionOutcome replayed = replayService.replay(failed.deadLetterId(), "ops");

        assertThat(replayed.action()).isEqualTo(ReconciliationAction.CREATE);
        assertThat(deadLetterService.list(true)).isEmpty();
        List<DeadLetterDTO> all = deadLetterService.list(false);
        assertThat(all).hasSize(1);
        assertThat(all.get(0).resolved()).isTrue();
        assertThat(all.get(0).replayCount()).isEqualTo(1);
    }

    @Test
    void failedReplayKeepsEntryOpen() {
        IngestionOutcome failed = executor.execute(PAYLOAD);

        IngestionOutcome replayed = replayService.replay(failed.deadLetterId(), "ops");

        assertThat(replayed.isDeadLettered()).isTrue();
        DeadLetterDTO original = deadLetterService.list(false).stream()
                .filter(d -> d.id().equals(failed.deadLetterId())).findFirst().orElseThrow();
        assertThat(original.resolved()).isFalse();
        assertThat(original.replayCount()).isEqualTo(1);
    }

    @Test
    void resolvedEntryCannotBeReplayedAgain() {
        IngestionOutcome failed = executor.execute(PAYLOAD);
        db.team("Late Joiners");
        replayService.replay(failed.deadLetterId(), "ops");

        assertThatThrownBy(() -> replayService.replay(failed.deadLetterId(), "ops"))
                .isInstanceOf(IllegalStateException.class);
    }
}
