package com.missingtable.sync.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.missingtable.sync.config.IngestRetryConfig;
import com.missingtable.sync.dto.IngestionOutcome;
import com.missingtable.sync.dto.MatchMessage;
import com.missingtable.sync.exception.IdentityRaceException;
import com.missingtable.sync.exception.PermanentIngestionException;
import com.missingtable.sync.exception.UnknownReferenceException;
import com.missingtable.sync.model.DeadLetterCategory;
import com.missingtable.sync.model.DeadLetterMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.classify.BinaryExceptionClassifier;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.retry.support.RetryTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetryingIngestionExecutorTest {

    @Mock private MatchIngestionService ingestionService;
    @Mock private DeadLetterService deadLetterService;

    private final ObjectMapper mapper = new ObjectMapper();
    private RetryingIngestionExecutor executor;

    @BeforeEach
    void setUp() {
        IngestRetryConfig config = new IngestRetryConfig();
        BinaryExceptionClassifier classifier = config.ingestFailureClassifier();
        RetryTemplate template = config.ingestRetryTemplate(classifier, 3, 1, 1.0, 1);
        executor = new RetryingIngestionExecutor(new MatchMessageValidator("America/New_York"),
                ingestionService, deadLetterService, template, classifier, mapper);
    }

    private ObjectNode payload() {
        ObjectNode n = mapper.createObjectNode();
        n.put("home_team", "Team A");
        n.put("away_team", "Team B");
        n.put("match_date", "2025-10-04");
        n.put("season", "2025-2026");
        n.put("age_group", "U14");
        n.put("match_type", "League");
        n.put("match_status", "scheduled");
        n.put("source", "automated");
        return n;
    }

    private DeadLetterMessage deadLetter(long id) {
        DeadLetterMessage dl = new DeadLetterMessage();
        dl.setId(id);
        return dl;
    }

    @Test
    void appliedOutcomeCarriesAttemptCount() {
        when(ingestionService.ingest(any(MatchMessage.class)))
                .thenReturn(IngestionOutcome.applied(ReconciliationAction.CREATE, 5L, "new match"));

        IngestionOutcome outcome = executor.execute(payload());

        assertThat(outcome.action()).isEqualTo(ReconciliationAction.CREATE);
        assertThat(outcome.attempts()).isEqualTo(1);
        verifyNoInteractions(deadLetterService);
    }

    @Test
    void invalidMessageGoesStraightToDeadLetterWithoutAttempts() {
        ObjectNode bad = payload();
        bad.remove("season");
        when(deadLetterService.record(anyString(), eq(DeadLetterCategory.VALIDATION), contains("season"), eq(0)))
                .thenReturn(deadLetter(1L));

        IngestionOutcome outcome = executor.execute(bad);

        assertThat(outcome.isDeadLettered()).isTrue();
        assertThat(outcome.deadLetterCategory()).isEqualTo(DeadLetterCategory.VALIDATION);
        verifyNoInteractions(ingestionService);
    }

    @Test
    void malformedJsonIsAValidationDeadLetter() {
        when(deadLetterService.record(eq("{not json"), eq(DeadLetterCategory.VALIDATION), anyString(), eq(0)))
                .thenReturn(deadLetter(2L));

        IngestionOutcome outcome = executor.execute("{not json");

        assertThat(outcome.deadLetterId()).isEqualTo(2L);
    }

    @Test
    void transientFailureIsRetriedUntilSuccess() {
        when(ingestionService.ingest(any(MatchMessage.class)))
                .thenThrow(new IdentityRaceException("raced"))
                .thenThrow(new QueryTimeoutException("slow"))
                .thenReturn(IngestionOutcome.applied(ReconciliationAction.UPDATE, 5L, "updated"));

        IngestionOutcome outcome = executor.execute(payload());

        assertThat(outcome.action()).isEqualTo(ReconciliationAction.UPDATE);
        assertThat(outcome.attempts()).isEqualTo(3);
        verify(ingestionService, times(3)).ingest(any(MatchMessage.class));
    }

    @Test
    void exhaustedRetriesAreDeadLetteredWithAttemptCount() {
        when(ingestionService.ingest(any(MatchMessage.class))).thenThrow(new IdentityRaceException("raced"));
        when(deadLetterService.record(anyString(), eq(DeadLetterCategory.EXHAUSTED_RETRIES), contains("raced"), eq(3)))
                .thenReturn(deadLetter(3L));

        IngestionOutcome outcome = executor.execute(payload());

        assertThat(outcome.deadLetterCategory()).isEqualTo(DeadLetterCategory.EXHAUSTED_RETRIES);
        assertThat(outcome.attempts()).isEqualTo(3);
        verify(ingestionService, times(3)).ingest(any(MatchMessage.class));
    }

    @Test
    void unknownReferenceIsNotRetried() {
        when(ingestionService.ingest(any(MatchMessage.class)))
                .thenThrow(new UnknownReferenceException("age_group", "U99"));
        when(deadLetterService.record(anyString(), eq(DeadLetterCategory.VALIDATION), contains("U99"), eq(1)))
                .thenReturn(deadLetter(4L));

        IngestionOutcome outcome = executor.execute(payload());

        assertThat(outcome.deadLetterCategory()).isEqualTo(DeadLetterCategory.VALIDATION);
        verify(ingestionService, times(1)).ingest(any(MatchMessage.class));
    }

    @Test
    void permanentFailureIsNotRetried() {
        when(ingestionService.ingest(any(MatchMessage.class)))
                .thenThrow(new PermanentIngestionException("external id clash"));
        when(deadLetterService.record(anyString(), eq(DeadLetterCategory.PERMANENT_FAILURE), anyString(), eq(1)))
                .thenReturn(deadLetter(5L));

        IngestionOutcome outcome = executor.execute(payload());

        assertThat(outcome.deadLetterCategory()).isEqualTo(DeadLetterCategory.PERMANENT_FAILURE);
        verify(ingestionService, times(1)).ingest(any(MatchMessage.class));
    }

    @Test
    void deadLetterWriteFailurePropagates() {
        ObjectNode bad = payload();
        bad.remove("source");
        when(deadLetterService.record(anyString(), any(), anyString(), anyInt()))
                .thenThrow(new IllegalStateException("db down"));

        assertThatThrownBy(() -> executor.execute(bad)).hasMessageContaining("db down");
    }
}
