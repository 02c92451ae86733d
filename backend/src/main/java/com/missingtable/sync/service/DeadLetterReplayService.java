package com.missingtable.sync.service;

import com.missingtable.sync.dto.IngestionOutcome;
import com.missingtable.sync.model.DeadLetterMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Re-submits a stored dead letter through the full pipeline. A successful replay resolves
 * the entry; a failed one leaves it open and records a fresh dead letter for the new attempt.
 */
@Service
public class DeadLetterReplayService {
    private static final Logger log = LoggerFactory.getLogger(DeadLetterReplayService.class);

    private final DeadLetterService deadLetterService;
    private final RetryingIngestionExecutor executor;
    private final AdminAuditService auditService;

    public DeadLetterReplayService(DeadLetterService deadLetterService,
                                   RetryingIngestionExecutor executor,
                                   AdminAuditService auditService) {
        this.deadLetterService = deadLetterService;
        this.executor = executor;
        this.auditService = auditService;
    }

    public IngestionOutcome replay(Long deadLetterId, String actor) {
        DeadLetterMessage dl = deadLetterService.get(deadLetterId);
        if (dl.isResolved()) {
            throw new IllegalStateException("Dead letter " + deadLetterId + " is already resolved");
        }
        IngestionOutcome outcome = executor.execute(dl.getPayload());
        deadLetterService.markReplayed(deadLetterId, !outcome.isDeadLettered());

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("deadLetterId", deadLetterId);
        params.put("outcome", outcome.isDeadLettered() ? "dead-lettered" : outcome.action().name());
        if (outcome.isDeadLettered()) params.put("newDeadLetterId", outcome.deadLetterId());
        auditService.record("replay-dead-letter", actor, outcome.matchId(), params, outcome.isDeadLettered() ? 0 : 1);
        log.info("[Admin][Replay] dead letter {} -> {}", deadLetterId, outcome.detail());
        return outcome;
    }
}
