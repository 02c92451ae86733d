package com.missingtable.sync.dto;

import com.missingtable.sync.model.DeadLetterCategory;
import com.missingtable.sync.service.ReconciliationAction;

/**
 * Terminal result of one message. Either a reconciliation action was applied, or the
 * message ended on the dead-letter channel ({@code action} is null in that case).
 */
public record IngestionOutcome(ReconciliationAction action, Long matchId, String detail,
                               Long deadLetterId, DeadLetterCategory deadLetterCategory, int attempts) {

    public static IngestionOutcome applied(ReconciliationAction action, Long matchId, String detail) {
        return new IngestionOutcome(action, matchId, detail, null, null, 1);
    }

    public static IngestionOutcome deadLettered(Long deadLetterId, DeadLetterCategory category, String detail, int attempts) {
        return new IngestionOutcome(null, null, detail, deadLetterId, category, attempts);
    }

    public IngestionOutcome withAttempts(int attempts) {
        return new IngestionOutcome(action, matchId, detail, deadLetterId, deadLetterCategory, attempts);
    }

    public boolean isDeadLettered() {
        return deadLetterId != null;
    }
}
