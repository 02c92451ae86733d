package com.missingtable.sync.service;

import com.missingtable.sync.dto.MatchMessage;
import com.missingtable.sync.dto.MatchSnapshot;
import com.missingtable.sync.model.ConflictReason;
import com.missingtable.sync.model.MatchSource;

/**
 * What the engine decided for one message. {@code existing} is null only for CREATE;
 * {@code conflictReason} is set only for CONFLICT.
 */
public record ReconciliationDecision(ReconciliationAction action, MatchSnapshot existing,
                                     MatchMessage incoming, boolean lock, boolean adoptExternalId,
                                     ConflictReason conflictReason, String detail) {

    static ReconciliationDecision create(MatchMessage incoming) {
        return new ReconciliationDecision(ReconciliationAction.CREATE, null, incoming,
                incoming.getSource() == MatchSource.MANUAL, false, null, "new match");
    }

    static ReconciliationDecision update(MatchSnapshot existing, MatchMessage incoming, boolean lock,
                                         boolean adoptExternalId, String detail) {
        return new ReconciliationDecision(ReconciliationAction.UPDATE, existing, incoming, lock, adoptExternalId, null, detail);
    }

    static ReconciliationDecision skip(MatchSnapshot existing, MatchMessage incoming, String detail) {
        return new ReconciliationDecision(ReconciliationAction.SKIP, existing, incoming, existing.locked(), false, null, detail);
    }

    static ReconciliationDecision conflict(MatchSnapshot existing, MatchMessage incoming, ConflictReason reason, String detail) {
        return new ReconciliationDecision(ReconciliationAction.CONFLICT, existing, incoming, existing.locked(), false, reason, detail);
    }

    public Long matchId() {
        return existing == null ? null : existing.id();
    }
}
