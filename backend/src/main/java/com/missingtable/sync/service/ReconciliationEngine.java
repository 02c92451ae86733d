package com.missingtable.sync.service;

import com.missingtable.sync.dto.MatchMessage;
import com.missingtable.sync.dto.MatchSnapshot;
import com.missingtable.sync.exception.InvalidTransitionException;
import com.missingtable.sync.model.ConflictReason;
import com.missingtable.sync.model.MatchSource;
import com.missingtable.sync.model.MatchStatus;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides what a message does to the stored row. Reads nothing and writes nothing:
 * the same inputs always give the same decision.
 *
 * <p>Manual edits always apply and lock the row. Automated writes never touch a
 * locked row; when they disagree with it the disagreement is surfaced as a conflict.
 * Incoming null scores mean "no score reported" and never clear stored scores.</p>
 */
@Component
public class ReconciliationEngine {

    private final MatchStatusTransitions transitions;

    public ReconciliationEngine(MatchStatusTransitions transitions) {
        this.transitions = transitions;
    }

    public ReconciliationDecision decide(Optional<MatchSnapshot> existing, MatchMessage incoming) {
        return decide(existing, incoming, false);
    }

    /**
     * @param adoptExternalId the row was found by natural key and has no external id yet;
     *                        writing the incoming id counts as a change on its own
     */
    public ReconciliationDecision decide(Optional<MatchSnapshot> existing, MatchMessage incoming, boolean adoptExternalId) {
        if (existing.isEmpty()) {
            return ReconciliationDecision.create(incoming);
        }
        MatchSnapshot stored = existing.get();
        if (stored.status() == MatchStatus.TBD && incoming.getStatus() == MatchStatus.TBD && !adoptExternalId) {
            // no result yet, whoever sends it
            return ReconciliationDecision.skip(stored, incoming, "still awaiting result");
        }
        if (incoming.getSource() == MatchSource.MANUAL) {
            return decideManual(stored, incoming, adoptExternalId);
        }
        return stored.locked()
                ? decideAutomatedLocked(stored, incoming, adoptExternalId)
                : decideAutomated(stored, incoming, adoptExternalId);
    }

    private ReconciliationDecision decideManual(MatchSnapshot stored, MatchMessage incoming, boolean adopt) {
        try {
            transitions.requireAllowed(stored.status(), incoming.getStatus());
        } catch (InvalidTransitionException ex) {
            return ReconciliationDecision.conflict(stored, incoming, ConflictReason.INVALID_TRANSITION,
                    transitionText(ex.getFrom(), ex.getTo()) + " rejected for manual edit");
        }
        return ReconciliationDecision.update(stored, incoming, true, adopt, "manual edit");
    }

    private ReconciliationDecision decideAutomatedLocked(MatchSnapshot stored, MatchMessage incoming, boolean adopt) {
        boolean statusDiffers = stored.status() != incoming.getStatus();
        if (statusDiffers || scoresDiffer(stored, incoming)) {
            return ReconciliationDecision.conflict(stored, incoming, ConflictReason.LOCKED_DIVERGENCE,
                    "automated update disagrees with locked manual values");
        }
        if (adopt) {
            return ReconciliationDecision.update(stored, incoming, true, true, "external id adopted");
        }
        return ReconciliationDecision.skip(stored, incoming, "locked row already agrees");
    }

    private ReconciliationDecision decideAutomated(MatchSnapshot stored, MatchMessage incoming, boolean adopt) {
        MatchStatus from = stored.status();
        MatchStatus to = incoming.getStatus();
        try {
            transitions.requireAllowed(from, to);
        } catch (InvalidTransitionException ex) {
            return ReconciliationDecision.conflict(stored, incoming, ConflictReason.INVALID_TRANSITION,
                    transitionText(ex.getFrom(), ex.getTo()) + " is not allowed");
        }
        boolean changed = from != to
                || scoresDiffer(stored, incoming)
                || kickoffDiffers(stored, incoming);
        if (changed) {
            return ReconciliationDecision.update(stored, incoming, false, adopt, describeChange(stored, incoming));
        }
        if (adopt) {
            return ReconciliationDecision.update(stored, incoming, false, true, "external id adopted");
        }
        return ReconciliationDecision.skip(stored, incoming, "no change");
    }

    private static boolean scoresDiffer(MatchSnapshot stored, MatchMessage incoming) {
        if (!incoming.hasScores()) return false;
        return !Objects.equals(stored.homeScore(), incoming.getHomeScore())
                || !Objects.equals(stored.awayScore(), incoming.getAwayScore());
    }

    private static boolean kickoffDiffers(MatchSnapshot stored, MatchMessage incoming) {
        return incoming.getScheduledKickoff() != null
                && !incoming.getScheduledKickoff().equals(stored.scheduledKickoff());
    }

    private static String describeChange(MatchSnapshot stored, MatchMessage incoming) {
        StringBuilder sb = new StringBuilder();
        if (stored.status() != incoming.getStatus()) {
            sb.append(transitionText(stored.status(), incoming.getStatus()));
        }
        if (scoresDiffer(stored, incoming)) {
            if (sb.length() > 0) sb.append(", ");
            sb.append("score ").append(stored.homeScore()).append('-').append(stored.awayScore())
                    .append(" -> ").append(incoming.getHomeScore()).append('-').append(incoming.getAwayScore());
        }
        if (kickoffDiffers(stored, incoming)) {
            if (sb.length() > 0) sb.append(", ");
            sb.append("kickoff ").append(incoming.getScheduledKickoff());
        }
        return sb.toString();
    }

    private static String transitionText(MatchStatus from, MatchStatus to) {
        return from.wireValue() + " -> " + to.wireValue();
    }
}
