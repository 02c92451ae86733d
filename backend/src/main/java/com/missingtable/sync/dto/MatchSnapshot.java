package com.missingtable.sync.dto;

import com.missingtable.sync.model.Match;
import com.missingtable.sync.model.MatchSource;
import com.missingtable.sync.model.MatchStatus;

import java.time.Instant;

/**
 * Immutable view of a stored match row as read during identity resolution.
 * {@code version} is the optimistic token the conditional update is keyed on.
 */
public record MatchSnapshot(Long id, String externalMatchId, MatchStatus status,
                            Integer homeScore, Integer awayScore, MatchSource source,
                            boolean locked, Instant scheduledKickoff, long version) {

    public static MatchSnapshot of(Match m) {
        return new MatchSnapshot(m.getId(), m.getExternalMatchId(), m.getStatus(),
                m.getHomeScore(), m.getAwayScore(), m.getSource(), m.isLocked(),
                m.getScheduledKickoff(), m.getVersion());
    }
}
