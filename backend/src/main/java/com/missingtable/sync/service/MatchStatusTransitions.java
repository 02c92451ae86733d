package com.missingtable.sync.service;

import com.missingtable.sync.exception.InvalidTransitionException;
import com.missingtable.sync.model.MatchStatus;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.missingtable.sync.model.MatchStatus.*;

/**
 * Allowed edges of the match status column. Staying on the same status is not a
 * transition and is always accepted; completed and cancelled have no way out.
 */
@Component
public class MatchStatusTransitions {

    private static final Map<MatchStatus, Set<MatchStatus>> EDGES = new EnumMap<>(MatchStatus.class);

    static {
        EDGES.put(SCHEDULED, EnumSet.of(TBD, COMPLETED, POSTPONED, CANCELLED));
        EDGES.put(TBD, EnumSet.of(COMPLETED, CANCELLED));
        EDGES.put(LIVE, EnumSet.of(COMPLETED, CANCELLED));
        EDGES.put(COMPLETED, EnumSet.noneOf(MatchStatus.class));
        EDGES.put(POSTPONED, EnumSet.of(SCHEDULED));
        EDGES.put(CANCELLED, EnumSet.noneOf(MatchStatus.class));
    }

    public boolean isAllowed(MatchStatus from, MatchStatus to) {
        if (from == to) return true;
        return EDGES.get(from).contains(to);
    }

    public void requireAllowed(MatchStatus from, MatchStatus to) {
        if (!isAllowed(from, to)) {
            throw new InvalidTransitionException(from, to);
        }
    }
}
