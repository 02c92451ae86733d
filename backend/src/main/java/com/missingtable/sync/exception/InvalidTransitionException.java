package com.missingtable.sync.exception;

import com.missingtable.sync.model.MatchStatus;

public class InvalidTransitionException extends IngestionException {

    private final MatchStatus from;
    private final MatchStatus to;

    public InvalidTransitionException(MatchStatus from, MatchStatus to) {
        super("Status transition " + from.wireValue() + " -> " + to.wireValue() + " is not allowed");
        this.from = from;
        this.to = to;
    }

    public MatchStatus getFrom() { return from; }
    public MatchStatus getTo() { return to; }
}
