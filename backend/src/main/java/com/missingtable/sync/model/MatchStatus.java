package com.missingtable.sync.model;

import java.util.Arrays;
import java.util.Optional;

public enum MatchStatus {
    SCHEDULED("scheduled"),
    TBD("tbd"),
    LIVE("live"),
    COMPLETED("completed"),
    POSTPONED("postponed"),
    CANCELLED("cancelled");

    private final String wireValue;

    MatchStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() { return wireValue; }

    public static Optional<MatchStatus> fromWire(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim().toLowerCase();
        return Arrays.stream(values()).filter(s -> s.wireValue.equals(v)).findFirst();
    }
}
