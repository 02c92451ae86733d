package com.missingtable.sync.model;

import java.util.Optional;

public enum MatchSource {
    MANUAL("manual"),
    AUTOMATED("automated");

    private final String tag;

    MatchSource(String tag) {
        this.tag = tag;
    }

    public String tag() { return tag; }

    // "match-scraper" is what the crawler historically stamped on its rows
    public static Optional<MatchSource> fromWire(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim().toLowerCase();
        return switch (v) {
            case "manual" -> Optional.of(MANUAL);
            case "automated", "match-scraper" -> Optional.of(AUTOMATED);
            default -> Optional.empty();
        };
    }
}
