package com.missingtable.sync.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

public final class KickoffTimes {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("H:mm");

    private KickoffTimes() {}

    public static Optional<LocalTime> parseTime(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(LocalTime.parse(raw.trim(), HH_MM));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    // match_time is published in the league's local zone; stored kickoff is UTC
    public static Instant toUtc(LocalDate date, LocalTime time, ZoneId sourceZone) {
        return date.atTime(time).atZone(sourceZone).toInstant();
    }
}
