package com.missingtable.sync.util;

import java.time.LocalDate;

/**
 * Builds the composite natural key stored in {@code matches.natural_key}:
 * date, home, away, season, age group, match type and division (or "-" when absent).
 */
public final class NaturalKeys {

    private NaturalKeys() {}

    public static String of(LocalDate date, long homeTeamId, long awayTeamId, long seasonId,
                            long ageGroupId, long matchTypeId, Long divisionId) {
        return date + "|" + homeTeamId + "|" + awayTeamId + "|" + seasonId + "|"
                + ageGroupId + "|" + matchTypeId + "|" + (divisionId == null ? "-" : divisionId.toString());
    }
}
