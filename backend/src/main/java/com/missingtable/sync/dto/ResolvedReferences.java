package com.missingtable.sync.dto;

import com.missingtable.sync.util.NaturalKeys;

import java.time.LocalDate;

public record ResolvedReferences(long homeTeamId, long awayTeamId, long seasonId,
                                 long ageGroupId, long matchTypeId, Long divisionId) {

    public String naturalKey(LocalDate date) {
        return NaturalKeys.of(date, homeTeamId, awayTeamId, seasonId, ageGroupId, matchTypeId, divisionId);
    }
}
