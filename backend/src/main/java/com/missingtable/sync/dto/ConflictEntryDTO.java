package com.missingtable.sync.dto;

import java.time.Instant;

public record ConflictEntryDTO(Long id, Long matchId, String reason, String storedValue,
                               String incomingValue, Instant detectedAt, boolean resolved) {}
