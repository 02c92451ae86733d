package com.missingtable.sync.dto;

import java.time.Instant;

public record DeadLetterDTO(Long id, String category, String payload, Integer attemptCount,
                            String lastError, Instant createdAt, boolean resolved, Integer replayCount) {}
