package com.missingtable.sync.service;

import com.missingtable.sync.dto.DeadLetterDTO;
import com.missingtable.sync.model.DeadLetterCategory;
import com.missingtable.sync.model.DeadLetterMessage;
import com.missingtable.sync.repository.DeadLetterRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Stores messages that could not be reconciled, with their failure category, attempt
 * count and last error. Entries stay queryable until an operator replays them successfully.
 */
@Service
public class DeadLetterService {
    private static final Logger log = LoggerFactory.getLogger(DeadLetterService.class);

    private static final int MAX_ERROR_LENGTH = 4000;

    private final DeadLetterRepository repository;

    public DeadLetterService(DeadLetterRepository repository) {
        this.repository = repository;
    }

    /**
     * Persists the payload. A failure here propagates: the caller must not acknowledge
     * a message that reached neither the match tables nor this table.
     */
    @Transactional
    public DeadLetterMessage record(String payload, DeadLetterCategory category, String lastError, int attempts) {
        DeadLetterMessage dl = new DeadLetterMessage();
        dl.setPayload(payload);
        dl.setCategory(category);
        dl.setAttemptCount(attempts);
        dl.setLastError(truncate(lastError));
        DeadLetterMessage saved = repository.save(dl);
        log.warn("[Ingest][DeadLetter] id={} category={} attempts={} error={}",
                saved.getId(), category.label(), attempts, lastError);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<DeadLetterDTO> list(boolean unresolvedOnly) {
        List<DeadLetterMessage> rows = unresolvedOnly
                ? repository.findByResolvedFalseOrderByCreatedAtDesc()
                : repository.findAllByOrderByCreatedAtDesc();
        return rows.stream().map(DeadLetterService::toDto).toList();
    }

    @Transactional(readOnly = true)
    public DeadLetterMessage get(Long id) {
        return repository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Dead letter not found: " + id));
    }

    @Transactional
    public DeadLetterMessage markReplayed(Long id, boolean succeeded) {
        DeadLetterMessage dl = get(id);
        dl.setReplayCount(dl.getReplayCount() + 1);
        if (succeeded) {
            dl.setResolved(true);
            dl.setResolvedAt(Instant.now());
        }
        return repository.save(dl);
    }

    static DeadLetterDTO toDto(DeadLetterMessage dl) {
        return new DeadLetterDTO(dl.getId(), dl.getCategory().label(), dl.getPayload(), dl.getAttemptCount(),
                dl.getLastError(), dl.getCreatedAt(), dl.isResolved(), dl.getReplayCount());
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_ERROR_LENGTH) return s;
        return s.substring(0, MAX_ERROR_LENGTH);
    }
}
