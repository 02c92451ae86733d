package com.missingtable.sync.service;

import com.missingtable.sync.dto.ConflictEntryDTO;
import com.missingtable.sync.model.MatchConflict;
import com.missingtable.sync.repository.MatchConflictRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Operator surface over recorded conflicts. Unlocking a match hands it back to the
 * automated source and closes its open conflicts.
 */
@Service
public class ConflictService {
    private static final Logger log = LoggerFactory.getLogger(ConflictService.class);

    private final MatchConflictRepository conflictRepository;
    private final MatchPersistenceAdapter persistence;
    private final AdminAuditService auditService;

    public ConflictService(MatchConflictRepository conflictRepository,
                           MatchPersistenceAdapter persistence,
                           AdminAuditService auditService) {
        this.conflictRepository = conflictRepository;
        this.persistence = persistence;
        this.auditService = auditService;
    }

    @Transactional(readOnly = true)
    public List<ConflictEntryDTO> list(boolean openOnly) {
        List<MatchConflict> rows = openOnly
                ? conflictRepository.findByResolvedFalseOrderByDetectedAtDesc()
                : conflictRepository.findAllByOrderByDetectedAtDesc();
        return rows.stream().map(ConflictService::toDto).toList();
    }

    @Transactional(readOnly = true)
    public List<ConflictEntryDTO> forMatch(Long matchId) {
        return conflictRepository.findByMatchIdOrderByDetectedAtDesc(matchId).stream()
                .map(ConflictService::toDto).toList();
    }

    /**
     * @return number of open conflicts closed by the unlock
     */
    @Transactional
    public int unlock(long matchId, String actor) {
        if (persistence.unlock(matchId, actor) == 0) {
            throw new NoSuchElementException("Match not found: " + matchId);
        }
        int resolved = persistence.resolveOpenConflicts(matchId, actor);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("resolvedConflicts", resolved);
        auditService.record("unlock", actor, matchId, params, resolved);
        log.info("[Admin][Unlock] match {} unlocked by {}; {} conflict(s) closed", matchId, actor, resolved);
        return resolved;
    }

    @Transactional
    public void dismiss(long conflictId, String actor) {
        MatchConflict conflict = conflictRepository.findById(conflictId)
                .orElseThrow(() -> new NoSuchElementException("Conflict not found: " + conflictId));
        if (conflict.isResolved()) {
            throw new IllegalStateException("Conflict " + conflictId + " is already resolved");
        }
        int rows = persistence.resolveConflict(conflictId, actor);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("conflictId", conflictId);
        params.put("reason", conflict.getReason().name());
        auditService.record("dismiss-conflict", actor, conflict.getMatchId(), params, rows);
    }

    static ConflictEntryDTO toDto(MatchConflict c) {
        return new ConflictEntryDTO(c.getId(), c.getMatchId(), c.getReason().name(), c.getStoredValue(),
                c.getIncomingValue(), c.getDetectedAt(), c.isResolved());
    }
}
