package com.missingtable.sync.service;

import com.missingtable.sync.dto.IngestionOutcome;
import com.missingtable.sync.dto.MatchMessage;
import com.missingtable.sync.dto.ResolvedReferences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * One unit of work for one validated message: resolve references and identity, decide,
 * apply. Runs in a single transaction; a failure leaves nothing behind and the whole
 * method may be re-run by the caller.
 */
@Service
public class MatchIngestionService {
    private static final Logger log = LoggerFactory.getLogger(MatchIngestionService.class);

    private final ReferenceDataResolver referenceResolver;
    private final IdentityResolver identityResolver;
    private final ReconciliationEngine engine;
    private final MatchPersistenceAdapter persistence;

    public MatchIngestionService(ReferenceDataResolver referenceResolver,
                                 IdentityResolver identityResolver,
                                 ReconciliationEngine engine,
                                 MatchPersistenceAdapter persistence) {
        this.referenceResolver = referenceResolver;
        this.identityResolver = identityResolver;
        this.engine = engine;
        this.persistence = persistence;
    }

    @Transactional
    public IngestionOutcome ingest(MatchMessage message) {
        ResolvedReferences refs = referenceResolver.resolve(message);
        IdentityResolution identity = identityResolver.resolve(message, refs);
        ReconciliationDecision decision = engine.decide(identity.existing(), message, identity.adoptExternalId());

        switch (decision.action()) {
            case CREATE -> {
                long id = persistence.insert(message, refs, identity.naturalKey(), decision.lock());
                log.info("[Ingest][Create] match {} {} status={} source={}", id, message.describe(),
                        message.getStatus().wireValue(), message.getSource().tag());
                return IngestionOutcome.applied(ReconciliationAction.CREATE, id, decision.detail());
            }
            case UPDATE -> {
                persistence.update(decision.existing(), message, decision.lock(), decision.adoptExternalId());
                log.info("[Ingest][Update] match {} {}: {}", decision.matchId(), message.describe(), decision.detail());
                return IngestionOutcome.applied(ReconciliationAction.UPDATE, decision.matchId(), decision.detail());
            }
            case CONFLICT -> {
                Long conflictId = persistence.recordConflict(decision);
                if (conflictId != null) {
                    log.warn("[Ingest][Conflict] match {} {} reason={}: {}", decision.matchId(), message.describe(),
                            decision.conflictReason(), decision.detail());
                }
                return IngestionOutcome.applied(ReconciliationAction.CONFLICT, decision.matchId(),
                        decision.conflictReason() + ": " + decision.detail());
            }
            default -> {
                log.debug("[Ingest][Skip] match {} {}: {}", decision.matchId(), message.describe(), decision.detail());
                return IngestionOutcome.applied(ReconciliationAction.SKIP, decision.matchId(), decision.detail());
            }
        }
    }
}
