package com.missingtable.sync.service;

import com.missingtable.sync.dto.MatchMessage;
import com.missingtable.sync.dto.MatchSnapshot;
import com.missingtable.sync.dto.ResolvedReferences;
import com.missingtable.sync.exception.PermanentIngestionException;
import com.missingtable.sync.model.Match;
import com.missingtable.sync.repository.MatchRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Finds the stored row a message refers to: by external id first, then by natural key.
 * A natural-key hit carrying a different external id is a data problem, not a match.
 */
@Service
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final MatchRepository matchRepository;

    public IdentityResolver(MatchRepository matchRepository) {
        this.matchRepository = matchRepository;
    }

    public IdentityResolution resolve(MatchMessage message, ResolvedReferences refs) {
        String naturalKey = refs.naturalKey(message.getDate());
        if (message.hasExternalId()) {
            Optional<Match> byExternal = matchRepository.findByExternalMatchId(message.getExternalMatchId());
            if (byExternal.isPresent()) {
                return IdentityResolution.found(MatchSnapshot.of(byExternal.get()), naturalKey, false);
            }
        }
        Optional<Match> byKey = matchRepository.findByNaturalKey(naturalKey);
        if (byKey.isEmpty()) {
            return IdentityResolution.absent(naturalKey);
        }
        Match match = byKey.get();
        if (!message.hasExternalId()) {
            return IdentityResolution.found(MatchSnapshot.of(match), naturalKey, false);
        }
        if (match.getExternalMatchId() == null) {
            log.info("[Ingest][Identity] match {} found by natural key; adopting external id {}",
                    match.getId(), message.getExternalMatchId());
            return IdentityResolution.found(MatchSnapshot.of(match), naturalKey, true);
        }
        throw new PermanentIngestionException("Match " + match.getId() + " at natural key " + naturalKey
                + " already carries external id " + match.getExternalMatchId()
                + ", incoming external id is " + message.getExternalMatchId());
    }
}
