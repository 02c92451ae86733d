package com.missingtable.sync.service;

import com.missingtable.sync.dto.MatchMessage;
import com.missingtable.sync.dto.ResolvedReferences;
import com.missingtable.sync.exception.UnknownReferenceException;
import com.missingtable.sync.exception.ValidationException;
import com.missingtable.sync.repository.*;
import com.missingtable.sync.util.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Function;

/**
 * Maps the reference identifiers carried by a message (names or numeric ids) to row ids.
 * Reference data is never created here; an unknown identifier rejects the message.
 */
@Service
public class ReferenceDataResolver {
    private static final Logger log = LoggerFactory.getLogger(ReferenceDataResolver.class);

    private final TeamRepository teamRepository;
    private final SeasonRepository seasonRepository;
    private final AgeGroupRepository ageGroupRepository;
    private final MatchTypeRepository matchTypeRepository;
    private final DivisionRepository divisionRepository;

    public ReferenceDataResolver(TeamRepository teamRepository,
                                 SeasonRepository seasonRepository,
                                 AgeGroupRepository ageGroupRepository,
                                 MatchTypeRepository matchTypeRepository,
                                 DivisionRepository divisionRepository) {
        this.teamRepository = teamRepository;
        this.seasonRepository = seasonRepository;
        this.ageGroupRepository = ageGroupRepository;
        this.matchTypeRepository = matchTypeRepository;
        this.divisionRepository = divisionRepository;
    }

    public ResolvedReferences resolve(MatchMessage message) {
        long home = resolve("home_team", message.getHomeTeam(), teamRepository,
                name -> teamRepository.findByNormalizedName(NameNormalizer.normalize(name)).map(t -> t.getId()));
        long away = resolve("away_team", message.getAwayTeam(), teamRepository,
                name -> teamRepository.findByNormalizedName(NameNormalizer.normalize(name)).map(t -> t.getId()));
        long season = resolve("season", message.getSeason(), seasonRepository,
                name -> seasonRepository.findByNameIgnoreCase(name).map(s -> s.getId()));
        long ageGroup = resolve("age_group", message.getAgeGroup(), ageGroupRepository,
                name -> ageGroupRepository.findByNameIgnoreCase(name).map(a -> a.getId()));
        long matchType = resolve("match_type", message.getMatchType(), matchTypeRepository,
                name -> matchTypeRepository.findByNameIgnoreCase(name).map(t -> t.getId()));
        Long division = null;
        if (!NameNormalizer.isBlank(message.getDivision())) {
            division = resolve("division", message.getDivision(), divisionRepository,
                    name -> divisionRepository.findByNameIgnoreCase(name).map(d -> d.getId()));
        }
        if (home == away) {
            // two spellings of the same club
            throw new ValidationException("away_team", "resolves to the same team as home_team");
        }
        return new ResolvedReferences(home, away, season, ageGroup, matchType, division);
    }

    private long resolve(String field, String identifier, JpaRepository<?, Long> byId,
                         Function<String, Optional<Long>> byName) {
        Optional<Long> id = Optional.empty();
        if (identifier.chars().allMatch(Character::isDigit)) {
            try {
                long numeric = Long.parseLong(identifier);
                if (byId.existsById(numeric)) {
                    id = Optional.of(numeric);
                }
            } catch (NumberFormatException ex) {
                // too long for an id; may still be a name
                log.debug("[Ingest][Reference] {} '{}' is not a valid id", field, identifier);
            }
        }
        if (id.isEmpty()) {
            id = byName.apply(identifier);
        }
        if (id.isEmpty()) {
            log.info("[Ingest][Reference] unknown {} '{}'", field, identifier);
            throw new UnknownReferenceException(field, identifier);
        }
        return id.get();
    }
}
