package com.missingtable.sync.repository;

import com.missingtable.sync.model.Match;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface MatchRepository extends JpaRepository<Match, Long> {

    Optional<Match> findByExternalMatchId(String externalMatchId);

    Optional<Match> findByNaturalKey(String naturalKey);
}
