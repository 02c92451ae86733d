package com.missingtable.sync.repository;

import com.missingtable.sync.model.Team;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface TeamRepository extends JpaRepository<Team, Long> {
    Optional<Team> findByNormalizedName(String normalizedName);
}
