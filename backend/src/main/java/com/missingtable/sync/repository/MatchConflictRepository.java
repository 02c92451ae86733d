package com.missingtable.sync.repository;

import com.missingtable.sync.model.MatchConflict;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface MatchConflictRepository extends JpaRepository<MatchConflict, Long> {
    List<MatchConflict> findByResolvedFalseOrderByDetectedAtDesc();
    List<MatchConflict> findAllByOrderByDetectedAtDesc();
    List<MatchConflict> findByMatchIdOrderByDetectedAtDesc(Long matchId);
}
