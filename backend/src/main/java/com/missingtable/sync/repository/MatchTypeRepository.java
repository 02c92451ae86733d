package com.missingtable.sync.repository;

import com.missingtable.sync.model.MatchType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface MatchTypeRepository extends JpaRepository<MatchType, Long> {
    @Query("select x from MatchType x where lower(trim(x.name)) = lower(trim(:name))")
    Optional<MatchType> findByNameIgnoreCase(@Param("name") String name);
}
