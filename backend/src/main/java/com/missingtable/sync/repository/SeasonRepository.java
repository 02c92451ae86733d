package com.missingtable.sync.repository;

import com.missingtable.sync.model.Season;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface SeasonRepository extends JpaRepository<Season, Long> {
    @Query("select s from Season s where lower(trim(s.name)) = lower(trim(:name))")
    Optional<Season> findByNameIgnoreCase(@Param("name") String name);
}
