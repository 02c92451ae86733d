package com.missingtable.sync.repository;

import com.missingtable.sync.model.AgeGroup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface AgeGroupRepository extends JpaRepository<AgeGroup, Long> {
    @Query("select x from AgeGroup x where lower(trim(x.name)) = lower(trim(:name))")
    Optional<AgeGroup> findByNameIgnoreCase(@Param("name") String name);
}
