package com.missingtable.sync.repository;

import com.missingtable.sync.model.Division;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface DivisionRepository extends JpaRepository<Division, Long> {
    @Query("select x from Division x where lower(trim(x.name)) = lower(trim(:name))")
    Optional<Division> findByNameIgnoreCase(@Param("name") String name);
}
