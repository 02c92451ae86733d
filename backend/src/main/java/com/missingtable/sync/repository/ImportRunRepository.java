package com.missingtable.sync.repository;

import com.missingtable.sync.model.ImportRun;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ImportRunRepository extends JpaRepository<ImportRun, Long> {
    List<ImportRun> findTop20ByOrderByStartedAtDesc();
}
