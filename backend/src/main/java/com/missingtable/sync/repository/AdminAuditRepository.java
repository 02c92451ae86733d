package com.missingtable.sync.repository;

import com.missingtable.sync.model.AdminAudit;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AdminAuditRepository extends JpaRepository<AdminAudit, Long> {
    List<AdminAudit> findByMatchIdOrderByAuditedAtDesc(Long matchId);
}
