package com.missingtable.sync.repository;

import com.missingtable.sync.model.DeadLetterMessage;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DeadLetterRepository extends JpaRepository<DeadLetterMessage, Long> {
    List<DeadLetterMessage> findByResolvedFalseOrderByCreatedAtDesc();
    List<DeadLetterMessage> findAllByOrderByCreatedAtDesc();
}
