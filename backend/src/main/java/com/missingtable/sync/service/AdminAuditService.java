package com.missingtable.sync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.missingtable.sync.model.AdminAudit;
import com.missingtable.sync.repository.AdminAuditRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class AdminAuditService {
    private static final Logger log = LoggerFactory.getLogger(AdminAuditService.class);

    private final AdminAuditRepository repository;
    private final ObjectMapper objectMapper;

    public AdminAuditService(AdminAuditRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    public AdminAudit record(String action, String actor, Long matchId, Map<String, Object> params, long affected) {
        AdminAudit audit = new AdminAudit();
        audit.setAction(action);
        audit.setActor(actor);
        audit.setMatchId(matchId);
        audit.setParams(toJson(params));
        audit.setAffectedCount(affected);
        AdminAudit saved = repository.save(audit);
        log.info("[Admin][Audit] action={} actor={} matchId={} affected={}", action, actor, matchId, affected);
        return saved;
    }

    private String toJson(Map<String, Object> params) {
        if (params == null || params.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            log.warn("[Admin][Audit] params not serializable, storing toString: {}", e.getOriginalMessage());
            return String.valueOf(params);
        }
    }
}
