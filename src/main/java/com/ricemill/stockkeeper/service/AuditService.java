package com.ricemill.stockkeeper.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ricemill.stockkeeper.model.AuditLog;
import com.ricemill.stockkeeper.model.User;
import com.ricemill.stockkeeper.repository.AuditLogRepository;
import com.ricemill.stockkeeper.security.Action;
import com.ricemill.stockkeeper.security.AuthorizationService;
import com.ricemill.stockkeeper.security.TenantRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class AuditService {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 200;
    private static final int MAX_CHANGES_LENGTH = 4000;

    private final AuditLogRepository auditLogRepository;
    private final AuthorizationService authorizationService;
    private final TenantScopedQueryService queries;
    private final ObjectMapper objectMapper;

    public AuditService(AuditLogRepository auditLogRepository,
            AuthorizationService authorizationService,
            TenantScopedQueryService queries,
            ObjectMapper objectMapper) {
        this.auditLogRepository = auditLogRepository;
        this.authorizationService = authorizationService;
        this.queries = queries;
        this.objectMapper = objectMapper;
    }

    /**
     * Appends an entry in its own transaction. Failures are logged and swallowed
     * here so an audit problem never undoes the business write.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(User actor, Long tenantId, String action, String resourceType, Long resourceId,
            Map<String, ?> changes) {
        try {
            AuditLog entry = new AuditLog();
            entry.setUserId(actor != null ? actor.getId() : null);
            entry.setTenantId(tenantId);
            entry.setAction(action);
            entry.setResourceType(resourceType);
            entry.setResourceId(resourceId);
            entry.setChanges(toJson(changes));
            auditLogRepository.save(entry);
        } catch (RuntimeException e) {
            log.warn("Failed to write audit log {} for tenant {}", action, tenantId, e);
        }
    }

    /**
     * Newest entries first. {@code limit} outside 1 to 200 falls back to 50.
     */
    public List<AuditLog> listForTenant(User actor, Long tenantId, Integer limit) {
        authorizationService.authorize(actor, Action.VIEW_AUDIT_LOGS, TenantRef.of(tenantId));
        TenantScope scope = queries.scope(actor, tenantId);
        int size = limit == null || limit < 1 || limit > MAX_LIMIT ? DEFAULT_LIMIT : limit;
        return queries.auditLogs(scope, size);
    }

    private String toJson(Map<String, ?> changes) {
        if (changes == null || changes.isEmpty()) {
            return null;
        }
        try {
            String json = objectMapper.writeValueAsString(changes);
            return json.length() > MAX_CHANGES_LENGTH ? json.substring(0, MAX_CHANGES_LENGTH) : json;
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise audit changes: {}", e.getMessage());
            return null;
        }
    }
}
