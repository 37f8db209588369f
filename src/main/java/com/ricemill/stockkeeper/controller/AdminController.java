package com.ricemill.stockkeeper.controller;

import com.ricemill.stockkeeper.model.AuditLog;
import com.ricemill.stockkeeper.security.CurrentActorResolver;
import com.ricemill.stockkeeper.service.AuditService;
import com.ricemill.stockkeeper.service.TenantSettingsService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tenants/{tenantId}")
public class AdminController {

    private final TenantSettingsService settingsService;
    private final AuditService auditService;
    private final CurrentActorResolver actorResolver;

    public AdminController(TenantSettingsService settingsService,
            AuditService auditService,
            CurrentActorResolver actorResolver) {
        this.settingsService = settingsService;
        this.auditService = auditService;
        this.actorResolver = actorResolver;
    }

    @GetMapping("/settings")
    public Map<String, String> settings(@PathVariable Long tenantId) {
        return settingsService.getSettings(actorResolver.currentActor(), tenantId);
    }

    @PutMapping("/settings/{key}")
    public Map<String, String> updateSetting(@PathVariable Long tenantId, @PathVariable String key,
            @RequestBody(required = false) Map<String, String> body) {
        String value = body != null ? body.get("value") : null;
        return settingsService.updateSetting(actorResolver.currentActor(), tenantId, key, value);
    }

    @GetMapping("/audit-logs")
    public List<AuditLog> auditLogs(@PathVariable Long tenantId, @RequestParam(required = false) Integer limit) {
        return auditService.listForTenant(actorResolver.currentActor(), tenantId, limit);
    }
}
