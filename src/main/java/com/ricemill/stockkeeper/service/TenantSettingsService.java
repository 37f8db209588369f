package com.ricemill.stockkeeper.service;

import com.ricemill.stockkeeper.config.DashboardProperties;
import com.ricemill.stockkeeper.event.ChangeType;
import com.ricemill.stockkeeper.event.TenantDataChangedEvent;
import com.ricemill.stockkeeper.model.Tenant;
import com.ricemill.stockkeeper.model.User;
import com.ricemill.stockkeeper.repository.TenantRepository;
import com.ricemill.stockkeeper.security.Action;
import com.ricemill.stockkeeper.security.AuthorizationService;
import com.ricemill.stockkeeper.security.TenantRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

@Slf4j
@Service
public class TenantSettingsService {

    public static final String KEY_LOW_STOCK_THRESHOLD = "low_stock_threshold";

    private static final int MAX_KEY_LENGTH = 64;
    private static final int MAX_VALUE_LENGTH = 255;

    private final TenantRepository tenantRepository;
    private final TenantScopedQueryService queries;
    private final AuthorizationService authorizationService;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;
    private final DashboardProperties properties;
    private final Clock clock;

    public TenantSettingsService(TenantRepository tenantRepository,
            TenantScopedQueryService queries,
            AuthorizationService authorizationService,
            AuditService auditService,
            ApplicationEventPublisher eventPublisher,
            DashboardProperties properties,
            Clock clock) {
        this.tenantRepository = tenantRepository;
        this.queries = queries;
        this.authorizationService = authorizationService;
        this.auditService = auditService;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * The tenant's own threshold if it has a valid one, else the global default.
     */
    public BigDecimal lowStockThreshold(Tenant tenant) {
        String value = tenant != null ? tenant.getSettings().get(KEY_LOW_STOCK_THRESHOLD) : null;
        if (value == null || value.isBlank()) {
            return properties.lowStockThreshold();
        }
        try {
            BigDecimal threshold = new BigDecimal(value.trim());
            return threshold.signum() > 0 ? threshold : properties.lowStockThreshold();
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid {} '{}' for tenant {}", KEY_LOW_STOCK_THRESHOLD, value, tenant.getId());
            return properties.lowStockThreshold();
        }
    }

    public Map<String, String> getSettings(User actor, Long tenantId) {
        authorizationService.authorize(actor, Action.MANAGE_TENANT_SETTINGS, TenantRef.of(tenantId));
        return new TreeMap<>(queries.scope(actor, tenantId).tenant().getSettings());
    }

    /**
     * Sets one key. A blank value removes it.
     */
    @Transactional
    public Map<String, String> updateSetting(User actor, Long tenantId, String key, String value) {
        authorizationService.authorize(actor, Action.MANAGE_TENANT_SETTINGS, TenantRef.of(tenantId));
        Tenant tenant = queries.scope(actor, tenantId).tenant();

        if (key == null || key.isBlank() || key.length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException("Setting key must be 1 to " + MAX_KEY_LENGTH + " characters");
        }
        String normalizedKey = key.trim();
        String normalizedValue = value != null ? value.trim() : "";
        if (normalizedValue.length() > MAX_VALUE_LENGTH) {
            throw new IllegalArgumentException("Setting value exceeds " + MAX_VALUE_LENGTH + " characters");
        }
        if (KEY_LOW_STOCK_THRESHOLD.equals(normalizedKey) && !normalizedValue.isEmpty()) {
            validateThreshold(normalizedValue);
        }

        String previous = normalizedValue.isEmpty()
                ? tenant.getSettings().remove(normalizedKey)
                : tenant.getSettings().put(normalizedKey, normalizedValue);
        Tenant saved = tenantRepository.save(tenant);

        Map<String, Object> changes = new TreeMap<>();
        changes.put("key", normalizedKey);
        changes.put("from", previous);
        changes.put("to", normalizedValue.isEmpty() ? null : normalizedValue);
        auditService.record(actor, tenantId, "tenant.settings.update", "tenant", tenantId, changes);
        eventPublisher.publishEvent(
                new TenantDataChangedEvent(tenantId, ChangeType.SETTINGS_CHANGED, tenantId, Instant.now(clock)));

        return new TreeMap<>(saved.getSettings());
    }

    private static void validateThreshold(String value) {
        try {
            if (new BigDecimal(value).signum() <= 0) {
                throw new IllegalArgumentException("Low stock threshold must be positive");
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Low stock threshold must be a number");
        }
    }
}
