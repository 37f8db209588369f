package com.ricemill.stockkeeper.event;

import com.ricemill.stockkeeper.service.DashboardCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Runs after the writing transaction commits: drops the tenant's cached metrics
 * and notifies live subscribers. A rolled-back write triggers neither.
 */
@Slf4j
@Component
public class TenantDataChangeListener {

    private final DashboardCache dashboardCache;
    private final TenantEventBus eventBus;

    public TenantDataChangeListener(DashboardCache dashboardCache, TenantEventBus eventBus) {
        this.dashboardCache = dashboardCache;
        this.eventBus = eventBus;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onTenantDataChanged(TenantDataChangedEvent event) {
        log.debug("Tenant {} changed: {} #{}", event.tenantId(), event.type(), event.resourceId());
        try {
            dashboardCache.invalidateTenant(event.tenantId());
        } catch (RuntimeException e) {
            // Entries still expire on TTL
            log.warn("Cache invalidation failed for tenant {}", event.tenantId(), e);
        }
        eventBus.publish(event.tenantId(), event);
    }
}
