package com.ricemill.stockkeeper.event;

import java.time.Instant;

/**
 * Published by write paths inside their transaction; acted on only once the
 * transaction has committed.
 */
public record TenantDataChangedEvent(Long tenantId, ChangeType type, Long resourceId, Instant occurredAt) {
}
