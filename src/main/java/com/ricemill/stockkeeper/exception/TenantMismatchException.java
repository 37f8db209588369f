package com.ricemill.stockkeeper.exception;

/**
 * An operation named a tenant the actor does not belong to, or a super admin
 * omitted the tenant. Handled exactly like {@link UnauthorizedException} at the boundary.
 */
public class TenantMismatchException extends UnauthorizedException {

    private final Long actorId;
    private final Long requestedTenantId;

    public TenantMismatchException(Long actorId, Long requestedTenantId) {
        super("Actor " + actorId + " is not scoped to tenant " + requestedTenantId);
        this.actorId = actorId;
        this.requestedTenantId = requestedTenantId;
    }

    public Long getActorId() {
        return actorId;
    }

    public Long getRequestedTenantId() {
        return requestedTenantId;
    }
}
