package com.ricemill.stockkeeper.service;

import com.ricemill.stockkeeper.model.Tenant;
import com.ricemill.stockkeeper.model.TenantOwned;
import com.ricemill.stockkeeper.model.User;

/**
 * Proof that an actor has been cleared to read one tenant's data. Only
 * {@link TenantScopedQueryService} can create one, and every store read it offers
 * takes a scope, so no read can run without a tenant filter.
 */
public final class TenantScope implements TenantOwned {

    private final Tenant tenant;
    private final User actor;

    TenantScope(Tenant tenant, User actor) {
        this.tenant = tenant;
        this.actor = actor;
    }

    public Long tenantId() {
        return tenant.getId();
    }

    public Tenant tenant() {
        return tenant;
    }

    public User actor() {
        return actor;
    }

    @Override
    public Long getTenantId() {
        return tenant.getId();
    }

    @Override
    public String toString() {
        return "TenantScope[tenant=" + tenant.getId() + ", actor=" + (actor != null ? actor.getId() : null) + "]";
    }
}
