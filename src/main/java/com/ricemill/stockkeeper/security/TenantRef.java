package com.ricemill.stockkeeper.security;

import com.ricemill.stockkeeper.model.TenantOwned;

/**
 * A bare tenant id used as the resource of an authorization check when no entity
 * has been loaded yet.
 */
public record TenantRef(Long tenantId) implements TenantOwned {

    public static TenantRef of(Long tenantId) {
        return new TenantRef(tenantId);
    }

    @Override
    public Long getTenantId() {
        return tenantId;
    }
}
