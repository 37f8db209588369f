package com.ricemill.stockkeeper.model;

/**
 * Anything that belongs to exactly one tenant. Authorization decisions compare
 * this id against the actor's tenant.
 */
public interface TenantOwned {

    Long getTenantId();
}
