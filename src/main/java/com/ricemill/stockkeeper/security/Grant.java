package com.ricemill.stockkeeper.security;

/**
 * One cell of the role x action table.
 */
public enum Grant {
    /** Not permitted. */
    DENY,
    /** Permitted whatever the resource; tenant confinement is left to the data access layer. */
    ALLOW,
    /** Permitted only when the resource belongs to the actor's tenant. */
    SAME_TENANT
}
