package com.ricemill.stockkeeper.security;

public enum Action {
    MANAGE_USERS,
    VIEW_AUDIT_LOGS,
    MANAGE_INVENTORY,
    VIEW_REPORTS,
    VIEW_FINANCIAL_METRICS,
    MANAGE_TENANT_SETTINGS,
    MANAGE_TENANTS
}
