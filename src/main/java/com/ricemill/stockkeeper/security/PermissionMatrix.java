package com.ricemill.stockkeeper.security;

import com.ricemill.stockkeeper.model.UserRole;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The complete role x action table. Every cell is written out; a missing cell
 * reads as {@link Grant#DENY}. There is no role inheritance.
 */
public final class PermissionMatrix {

    private static final Map<UserRole, Map<Action, Grant>> TABLE = new EnumMap<>(UserRole.class);

    static {
        Map<Action, Grant> superAdmin = new EnumMap<>(Action.class);
        superAdmin.put(Action.MANAGE_USERS, Grant.ALLOW);
        superAdmin.put(Action.VIEW_AUDIT_LOGS, Grant.ALLOW);
        superAdmin.put(Action.MANAGE_INVENTORY, Grant.ALLOW);
        superAdmin.put(Action.VIEW_REPORTS, Grant.ALLOW);
        superAdmin.put(Action.VIEW_FINANCIAL_METRICS, Grant.ALLOW);
        superAdmin.put(Action.MANAGE_TENANT_SETTINGS, Grant.ALLOW);
        superAdmin.put(Action.MANAGE_TENANTS, Grant.ALLOW);
        TABLE.put(UserRole.SUPER_ADMIN, Collections.unmodifiableMap(superAdmin));

        Map<Action, Grant> companyAdmin = new EnumMap<>(Action.class);
        companyAdmin.put(Action.MANAGE_USERS, Grant.SAME_TENANT);
        companyAdmin.put(Action.VIEW_AUDIT_LOGS, Grant.SAME_TENANT);
        companyAdmin.put(Action.MANAGE_INVENTORY, Grant.ALLOW);
        companyAdmin.put(Action.VIEW_REPORTS, Grant.ALLOW);
        companyAdmin.put(Action.VIEW_FINANCIAL_METRICS, Grant.ALLOW);
        companyAdmin.put(Action.MANAGE_TENANT_SETTINGS, Grant.ALLOW);
        companyAdmin.put(Action.MANAGE_TENANTS, Grant.DENY);
        TABLE.put(UserRole.COMPANY_ADMIN, Collections.unmodifiableMap(companyAdmin));

        Map<Action, Grant> operator = new EnumMap<>(Action.class);
        operator.put(Action.MANAGE_USERS, Grant.DENY);
        operator.put(Action.VIEW_AUDIT_LOGS, Grant.DENY);
        operator.put(Action.MANAGE_INVENTORY, Grant.SAME_TENANT);
        operator.put(Action.VIEW_REPORTS, Grant.SAME_TENANT);
        operator.put(Action.VIEW_FINANCIAL_METRICS, Grant.SAME_TENANT);
        operator.put(Action.MANAGE_TENANT_SETTINGS, Grant.DENY);
        operator.put(Action.MANAGE_TENANTS, Grant.DENY);
        TABLE.put(UserRole.OPERATOR, Collections.unmodifiableMap(operator));

        Map<Action, Grant> viewer = new EnumMap<>(Action.class);
        viewer.put(Action.MANAGE_USERS, Grant.DENY);
        viewer.put(Action.VIEW_AUDIT_LOGS, Grant.DENY);
        viewer.put(Action.MANAGE_INVENTORY, Grant.DENY);
        viewer.put(Action.VIEW_REPORTS, Grant.SAME_TENANT);
        viewer.put(Action.VIEW_FINANCIAL_METRICS, Grant.DENY);
        viewer.put(Action.MANAGE_TENANT_SETTINGS, Grant.DENY);
        viewer.put(Action.MANAGE_TENANTS, Grant.DENY);
        TABLE.put(UserRole.VIEWER, Collections.unmodifiableMap(viewer));
    }

    private PermissionMatrix() {
    }

    public static Grant grantFor(UserRole role, Action action) {
        if (role == null || action == null) {
            return Grant.DENY;
        }
        return TABLE.getOrDefault(role, Map.of()).getOrDefault(action, Grant.DENY);
    }

    public static Map<Action, Grant> grantsFor(UserRole role) {
        return TABLE.getOrDefault(role, Map.of());
    }
}
