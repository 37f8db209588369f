package com.ricemill.stockkeeper.security;

import com.ricemill.stockkeeper.exception.UnauthorizedException;
import com.ricemill.stockkeeper.model.TenantOwned;
import com.ricemill.stockkeeper.model.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Single decision point for role based access. {@link #can} is pure and total:
 * it has no side effects and answers {@code false} for anything it does not
 * recognise.
 */
@Slf4j
@Service
public class AuthorizationService {

    public boolean can(User actor, Action action, TenantOwned resource) {
        if (actor == null || action == null || actor.getRole() == null) {
            return false;
        }
        if (!actor.isActive()) {
            return false;
        }
        if (actor.isSuperAdmin()) {
            return true;
        }
        // Tenant-bound roles without a tenant are never granted anything
        if (actor.getTenantId() == null) {
            return false;
        }

        switch (PermissionMatrix.grantFor(actor.getRole(), action)) {
            case ALLOW:
                return true;
            case SAME_TENANT:
                return resource != null && Objects.equals(resource.getTenantId(), actor.getTenantId());
            default:
                return false;
        }
    }

    public void authorize(User actor, Action action, TenantOwned resource) {
        if (!can(actor, action, resource)) {
            log.warn("Denied {} for user {} on tenant {}", action,
                    actor != null ? actor.getId() : "anonymous",
                    resource != null ? resource.getTenantId() : null);
            throw new UnauthorizedException("Not permitted: " + action);
        }
    }
}
