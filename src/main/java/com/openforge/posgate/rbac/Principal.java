package com.openforge.posgate.rbac;

import com.openforge.posgate.domain.Role;
import com.openforge.posgate.domain.User;

/**
 * The authenticated identity attached to one request. Always rebuilt from the
 * stored user, never from token claims, so a suspension or role change is
 * visible on the very next request.
 */
public record Principal(String userId, String tenantId, String email, Role role) {

    public static Principal of(User user) {
        return new Principal(user.getUserId(), user.getTenantId(), user.getEmail(), user.getRole());
    }

    public boolean isSuperAdmin() {
        return role == Role.SUPER_ADMIN;
    }
}
