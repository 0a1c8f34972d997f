package com.openforge.posgate.rbac;

import com.openforge.posgate.domain.Permission;
import com.openforge.posgate.domain.Role;

/**
 * A named guard: the lowest role admitted and, optionally, the staff
 * permission flag that must also be held.
 */
public record AccessPolicy(String name, Role minimumRole, Permission permission) {

    public static AccessPolicy anyRole(String name) {
        return new AccessPolicy(name, Role.STAFF, null);
    }

    public static AccessPolicy atLeast(String name, Role role) {
        return new AccessPolicy(name, role, null);
    }

    public static AccessPolicy withPermission(String name, Permission permission) {
        return new AccessPolicy(name, Role.STAFF, permission);
    }
}
