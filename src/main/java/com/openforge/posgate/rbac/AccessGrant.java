package com.openforge.posgate.rbac;

/**
 * Proof that {@link AuthorizationEngine#admit} let a principal through.
 * {@code tenantId} is the tenant every downstream query must be scoped to.
 */
public record AccessGrant(Principal principal, String tenantId, AccessPolicy policy) {}
