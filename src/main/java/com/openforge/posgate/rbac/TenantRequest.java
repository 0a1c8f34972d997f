package com.openforge.posgate.rbac;

/**
 * The tenant ids a request names. A path id is checked as named; a body id is
 * honoured only for super admins and otherwise replaced with the caller's own
 * tenant. When neither is present the principal's own tenant applies.
 */
public record TenantRequest(String pathTenantId, String bodyTenantId) {

    private static final TenantRequest NONE = new TenantRequest(null, null);

    public static TenantRequest none() {
        return NONE;
    }

    public static TenantRequest path(String tenantId) {
        return new TenantRequest(tenantId, null);
    }

    public static TenantRequest body(String tenantId) {
        return new TenantRequest(null, tenantId);
    }

    public boolean hasPath() {
        return pathTenantId != null && !pathTenantId.isBlank();
    }
}
