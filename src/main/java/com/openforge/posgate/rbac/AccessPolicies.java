package com.openforge.posgate.rbac;

import com.openforge.posgate.domain.Permission;
import com.openforge.posgate.domain.Role;

/**
 * Guards passed to {@link AuthorizationEngine#admit}. The staff, tenant and
 * observability guards are used by the controllers here; the product and sale
 * guards are for the product and sale handlers, which run outside this service.
 */
public final class AccessPolicies {

    // ── Products ─────────────────────────────────────────────────────────────
    public static final AccessPolicy PRODUCT_READ  = AccessPolicy.anyRole("product:read");
    public static final AccessPolicy PRODUCT_WRITE = AccessPolicy.withPermission("product:write", Permission.MANAGE_PRODUCTS);

    // ── Sales ────────────────────────────────────────────────────────────────
    public static final AccessPolicy SALE_LIST     = AccessPolicy.anyRole("sale:list");
    public static final AccessPolicy SALE_CREATE   = AccessPolicy.withPermission("sale:create", Permission.MANAGE_SALES);
    public static final AccessPolicy SALE_CANCEL   = AccessPolicy.withPermission("sale:cancel", Permission.MANAGE_SALES);
    public static final AccessPolicy SALE_REFUND   = AccessPolicy.withPermission("sale:refund", Permission.REFUND);
    public static final AccessPolicy SALE_DISCOUNT = AccessPolicy.withPermission("sale:discount", Permission.APPLY_DISCOUNT);
    public static final AccessPolicy SALE_SUMMARY  = AccessPolicy.withPermission("sale:summary", Permission.VIEW_REPORTS);

    // ── Staff / tenants ──────────────────────────────────────────────────────
    public static final AccessPolicy STAFF_MANAGE  = AccessPolicy.atLeast("staff:manage", Role.SHOP_ADMIN);
    public static final AccessPolicy TENANT_READ   = AccessPolicy.anyRole("tenant:read");
    public static final AccessPolicy TENANT_CREATE = AccessPolicy.atLeast("tenant:create", Role.SUPER_ADMIN);
    public static final AccessPolicy TENANT_STATUS = AccessPolicy.atLeast("tenant:status", Role.SUPER_ADMIN);

    // ── Observability ────────────────────────────────────────────────────────
    public static final AccessPolicy AUDIT_READ    = AccessPolicy.atLeast("audit:read", Role.SHOP_ADMIN);
    public static final AccessPolicy MONITOR       = AccessPolicy.atLeast("monitor:subscribe", Role.SHOP_ADMIN);

    private AccessPolicies() {}
}
