package com.openforge.posgate.domain;

/**
 * Closed set of security-relevant actions written to the audit log.
 */
public enum AuditAction {

    // Authentication
    LOGIN,
    LOGOUT,
    LOGIN_FAILED,
    PASSWORD_CHANGE,
    TOKEN_REFRESH,
    TOKEN_REVOKED,

    // Tenant management
    TENANT_CREATE,
    TENANT_UPDATE,
    TENANT_SUSPEND,
    TENANT_DELETE,

    // User management
    USER_CREATE,
    USER_UPDATE,
    USER_DELETE,
    USER_SUSPEND,
    USER_ACTIVATE,

    // Staff management
    STAFF_CREATE,
    STAFF_UPDATE,
    STAFF_SUSPEND,
    STAFF_DELETE,

    // Products
    PRODUCT_CREATE,
    PRODUCT_UPDATE,
    PRODUCT_DELETE,
    PRODUCT_STOCK_UPDATE,

    // Sales
    SALE_CREATE,
    SALE_UPDATE,
    SALE_CANCEL,
    SALE_REFUND,

    // System
    SETTINGS_UPDATE,
    EXPORT_DATA,
    IMPORT_DATA,
    SYSTEM_ERROR
}
