package com.openforge.posgate.common;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Every error code the API can return, with its HTTP status and default message.
 *
 * Clients branch on {@link #name()}: TOKEN_EXPIRED means "try a refresh",
 * TOKEN_INVALID means "log in again".
 */
@Getter
public enum ErrorCode {

    // ── Authentication ───────────────────────────────────────────────────────
    AUTH_REQUIRED(HttpStatus.UNAUTHORIZED, "Authentication required"),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "Token has expired"),
    TOKEN_INVALID(HttpStatus.UNAUTHORIZED, "Invalid token"),
    USER_NOT_FOUND(HttpStatus.UNAUTHORIZED, "User not found"),
    ACCOUNT_INACTIVE(HttpStatus.FORBIDDEN, "Account is not active"),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid email or password"),
    REFRESH_TOKEN_REQUIRED(HttpStatus.BAD_REQUEST, "Refresh token is required"),
    AUTH_RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS,
            "Too many authentication attempts, please try again later"),

    // ── Tenancy ──────────────────────────────────────────────────────────────
    TENANT_NOT_FOUND(HttpStatus.NOT_FOUND, "Tenant not found"),
    TENANT_INACTIVE(HttpStatus.FORBIDDEN, "Tenant account is not active"),
    TENANT_FORBIDDEN(HttpStatus.FORBIDDEN, "Access denied to this tenant"),
    MISSING_TENANT(HttpStatus.BAD_REQUEST, "Tenant ID is required"),

    // ── Roles & fine-grained permissions ─────────────────────────────────────
    FORBIDDEN(HttpStatus.FORBIDDEN, "Insufficient permissions"),
    NO_PRODUCT_PERMISSION(HttpStatus.FORBIDDEN, "Permission denied: Cannot manage products"),
    NO_SALES_PERMISSION(HttpStatus.FORBIDDEN, "Permission denied: Cannot modify sales"),
    NO_STAFF_PERMISSION(HttpStatus.FORBIDDEN, "Permission denied: Cannot manage staff"),
    NO_REPORT_PERMISSION(HttpStatus.FORBIDDEN, "Permission denied: Cannot view reports"),
    NO_DISCOUNT_PERMISSION(HttpStatus.FORBIDDEN, "Permission denied: Cannot apply discounts"),
    NO_REFUND_PERMISSION(HttpStatus.FORBIDDEN, "Permission denied: Cannot process refunds"),

    // ── One-time setup ───────────────────────────────────────────────────────
    ALREADY_SETUP(HttpStatus.CONFLICT, "System has already been set up"),
    SUPER_ADMIN_EXISTS(HttpStatus.CONFLICT, "Super admin already exists"),

    // ── Staff / generic ──────────────────────────────────────────────────────
    EMAIL_EXISTS(HttpStatus.CONFLICT, "Email already registered for this tenant"),
    STAFF_NOT_FOUND(HttpStatus.NOT_FOUND, "Staff not found"),
    INVALID_ROLE(HttpStatus.BAD_REQUEST, "Invalid role"),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "Validation failed"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "Resource not found"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }
}
