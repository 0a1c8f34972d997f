package com.openforge.posgate.domain;

import com.openforge.posgate.common.ErrorCode;
import lombok.Getter;

/**
 * Fine-grained capabilities a staff member may hold, independent of role.
 * Each one maps to the error code returned when it is missing.
 */
@Getter
public enum Permission {

    MANAGE_PRODUCTS(ErrorCode.NO_PRODUCT_PERMISSION),
    MANAGE_SALES(ErrorCode.NO_SALES_PERMISSION),
    MANAGE_STAFF(ErrorCode.NO_STAFF_PERMISSION),
    VIEW_REPORTS(ErrorCode.NO_REPORT_PERMISSION),
    APPLY_DISCOUNT(ErrorCode.NO_DISCOUNT_PERMISSION),
    REFUND(ErrorCode.NO_REFUND_PERMISSION);

    private final ErrorCode deniedCode;

    Permission(ErrorCode deniedCode) {
        this.deniedCode = deniedCode;
    }
}
