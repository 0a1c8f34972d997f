package com.openforge.posgate.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Permission flags attached to a staff profile. Every flag is a column;
 * an unset flag is {@code false}, i.e. denied.
 */
@Getter
@Setter
@Embeddable
@NoArgsConstructor
@AllArgsConstructor
public class StaffPermissions {

    @Column(name = "can_manage_products", nullable = false)
    private boolean canManageProducts;

    @Column(name = "can_manage_sales", nullable = false)
    private boolean canManageSales;

    @Column(name = "can_manage_staff", nullable = false)
    private boolean canManageStaff;

    @Column(name = "can_view_reports", nullable = false)
    private boolean canViewReports;

    @Column(name = "can_apply_discount", nullable = false)
    private boolean canApplyDiscount;

    @Column(name = "can_refund", nullable = false)
    private boolean canRefund;

    public boolean allows(Permission permission) {
        return switch (permission) {
            case MANAGE_PRODUCTS -> canManageProducts;
            case MANAGE_SALES    -> canManageSales;
            case MANAGE_STAFF    -> canManageStaff;
            case VIEW_REPORTS    -> canViewReports;
            case APPLY_DISCOUNT  -> canApplyDiscount;
            case REFUND          -> canRefund;
        };
    }

    /** Defaults applied when a staff member is created without explicit flags. */
    public static StaffPermissions defaultsFor(StaffProfile.Position position) {
        boolean admin   = position == StaffProfile.Position.SHOP_ADMIN;
        boolean manager = admin || position == StaffProfile.Position.MANAGER;
        return new StaffPermissions(admin, true, admin, manager, manager, manager);
    }

    public StaffPermissions copy() {
        return new StaffPermissions(canManageProducts, canManageSales, canManageStaff,
                canViewReports, canApplyDiscount, canRefund);
    }
}
