package com.openforge.posgate.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.Locale;

/**
 * Shop-level profile of a staff account, 1:1 with its {@link User}.
 * Holds the fine-grained permission flags checked for STAFF principals.
 */
@Getter
@Setter
@Entity
@Table(
    name = "staff_profiles",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_staff_staff_id", columnNames = "staff_id"),
        @UniqueConstraint(name = "uq_staff_user_id", columnNames = "user_id"),
        @UniqueConstraint(name = "uq_staff_tenant_email", columnNames = {"tenant_id", "email"})
    }
)
public class StaffProfile extends BaseEntity {

    @Column(name = "staff_id", nullable = false, length = 64)
    private String staffId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(nullable = false, length = 255)
    private String email;

    @Column(length = 32)
    private String phone;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Position position = Position.STAFF;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private User.Status status = User.Status.ACTIVE;

    @Embedded
    private StaffPermissions permissions = new StaffPermissions();

    @Column(name = "created_by", nullable = false, length = 64)
    private String createdBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "created_by_role", nullable = false, length = 16)
    private Role createdByRole;

    /** Job title inside the shop. Only SHOP_ADMIN maps to a role above STAFF. */
    public enum Position {
        SHOP_ADMIN,
        MANAGER,
        CASHIER,
        STAFF;

        public Role role() {
            return this == SHOP_ADMIN ? Role.SHOP_ADMIN : Role.STAFF;
        }

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Position of(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
