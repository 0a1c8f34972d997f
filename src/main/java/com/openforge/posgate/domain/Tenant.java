package com.openforge.posgate.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.Locale;

/**
 * An isolated shop account. Every non-super-admin request requires its
 * tenant to be {@link Status#ACTIVE}.
 */
@Getter
@Setter
@Entity
@Table(
    name = "tenants",
    uniqueConstraints = @UniqueConstraint(name = "uq_tenants_tenant_id", columnNames = "tenant_id")
)
public class Tenant extends BaseEntity {

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(nullable = false, length = 128)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status = Status.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Plan plan = Plan.FREE;

    public boolean isActive() {
        return status == Status.ACTIVE;
    }

    public enum Status {
        PENDING,
        ACTIVE,
        SUSPENDED,
        CANCELLED;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Status of(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public enum Plan {
        FREE,
        BASIC,
        PROFESSIONAL,
        ENTERPRISE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Plan of(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
