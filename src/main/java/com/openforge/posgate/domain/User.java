package com.openforge.posgate.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Credential store row. Identity is unique per (tenant_id, email);
 * super admins live in the "global" pseudo-tenant.
 *
 * Users are never deleted: suspension and soft delete only flip {@link #status}.
 */
@Getter
@Setter
@Entity
@Table(
    name = "users",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_users_user_id", columnNames = "user_id"),
        @UniqueConstraint(name = "uq_users_tenant_email", columnNames = {"tenant_id", "email"})
    }
)
public class User extends BaseEntity {

    public static final String GLOBAL_TENANT = "global";

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(nullable = false, length = 255)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Role role;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status = Status.ACTIVE;

    @Column(name = "first_name", length = 128)
    private String firstName;

    @Column(name = "last_name", length = 128)
    private String lastName;

    /** userId of the creator, or "system" for bootstrap/setup. */
    @Column(name = "created_by", length = 64)
    private String createdBy;

    @Column(name = "last_login_at")
    private Instant lastLoginAt;

    /** Oldest first. Bounded by SessionRegistry. */
    @ElementCollection
    @CollectionTable(name = "user_refresh_tokens", joinColumns = @JoinColumn(name = "user_pk"))
    @OrderColumn(name = "token_order")
    private List<RefreshTokenRecord> refreshTokens = new ArrayList<>();

    public boolean isActive() {
        return status == Status.ACTIVE;
    }

    public String displayName() {
        String first = firstName == null ? "" : firstName;
        String last  = lastName == null ? "" : lastName;
        String name  = (first + " " + last).trim();
        return name.isEmpty() ? email : name;
    }

    public enum Status {
        ACTIVE,
        INACTIVE,
        SUSPENDED;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Status of(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
