package com.openforge.posgate.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.Locale;

/**
 * Append-only audit record. Carries no live reference to the user, tenant or
 * resource it describes: it is a historical fact and is never updated.
 *
 * details / previous_state / new_state are JSON snapshots.
 */
@Getter
@Builder
@Immutable
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Entity
@Table(
    name = "audit_logs",
    uniqueConstraints = @UniqueConstraint(name = "uq_audit_log_id", columnNames = "log_id"),
    indexes = {
        @Index(name = "idx_audit_tenant_created", columnList = "tenant_id, created_at"),
        @Index(name = "idx_audit_tenant_action", columnList = "tenant_id, action, created_at")
    }
)
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "log_id", nullable = false, length = 64)
    private String logId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "user_name", length = 255)
    private String userName;

    @Enumerated(EnumType.STRING)
    @Column(name = "user_role", length = 16)
    private Role userRole;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private AuditAction action;

    @Column(name = "resource_type", length = 32)
    private String resourceType;

    @Column(name = "resource_id", length = 64)
    private String resourceId;

    @Column(name = "resource_name", length = 255)
    private String resourceName;

    @Column(columnDefinition = "TEXT")
    private String details;

    @Column(name = "previous_state", columnDefinition = "TEXT")
    private String previousState;

    @Column(name = "new_state", columnDefinition = "TEXT")
    private String newState;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public enum Status {
        SUCCESS,
        FAILURE,
        WARNING;

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
