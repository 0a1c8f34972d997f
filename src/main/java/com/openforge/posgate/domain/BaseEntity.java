package com.openforge.posgate.domain;

import jakarta.persistence.*;
import lombok.Getter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * Surrogate key, insert timestamp and version column shared by the mutable
 * tables. Business identifiers (userId, tenantId, staffId) live on the
 * subclasses; the numeric id only orders rows by insertion.
 */
@Getter
@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
public abstract class BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Stamped from the application clock on insert; shown as createdAt. */
    @CreatedDate
    @Column(name = "create_time", nullable = false, updatable = false)
    private LocalDateTime createTime;

    /**
     * Bumped on every flush of the row. Refresh-token mutations also hold the
     * row lock, so a conflict here means a writer skipped the lock.
     */
    @Version
    @Column(nullable = false)
    private Integer version = 0;
}
