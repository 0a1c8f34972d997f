package com.openforge.posgate.repository;

import com.openforge.posgate.domain.AuditAction;
import com.openforge.posgate.domain.AuditLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.repository.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Inserts and reads only. Extends the marker {@link Repository} rather than a
 * CRUD interface, so no update or delete method exists to call.
 */
public interface AuditLogRepository extends Repository<AuditLog, Long> {

    AuditLog save(AuditLog row);

    List<AuditLog> findByTenantIdOrderByCreatedAtDescIdDesc(String tenantId, Pageable page);

    List<AuditLog> findByTenantIdAndActionOrderByCreatedAtDescIdDesc(
            String tenantId, AuditAction action, Pageable page);

    List<AuditLog> findByOrderByCreatedAtDescIdDesc(Pageable page);

    List<AuditLog> findByActionOrderByCreatedAtDescIdDesc(AuditAction action, Pageable page);

    List<AuditLog> findByActionAndCreatedAtGreaterThanEqualOrderByCreatedAtDescIdDesc(
            AuditAction action, Instant since, Pageable page);

    List<AuditLog> findByTenantIdAndActionAndCreatedAtGreaterThanEqualOrderByCreatedAtDescIdDesc(
            String tenantId, AuditAction action, Instant since, Pageable page);
}
