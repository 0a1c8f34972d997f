package com.openforge.posgate.audit;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.openforge.posgate.domain.AuditAction;
import com.openforge.posgate.domain.AuditLog;
import com.openforge.posgate.domain.Role;

import java.time.Instant;

/** The JSON snapshot columns are emitted as nested JSON, not as strings. */
public record AuditLogResponse(
        String          logId,
        String          tenantId,
        String          userId,
        String          userName,
        Role            userRole,
        AuditAction     action,
        String          resourceType,
        String          resourceId,
        String          resourceName,
        @JsonRawValue   String details,
        @JsonRawValue   String previousState,
        @JsonRawValue   String newState,
        AuditLog.Status status,
        String          errorMessage,
        Instant         createdAt
) {
    public static AuditLogResponse of(AuditLog row) {
        return new AuditLogResponse(
                row.getLogId(),
                row.getTenantId(),
                row.getUserId(),
                row.getUserName(),
                row.getUserRole(),
                row.getAction(),
                row.getResourceType(),
                row.getResourceId(),
                row.getResourceName(),
                row.getDetails(),
                row.getPreviousState(),
                row.getNewState(),
                row.getStatus(),
                row.getErrorMessage(),
                row.getCreatedAt());
    }
}
