package com.openforge.posgate.audit;

import com.openforge.posgate.domain.AuditAction;
import com.openforge.posgate.domain.AuditLog;
import com.openforge.posgate.domain.Role;
import com.openforge.posgate.domain.User;
import com.openforge.posgate.rbac.Principal;
import lombok.Builder;

import java.util.Map;

/**
 * What a caller hands to {@link AuditRecorder}. The recorder adds the log id
 * and timestamp; everything else is the caller's account of the attempt.
 *
 * previousState / newState are arbitrary objects serialized to JSON.
 */
@Builder(toBuilder = true)
public record AuditEntry(
        String              tenantId,
        String              userId,
        String              userName,
        Role                userRole,
        AuditAction         action,
        String              resourceType,
        String              resourceId,
        String              resourceName,
        Map<String, Object> details,
        Object              previousState,
        Object              newState,
        AuditLog.Status     status,
        String              errorMessage
) {

    /** Entry acted by an authenticated principal in its own tenant. */
    public static AuditEntryBuilder by(Principal principal, AuditAction action) {
        return builder()
                .tenantId(principal.tenantId())
                .userId(principal.userId())
                .userName(principal.email())
                .userRole(principal.role())
                .action(action);
    }

    /** Entry acted by (or on behalf of) a stored user, e.g. during login. */
    public static AuditEntryBuilder by(User user, AuditAction action) {
        return builder()
                .tenantId(user.getTenantId())
                .userId(user.getUserId())
                .userName(user.displayName())
                .userRole(user.getRole())
                .action(action);
    }
}
