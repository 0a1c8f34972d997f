package com.openforge.posgate.audit;

import com.openforge.posgate.common.ApiResponse;
import com.openforge.posgate.domain.AuditAction;
import com.openforge.posgate.domain.AuditLog;
import com.openforge.posgate.rbac.AccessGrant;
import com.openforge.posgate.rbac.AccessPolicies;
import com.openforge.posgate.rbac.AuthorizationEngine;
import com.openforge.posgate.rbac.Principal;
import com.openforge.posgate.rbac.TenantRequest;
import com.openforge.posgate.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of the audit trail, newest first.
 *
 * Shop admins see their own tenant. Super admins see one tenant when they
 * pass {@code tenantId}, otherwise every tenant.
 *
 * Base path: /api/audit-logs
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/audit-logs")
public class AuditController {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT     = 200;

    private final AuditLogRepository  auditLogRepository;
    private final AuthorizationEngine authorizationEngine;

    // ── Query ────────────────────────────────────────────────────────────────

    @GetMapping
    public ApiResponse<List<AuditLogResponse>> list(@AuthenticationPrincipal Principal principal,
                                                    @RequestParam(required = false) String tenantId,
                                                    @RequestParam(required = false) AuditAction action,
                                                    @RequestParam(defaultValue = "" + DEFAULT_LIMIT) int limit) {

        AccessGrant grant = authorizationEngine.admit(principal, AccessPolicies.AUDIT_READ, TenantRequest.path(tenantId));
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_LIMIT)));

        boolean allTenants = principal.isSuperAdmin() && (tenantId == null || tenantId.isBlank());
        List<AuditLog> rows;
        if (allTenants) {
            rows = action == null
                    ? auditLogRepository.findByOrderByCreatedAtDescIdDesc(page)
                    : auditLogRepository.findByActionOrderByCreatedAtDescIdDesc(action, page);
        } else {
            rows = action == null
                    ? auditLogRepository.findByTenantIdOrderByCreatedAtDescIdDesc(grant.tenantId(), page)
                    : auditLogRepository.findByTenantIdAndActionOrderByCreatedAtDescIdDesc(grant.tenantId(), action, page);
        }
        return ApiResponse.ok(rows.stream().map(AuditLogResponse::of).toList());
    }
}
