package com.openforge.posgate.monitor;

import com.openforge.posgate.audit.AuditLogResponse;
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

import java.time.Instant;
import java.util.List;

/**
 * Recent SYSTEM_ERROR entries, the persisted counterpart of the live ERROR
 * events on the monitor topics.
 *
 * Base path: /api/monitor
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/monitor")
public class MonitorController {

    private static final int MAX_LIMIT = 200;

    private final AuditLogRepository  auditLogRepository;
    private final AuthorizationEngine authorizationEngine;

    @GetMapping("/errors")
    public ApiResponse<List<AuditLogResponse>> errors(@AuthenticationPrincipal Principal principal,
                                                      @RequestParam(required = false) String tenantId,
                                                      @RequestParam(required = false) Instant since,
                                                      @RequestParam(defaultValue = "50") int limit) {

        AccessGrant grant = authorizationEngine.admit(principal, AccessPolicies.MONITOR, TenantRequest.path(tenantId));
        PageRequest page  = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_LIMIT)));
        Instant     from  = since == null ? Instant.EPOCH : since;

        List<AuditLog> rows = principal.isSuperAdmin() && (tenantId == null || tenantId.isBlank())
                ? auditLogRepository.findByActionAndCreatedAtGreaterThanEqualOrderByCreatedAtDescIdDesc(
                        AuditAction.SYSTEM_ERROR, from, page)
                : auditLogRepository.findByTenantIdAndActionAndCreatedAtGreaterThanEqualOrderByCreatedAtDescIdDesc(
                        grant.tenantId(), AuditAction.SYSTEM_ERROR, from, page);

        return ApiResponse.ok(rows.stream().map(AuditLogResponse::of).toList());
    }
}
