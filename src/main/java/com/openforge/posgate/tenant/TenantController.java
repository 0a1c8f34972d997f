package com.openforge.posgate.tenant;

import com.openforge.posgate.audit.AuditEntry;
import com.openforge.posgate.audit.AuditRecorder;
import com.openforge.posgate.common.ApiResponse;
import com.openforge.posgate.domain.AuditAction;
import com.openforge.posgate.domain.Tenant;
import com.openforge.posgate.domain.User;
import com.openforge.posgate.rbac.AccessGrant;
import com.openforge.posgate.rbac.AccessPolicies;
import com.openforge.posgate.rbac.AuthorizationEngine;
import com.openforge.posgate.rbac.Principal;
import com.openforge.posgate.rbac.TenantRequest;
import com.openforge.posgate.tenant.dto.TenantResponse;
import com.openforge.posgate.tenant.dto.TenantStatusRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Base path: /api/tenants
 *
 * Tenant creation lives on /api/auth/tenants because it also provisions the shop admin.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/tenants")
public class TenantController {

    private final TenantDirectory     tenantDirectory;
    private final AuthorizationEngine authorizationEngine;
    private final AuditRecorder       auditRecorder;

    @GetMapping("/{tenantId}")
    public ApiResponse<TenantResponse> get(@AuthenticationPrincipal Principal principal,
                                           @PathVariable String tenantId) {
        AccessGrant grant = authorizationEngine.admit(principal, AccessPolicies.TENANT_READ, TenantRequest.path(tenantId));
        return ApiResponse.ok(TenantResponse.of(tenantDirectory.require(grant.tenantId())));
    }

    /** SUSPENDED is recorded as TENANT_SUSPEND, every other target as TENANT_UPDATE. */
    @PutMapping("/{tenantId}/status")
    public ApiResponse<TenantResponse> changeStatus(@AuthenticationPrincipal Principal principal,
                                                    @PathVariable String tenantId,
                                                    @Valid @RequestBody TenantStatusRequest req) {
        authorizationEngine.admit(principal, AccessPolicies.TENANT_STATUS, TenantRequest.path(tenantId));

        AuditAction action = req.status() == Tenant.Status.SUSPENDED
                ? AuditAction.TENANT_SUSPEND
                : AuditAction.TENANT_UPDATE;
        AuditEntry.AuditEntryBuilder entry = AuditEntry.by(principal, action)
                .tenantId(User.GLOBAL_TENANT)
                .resourceType("tenant")
                .resourceId(tenantId);

        return auditRecorder.attempt(entry, () -> {
            Tenant tenant = tenantDirectory.require(tenantId);
            Tenant.Status previous = tenantDirectory.changeStatus(tenant, req.status());
            entry.resourceName(tenant.getName())
                 .details(Map.of("from", previous.value(), "to", req.status().value()));
            return ApiResponse.ok(TenantResponse.of(tenant));
        });
    }
}
