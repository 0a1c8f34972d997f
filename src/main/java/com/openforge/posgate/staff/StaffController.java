package com.openforge.posgate.staff;

import com.openforge.posgate.common.ApiResponse;
import com.openforge.posgate.rbac.AccessGrant;
import com.openforge.posgate.rbac.AccessPolicies;
import com.openforge.posgate.rbac.AuthorizationEngine;
import com.openforge.posgate.rbac.Principal;
import com.openforge.posgate.rbac.TenantRequest;
import com.openforge.posgate.staff.dto.CreateStaffRequest;
import com.openforge.posgate.staff.dto.StaffCreatedResponse;
import com.openforge.posgate.staff.dto.StaffResponse;
import com.openforge.posgate.staff.dto.UpdateStaffRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Staff management for shop admins and above.
 *
 * Super admins name the tenant with {@code ?tenantId=} (or the body on create);
 * everyone else is pinned to their own tenant.
 *
 * Base path: /api/staff
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/staff")
public class StaffController {

    private final StaffService        staffService;
    private final AuthorizationEngine authorizationEngine;

    // ── Collection ───────────────────────────────────────────────────────────

    @GetMapping
    public ApiResponse<List<StaffResponse>> list(@AuthenticationPrincipal Principal principal,
                                                 @RequestParam(required = false) String tenantId) {
        return ApiResponse.ok(staffService.list(admit(principal, TenantRequest.path(tenantId))));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<StaffCreatedResponse>> create(
            @AuthenticationPrincipal Principal principal,
            @Valid @RequestBody CreateStaffRequest req) {

        AccessGrant grant = admit(principal, TenantRequest.body(req.tenantId()));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(staffService.create(grant, req)));
    }

    // ── Single member ────────────────────────────────────────────────────────

    @GetMapping("/{staffId}")
    public ApiResponse<StaffResponse> get(@AuthenticationPrincipal Principal principal,
                                          @PathVariable String staffId,
                                          @RequestParam(required = false) String tenantId) {
        return ApiResponse.ok(staffService.get(admit(principal, TenantRequest.path(tenantId)), staffId));
    }

    @PutMapping("/{staffId}")
    public ApiResponse<StaffResponse> update(@AuthenticationPrincipal Principal principal,
                                             @PathVariable String staffId,
                                             @RequestParam(required = false) String tenantId,
                                             @Valid @RequestBody UpdateStaffRequest req) {
        return ApiResponse.ok(staffService.update(admit(principal, TenantRequest.path(tenantId)), staffId, req));
    }

    @DeleteMapping("/{staffId}")
    public ApiResponse<StaffResponse> delete(@AuthenticationPrincipal Principal principal,
                                             @PathVariable String staffId,
                                             @RequestParam(required = false) String tenantId) {
        return ApiResponse.ok(staffService.delete(admit(principal, TenantRequest.path(tenantId)), staffId),
                "Staff member deactivated");
    }

    @PostMapping("/{staffId}/suspend")
    public ApiResponse<StaffResponse> suspend(@AuthenticationPrincipal Principal principal,
                                              @PathVariable String staffId,
                                              @RequestParam(required = false) String tenantId) {
        return ApiResponse.ok(staffService.suspend(admit(principal, TenantRequest.path(tenantId)), staffId));
    }

    @PostMapping("/{staffId}/activate")
    public ApiResponse<StaffResponse> activate(@AuthenticationPrincipal Principal principal,
                                               @PathVariable String staffId,
                                               @RequestParam(required = false) String tenantId) {
        return ApiResponse.ok(staffService.activate(admit(principal, TenantRequest.path(tenantId)), staffId));
    }

    private AccessGrant admit(Principal principal, TenantRequest tenant) {
        return authorizationEngine.admit(principal, AccessPolicies.STAFF_MANAGE, tenant);
    }
}
