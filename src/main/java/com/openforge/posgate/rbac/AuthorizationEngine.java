package com.openforge.posgate.rbac;

import com.openforge.posgate.auth.TokenService;
import com.openforge.posgate.common.AuthorizationException;
import com.openforge.posgate.common.ErrorCode;
import com.openforge.posgate.domain.Permission;
import com.openforge.posgate.domain.Role;
import com.openforge.posgate.domain.StaffProfile;
import com.openforge.posgate.domain.User;
import com.openforge.posgate.repository.StaffProfileRepository;
import com.openforge.posgate.repository.UserRepository;
import com.openforge.posgate.tenant.TenantDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Per-request authorization: who is calling, which tenant they may touch,
 * and whether their role and permission flags cover the operation.
 *
 * Every decision reads the current user, tenant and staff rows. There is
 * no cache, so a suspension takes effect on the caller's next request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthorizationEngine {

    private static final String BEARER = "Bearer ";

    private final TokenService           tokenService;
    private final UserRepository         userRepository;
    private final StaffProfileRepository staffProfileRepository;
    private final TenantDirectory        tenantDirectory;

    // ── Authentication ───────────────────────────────────────────────────────

    /**
     * @throws AuthorizationException AUTH_REQUIRED, TOKEN_EXPIRED, TOKEN_INVALID,
     *                                USER_NOT_FOUND or ACCOUNT_INACTIVE
     */
    public Principal authenticate(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER)) {
            throw new AuthorizationException(ErrorCode.AUTH_REQUIRED);
        }
        TokenService.AccessTokenClaims claims =
                tokenService.verifyAccess(authorizationHeader.substring(BEARER.length()).trim());

        return reload(claims.userId());
    }

    /**
     * Rebuild a principal from the stored user, for long-lived channels that
     * authenticated once and must re-check on each later frame.
     *
     * @throws AuthorizationException USER_NOT_FOUND or ACCOUNT_INACTIVE
     */
    public Principal reload(String userId) {
        User user = userRepository.findByUserId(userId)
                .orElseThrow(() -> new AuthorizationException(ErrorCode.USER_NOT_FOUND));
        if (!user.isActive()) {
            throw new AuthorizationException(ErrorCode.ACCOUNT_INACTIVE, "Account is not active");
        }
        return Principal.of(user);
    }

    // ── Roles ────────────────────────────────────────────────────────────────

    public void requireRole(Principal principal, Set<Role> allowed) {
        if (!allowed.contains(principal.role())) {
            throw new AuthorizationException(ErrorCode.FORBIDDEN);
        }
    }

    public void requireAtLeast(Principal principal, Role minimum) {
        if (!principal.role().isAtLeast(minimum)) {
            throw new AuthorizationException(ErrorCode.FORBIDDEN);
        }
    }

    // ── Tenants ──────────────────────────────────────────────────────────────

    /**
     * Returns the tenant the caller acts in. Super admins may act in any tenant
     * (or "global" when none is named). Everyone else is pinned to their own
     * tenant, which must exist and be active.
     *
     * @throws AuthorizationException TENANT_FORBIDDEN, TENANT_NOT_FOUND or TENANT_INACTIVE
     */
    public String requireTenantAccess(Principal principal, String requestedTenantId) {
        boolean named = requestedTenantId != null && !requestedTenantId.isBlank();
        if (principal.isSuperAdmin()) {
            return named ? requestedTenantId : principal.tenantId();
        }
        if (named && !requestedTenantId.equals(principal.tenantId())) {
            throw new AuthorizationException(ErrorCode.TENANT_FORBIDDEN);
        }
        tenantDirectory.requireActive(principal.tenantId());
        return principal.tenantId();
    }

    /** The tenant a client-supplied id is rewritten to before it reaches storage. */
    public String scopeTenant(Principal principal, String clientTenantId) {
        if (principal.isSuperAdmin() && clientTenantId != null && !clientTenantId.isBlank()) {
            return clientTenantId;
        }
        return principal.tenantId();
    }

    // ── Permissions ──────────────────────────────────────────────────────────

    /**
     * Shop admins and super admins hold every permission. Staff need the flag
     * on an active staff profile.
     */
    public void requirePermission(Principal principal, Permission permission) {
        if (principal.role().isAtLeast(Role.SHOP_ADMIN)) {
            return;
        }
        boolean granted = staffProfileRepository.findByUserId(principal.userId())
                .filter(profile -> profile.getStatus() == User.Status.ACTIVE)
                .map(StaffProfile::getPermissions)
                .map(flags -> flags.allows(permission))
                .orElse(false);
        if (!granted) {
            throw new AuthorizationException(permission.getDeniedCode());
        }
    }

    // ── Combined ─────────────────────────────────────────────────────────────

    /**
     * Tenant, then role, then permission. The first failing check decides the error.
     */
    public AccessGrant admit(Principal principal, AccessPolicy policy, TenantRequest request) {
        AuthorizationStage stage = AuthorizationStage.TENANT_SCOPED;
        try {
            String requested = request.hasPath()
                    ? request.pathTenantId()
                    : scopeTenant(principal, request.bodyTenantId());
            String tenantId = requireTenantAccess(principal, requested);

            stage = AuthorizationStage.ROLE_CHECKED;
            requireAtLeast(principal, policy.minimumRole());

            stage = AuthorizationStage.PERMISSION_CHECKED;
            if (policy.permission() != null) {
                requirePermission(principal, policy.permission());
            }

            stage = AuthorizationStage.ADMITTED;
            log.debug("[Rbac] {} admitted userId={} tenant={}", policy.name(), principal.userId(), tenantId);
            return new AccessGrant(principal, tenantId, policy);
        } catch (AuthorizationException e) {
            log.info("[Rbac] {} denied userId={} at {}: {}",
                    policy.name(), principal.userId(), stage, e.getCode());
            throw e;
        }
    }
}
