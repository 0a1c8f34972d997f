package com.openforge.posgate.auth;

import com.openforge.posgate.audit.AuditEntry;
import com.openforge.posgate.audit.AuditRecorder;
import com.openforge.posgate.auth.dto.AuthResponse;
import com.openforge.posgate.auth.dto.CreateTenantRequest;
import com.openforge.posgate.auth.dto.LoginRequest;
import com.openforge.posgate.auth.dto.MeResponse;
import com.openforge.posgate.auth.dto.SetupRequest;
import com.openforge.posgate.auth.dto.TenantCreatedResponse;
import com.openforge.posgate.auth.dto.UserSummary;
import com.openforge.posgate.common.ApiException;
import com.openforge.posgate.common.AuthorizationException;
import com.openforge.posgate.common.ErrorCode;
import com.openforge.posgate.common.Ids;
import com.openforge.posgate.domain.AuditAction;
import com.openforge.posgate.domain.AuditLog;
import com.openforge.posgate.domain.RefreshTokenRecord;
import com.openforge.posgate.domain.Role;
import com.openforge.posgate.domain.Tenant;
import com.openforge.posgate.domain.User;
import com.openforge.posgate.rbac.Principal;
import com.openforge.posgate.repository.TenantRepository;
import com.openforge.posgate.repository.UserRepository;
import com.openforge.posgate.tenant.TenantDirectory;
import com.openforge.posgate.tenant.dto.TenantResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Login, refresh-token rotation, logout and account provisioning.
 *
 * Every refresh-token mutation happens on a user row loaded with
 * {@link UserRepository#lockByUserId}, so concurrent rotations of the same
 * token are serialized and exactly one of them succeeds.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    static final String SYSTEM_ACTOR = "system";

    private final UserRepository   userRepository;
    private final TenantRepository tenantRepository;
    private final TenantDirectory  tenantDirectory;
    private final PasswordEncoder  passwordEncoder;
    private final TokenService     tokenService;
    private final SessionRegistry  sessionRegistry;
    private final AuditRecorder    auditRecorder;
    private final Clock            clock;

    private volatile String dummyHash;

    // ── Login ────────────────────────────────────────────────────────────────

    @Transactional
    public AuthResponse login(LoginRequest req, String clientIp) {
        String email = normalizeEmail(req.email());

        List<UserRepository.Credentials> candidates = userRepository.findCredentialsByEmailOrderByIdAsc(email).stream()
                .filter(c -> req.tenantId() == null || req.tenantId().isBlank()
                        || req.tenantId().equals(c.getTenantId()))
                .toList();

        if (candidates.isEmpty()) {
            // Same hashing cost as a wrong password, so response time does not reveal the email.
            passwordEncoder.matches(req.password(), dummyHash());
            auditRecorder.record(AuditEntry.builder()
                    .tenantId(req.tenantId() == null || req.tenantId().isBlank() ? User.GLOBAL_TENANT : req.tenantId())
                    .userName(email)
                    .action(AuditAction.LOGIN_FAILED)
                    .details(Map.of("email", email, "reason", "unknown email", "ip", ip(clientIp)))
                    .status(AuditLog.Status.FAILURE)
                    .errorMessage(ErrorCode.INVALID_CREDENTIALS.getDefaultMessage())
                    .build());
            log.info("[Auth] Login failed: unknown email from ip={}", clientIp);
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        Optional<UserRepository.Credentials> matched = candidates.stream()
                .filter(c -> passwordEncoder.matches(req.password(), c.getPasswordHash()))
                .findFirst();
        if (matched.isEmpty()) {
            UserRepository.Credentials first = candidates.get(0);
            auditRecorder.record(AuditEntry.builder()
                    .tenantId(first.getTenantId())
                    .userId(first.getUserId())
                    .userName(email)
                    .userRole(first.getRole())
                    .action(AuditAction.LOGIN_FAILED)
                    .details(Map.of("reason", "wrong password", "ip", ip(clientIp)))
                    .status(AuditLog.Status.FAILURE)
                    .errorMessage(ErrorCode.INVALID_CREDENTIALS.getDefaultMessage())
                    .build());
            log.info("[Auth] Login failed: wrong password for userId={}", first.getUserId());
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        // First entity load of this row in the transaction, so concurrent logins see each other's sessions.
        User locked = lock(matched.get().getUserId());
        if (!locked.isActive()) {
            recordLoginFailure(locked, "account " + locked.getStatus().value(), clientIp, "Account is not active");
            throw new AuthorizationException(ErrorCode.ACCOUNT_INACTIVE, "Account is not active");
        }
        if (locked.getRole() != Role.SUPER_ADMIN) {
            try {
                tenantDirectory.requireActive(locked.getTenantId());
            } catch (AuthorizationException e) {
                recordLoginFailure(locked, "tenant not active", clientIp, e.getMessage());
                throw new AuthorizationException(ErrorCode.TENANT_INACTIVE, "Tenant account is not active");
            }
        }

        TokenService.TokenPair pair = tokenService.issue(locked);
        sessionRegistry.register(locked, pair);
        locked.setLastLoginAt(clock.instant());
        userRepository.save(locked);

        auditRecorder.record(AuditEntry.by(locked, AuditAction.LOGIN)
                .details(Map.of("ip", ip(clientIp)))
                .status(AuditLog.Status.SUCCESS)
                .build());
        log.info("[Auth] Login userId={} tenant={} sessions={}",
                locked.getUserId(), locked.getTenantId(), locked.getRefreshTokens().size());

        return AuthResponse.of(UserSummary.of(locked), pair);
    }

    // ── Refresh ──────────────────────────────────────────────────────────────

    /**
     * Single-use rotation: the presented token is consumed and a new pair is
     * issued from the user as stored now. A token that verifies but is no
     * longer registered is treated as replayed.
     */
    @Transactional
    public AuthResponse refresh(String refreshToken, String clientIp) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new ApiException(ErrorCode.REFRESH_TOKEN_REQUIRED);
        }
        TokenService.RefreshTokenClaims claims = tokenService.verifyRefresh(refreshToken);

        User user = userRepository.lockByUserId(claims.userId())
                .orElseThrow(() -> new AuthorizationException(ErrorCode.USER_NOT_FOUND));

        Optional<RefreshTokenRecord> record = sessionRegistry.find(user, refreshToken);
        if (record.isEmpty()) {
            auditRecorder.record(AuditEntry.by(user, AuditAction.TOKEN_REVOKED)
                    .details(Map.of("reason", "refresh token not registered", "ip", ip(clientIp)))
                    .status(AuditLog.Status.FAILURE)
                    .errorMessage("Invalid refresh token")
                    .build());
            log.warn("[Auth] Unregistered refresh token presented for userId={}", user.getUserId());
            throw new AuthorizationException(ErrorCode.TOKEN_INVALID, "Invalid refresh token");
        }
        if (record.get().isExpiredAt(clock.instant())) {
            throw new AuthorizationException(ErrorCode.TOKEN_EXPIRED, "Refresh token expired");
        }
        if (!user.isActive()) {
            throw new AuthorizationException(ErrorCode.ACCOUNT_INACTIVE, "Account is not active");
        }
        if (user.getRole() != Role.SUPER_ADMIN) {
            Tenant tenant = tenantDirectory.find(user.getTenantId()).orElse(null);
            if (tenant == null || !tenant.isActive()) {
                throw new AuthorizationException(ErrorCode.TENANT_INACTIVE, "Tenant account is not active");
            }
        }

        sessionRegistry.consume(user, refreshToken);
        TokenService.TokenPair pair = tokenService.issue(user);
        sessionRegistry.register(user, pair);
        userRepository.save(user);

        auditRecorder.record(AuditEntry.by(user, AuditAction.TOKEN_REFRESH)
                .details(Map.of("ip", ip(clientIp)))
                .status(AuditLog.Status.SUCCESS)
                .build());
        log.debug("[Auth] Rotated refresh token for userId={}", user.getUserId());

        return AuthResponse.of(UserSummary.of(user), pair);
    }

    // ── Logout ───────────────────────────────────────────────────────────────

    /**
     * Revokes at most the one presented session. An absent or unknown token
     * still succeeds and leaves the other sessions alone.
     */
    @Transactional
    public void logout(Principal principal, String refreshToken) {
        boolean revoked = false;
        Optional<User> user = userRepository.lockByUserId(principal.userId());
        if (user.isPresent() && sessionRegistry.revoke(user.get(), refreshToken)) {
            userRepository.save(user.get());
            revoked = true;
        }
        auditRecorder.record(AuditEntry.by(principal, AuditAction.LOGOUT)
                .details(Map.of("sessionRevoked", revoked))
                .status(AuditLog.Status.SUCCESS)
                .build());
        log.info("[Auth] Logout userId={} sessionRevoked={}", principal.userId(), revoked);
    }

    // ── Me ───────────────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public MeResponse me(Principal principal) {
        User user = userRepository.findByUserId(principal.userId())
                .orElseThrow(() -> new AuthorizationException(ErrorCode.USER_NOT_FOUND));
        TenantResponse tenant = principal.isSuperAdmin()
                ? null
                : tenantDirectory.find(user.getTenantId()).map(TenantResponse::of).orElse(null);
        return new MeResponse(UserSummary.of(user), tenant);
    }

    // ── Provisioning ─────────────────────────────────────────────────────────

    public boolean isSetupComplete() {
        return userRepository.existsByRole(Role.SUPER_ADMIN);
    }

    /** One-time public setup. Refused with ALREADY_SETUP once a super admin exists. */
    @Transactional
    public UserSummary setup(SetupRequest req) {
        if (isSetupComplete()) {
            throw new ApiException(ErrorCode.ALREADY_SETUP);
        }
        return createSuperAdmin(req);
    }

    @Transactional
    public UserSummary createSuperAdmin(SetupRequest req) {
        if (isSetupComplete()) {
            throw new ApiException(ErrorCode.SUPER_ADMIN_EXISTS);
        }
        User user = new User();
        user.setUserId(Ids.next("user"));
        user.setTenantId(User.GLOBAL_TENANT);
        user.setEmail(normalizeEmail(req.email()));
        user.setPasswordHash(passwordEncoder.encode(req.password()));
        user.setRole(Role.SUPER_ADMIN);
        user.setStatus(User.Status.ACTIVE);
        user.setFirstName(req.firstName());
        user.setLastName(req.lastName());
        user.setCreatedBy(SYSTEM_ACTOR);
        User saved = userRepository.saveAndFlush(user);

        auditRecorder.record(AuditEntry.by(saved, AuditAction.USER_CREATE)
                .resourceType("user")
                .resourceId(saved.getUserId())
                .resourceName(saved.getEmail())
                .details(Map.of("role", Role.SUPER_ADMIN.value(), "email", saved.getEmail()))
                .status(AuditLog.Status.SUCCESS)
                .build());
        log.info("[Auth] Super admin created: userId={}", saved.getUserId());
        return UserSummary.of(saved);
    }

    /**
     * Creates an active tenant and its first shop admin in one transaction.
     * Writes TENANT_CREATE (global tenant, actor = the super admin) and
     * USER_CREATE (the new tenant, actor = the new shop admin).
     */
    @Transactional
    public TenantCreatedResponse createTenantAndShopAdmin(Principal creator, CreateTenantRequest req) {
        if (!creator.isSuperAdmin()) {
            throw new AuthorizationException(ErrorCode.FORBIDDEN, "Only super admin can create tenants");
        }
        Tenant.Plan plan = req.plan() == null ? Tenant.Plan.FREE : req.plan();
        String adminEmail = normalizeEmail(req.shopAdminEmail());
        String adminName  = req.shopAdminName() == null || req.shopAdminName().isBlank()
                ? adminEmail.substring(0, Math.max(adminEmail.indexOf('@'), 0))
                : req.shopAdminName().trim();

        Map<String, Object> details = new HashMap<>();
        details.put("plan", plan.value());
        details.put("shopAdminEmail", adminEmail);

        AuditEntry.AuditEntryBuilder entry = AuditEntry.by(creator, AuditAction.TENANT_CREATE)
                .tenantId(User.GLOBAL_TENANT)
                .resourceType("tenant")
                .resourceName(req.tenantName())
                .details(details);

        return auditRecorder.attempt(entry, () -> {
            Tenant tenant = new Tenant();
            tenant.setTenantId(tenantDirectory.generateTenantId(req.tenantName()));
            tenant.setName(req.tenantName().trim());
            tenant.setStatus(Tenant.Status.ACTIVE);
            tenant.setPlan(plan);
            tenant = tenantRepository.saveAndFlush(tenant);
            entry.resourceId(tenant.getTenantId());

            User shopAdmin = new User();
            shopAdmin.setUserId(Ids.next("user"));
            shopAdmin.setTenantId(tenant.getTenantId());
            shopAdmin.setEmail(adminEmail);
            shopAdmin.setPasswordHash(passwordEncoder.encode(req.shopAdminPassword()));
            shopAdmin.setRole(Role.SHOP_ADMIN);
            shopAdmin.setStatus(User.Status.ACTIVE);
            shopAdmin.setFirstName(adminName);
            shopAdmin.setCreatedBy(creator.userId());
            shopAdmin = userRepository.saveAndFlush(shopAdmin);

            auditRecorder.record(AuditEntry.by(shopAdmin, AuditAction.USER_CREATE)
                    .resourceType("user")
                    .resourceId(shopAdmin.getUserId())
                    .resourceName(adminEmail)
                    .details(Map.of("email", adminEmail, "createdBy", Role.SUPER_ADMIN.value()))
                    .status(AuditLog.Status.SUCCESS)
                    .build());
            log.info("[Auth] Tenant {} created with shop admin userId={}",
                    tenant.getTenantId(), shopAdmin.getUserId());

            return new TenantCreatedResponse(TenantResponse.of(tenant), UserSummary.of(shopAdmin));
        });
    }

    // ── Private ───────────────────────────────────────────────────────────────

    private User lock(String userId) {
        return userRepository.lockByUserId(userId)
                .orElseThrow(() -> new AuthorizationException(ErrorCode.USER_NOT_FOUND));
    }

    private void recordLoginFailure(User user, String reason, String clientIp, String message) {
        auditRecorder.record(AuditEntry.by(user, AuditAction.LOGIN_FAILED)
                .details(Map.of("reason", reason, "ip", ip(clientIp)))
                .status(AuditLog.Status.FAILURE)
                .errorMessage(message)
                .build());
    }

    private String dummyHash() {
        String hash = dummyHash;
        if (hash == null) {
            hash = passwordEncoder.encode(Ids.random(24));
            dummyHash = hash;
        }
        return hash;
    }

    private static String ip(String clientIp) {
        return clientIp == null ? "unknown" : clientIp;
    }

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
