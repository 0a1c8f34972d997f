package com.openforge.posgate.staff;

import com.openforge.posgate.audit.AuditEntry;
import com.openforge.posgate.audit.AuditRecorder;
import com.openforge.posgate.auth.dto.UserSummary;
import com.openforge.posgate.common.ApiException;
import com.openforge.posgate.common.AuthorizationException;
import com.openforge.posgate.common.ErrorCode;
import com.openforge.posgate.common.Ids;
import com.openforge.posgate.domain.AuditAction;
import com.openforge.posgate.domain.StaffPermissions;
import com.openforge.posgate.domain.StaffProfile;
import com.openforge.posgate.domain.User;
import com.openforge.posgate.rbac.AccessGrant;
import com.openforge.posgate.rbac.Principal;
import com.openforge.posgate.repository.StaffProfileRepository;
import com.openforge.posgate.repository.UserRepository;
import com.openforge.posgate.staff.dto.CreateStaffRequest;
import com.openforge.posgate.staff.dto.StaffCreatedResponse;
import com.openforge.posgate.staff.dto.StaffResponse;
import com.openforge.posgate.staff.dto.UpdateStaffRequest;
import com.openforge.posgate.tenant.TenantDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Staff accounts inside one tenant. Every method takes the {@link AccessGrant}
 * produced by the authorization engine and only ever touches
 * {@code grant.tenantId()}.
 *
 * Status changes are mirrored onto the linked {@link User}, which is what the
 * authorization engine checks on every request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaffService {

    private final StaffProfileRepository staffRepository;
    private final UserRepository         userRepository;
    private final TenantDirectory        tenantDirectory;
    private final PasswordEncoder        passwordEncoder;
    private final AuditRecorder          auditRecorder;

    // ── Queries ──────────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public List<StaffResponse> list(AccessGrant grant) {
        return staffRepository.findByTenantIdOrderByIdAsc(grant.tenantId())
                .stream()
                .map(StaffResponse::of)
                .toList();
    }

    @Transactional(readOnly = true)
    public StaffResponse get(AccessGrant grant, String staffId) {
        return StaffResponse.of(find(grant, staffId));
    }

    // ── Create ───────────────────────────────────────────────────────────────

    @Transactional
    public StaffCreatedResponse create(AccessGrant grant, CreateStaffRequest req) {
        String tenantId = grant.tenantId();
        if (User.GLOBAL_TENANT.equals(tenantId)) {
            throw new ApiException(ErrorCode.MISSING_TENANT, "tenantId is required");
        }
        tenantDirectory.require(tenantId);

        Principal actor    = grant.principal();
        String    email    = normalizeEmail(req.email());
        StaffProfile.Position position = parsePosition(req.position(), StaffProfile.Position.STAFF);

        AuditEntry.AuditEntryBuilder entry = AuditEntry.by(actor, AuditAction.STAFF_CREATE)
                .tenantId(tenantId)
                .resourceType("staff")
                .resourceName(req.name());

        return auditRecorder.attempt(entry, () -> {
            if (staffRepository.existsByTenantIdAndEmail(tenantId, email)
                    || userRepository.existsByTenantIdAndEmail(tenantId, email)) {
                throw new ApiException(ErrorCode.EMAIL_EXISTS);
            }

            boolean generated = req.password() == null || req.password().isBlank();
            String  password  = generated ? Ids.random(12) : req.password();

            User user = new User();
            user.setUserId(Ids.next("user"));
            user.setTenantId(tenantId);
            user.setEmail(email);
            user.setPasswordHash(passwordEncoder.encode(password));
            user.setRole(position.role());
            user.setStatus(User.Status.ACTIVE);
            user.setFirstName(req.name().trim());
            user.setCreatedBy(actor.userId());
            user = userRepository.saveAndFlush(user);

            StaffProfile profile = new StaffProfile();
            profile.setStaffId(Ids.next("staff"));
            profile.setTenantId(tenantId);
            profile.setUserId(user.getUserId());
            profile.setName(req.name().trim());
            profile.setEmail(email);
            profile.setPhone(req.phone());
            profile.setPosition(position);
            profile.setStatus(User.Status.ACTIVE);
            profile.setPermissions(req.permissions() == null
                    ? StaffPermissions.defaultsFor(position)
                    : req.permissions().copy());
            profile.setCreatedBy(actor.userId());
            profile.setCreatedByRole(actor.role());
            profile = staffRepository.saveAndFlush(profile);

            StaffResponse created = StaffResponse.of(profile);
            Map<String, Object> details = new HashMap<>();
            details.put("email", email);
            details.put("position", position.value());
            details.put("createdBy", actor.role().value());
            entry.resourceId(profile.getStaffId()).details(details).newState(created);

            log.info("[Staff] Created staffId={} tenant={} position={}",
                    profile.getStaffId(), tenantId, position.value());
            return new StaffCreatedResponse(created, UserSummary.of(user), generated ? password : null);
        });
    }

    // ── Update ───────────────────────────────────────────────────────────────

    @Transactional
    public StaffResponse update(AccessGrant grant, String staffId, UpdateStaffRequest req) {
        StaffProfile profile = find(grant, staffId);
        StaffResponse before = StaffResponse.of(profile);

        AuditEntry.AuditEntryBuilder entry = auditEntry(grant, AuditAction.STAFF_UPDATE, profile)
                .previousState(before);

        return auditRecorder.attempt(entry, () -> {
            User user = lockUser(profile);

            if (req.position() != null) {
                StaffProfile.Position position = parsePosition(req.position(), profile.getPosition());
                if (position != profile.getPosition()) {
                    requireSuperAdminForShopAdmin(grant, profile);
                    profile.setPosition(position);
                    user.setRole(position.role());
                }
            }
            if (req.email() != null) {
                String email = normalizeEmail(req.email());
                if (!email.equals(profile.getEmail())) {
                    if (staffRepository.existsByTenantIdAndEmail(profile.getTenantId(), email)
                            || userRepository.existsByTenantIdAndEmail(profile.getTenantId(), email)) {
                        throw new ApiException(ErrorCode.EMAIL_EXISTS);
                    }
                    profile.setEmail(email);
                    user.setEmail(email);
                }
            }
            if (req.name() != null) {
                profile.setName(req.name().trim());
                user.setFirstName(req.name().trim());
            }
            if (req.phone() != null) {
                profile.setPhone(req.phone());
            }
            if (req.permissions() != null) {
                profile.setPermissions(req.permissions().copy());
            }

            userRepository.save(user);
            StaffResponse after = StaffResponse.of(staffRepository.save(profile));
            entry.newState(after);
            log.info("[Staff] Updated staffId={} tenant={}", staffId, profile.getTenantId());
            return after;
        });
    }

    // ── Status transitions ───────────────────────────────────────────────────

    /** Takes effect on the member's next request; their refresh tokens are dropped. */
    @Transactional
    public StaffResponse suspend(AccessGrant grant, String staffId) {
        return transition(grant, staffId, User.Status.SUSPENDED, AuditAction.STAFF_SUSPEND);
    }

    @Transactional
    public StaffResponse activate(AccessGrant grant, String staffId) {
        return transition(grant, staffId, User.Status.ACTIVE, AuditAction.USER_ACTIVATE);
    }

    /** Soft delete: the profile and user stay, both marked inactive. */
    @Transactional
    public StaffResponse delete(AccessGrant grant, String staffId) {
        return transition(grant, staffId, User.Status.INACTIVE, AuditAction.STAFF_DELETE);
    }

    // ── Private ───────────────────────────────────────────────────────────────

    private StaffResponse transition(AccessGrant grant, String staffId, User.Status target, AuditAction action) {
        StaffProfile profile = find(grant, staffId);
        StaffResponse before = StaffResponse.of(profile);

        AuditEntry.AuditEntryBuilder entry = auditEntry(grant, action, profile)
                .previousState(before)
                .details(Map.of("from", before.status().value(), "to", target.value()));

        return auditRecorder.attempt(entry, () -> {
            if (target != User.Status.ACTIVE) {
                if (profile.getUserId().equals(grant.principal().userId())) {
                    throw new AuthorizationException(ErrorCode.FORBIDDEN, "Cannot change the status of your own account");
                }
                requireSuperAdminForShopAdmin(grant, profile);
            }

            User user = lockUser(profile);
            profile.setStatus(target);
            user.setStatus(target);
            if (target != User.Status.ACTIVE) {
                user.getRefreshTokens().clear();
            }
            userRepository.save(user);

            StaffResponse after = StaffResponse.of(staffRepository.save(profile));
            entry.newState(after);
            log.info("[Staff] staffId={} tenant={} {} -> {}",
                    staffId, profile.getTenantId(), before.status().value(), target.value());
            return after;
        });
    }

    private StaffProfile find(AccessGrant grant, String staffId) {
        return staffRepository.findByTenantIdAndStaffId(grant.tenantId(), staffId)
                .orElseThrow(() -> new ApiException(ErrorCode.STAFF_NOT_FOUND));
    }

    private User lockUser(StaffProfile profile) {
        return userRepository.lockByUserId(profile.getUserId())
                .orElseThrow(() -> new ApiException(ErrorCode.STAFF_NOT_FOUND,
                        "Staff account has no user record"));
    }

    private static void requireSuperAdminForShopAdmin(AccessGrant grant, StaffProfile profile) {
        if (profile.getPosition() == StaffProfile.Position.SHOP_ADMIN && !grant.principal().isSuperAdmin()) {
            throw new AuthorizationException(ErrorCode.FORBIDDEN, "Only super admin can modify a shop admin");
        }
    }

    private static AuditEntry.AuditEntryBuilder auditEntry(AccessGrant grant, AuditAction action, StaffProfile profile) {
        return AuditEntry.by(grant.principal(), action)
                .tenantId(grant.tenantId())
                .resourceType("staff")
                .resourceId(profile.getStaffId())
                .resourceName(profile.getName());
    }

    static StaffProfile.Position parsePosition(String value, StaffProfile.Position fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        if ("super_admin".equalsIgnoreCase(value.trim())) {
            throw new ApiException(ErrorCode.INVALID_ROLE, "Cannot assign super_admin role");
        }
        try {
            return StaffProfile.Position.of(value);
        } catch (IllegalArgumentException e) {
            throw new ApiException(ErrorCode.INVALID_ROLE, "Unknown position: " + value);
        }
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
