package com.openforge.posgate.staff;

import com.openforge.posgate.Fixtures;
import com.openforge.posgate.audit.AuditEntry;
import com.openforge.posgate.audit.AuditRecorder;
import com.openforge.posgate.common.ErrorCode;
import com.openforge.posgate.domain.AuditAction;
import com.openforge.posgate.domain.RefreshTokenRecord;
import com.openforge.posgate.domain.Role;
import com.openforge.posgate.domain.StaffPermissions;
import com.openforge.posgate.domain.StaffProfile;
import com.openforge.posgate.domain.User;
import com.openforge.posgate.rbac.AccessGrant;
import com.openforge.posgate.rbac.AccessPolicies;
import com.openforge.posgate.rbac.Principal;
import com.openforge.posgate.repository.StaffProfileRepository;
import com.openforge.posgate.repository.UserRepository;
import com.openforge.posgate.staff.dto.CreateStaffRequest;
import com.openforge.posgate.staff.dto.StaffCreatedResponse;
import com.openforge.posgate.staff.dto.StaffResponse;
import com.openforge.posgate.staff.dto.UpdateStaffRequest;
import com.openforge.posgate.tenant.TenantDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StaffService")
class StaffServiceTest {

    @Mock private StaffProfileRepository staffRepository;
    @Mock private UserRepository         userRepository;
    @Mock private TenantDirectory        tenantDirectory;
    @Mock private AuditRecorder          auditRecorder;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);

    private StaffService service;

    private final Principal superAdmin = new Principal("user_root", User.GLOBAL_TENANT, "root@example.com", Role.SUPER_ADMIN);
    private final Principal shopAdmin  = new Principal("user_admin", Fixtures.TENANT_A, "admin@example.com", Role.SHOP_ADMIN);

    private final AccessGrant adminGrant = new AccessGrant(shopAdmin, Fixtures.TENANT_A, AccessPolicies.STAFF_MANAGE);
    private final AccessGrant rootGrant  = new AccessGrant(superAdmin, Fixtures.TENANT_A, AccessPolicies.STAFF_MANAGE);

    @BeforeEach
    void setUp() {
        service = new StaffService(staffRepository, userRepository, tenantDirectory, passwordEncoder, auditRecorder);

        lenient().when(auditRecorder.attempt(any(), any()))
                .thenAnswer(inv -> ((Supplier<?>) inv.getArgument(1)).get());
        lenient().when(userRepository.saveAndFlush(any(User.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(userRepository.save(any(User.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(staffRepository.saveAndFlush(any(StaffProfile.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(staffRepository.save(any(StaffProfile.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    /** A stored staff member with its linked user, both reachable through the mocks. */
    private User existing(String staffId, String userId, StaffProfile.Position position) {
        User user = Fixtures.user(userId, Fixtures.TENANT_A, position.role());
        user.getRefreshTokens().add(new RefreshTokenRecord("rt", Instant.EPOCH, Instant.EPOCH.plusSeconds(60)));

        StaffProfile profile = new StaffProfile();
        profile.setStaffId(staffId);
        profile.setTenantId(Fixtures.TENANT_A);
        profile.setUserId(userId);
        profile.setName("Sam");
        profile.setEmail(user.getEmail());
        profile.setPosition(position);
        profile.setStatus(User.Status.ACTIVE);
        profile.setPermissions(StaffPermissions.defaultsFor(position));

        lenient().when(staffRepository.findByTenantIdAndStaffId(Fixtures.TENANT_A, staffId)).thenReturn(Optional.of(profile));
        lenient().when(userRepository.lockByUserId(userId)).thenReturn(Optional.of(user));
        return user;
    }

    private static CreateStaffRequest createRequest(String position, String password) {
        return new CreateStaffRequest("Sam Cashier", "Sam@Shop.com", null, position, password, null, null);
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("generates and returns a temporary password when none is given")
        void temporaryPassword() {
            StaffCreatedResponse created = service.create(adminGrant, createRequest("cashier", null));

            assertThat(created.temporaryPassword()).hasSize(12);
            assertThat(created.staff().position()).isEqualTo(StaffProfile.Position.CASHIER);
            assertThat(created.staff().tenantId()).isEqualTo(Fixtures.TENANT_A);
            assertThat(created.staff().createdByRole()).isEqualTo(Role.SHOP_ADMIN);
            assertThat(created.staff().permissions().isCanManageSales()).isTrue();
            assertThat(created.staff().permissions().isCanRefund()).isFalse();
            assertThat(created.user().role()).isEqualTo(Role.STAFF);
            assertThat(created.user().email()).isEqualTo("sam@shop.com");

            ArgumentCaptor<User> user = ArgumentCaptor.forClass(User.class);
            verify(userRepository).saveAndFlush(user.capture());
            assertThat(passwordEncoder.matches(created.temporaryPassword(), user.getValue().getPasswordHash())).isTrue();
        }

        @Test
        @DisplayName("a supplied password is never echoed back")
        void suppliedPassword() {
            StaffCreatedResponse created = service.create(adminGrant, createRequest("manager", "password123"));

            assertThat(created.temporaryPassword()).isNull();
            assertThat(created.staff().permissions().isCanRefund()).isTrue();
        }

        @Test
        @DisplayName("audits STAFF_CREATE in the grant's tenant")
        void audited() {
            service.create(adminGrant, createRequest(null, null));

            ArgumentCaptor<AuditEntry.AuditEntryBuilder> builder = ArgumentCaptor.forClass(AuditEntry.AuditEntryBuilder.class);
            verify(auditRecorder).attempt(builder.capture(), any());
            AuditEntry entry = builder.getValue().build();
            assertThat(entry.action()).isEqualTo(AuditAction.STAFF_CREATE);
            assertThat(entry.tenantId()).isEqualTo(Fixtures.TENANT_A);
            assertThat(entry.resourceId()).startsWith("staff_");
            assertThat(entry.newState()).isInstanceOf(StaffResponse.class);
        }

        @Test
        @DisplayName("duplicate email in the tenant is EMAIL_EXISTS")
        void duplicateEmail() {
            when(staffRepository.existsByTenantIdAndEmail(Fixtures.TENANT_A, "sam@shop.com")).thenReturn(true);

            assertThatThrownBy(() -> service.create(adminGrant, createRequest("cashier", null)))
                    .extracting("code").isEqualTo(ErrorCode.EMAIL_EXISTS);
            verify(userRepository, never()).saveAndFlush(any(User.class));
        }

        @Test
        @DisplayName("super_admin and unknown positions are INVALID_ROLE")
        void invalidPosition() {
            assertThatThrownBy(() -> service.create(adminGrant, createRequest("super_admin", null)))
                    .extracting("code").isEqualTo(ErrorCode.INVALID_ROLE);
            assertThatThrownBy(() -> service.create(adminGrant, createRequest("janitor", null)))
                    .extracting("code").isEqualTo(ErrorCode.INVALID_ROLE);
        }

        @Test
        @DisplayName("global tenant is MISSING_TENANT")
        void globalTenant() {
            AccessGrant global = new AccessGrant(superAdmin, User.GLOBAL_TENANT, AccessPolicies.STAFF_MANAGE);

            assertThatThrownBy(() -> service.create(global, createRequest("cashier", null)))
                    .extracting("code").isEqualTo(ErrorCode.MISSING_TENANT);
        }
    }

    @Nested
    @DisplayName("status transitions")
    class Transitions {

        @Test
        @DisplayName("suspend marks profile and user and drops refresh tokens")
        void suspend() {
            User user = existing("staff_1", "user_cash", StaffProfile.Position.CASHIER);

            StaffResponse response = service.suspend(adminGrant, "staff_1");

            assertThat(response.status()).isEqualTo(User.Status.SUSPENDED);
            assertThat(user.getStatus()).isEqualTo(User.Status.SUSPENDED);
            assertThat(user.getRefreshTokens()).isEmpty();
        }

        @Test
        @DisplayName("activate restores both statuses")
        void activate() {
            User user = existing("staff_1", "user_cash", StaffProfile.Position.CASHIER);
            service.suspend(adminGrant, "staff_1");

            assertThat(service.activate(adminGrant, "staff_1").status()).isEqualTo(User.Status.ACTIVE);
            assertThat(user.getStatus()).isEqualTo(User.Status.ACTIVE);
        }

        @Test
        @DisplayName("delete is a soft delete to inactive")
        void delete() {
            User user = existing("staff_1", "user_cash", StaffProfile.Position.CASHIER);

            assertThat(service.delete(adminGrant, "staff_1").status()).isEqualTo(User.Status.INACTIVE);
            assertThat(user.getStatus()).isEqualTo(User.Status.INACTIVE);
            verify(staffRepository, never()).delete(any(StaffProfile.class));
        }

        @Test
        @DisplayName("nobody can suspend their own account")
        void self() {
            existing("staff_me", "user_admin", StaffProfile.Position.SHOP_ADMIN);

            assertThatThrownBy(() -> service.suspend(adminGrant, "staff_me"))
                    .extracting("code").isEqualTo(ErrorCode.FORBIDDEN);
        }

        @Test
        @DisplayName("only a super admin may suspend a shop admin")
        void shopAdminTarget() {
            User other = existing("staff_2", "user_admin2", StaffProfile.Position.SHOP_ADMIN);

            assertThatThrownBy(() -> service.suspend(adminGrant, "staff_2"))
                    .extracting("code").isEqualTo(ErrorCode.FORBIDDEN);
            assertThat(other.getStatus()).isEqualTo(User.Status.ACTIVE);

            assertThat(service.suspend(rootGrant, "staff_2").status()).isEqualTo(User.Status.SUSPENDED);
        }

        @Test
        @DisplayName("staff of another tenant is STAFF_NOT_FOUND")
        void otherTenant() {
            when(staffRepository.findByTenantIdAndStaffId(anyString(), anyString())).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.suspend(adminGrant, "staff_elsewhere"))
                    .extracting("code").isEqualTo(ErrorCode.STAFF_NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        @DisplayName("position change syncs the user's role")
        void positionChange() {
            User user = existing("staff_1", "user_cash", StaffProfile.Position.CASHIER);

            StaffResponse response = service.update(adminGrant, "staff_1",
                    new UpdateStaffRequest(null, null, null, "shop_admin", null));

            assertThat(response.position()).isEqualTo(StaffProfile.Position.SHOP_ADMIN);
            assertThat(user.getRole()).isEqualTo(Role.SHOP_ADMIN);
        }

        @Test
        @DisplayName("email change to a taken address is EMAIL_EXISTS")
        void emailTaken() {
            existing("staff_1", "user_cash", StaffProfile.Position.CASHIER);
            when(userRepository.existsByTenantIdAndEmail(Fixtures.TENANT_A, "taken@shop.com")).thenReturn(true);

            assertThatThrownBy(() -> service.update(adminGrant, "staff_1",
                    new UpdateStaffRequest(null, "Taken@Shop.com", null, null, null)))
                    .extracting("code").isEqualTo(ErrorCode.EMAIL_EXISTS);
        }

        @Test
        @DisplayName("name and email are mirrored onto the user")
        void mirrored() {
            User user = existing("staff_1", "user_cash", StaffProfile.Position.CASHIER);

            StaffResponse response = service.update(adminGrant, "staff_1",
                    new UpdateStaffRequest("Samantha", "samantha@shop.com", null, null, null));

            assertThat(response.name()).isEqualTo("Samantha");
            assertThat(user.getFirstName()).isEqualTo("Samantha");
            assertThat(user.getEmail()).isEqualTo("samantha@shop.com");
        }
    }
}
