package com.openforge.posgate.config;

import com.openforge.posgate.auth.AuthService;
import com.openforge.posgate.auth.dto.CreateTenantRequest;
import com.openforge.posgate.auth.dto.SetupRequest;
import com.openforge.posgate.domain.Role;
import com.openforge.posgate.domain.Tenant;
import com.openforge.posgate.rbac.Principal;
import com.openforge.posgate.repository.TenantRepository;
import com.openforge.posgate.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * First-deployment provisioning, enabled by {@code pos.bootstrap.auto-create}.
 *
 *   1. super admin, unless one already exists
 *   2. default tenant with its shop admin, unless a tenant of that name exists
 *
 * Never stops startup: every failure is logged and the step skipped.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class AdminBootstrapRunner implements ApplicationRunner {

    private final BootstrapProperties properties;
    private final AuthService         authService;
    private final UserRepository      userRepository;
    private final TenantRepository    tenantRepository;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.autoCreate()) {
            log.debug("[Bootstrap] Disabled");
            return;
        }
        try {
            ensureSuperAdmin();
            ensureDefaultTenant();
        } catch (RuntimeException e) {
            log.error("[Bootstrap] Provisioning failed: {}", e.getMessage(), e);
        }
    }

    private void ensureSuperAdmin() {
        if (authService.isSetupComplete()) {
            log.info("[Bootstrap] Super admin already present");
            return;
        }
        BootstrapProperties.SuperAdmin admin = properties.superAdmin();
        if (isBlank(admin.password())) {
            log.warn("[Bootstrap] pos.bootstrap.super-admin.password not set; super admin not created");
            return;
        }
        authService.createSuperAdmin(new SetupRequest(
                admin.email(), admin.password(), admin.firstName(), admin.lastName()));
        log.info("[Bootstrap] Super admin {} created", admin.email());
    }

    private void ensureDefaultTenant() {
        BootstrapProperties.DefaultTenant tenant = properties.tenant();
        if (tenantRepository.findFirstByNameOrderByIdAsc(tenant.name()).isPresent()) {
            log.info("[Bootstrap] Tenant '{}' already present", tenant.name());
            return;
        }
        if (isBlank(tenant.shopAdminPassword())) {
            log.warn("[Bootstrap] pos.bootstrap.tenant.shop-admin-password not set; default tenant not created");
            return;
        }
        Principal superAdmin = userRepository.findFirstByRoleOrderByIdAsc(Role.SUPER_ADMIN)
                .map(Principal::of)
                .orElse(null);
        if (superAdmin == null) {
            log.warn("[Bootstrap] No super admin; default tenant not created");
            return;
        }
        var created = authService.createTenantAndShopAdmin(superAdmin, new CreateTenantRequest(
                tenant.name(),
                tenant.shopAdminEmail(),
                tenant.shopAdminPassword(),
                tenant.shopAdminName(),
                Tenant.Plan.of(tenant.plan())));
        log.info("[Bootstrap] Tenant '{}' created as {}", tenant.name(), created.tenant().tenantId());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
