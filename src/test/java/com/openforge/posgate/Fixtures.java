package com.openforge.posgate;

import com.openforge.posgate.config.AuthProperties;
import com.openforge.posgate.domain.Role;
import com.openforge.posgate.domain.Tenant;
import com.openforge.posgate.domain.User;

import java.time.Duration;

/** Shared builders for unit tests. */
public final class Fixtures {

    public static final String TENANT_A = "tenant_ACM_A1";
    public static final String TENANT_B = "tenant_BET_B2";

    private Fixtures() {}

    public static AuthProperties authProperties() {
        return new AuthProperties(
                "unit-test-access-secret",
                "unit-test-refresh-secret",
                "pos-gate",
                Duration.ofMinutes(15),
                Duration.ofDays(7),
                5,
                5,
                Duration.ofMinutes(15));
    }

    public static User user(String userId, String tenantId, Role role) {
        User user = new User();
        user.setUserId(userId);
        user.setTenantId(tenantId);
        user.setEmail(userId + "@example.com");
        user.setPasswordHash("unused");
        user.setRole(role);
        user.setStatus(User.Status.ACTIVE);
        user.setFirstName(userId);
        return user;
    }

    public static Tenant tenant(String tenantId, Tenant.Status status) {
        Tenant tenant = new Tenant();
        tenant.setTenantId(tenantId);
        tenant.setName("Shop " + tenantId);
        tenant.setStatus(status);
        tenant.setPlan(Tenant.Plan.BASIC);
        return tenant;
    }
}
