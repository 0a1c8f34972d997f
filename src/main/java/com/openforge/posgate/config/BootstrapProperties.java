package com.openforge.posgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * First-deployment accounts created by {@link AdminBootstrapRunner}.
 *
 * pos:
 *   bootstrap:
 *     auto-create: true
 *     super-admin:
 *       email: admin@example.com
 *       password: ${SUPER_ADMIN_PASSWORD}
 *     tenant:
 *       name: Digital Mart
 *       shop-admin-email: shopadmin@example.com
 *       shop-admin-password: ${DEFAULT_SHOP_ADMIN_PASSWORD}
 *       plan: professional
 */
@ConfigurationProperties(prefix = "pos.bootstrap")
public record BootstrapProperties(
        @DefaultValue("false") boolean autoCreate,
        @DefaultValue          SuperAdmin superAdmin,
        @DefaultValue          DefaultTenant tenant
) {

    public record SuperAdmin(
            @DefaultValue("admin@example.com") String email,
            String password,
            @DefaultValue("Super") String firstName,
            @DefaultValue("Admin") String lastName
    ) {}

    public record DefaultTenant(
            @DefaultValue("Digital Mart")          String name,
            @DefaultValue("shopadmin@example.com") String shopAdminEmail,
            String shopAdminPassword,
            @DefaultValue("Shop")                  String shopAdminName,
            @DefaultValue("professional")          String plan
    ) {}
}
