package com.openforge.posgate.auth.dto;

import com.openforge.posgate.domain.Tenant;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * New shop plus its first shop admin. {@code shopAdminName} defaults to the
 * local part of the email, {@code plan} to free.
 */
public record CreateTenantRequest(
        @NotBlank
        @Size(max = 128)
        String tenantName,

        @NotBlank
        @Email
        String shopAdminEmail,

        @NotBlank
        @Size(min = 8, max = 72)
        String shopAdminPassword,

        @Size(max = 128)
        String shopAdminName,

        Tenant.Plan plan
) {
}
