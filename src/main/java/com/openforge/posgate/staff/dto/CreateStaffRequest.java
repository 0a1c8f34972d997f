package com.openforge.posgate.staff.dto;

import com.openforge.posgate.domain.StaffPermissions;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * {@code position} is parsed by the service so an unknown or super_admin value
 * surfaces as INVALID_ROLE. Without {@code password} a temporary one is
 * generated and returned once. Without {@code permissions} the position's
 * defaults apply. {@code tenantId} is only honoured for super admins.
 */
public record CreateStaffRequest(
        @NotBlank @Size(max = 128) String name,
        @NotBlank @Email           String email,
        @Size(max = 32)            String phone,
                                   String position,
        @Size(min = 8, max = 72)   String password,
                                   StaffPermissions permissions,
                                   String tenantId
) {}
