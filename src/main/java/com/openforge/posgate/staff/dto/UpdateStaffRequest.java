package com.openforge.posgate.staff.dto;

import com.openforge.posgate.domain.StaffPermissions;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

/** Null fields are left unchanged. Status changes go through suspend / activate / delete. */
public record UpdateStaffRequest(
        @Size(max = 128) String name,
        @Email           String email,
        @Size(max = 32)  String phone,
                         String position,
                         StaffPermissions permissions
) {}
