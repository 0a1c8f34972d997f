package com.openforge.posgate.staff.dto;

import com.openforge.posgate.domain.Role;
import com.openforge.posgate.domain.StaffPermissions;
import com.openforge.posgate.domain.StaffProfile;
import com.openforge.posgate.domain.User;

import java.time.LocalDateTime;

public record StaffResponse(
        String                staffId,
        String                tenantId,
        String                userId,
        String                name,
        String                email,
        String                phone,
        StaffProfile.Position position,
        User.Status           status,
        StaffPermissions      permissions,
        String                createdBy,
        Role                  createdByRole,
        LocalDateTime         createdAt
) {
    public static StaffResponse of(StaffProfile profile) {
        return new StaffResponse(
                profile.getStaffId(),
                profile.getTenantId(),
                profile.getUserId(),
                profile.getName(),
                profile.getEmail(),
                profile.getPhone(),
                profile.getPosition(),
                profile.getStatus(),
                profile.getPermissions().copy(),
                profile.getCreatedBy(),
                profile.getCreatedByRole(),
                profile.getCreateTime());
    }
}
