package com.openforge.posgate.auth.dto;

import com.openforge.posgate.domain.Role;
import com.openforge.posgate.domain.User;

import java.time.Instant;

public record UserSummary(
        String      userId,
        String      tenantId,
        String      email,
        Role        role,
        User.Status status,
        String      firstName,
        String      lastName,
        Instant     lastLoginAt
) {
    public static UserSummary of(User user) {
        return new UserSummary(
                user.getUserId(),
                user.getTenantId(),
                user.getEmail(),
                user.getRole(),
                user.getStatus(),
                user.getFirstName(),
                user.getLastName(),
                user.getLastLoginAt());
    }
}
