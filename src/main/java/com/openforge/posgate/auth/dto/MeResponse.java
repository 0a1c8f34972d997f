package com.openforge.posgate.auth.dto;

import com.openforge.posgate.tenant.dto.TenantResponse;

/** {@code tenant} is null for super admins. */
public record MeResponse(UserSummary user, TenantResponse tenant) {
}
