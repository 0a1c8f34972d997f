package com.openforge.posgate.auth.dto;

import com.openforge.posgate.tenant.dto.TenantResponse;

public record TenantCreatedResponse(TenantResponse tenant, UserSummary shopAdmin) {
}
