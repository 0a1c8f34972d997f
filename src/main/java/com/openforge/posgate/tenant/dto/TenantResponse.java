package com.openforge.posgate.tenant.dto;

import com.openforge.posgate.domain.Tenant;

import java.time.LocalDateTime;

public record TenantResponse(
        String        tenantId,
        String        name,
        Tenant.Status status,
        Tenant.Plan   plan,
        LocalDateTime createdAt
) {
    public static TenantResponse of(Tenant tenant) {
        return new TenantResponse(
                tenant.getTenantId(),
                tenant.getName(),
                tenant.getStatus(),
                tenant.getPlan(),
                tenant.getCreateTime());
    }
}
