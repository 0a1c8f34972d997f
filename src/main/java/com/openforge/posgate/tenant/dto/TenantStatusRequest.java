package com.openforge.posgate.tenant.dto;

import com.openforge.posgate.domain.Tenant;
import jakarta.validation.constraints.NotNull;

public record TenantStatusRequest(@NotNull Tenant.Status status) {}
