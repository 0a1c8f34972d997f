package com.openforge.posgate.tenant;

import com.openforge.posgate.common.ApiException;
import com.openforge.posgate.common.AuthorizationException;
import com.openforge.posgate.common.ErrorCode;
import com.openforge.posgate.common.Ids;
import com.openforge.posgate.domain.Tenant;
import com.openforge.posgate.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * Tenant lookup and the "is this tenant open for business" gate.
 * Always reads the current row; nothing is cached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TenantDirectory {

    private static final int MAX_ID_ATTEMPTS = 5;

    private final TenantRepository tenantRepository;
    private final Clock            clock;

    public Optional<Tenant> find(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            return Optional.empty();
        }
        return tenantRepository.findByTenantId(tenantId);
    }

    public Tenant require(String tenantId) {
        return find(tenantId).orElseThrow(() -> new ApiException(ErrorCode.TENANT_NOT_FOUND));
    }

    /** @throws AuthorizationException TENANT_NOT_FOUND or TENANT_INACTIVE */
    public Tenant requireActive(String tenantId) {
        Tenant tenant = find(tenantId)
                .orElseThrow(() -> new AuthorizationException(ErrorCode.TENANT_NOT_FOUND));
        if (!tenant.isActive()) {
            throw new AuthorizationException(ErrorCode.TENANT_INACTIVE);
        }
        return tenant;
    }

    /**
     * {@code tenant_<first 3 letters of name>_<base36 millis>}, upper case.
     * Falls back to a random suffix when the plain id is already taken.
     */
    public String generateTenantId(String name) {
        String letters = name == null ? "" : name.replaceAll("[^A-Za-z]", "");
        String prefix  = (letters + "XXX").substring(0, 3).toUpperCase(Locale.ROOT);
        String base    = "tenant_" + prefix + "_" + Long.toString(clock.millis(), 36).toUpperCase(Locale.ROOT);

        String candidate = base;
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            if (!tenantRepository.existsByTenantId(candidate)) {
                return candidate;
            }
            candidate = base + Ids.random(4).toUpperCase(Locale.ROOT);
        }
        throw new IllegalStateException("Could not allocate a unique tenant id for " + name);
    }

    /** Returns the status before the change. */
    @Transactional
    public Tenant.Status changeStatus(Tenant tenant, Tenant.Status status) {
        Tenant.Status previous = tenant.getStatus();
        tenant.setStatus(status);
        tenantRepository.save(tenant);
        log.info("[Tenant] {} status {} -> {}", tenant.getTenantId(), previous.value(), status.value());
        return previous;
    }
}
