package com.openforge.posgate.auth;

import com.openforge.posgate.common.ApiException;
import com.openforge.posgate.common.ErrorCode;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Per-address login throttle. Each client address gets its own limiter from
 * the registry; a denied permit fails immediately with AUTH_RATE_LIMIT_EXCEEDED.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoginRateLimiter {

    private final RateLimiterRegistry loginRateLimiterRegistry;

    public void acquire(String clientIp) {
        RateLimiter limiter = loginRateLimiterRegistry.rateLimiter("login:" + clientIp);
        if (!limiter.acquirePermission()) {
            long retryAfter = limiter.getRateLimiterConfig().getLimitRefreshPeriod().toSeconds();
            log.warn("[Auth] Login rate limit hit for ip={}", clientIp);
            throw new ApiException(ErrorCode.AUTH_RATE_LIMIT_EXCEEDED,
                    ErrorCode.AUTH_RATE_LIMIT_EXCEEDED.getDefaultMessage(),
                    Map.of("retryAfterSeconds", retryAfter));
        }
    }
}
