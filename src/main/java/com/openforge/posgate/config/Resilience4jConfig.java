package com.openforge.posgate.config;

import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 *   • "auditWrite" retry : audit inserts run off the request thread; a short
 *                           retry rides out a DB blip before the entry is dropped
 *   • "login" rate limits : one limiter per client address, created on demand
 */
@Configuration
public class Resilience4jConfig {

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(200))
                // only connection / transient failures are worth repeating
                .retryExceptions(TransientDataAccessException.class, CannotCreateTransactionException.class)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry("auditWrite");
        return registry;
    }

    @Bean
    public Retry auditWriteRetry(RetryRegistry registry) {
        return registry.retry("auditWrite");
    }

    // ── Rate limiter ─────────────────────────────────────────────────────────

    @Bean
    public RateLimiterRegistry loginRateLimiterRegistry(AuthProperties authProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(authProperties.loginAttempts())
                .limitRefreshPeriod(authProperties.loginWindow())
                // never park the request thread waiting for a permit
                .timeoutDuration(Duration.ZERO)
                .build();
        return RateLimiterRegistry.of(config);
    }
}
