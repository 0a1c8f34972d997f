package com.openforge.posgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Token and session settings, read once at startup and handed to constructors.
 *
 * application.yml:
 *
 * pos:
 *   auth:
 *     access-secret: ${JWT_SECRET}
 *     refresh-secret: ${JWT_REFRESH_SECRET}
 *     issuer: pos-gate
 *     access-token-ttl: 15m
 *     refresh-token-ttl: 7d
 *     max-sessions: 5
 *     login-attempts: 5
 *     login-window: 15m
 */
@ConfigurationProperties(prefix = "pos.auth")
public record AuthProperties(
        String accessSecret,
        String refreshSecret,
        @DefaultValue("pos-gate") String   issuer,
        @DefaultValue("15m")      Duration accessTokenTtl,
        @DefaultValue("7d")       Duration refreshTokenTtl,
        @DefaultValue("5")        int      maxSessions,
        @DefaultValue("5")        int      loginAttempts,
        @DefaultValue("15m")      Duration loginWindow
) {}
