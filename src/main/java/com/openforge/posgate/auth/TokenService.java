package com.openforge.posgate.auth;

import com.openforge.posgate.common.AuthorizationException;
import com.openforge.posgate.common.ErrorCode;
import com.openforge.posgate.config.AuthProperties;
import com.openforge.posgate.domain.Role;
import com.openforge.posgate.domain.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies the access / refresh JWT pair.
 *
 * Access tokens carry {sub=userId, tenantId, email, role}; refresh tokens carry
 * only {sub=userId, jti}. The two are signed with different keys, so one can
 * never be replayed as the other.
 *
 * Verification has three outcomes: claims, TOKEN_EXPIRED (signature fine, past
 * expiry → client should refresh) or TOKEN_INVALID (anything else → client
 * must log in again).
 */
@Slf4j
@Component
public class TokenService {

    static final String TYPE_CLAIM   = "typ";
    static final String TYPE_ACCESS  = "access";
    static final String TYPE_REFRESH = "refresh";

    private final SecretKey accessKey;
    private final SecretKey refreshKey;
    private final String    issuer;
    private final Duration  accessTtl;
    private final Duration  refreshTtl;
    private final Clock     clock;

    public TokenService(AuthProperties properties, Clock clock) {
        this.accessKey  = Keys.hmacShaKeyFor(deriveKey(properties.accessSecret(), "pos.auth.access-secret"));
        this.refreshKey = Keys.hmacShaKeyFor(deriveKey(properties.refreshSecret(), "pos.auth.refresh-secret"));
        this.issuer     = properties.issuer();
        this.accessTtl  = properties.accessTokenTtl();
        this.refreshTtl = properties.refreshTokenTtl();
        this.clock      = clock;

        if (properties.accessSecret().equals(properties.refreshSecret())) {
            log.warn("[JWT] Access and refresh secrets are identical; configure distinct values");
        }
    }

    /** Sign a fresh pair for the user as it is stored right now. */
    public TokenPair issue(User user) {
        Instant now           = clock.instant();
        Instant accessExpiry  = now.plus(accessTtl);
        Instant refreshExpiry = now.plus(refreshTtl);

        String accessToken = Jwts.builder()
                .issuer(issuer)
                .subject(user.getUserId())
                .claim("tenantId", user.getTenantId())
                .claim("email", user.getEmail())
                .claim("role", user.getRole().value())
                .claim(TYPE_CLAIM, TYPE_ACCESS)
                .issuedAt(Date.from(now))
                .expiration(Date.from(accessExpiry))
                .signWith(accessKey)
                .compact();

        String refreshToken = Jwts.builder()
                .issuer(issuer)
                .id(UUID.randomUUID().toString())
                .subject(user.getUserId())
                .claim(TYPE_CLAIM, TYPE_REFRESH)
                .issuedAt(Date.from(now))
                .expiration(Date.from(refreshExpiry))
                .signWith(refreshKey)
                .compact();

        return new TokenPair(accessToken, refreshToken, "Bearer",
                accessTtl.toSeconds(), now, refreshExpiry);
    }

    public AccessTokenClaims verifyAccess(String token) {
        Claims claims = parse(accessKey, token, TYPE_ACCESS);
        String role = claims.get("role", String.class);
        return new AccessTokenClaims(
                claims.getSubject(),
                claims.get("tenantId", String.class),
                claims.get("email", String.class),
                role == null ? null : Role.of(role),
                claims.getExpiration().toInstant());
    }

    public RefreshTokenClaims verifyRefresh(String token) {
        Claims claims = parse(refreshKey, token, TYPE_REFRESH);
        return new RefreshTokenClaims(
                claims.getSubject(),
                claims.getId(),
                claims.getExpiration().toInstant());
    }

    // ── Private ───────────────────────────────────────────────────────────────

    private Claims parse(SecretKey key, String token, String expectedType) {
        if (token == null || token.isBlank()) {
            throw new AuthorizationException(ErrorCode.TOKEN_INVALID, "Invalid " + expectedType + " token");
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new AuthorizationException(ErrorCode.TOKEN_EXPIRED,
                    capitalize(expectedType) + " token expired");
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("[JWT] Rejected {} token: {}", expectedType, e.getMessage());
            throw new AuthorizationException(ErrorCode.TOKEN_INVALID, "Invalid " + expectedType + " token");
        }

        if (!expectedType.equals(claims.get(TYPE_CLAIM, String.class))
                || claims.getSubject() == null || claims.getSubject().isBlank()) {
            throw new AuthorizationException(ErrorCode.TOKEN_INVALID, "Invalid " + expectedType + " token");
        }
        return claims;
    }

    /**
     * Accept any non-blank secret and derive a fixed 32-byte HS256 key from it.
     */
    private static byte[] deriveKey(String secret, String property) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException(property + " is empty");
        }
        try {
            return MessageDigest.getInstance("SHA-256").digest(secret.trim().getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    // ── Value types ───────────────────────────────────────────────────────────

    public record TokenPair(
            String  accessToken,
            String  refreshToken,
            String  tokenType,
            long    expiresIn,
            Instant issuedAt,
            Instant refreshExpiresAt
    ) {}

    public record AccessTokenClaims(String userId, String tenantId, String email, Role role, Instant expiresAt) {}

    public record RefreshTokenClaims(String userId, String tokenId, Instant expiresAt) {}
}
