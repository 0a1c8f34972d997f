package com.openforge.posgate.auth.dto;

import com.openforge.posgate.auth.TokenService;

import java.time.Instant;

/**
 * Returned by login and refresh. {@code expiresIn} is the access token
 * lifetime in seconds.
 */
public record AuthResponse(
        UserSummary user,
        String      accessToken,
        String      refreshToken,
        String      tokenType,
        long        expiresIn,
        Instant     refreshExpiresAt
) {
    public static AuthResponse of(UserSummary user, TokenService.TokenPair pair) {
        return new AuthResponse(
                user,
                pair.accessToken(),
                pair.refreshToken(),
                pair.tokenType(),
                pair.expiresIn(),
                pair.refreshExpiresAt());
    }
}
