package com.openforge.posgate.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One live refresh token owned by a user. Rows only ever get appended or
 * removed; a record is never edited in place.
 */
@Getter
@Embeddable
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class RefreshTokenRecord {

    @Column(nullable = false, length = 1024)
    private String token;

    @Column(name = "issued_at", nullable = false)
    private Instant issuedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
