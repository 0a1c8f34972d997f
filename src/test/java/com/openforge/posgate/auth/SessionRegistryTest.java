package com.openforge.posgate.auth;

import com.openforge.posgate.Fixtures;
import com.openforge.posgate.domain.RefreshTokenRecord;
import com.openforge.posgate.domain.Role;
import com.openforge.posgate.domain.User;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SessionRegistry")
class SessionRegistryTest {

    private final SessionRegistry registry = new SessionRegistry(Fixtures.authProperties());
    private final User            user     = Fixtures.user("user_1", Fixtures.TENANT_A, Role.STAFF);

    private static TokenService.TokenPair pair(String refreshToken) {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        return new TokenService.TokenPair("access", refreshToken, "Bearer", 900, now, now.plusSeconds(3600));
    }

    @Test
    @DisplayName("sixth session evicts the oldest")
    void capEvictsOldest() {
        for (int i = 1; i <= 6; i++) {
            registry.register(user, pair("rt-" + i));
        }

        assertThat(user.getRefreshTokens())
                .extracting(RefreshTokenRecord::getToken)
                .containsExactly("rt-2", "rt-3", "rt-4", "rt-5", "rt-6");
        assertThat(registry.find(user, "rt-1")).isEmpty();
    }

    @Test
    @DisplayName("consume removes exactly the matching record")
    void consume() {
        registry.register(user, pair("rt-1"));
        registry.register(user, pair("rt-2"));

        assertThat(registry.consume(user, "rt-1")).map(RefreshTokenRecord::getToken).contains("rt-1");
        assertThat(registry.consume(user, "rt-1")).isEmpty();
        assertThat(user.getRefreshTokens()).extracting(RefreshTokenRecord::getToken).containsExactly("rt-2");
    }

    @Test
    @DisplayName("revoking an unknown or null token changes nothing")
    void revokeUnknown() {
        registry.register(user, pair("rt-1"));

        assertThat(registry.revoke(user, "nope")).isFalse();
        assertThat(registry.revoke(user, null)).isFalse();
        assertThat(user.getRefreshTokens()).hasSize(1);
    }
}
