package com.openforge.posgate.auth;

import com.openforge.posgate.Fixtures;
import com.openforge.posgate.common.AuthorizationException;
import com.openforge.posgate.common.ErrorCode;
import com.openforge.posgate.config.AuthProperties;
import com.openforge.posgate.domain.Role;
import com.openforge.posgate.domain.User;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TokenService")
class TokenServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final User        user    = Fixtures.user("user_1", Fixtures.TENANT_A, Role.SHOP_ADMIN);
    private final TokenService service = at(NOW);

    private static TokenService at(Instant instant) {
        return new TokenService(Fixtures.authProperties(), Clock.fixed(instant, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("issue")
    class Issue {

        @Test
        @DisplayName("access token carries user id, tenant, email and role")
        void accessClaims() {
            TokenService.TokenPair pair = service.issue(user);

            TokenService.AccessTokenClaims claims = service.verifyAccess(pair.accessToken());

            assertThat(claims.userId()).isEqualTo("user_1");
            assertThat(claims.tenantId()).isEqualTo(Fixtures.TENANT_A);
            assertThat(claims.email()).isEqualTo("user_1@example.com");
            assertThat(claims.role()).isEqualTo(Role.SHOP_ADMIN);
            assertThat(claims.expiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
        }

        @Test
        @DisplayName("pair metadata reflects configured TTLs")
        void pairMetadata() {
            TokenService.TokenPair pair = service.issue(user);

            assertThat(pair.tokenType()).isEqualTo("Bearer");
            assertThat(pair.expiresIn()).isEqualTo(900);
            assertThat(pair.issuedAt()).isEqualTo(NOW);
            assertThat(pair.refreshExpiresAt()).isEqualTo(NOW.plus(Duration.ofDays(7)));
        }

        @Test
        @DisplayName("two refresh tokens issued in the same instant differ")
        void refreshTokensAreUnique() {
            String first  = service.issue(user).refreshToken();
            String second = service.issue(user).refreshToken();

            assertThat(first).isNotEqualTo(second);
            assertThat(service.verifyRefresh(first).tokenId())
                    .isNotEqualTo(service.verifyRefresh(second).tokenId());
        }
    }

    @Nested
    @DisplayName("verify")
    class Verify {

        @Test
        @DisplayName("expired access token is TOKEN_EXPIRED")
        void expiredAccess() {
            String token = service.issue(user).accessToken();

            assertThatThrownBy(() -> at(NOW.plus(Duration.ofMinutes(16))).verifyAccess(token))
                    .isInstanceOf(AuthorizationException.class)
                    .extracting("code").isEqualTo(ErrorCode.TOKEN_EXPIRED);
        }

        @Test
        @DisplayName("expired refresh token is TOKEN_EXPIRED")
        void expiredRefresh() {
            String token = service.issue(user).refreshToken();

            assertThatThrownBy(() -> at(NOW.plus(Duration.ofDays(8))).verifyRefresh(token))
                    .isInstanceOf(AuthorizationException.class)
                    .extracting("code").isEqualTo(ErrorCode.TOKEN_EXPIRED);
        }

        @Test
        @DisplayName("refresh token is not accepted as an access token")
        void refreshAsAccess() {
            String refresh = service.issue(user).refreshToken();

            assertThatThrownBy(() -> service.verifyAccess(refresh))
                    .extracting("code").isEqualTo(ErrorCode.TOKEN_INVALID);
        }

        @Test
        @DisplayName("access token is not accepted as a refresh token")
        void accessAsRefresh() {
            String access = service.issue(user).accessToken();

            assertThatThrownBy(() -> service.verifyRefresh(access))
                    .extracting("code").isEqualTo(ErrorCode.TOKEN_INVALID);
        }

        @Test
        @DisplayName("tampered signature is TOKEN_INVALID")
        void tampered() {
            String token    = service.issue(user).accessToken();
            String tampered = token.substring(0, token.length() - 4) + "AAAA";

            assertThatThrownBy(() -> service.verifyAccess(tampered))
                    .extracting("code").isEqualTo(ErrorCode.TOKEN_INVALID);
        }

        @Test
        @DisplayName("garbage and blank input are TOKEN_INVALID")
        void garbage() {
            assertThatThrownBy(() -> service.verifyAccess("not-a-jwt"))
                    .extracting("code").isEqualTo(ErrorCode.TOKEN_INVALID);
            assertThatThrownBy(() -> service.verifyRefresh(" "))
                    .extracting("code").isEqualTo(ErrorCode.TOKEN_INVALID);
        }

        @Test
        @DisplayName("token from another issuer is TOKEN_INVALID")
        void foreignIssuer() {
            AuthProperties base = Fixtures.authProperties();
            AuthProperties other = new AuthProperties(base.accessSecret(), base.refreshSecret(), "someone-else",
                    base.accessTokenTtl(), base.refreshTokenTtl(), base.maxSessions(),
                    base.loginAttempts(), base.loginWindow());
            String token = new TokenService(other, Clock.fixed(NOW, ZoneOffset.UTC)).issue(user).accessToken();

            assertThatThrownBy(() -> service.verifyAccess(token))
                    .extracting("code").isEqualTo(ErrorCode.TOKEN_INVALID);
        }
    }

    @Test
    @DisplayName("blank secret fails construction")
    void blankSecret() {
        AuthProperties base = Fixtures.authProperties();
        AuthProperties blank = new AuthProperties(" ", base.refreshSecret(), base.issuer(),
                base.accessTokenTtl(), base.refreshTokenTtl(), base.maxSessions(),
                base.loginAttempts(), base.loginWindow());

        assertThatThrownBy(() -> new TokenService(blank, Clock.systemUTC()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("pos.auth.access-secret");
    }
}
