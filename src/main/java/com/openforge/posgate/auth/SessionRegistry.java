package com.openforge.posgate.auth;

import com.openforge.posgate.config.AuthProperties;
import com.openforge.posgate.domain.RefreshTokenRecord;
import com.openforge.posgate.domain.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Keeps each user's list of live refresh tokens bounded and single-use.
 *
 * Operates on the (locked) {@link User} entity; callers persist the user.
 * The list is ordered oldest first, so eviction is FIFO by issue order,
 * not by last use.
 */
@Slf4j
@Component
public class SessionRegistry {

    private final int maxSessions;

    public SessionRegistry(AuthProperties properties) {
        if (properties.maxSessions() < 1) {
            throw new IllegalStateException("pos.auth.max-sessions must be at least 1");
        }
        this.maxSessions = properties.maxSessions();
    }

    /** Append a record for the pair's refresh token, evicting the oldest beyond the cap. */
    public void register(User user, TokenService.TokenPair pair) {
        List<RefreshTokenRecord> records = user.getRefreshTokens();
        records.add(new RefreshTokenRecord(pair.refreshToken(), pair.issuedAt(), pair.refreshExpiresAt()));
        while (records.size() > maxSessions) {
            records.remove(0);
            log.debug("[Session] Evicted oldest refresh token for userId={}", user.getUserId());
        }
    }

    public Optional<RefreshTokenRecord> find(User user, String token) {
        return user.getRefreshTokens().stream()
                .filter(r -> r.getToken().equals(token))
                .findFirst();
    }

    /** Remove and return the record for {@code token}, if it is live. */
    public Optional<RefreshTokenRecord> consume(User user, String token) {
        if (token == null) {
            return Optional.empty();
        }
        Iterator<RefreshTokenRecord> it = user.getRefreshTokens().iterator();
        while (it.hasNext()) {
            RefreshTokenRecord record = it.next();
            if (record.getToken().equals(token)) {
                it.remove();
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    /** Remove the record for {@code token}. Returns false when it was not live. */
    public boolean revoke(User user, String token) {
        return consume(user, token).isPresent();
    }

    public int maxSessions() {
        return maxSessions;
    }
}
