package com.openforge.posgate.rbac;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;

/**
 * Reads the {@link Principal} that {@code JwtAuthFilter} put into the
 * SecurityContext, for code that is not handed one as a parameter.
 */
public final class CurrentPrincipal {

    private CurrentPrincipal() {}

    public static Optional<Principal> find() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.getPrincipal() instanceof Principal principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }
}
