package com.openforge.posgate.auth;

import com.openforge.posgate.common.ApiException;
import com.openforge.posgate.common.ErrorResponseWriter;
import com.openforge.posgate.rbac.AuthorizationEngine;
import com.openforge.posgate.rbac.Principal;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Authenticates every protected /api request from its bearer token.
 *
 * On success the reloaded {@link Principal} becomes the SecurityContext
 * principal, with its role as a ROLE_ authority. On failure the precise
 * error code (TOKEN_EXPIRED, ACCOUNT_INACTIVE, ...) is written straight
 * back and the chain stops.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthFilter extends OncePerRequestFilter {

    static final Set<String> PUBLIC_PATHS = Set.of(
            "/api/auth/login",
            "/api/auth/refresh",
            "/api/auth/setup"
    );

    private final AuthorizationEngine authorizationEngine;
    private final ErrorResponseWriter errorWriter;

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !path.startsWith("/api/")
                || PUBLIC_PATHS.contains(path)
                || "OPTIONS".equalsIgnoreCase(request.getMethod());
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest  request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain         chain) throws ServletException, IOException {

        Principal principal;
        try {
            principal = authorizationEngine.authenticate(request.getHeader(HttpHeaders.AUTHORIZATION));
        } catch (ApiException e) {
            log.debug("[JWT] Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), e.getCode());
            SecurityContextHolder.clearContext();
            errorWriter.write(response, e);
            return;
        }

        var auth = new UsernamePasswordAuthenticationToken(
                principal,
                null,
                List.of(new SimpleGrantedAuthority("ROLE_" + principal.role().name())));
        auth.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(auth);
        log.debug("[JWT] Authenticated userId={} path={}", principal.userId(), request.getRequestURI());

        chain.doFilter(request, response);
    }
}
