package com.openforge.posgate.monitor;

import com.openforge.posgate.common.Ids;
import com.openforge.posgate.rbac.CurrentPrincipal;
import com.openforge.posgate.rbac.Principal;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Publishes REQUEST_START / REQUEST_END for every /api request.
 *
 * Sits in the security chain in front of {@code JwtAuthFilter}, so the END
 * event can name the authenticated tenant and user.
 */
@Component
@RequiredArgsConstructor
public class RequestLifecycleFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_ATTRIBUTE = RequestLifecycleFilter.class.getName() + ".requestId";

    private final MonitorEventBus bus;

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return !request.getRequestURI().substring(request.getContextPath().length()).startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest  request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain         chain) throws ServletException, IOException {

        String requestId = Ids.next("req");
        String method    = request.getMethod();
        String path      = request.getRequestURI();
        long   started   = System.nanoTime();

        request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
        bus.publish(MonitorEvent.start(requestId, method, path));
        try {
            chain.doFilter(request, response);
        } finally {
            Principal principal = CurrentPrincipal.find().orElse(null);
            bus.publish(MonitorEvent.end(requestId, method, path,
                    principal == null ? null : principal.tenantId(),
                    principal == null ? null : principal.userId(),
                    response.getStatus(),
                    (System.nanoTime() - started) / 1_000_000));
        }
    }
}
