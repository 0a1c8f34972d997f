package com.openforge.posgate.websocket;

import com.openforge.posgate.common.ApiException;
import com.openforge.posgate.common.AuthorizationException;
import com.openforge.posgate.common.ErrorCode;
import com.openforge.posgate.domain.Role;
import com.openforge.posgate.monitor.MonitorEventPublisher;
import com.openforge.posgate.rbac.AccessPolicies;
import com.openforge.posgate.rbac.AuthorizationEngine;
import com.openforge.posgate.rbac.Principal;
import com.openforge.posgate.rbac.TenantRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Guards the STOMP channel.
 *
 *   CONNECT    → bearer token in the "Authorization" native header, same checks as /api
 *   SUBSCRIBE  → /topic/monitor/all needs super_admin;
 *                /topic/monitor/{tenantId} needs shop_admin+ with access to that tenant
 *
 * The principal is reloaded on SUBSCRIBE, so a user suspended after connecting
 * cannot open new subscriptions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompAuthInterceptor implements ChannelInterceptor {

    private final AuthorizationEngine authorizationEngine;

    @Override
    public Message<?> preSend(@NonNull Message<?> message, @NonNull MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || accessor.getCommand() == null) {
            return message;
        }
        try {
            if (StompCommand.CONNECT.equals(accessor.getCommand())) {
                connect(accessor);
            } else if (StompCommand.SUBSCRIBE.equals(accessor.getCommand())) {
                subscribe(accessor);
            }
        } catch (ApiException e) {
            log.debug("[WS] {} rejected: {}", accessor.getCommand(), e.getCode());
            throw new MessageDeliveryException(message, e.getCode().name());
        }
        return message;
    }

    private void connect(StompHeaderAccessor accessor) {
        Principal principal = authorizationEngine.authenticate(accessor.getFirstNativeHeader(HttpHeaders.AUTHORIZATION));
        accessor.setUser(new UsernamePasswordAuthenticationToken(
                principal,
                null,
                List.of(new SimpleGrantedAuthority("ROLE_" + principal.role().name()))));
        log.debug("[WS] CONNECT userId={}", principal.userId());
    }

    private void subscribe(StompHeaderAccessor accessor) {
        if (!(accessor.getUser() instanceof UsernamePasswordAuthenticationToken auth)
                || !(auth.getPrincipal() instanceof Principal connected)) {
            throw new AuthorizationException(ErrorCode.AUTH_REQUIRED);
        }
        Principal principal   = authorizationEngine.reload(connected.userId());
        String    destination = accessor.getDestination();

        if (MonitorEventPublisher.ALL_TOPIC.equals(destination)) {
            authorizationEngine.requireRole(principal, Set.of(Role.SUPER_ADMIN));
        } else if (destination != null && destination.startsWith(MonitorEventPublisher.TOPIC_PREFIX)) {
            String tenantId = destination.substring(MonitorEventPublisher.TOPIC_PREFIX.length());
            authorizationEngine.admit(principal, AccessPolicies.MONITOR, TenantRequest.path(tenantId));
        } else {
            throw new AuthorizationException(ErrorCode.FORBIDDEN, "Unknown destination");
        }
        log.debug("[WS] SUBSCRIBE userId={} destination={}", principal.userId(), destination);
    }
}
