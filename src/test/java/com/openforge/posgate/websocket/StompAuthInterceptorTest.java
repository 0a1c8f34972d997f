package com.openforge.posgate.websocket;

import com.openforge.posgate.Fixtures;
import com.openforge.posgate.common.AuthorizationException;
import com.openforge.posgate.common.ErrorCode;
import com.openforge.posgate.domain.Role;
import com.openforge.posgate.domain.User;
import com.openforge.posgate.monitor.MonitorEventPublisher;
import com.openforge.posgate.rbac.AccessPolicies;
import com.openforge.posgate.rbac.AuthorizationEngine;
import com.openforge.posgate.rbac.Principal;
import com.openforge.posgate.rbac.TenantRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StompAuthInterceptor")
class StompAuthInterceptorTest {

    @Mock private AuthorizationEngine engine;

    private final MessageChannel channel   = mock(MessageChannel.class);
    private final Principal      shopAdmin = new Principal("user_admin", Fixtures.TENANT_A, "a@b.com", Role.SHOP_ADMIN);
    private final Principal      root      = new Principal("user_root", User.GLOBAL_TENANT, "r@b.com", Role.SUPER_ADMIN);

    private StompAuthInterceptor interceptor;

    @BeforeEach
    void setUp() {
        interceptor = new StompAuthInterceptor(engine);
    }

    private static Message<byte[]> message(StompHeaderAccessor accessor) {
        accessor.setLeaveMutable(true);
        return MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
    }

    private static StompHeaderAccessor subscribe(Principal principal, String destination) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.SUBSCRIBE);
        accessor.setDestination(destination);
        if (principal != null) {
            accessor.setUser(new UsernamePasswordAuthenticationToken(principal, null, List.of()));
        }
        return accessor;
    }

    @Test
    @DisplayName("CONNECT attaches the authenticated principal")
    void connect() {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.CONNECT);
        accessor.setNativeHeader("Authorization", "Bearer token");
        when(engine.authenticate("Bearer token")).thenReturn(shopAdmin);

        interceptor.preSend(message(accessor), channel);

        assertThat(accessor.getUser()).isInstanceOf(UsernamePasswordAuthenticationToken.class);
        assertThat(((UsernamePasswordAuthenticationToken) accessor.getUser()).getPrincipal()).isEqualTo(shopAdmin);
    }

    @Test
    @DisplayName("CONNECT with a bad token is refused with its code")
    void connectRejected() {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.CONNECT);
        when(engine.authenticate(any())).thenThrow(new AuthorizationException(ErrorCode.AUTH_REQUIRED));

        assertThatThrownBy(() -> interceptor.preSend(message(accessor), channel))
                .isInstanceOf(MessageDeliveryException.class)
                .hasMessageContaining("AUTH_REQUIRED");
    }

    @Test
    @DisplayName("SUBSCRIBE without a connected user is refused")
    void subscribeAnonymous() {
        assertThatThrownBy(() -> interceptor.preSend(message(subscribe(null, "/topic/monitor/all")), channel))
                .isInstanceOf(MessageDeliveryException.class)
                .hasMessageContaining("AUTH_REQUIRED");
    }

    @Test
    @DisplayName("the all-tenants topic requires super admin")
    void allTopic() {
        when(engine.reload("user_admin")).thenReturn(shopAdmin);
        doThrow(new AuthorizationException(ErrorCode.FORBIDDEN))
                .when(engine).requireRole(shopAdmin, Set.of(Role.SUPER_ADMIN));

        assertThatThrownBy(() -> interceptor.preSend(message(subscribe(shopAdmin, MonitorEventPublisher.ALL_TOPIC)), channel))
                .isInstanceOf(MessageDeliveryException.class)
                .hasMessageContaining("FORBIDDEN");
    }

    @Test
    @DisplayName("super admin may subscribe to the all-tenants topic")
    void allTopicSuperAdmin() {
        when(engine.reload("user_root")).thenReturn(root);

        interceptor.preSend(message(subscribe(root, MonitorEventPublisher.ALL_TOPIC)), channel);

        verify(engine).requireRole(root, Set.of(Role.SUPER_ADMIN));
    }

    @Test
    @DisplayName("a tenant topic is admitted against that tenant")
    void tenantTopic() {
        when(engine.reload("user_admin")).thenReturn(shopAdmin);

        interceptor.preSend(message(subscribe(shopAdmin, MonitorEventPublisher.TOPIC_PREFIX + Fixtures.TENANT_A)), channel);

        verify(engine).admit(eq(shopAdmin), eq(AccessPolicies.MONITOR), eq(TenantRequest.path(Fixtures.TENANT_A)));
    }

    @Test
    @DisplayName("another tenant's topic is refused")
    void otherTenantTopic() {
        when(engine.reload("user_admin")).thenReturn(shopAdmin);
        when(engine.admit(shopAdmin, AccessPolicies.MONITOR, TenantRequest.path(Fixtures.TENANT_B)))
                .thenThrow(new AuthorizationException(ErrorCode.TENANT_FORBIDDEN));

        assertThatThrownBy(() -> interceptor.preSend(
                message(subscribe(shopAdmin, MonitorEventPublisher.TOPIC_PREFIX + Fixtures.TENANT_B)), channel))
                .hasMessageContaining("TENANT_FORBIDDEN");
    }

    @Test
    @DisplayName("unknown destinations are refused")
    void unknownDestination() {
        when(engine.reload("user_admin")).thenReturn(shopAdmin);

        assertThatThrownBy(() -> interceptor.preSend(message(subscribe(shopAdmin, "/topic/other")), channel))
                .hasMessageContaining("FORBIDDEN");
    }
}
