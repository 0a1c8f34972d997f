package com.openforge.posgate.monitor;

import com.openforge.posgate.domain.User;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Bridges the monitor bus onto STOMP topics.
 *
 * Topic layout:
 *   /topic/monitor/{tenantId}  → events of one tenant (shop admins and above)
 *   /topic/monitor/all         → every event (super admins only)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MonitorEventPublisher {

    public static final String TOPIC_PREFIX = "/topic/monitor/";
    public static final String ALL_TOPIC    = TOPIC_PREFIX + "all";

    private final MonitorEventBus       bus;
    private final SimpMessagingTemplate messagingTemplate;

    private Runnable subscription;

    @PostConstruct
    void subscribe() {
        subscription = bus.subscribe(this::forward);
    }

    @PreDestroy
    void unsubscribe() {
        if (subscription != null) {
            subscription.run();
        }
    }

    void forward(MonitorEvent event) {
        send(ALL_TOPIC, event);
        if (event.tenantId() != null && !User.GLOBAL_TENANT.equals(event.tenantId())) {
            send(TOPIC_PREFIX + event.tenantId(), event);
        }
    }

    private void send(String destination, MonitorEvent event) {
        try {
            messagingTemplate.convertAndSend(destination, event);
        } catch (Exception e) {
            // delivery problems must never reach the request path
            log.warn("[Monitor] Failed to deliver {} event to {}: {}",
                    event.type(), destination, e.getMessage());
        }
    }
}
