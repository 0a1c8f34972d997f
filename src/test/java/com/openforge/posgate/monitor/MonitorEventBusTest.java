package com.openforge.posgate.monitor;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@DisplayName("MonitorEventBus")
class MonitorEventBusTest {

    private final MonitorEventBus    bus      = new MonitorEventBus();
    private final List<MonitorEvent> received = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        bus.start();
    }

    @AfterEach
    void tearDown() {
        bus.stop();
    }

    private static MonitorEvent event(String requestId) {
        return MonitorEvent.start(requestId, "GET", "/api/staff");
    }

    @Test
    @DisplayName("delivers events in publish order")
    void ordered() {
        bus.subscribe(received::add);

        for (int i = 0; i < 20; i++) {
            bus.publish(event("req_" + i));
        }

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(received).hasSize(20));
        assertThat(received).extracting(MonitorEvent::requestId)
                .startsWith("req_0", "req_1", "req_2")
                .endsWith("req_19");
    }

    @Test
    @DisplayName("a failing subscriber does not starve the others")
    void failingSubscriber() {
        bus.subscribe(e -> {
            throw new IllegalStateException("broken socket");
        });
        bus.subscribe(received::add);

        bus.publish(event("req_1"));
        bus.publish(event("req_2"));

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(received).hasSize(2));
    }

    @Test
    @DisplayName("unsubscribe stops delivery")
    void unsubscribe() {
        Runnable handle = bus.subscribe(received::add);
        assertThat(bus.subscriberCount()).isEqualTo(1);

        handle.run();
        bus.publish(event("req_1"));

        assertThat(bus.subscriberCount()).isZero();
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1))
                .untilAsserted(() -> assertThat(received).isEmpty());
    }

    @Test
    @DisplayName("events published after stop are dropped")
    void afterStop() {
        bus.subscribe(received::add);
        bus.stop();

        bus.publish(event("req_late"));

        assertThat(bus.isRunning()).isFalse();
        assertThat(received).isEmpty();
    }
}
