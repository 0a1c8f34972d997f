package com.openforge.posgate.monitor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * In-process pub/sub for {@link MonitorEvent}s, scoped to the application
 * context lifecycle.
 *
 * Publishers never block: events are handed to the bus thread and delivered
 * to each subscriber in publish order. A subscriber that throws is logged and
 * skipped. Events published before start or after stop are dropped.
 */
@Slf4j
@Component
public class MonitorEventBus implements SmartLifecycle {

    private static final long STOP_TIMEOUT_MS = 2_000;

    private final List<Consumer<MonitorEvent>> subscribers = new CopyOnWriteArrayList<>();

    private volatile ExecutorService executor;
    private volatile boolean         running;

    /** Returns a handle that removes the subscription. */
    public Runnable subscribe(Consumer<MonitorEvent> subscriber) {
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    public void publish(MonitorEvent event) {
        ExecutorService current = executor;
        if (!running || current == null) {
            log.trace("[Monitor] Bus not running, dropped {}", event.type());
            return;
        }
        try {
            current.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.trace("[Monitor] Bus stopping, dropped {}", event.type());
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    // ── SmartLifecycle ───────────────────────────────────────────────────────

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        CustomizableThreadFactory threads = new CustomizableThreadFactory("monitor-bus-");
        threads.setDaemon(true);
        executor = Executors.newSingleThreadExecutor(threads);
        running  = true;
        log.info("[Monitor] Event bus started");
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        log.info("[Monitor] Event bus stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ── Private ───────────────────────────────────────────────────────────────

    private void deliver(MonitorEvent event) {
        for (Consumer<MonitorEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                log.warn("[Monitor] Subscriber failed on {} event: {}", event.type(), e.getMessage());
            }
        }
    }
}
