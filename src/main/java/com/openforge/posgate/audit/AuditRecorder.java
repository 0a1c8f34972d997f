package com.openforge.posgate.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.posgate.config.AuditProperties;
import com.openforge.posgate.domain.AuditLog;
import com.openforge.posgate.domain.User;
import com.openforge.posgate.repository.AuditLogRepository;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Fire-and-forget writer for the audit log.
 *
 * Guarantees:
 *   - {@link #record} never throws and never waits on the database
 *   - entries of one tenant are written in call order (one single-thread
 *     lane per tenant hash) with non-decreasing timestamps
 *   - inside a transaction the write waits for the outcome; a SUCCESS entry
 *     whose transaction rolled back is written as FAILURE
 *   - a write that still fails after the "auditWrite" retry is logged and dropped
 */
@Slf4j
@Component
public class AuditRecorder implements DisposableBean {

    static final String ROLLED_BACK_MESSAGE = "transaction rolled back";

    private final AuditLogRepository    repository;
    private final ObjectMapper          objectMapper;
    private final Retry                 retry;
    private final Clock                 clock;
    private final Duration              shutdownTimeout;
    private final List<ExecutorService> lanes;
    private final AtomicLong            lastTimestamp = new AtomicLong();

    public AuditRecorder(AuditLogRepository repository,
                         ObjectMapper objectMapper,
                         Retry auditWriteRetry,
                         Clock clock,
                         AuditProperties properties) {
        this.repository      = repository;
        this.objectMapper    = objectMapper;
        this.retry           = auditWriteRetry;
        this.clock           = clock;
        this.shutdownTimeout = properties.shutdownTimeout();

        int laneCount = Math.max(1, properties.lanes());
        CustomizableThreadFactory threads = new CustomizableThreadFactory("audit-lane-");
        threads.setDaemon(true);
        List<ExecutorService> created = new ArrayList<>(laneCount);
        for (int i = 0; i < laneCount; i++) {
            created.add(Executors.newSingleThreadExecutor(threads));
        }
        this.lanes = List.copyOf(created);
    }

    /**
     * Queue one entry. Safe to call from any thread, inside or outside a transaction.
     */
    public void record(AuditEntry entry) {
        try {
            Instant timestamp = stamp();
            String  logId     = nextLogId(timestamp);

            if (TransactionSynchronizationManager.isSynchronizationActive()) {
                TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                    @Override
                    public void afterCompletion(int status) {
                        AuditEntry outcome = status == STATUS_ROLLED_BACK ? asRolledBack(entry) : entry;
                        dispatch(toRow(outcome, logId, timestamp));
                    }
                });
            } else {
                dispatch(toRow(entry, logId, timestamp));
            }
        } catch (RuntimeException e) {
            log.error("[Audit] Could not queue {} entry: {}", entry.action(), e.getMessage(), e);
        }
    }

    /**
     * Run {@code operation} and record exactly one entry for it: SUCCESS with
     * whatever the operation filled into the builder, or FAILURE carrying the
     * exception message. The exception is rethrown unchanged.
     */
    public <T> T attempt(AuditEntry.AuditEntryBuilder entry, Supplier<T> operation) {
        T result;
        try {
            result = operation.get();
        } catch (RuntimeException e) {
            record(entry.status(AuditLog.Status.FAILURE).errorMessage(e.getMessage()).build());
            throw e;
        }
        record(entry.status(AuditLog.Status.SUCCESS).build());
        return result;
    }

    @Override
    public void destroy() {
        lanes.forEach(ExecutorService::shutdown);
        long deadline = System.nanoTime() + shutdownTimeout.toNanos();
        for (ExecutorService lane : lanes) {
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                if (!lane.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    log.warn("[Audit] Shutdown timeout reached; {} queued entries dropped",
                            lane.shutdownNow().size());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lane.shutdownNow();
            }
        }
        log.info("[Audit] Lanes stopped");
    }

    // ── Private ───────────────────────────────────────────────────────────────

    private void dispatch(AuditLog row) {
        ExecutorService lane = lanes.get(Math.floorMod(row.getTenantId().hashCode(), lanes.size()));
        try {
            lane.execute(() -> write(row));
        } catch (RejectedExecutionException e) {
            log.warn("[Audit] Recorder stopped; dropped {} entry {} for tenant={}",
                    row.getAction(), row.getLogId(), row.getTenantId());
        }
    }

    private void write(AuditLog row) {
        try {
            retry.executeRunnable(() -> repository.save(row));
        } catch (Exception e) {
            log.warn("[Audit] Failed to persist {} entry {} for tenant={}: {}",
                    row.getAction(), row.getLogId(), row.getTenantId(), e.getMessage());
        }
    }

    private Instant stamp() {
        return Instant.ofEpochMilli(lastTimestamp.accumulateAndGet(clock.millis(), Math::max));
    }

    private static String nextLogId(Instant timestamp) {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return "log_" + Long.toString(timestamp.toEpochMilli(), 36) + "_" + random;
    }

    private static AuditEntry asRolledBack(AuditEntry entry) {
        if (entry.status() != null && entry.status() != AuditLog.Status.SUCCESS) {
            return entry;
        }
        return entry.toBuilder()
                .status(AuditLog.Status.FAILURE)
                .errorMessage(ROLLED_BACK_MESSAGE)
                .build();
    }

    private AuditLog toRow(AuditEntry entry, String logId, Instant timestamp) {
        return AuditLog.builder()
                .logId(logId)
                .tenantId(entry.tenantId() == null ? User.GLOBAL_TENANT : entry.tenantId())
                .userId(entry.userId() == null ? "unknown" : entry.userId())
                .userName(entry.userName())
                .userRole(entry.userRole())
                .action(entry.action())
                .resourceType(entry.resourceType())
                .resourceId(entry.resourceId())
                .resourceName(entry.resourceName())
                .details(toJson(entry.details()))
                .previousState(toJson(entry.previousState()))
                .newState(toJson(entry.newState()))
                .status(entry.status() == null ? AuditLog.Status.SUCCESS : entry.status())
                .errorMessage(entry.errorMessage())
                .createdAt(timestamp)
                .build();
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
