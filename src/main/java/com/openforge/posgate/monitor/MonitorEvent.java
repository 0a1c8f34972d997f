package com.openforge.posgate.monitor;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The envelope broadcast on the monitor topics.
 *
 *   requestId : correlates REQUEST_START, ERROR and REQUEST_END of one request
 *   tenantId : null for REQUEST_START and for unauthenticated requests
 *   timestamp : epoch millis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MonitorEvent(
        String           requestId,
        MonitorEventType type,
        String           method,
        String           path,
        String           tenantId,
        String           userId,
        Integer          status,
        Boolean          success,
        Long             durationMs,
        String           code,
        String           message,
        long             timestamp
) {

    // ── Static factory helpers ───────────────────────────────────────────────

    public static MonitorEvent start(String requestId, String method, String path) {
        return new MonitorEvent(requestId, MonitorEventType.REQUEST_START, method, path,
                null, null, null, null, null, null, null, now());
    }

    public static MonitorEvent end(String requestId, String method, String path,
                                   String tenantId, String userId, int status, long durationMs) {
        return new MonitorEvent(requestId, MonitorEventType.REQUEST_END, method, path,
                tenantId, userId, status, status < 400, durationMs, null, null, now());
    }

    public static MonitorEvent error(String requestId, String method, String path,
                                     String tenantId, String userId, int status, String code, String message) {
        return new MonitorEvent(requestId, MonitorEventType.ERROR, method, path,
                tenantId, userId, status, false, null, code, message, now());
    }

    private static long now() {
        return System.currentTimeMillis();
    }
}
