package com.openforge.posgate.monitor;

/**
 * Classifies every event pushed to the monitor stream.
 */
public enum MonitorEventType {

    /** An /api request arrived. tenantId / userId are not known yet. */
    REQUEST_START,

    /** The response was committed. Carries status, success and durationMs. */
    REQUEST_END,

    /** A request failed with an error response. Carries code and message. */
    ERROR
}
