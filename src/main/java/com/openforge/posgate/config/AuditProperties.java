package com.openforge.posgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * pos:
 *   audit:
 *     lanes: 4               # single-thread writers; a tenant always maps to the same lane
 *     shutdown-timeout: 10s  # how long shutdown waits for queued entries
 */
@ConfigurationProperties(prefix = "pos.audit")
public record AuditProperties(
        @DefaultValue("4")   int      lanes,
        @DefaultValue("10s") Duration shutdownTimeout
) {}
