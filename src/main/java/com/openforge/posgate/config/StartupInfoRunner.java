package com.openforge.posgate.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - Database: opens a real JDBC connection and reads the server version
 *   - Tokens: TTLs, session cap and login throttle (secrets are never printed)
 *   - Audit: lane count and drain timeout
 *   - Bootstrap: whether first-deployment provisioning is enabled
 */
@Slf4j
@Component
@Order(2)
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource          dataSource;
    private final AuthProperties      authProperties;
    private final AuditProperties     auditProperties;
    private final BootstrapProperties bootstrapProperties;
    private final Environment         env;

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              POS Gate    Startup Summary                 ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ║    Profiles       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database                                                ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Tokens                                                  ║
                ║    Issuer         : {}
                ║    Access TTL     : {}
                ║    Refresh TTL    : {}
                ║    Max sessions   : {}
                ║    Login throttle : {} per {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Audit                                                   ║
                ║    Lanes          : {}  drain timeout={}
                ║    Bootstrap      : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),
                String.join(",", env.getActiveProfiles()),

                checkDatabase(),

                authProperties.issuer(),
                authProperties.accessTokenTtl(),
                authProperties.refreshTokenTtl(),
                authProperties.maxSessions(),
                authProperties.loginAttempts(), authProperties.loginWindow(),

                auditProperties.lanes(), auditProperties.shutdownTimeout(),
                bootstrapProperties.autoCreate() ? "✔ auto-create" : "✘ disabled"
        );
    }

    /**
     * Opens a real JDBC connection and reads the DB server version.
     * Returns a one-line summary or error message.
     */
    private String checkDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String product = conn.getMetaData().getDatabaseProductName();
            String version = conn.getMetaData().getDatabaseProductVersion();
            // Strip credentials from the JDBC URL for safe logging
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  " + product + " " + version + "  url=" + safeUrl;
        } catch (Exception e) {
            return "✘ FAILED: " + e.getMessage();
        }
    }
}
