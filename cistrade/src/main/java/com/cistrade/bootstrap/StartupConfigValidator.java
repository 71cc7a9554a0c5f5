package com.cistrade.bootstrap;

import com.cistrade.config.AuditConfig;
import com.cistrade.config.ImpalaConfig;
import com.cistrade.config.PoolConfig;
import com.cistrade.infrastructure.impala.JdbcConnectionFactory;
import com.cistrade.infrastructure.persistence.ImpalaAuditRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup configuration validator.
 *
 * Validates configuration at startup before anything connects to Impala.
 * Throws IllegalStateException if configuration is invalid.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * Validate configuration at startup.
     *
     * Called from App.main() before the pool is built. If validation fails, the
     * service refuses to start.
     *
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(ImpalaConfig impala, PoolConfig pool, AuditConfig audit) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        validateImpala(impala);
        validatePool(pool, impala);
        validateAudit(audit);

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void validateImpala(ImpalaConfig impala) {
        if (!impala.hasExplicitUrl()) {
            if (impala.host() == null || impala.host().isBlank()) {
                throw new IllegalStateException(
                    "❌ INVALID CONFIG: IMPALA_HOST is empty and no IMPALA_JDBC_URL is set");
            }
            if (impala.port() < 1 || impala.port() > 65535) {
                throw new IllegalStateException(
                    "❌ INVALID CONFIG: IMPALA_PORT out of range: " + impala.port());
            }
        } else if (!impala.jdbcUrl().startsWith("jdbc:")) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: IMPALA_JDBC_URL must start with jdbc:");
        }

        int mech;
        try {
            mech = JdbcConnectionFactory.authMech(impala.authMechanism());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: IMPALA_AUTH must be one of NOSASL, GSSAPI, LDAP, PLAIN (got "
                    + impala.authMechanism() + ")");
        }

        if (mech == 3 && (impala.user() == null || impala.user().isBlank())) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: IMPALA_AUTH=" + impala.authMechanism() + " requires IMPALA_USER\n" +
                "Either:\n" +
                "  1. Set IMPALA_USER and IMPALA_PASSWORD\n" +
                "  2. Use IMPALA_AUTH=GSSAPI with a Kerberos ticket"
            );
        }
        if (!impala.useSsl()) {
            log.warn("⚠️  IMPALA_USE_SSL=false - connections to {} are not encrypted", impala.host());
        }
        log.info("✓ Impala target {}:{} database={} auth={}",
            impala.host(), impala.port(), impala.database(), impala.authMechanism());
    }

    private static void validatePool(PoolConfig pool, ImpalaConfig impala) {
        if (pool.validationTimeoutSeconds() > impala.timeoutSeconds() && impala.timeoutSeconds() > 0) {
            log.warn("⚠️  POOL_VALIDATION_TIMEOUT_SECONDS ({}) exceeds IMPALA_TIMEOUT ({})",
                pool.validationTimeoutSeconds(), impala.timeoutSeconds());
        }
        log.info("✓ Pool max={} lifetime={}s acquireTimeout={}s",
            pool.maxConnections(), pool.maxLifetime().toSeconds(), pool.acquireTimeout().toSeconds());
    }

    private static void validateAudit(AuditConfig audit) {
        if (!audit.enabled()) {
            log.warn("⚠️  AUDIT_LOG_ENABLED=false - audit entries will be dropped");
        }
        if (audit.queueCapacity() < 1) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: AUDIT_QUEUE_CAPACITY must be >= 1 (got " + audit.queueCapacity() + ")");
        }
        if (audit.workerCount() < 1) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: AUDIT_WORKERS must be >= 1 (got " + audit.workerCount() + ")");
        }
        if (audit.pollInterval().isZero() || audit.pollInterval().isNegative()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: AUDIT_POLL_INTERVAL_MS must be positive");
        }
        if (!ImpalaAuditRepository.isValidTableName(audit.table())) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: AUDIT_TABLE is not a valid identifier: " + audit.table());
        }
        log.info("✓ Audit table={} workers={} queueCapacity={}",
            audit.table(), audit.workerCount(), audit.queueCapacity());
    }

    private StartupConfigValidator() {
        // Utility class - no instantiation
    }
}
