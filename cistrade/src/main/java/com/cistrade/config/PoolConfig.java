package com.cistrade.config;

import com.cistrade.util.Env;

import java.time.Duration;

/**
 * Sizing and validation settings for the Impala connection pool.
 */
public record PoolConfig(
    int maxConnections,
    Duration maxLifetime,
    Duration acquireTimeout,
    String validationQuery,
    int validationTimeoutSeconds
) {
    public static final String DEFAULT_VALIDATION_QUERY = "SELECT 1";

    public PoolConfig {
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be >= 1, got " + maxConnections);
        }
        if (maxLifetime == null || maxLifetime.isNegative() || maxLifetime.isZero()) {
            throw new IllegalArgumentException("maxLifetime must be positive");
        }
        if (acquireTimeout == null || acquireTimeout.isNegative()) {
            throw new IllegalArgumentException("acquireTimeout must not be negative");
        }
        if (validationQuery == null || validationQuery.isBlank()) {
            validationQuery = DEFAULT_VALIDATION_QUERY;
        }
    }

    public static PoolConfig defaults() {
        return new PoolConfig(10, Duration.ofHours(1), Duration.ofSeconds(30), DEFAULT_VALIDATION_QUERY, 5);
    }

    public static PoolConfig fromEnv() {
        return new PoolConfig(
            Env.getInt("POOL_MAX_CONNECTIONS", 10),
            Env.getSeconds("POOL_MAX_LIFETIME_SECONDS", 3600),
            Env.getSeconds("POOL_ACQUIRE_TIMEOUT_SECONDS", 30),
            Env.get("POOL_VALIDATION_QUERY", DEFAULT_VALIDATION_QUERY),
            Env.getInt("POOL_VALIDATION_TIMEOUT_SECONDS", 5)
        );
    }
}
