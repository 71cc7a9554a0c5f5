package com.cistrade.infrastructure.impala;

import com.cistrade.domain.common.ErrorKind;

import java.time.Duration;

/**
 * Exception thrown when no connection became available within the acquire timeout.
 */
public class PoolExhaustedException extends ImpalaAccessException {

    private final Duration waited;

    public PoolExhaustedException(String database, int maxConnections, Duration waited) {
        super(ErrorKind.POOL_EXHAUSTED, database,
            "No connection available after " + waited.toMillis() + "ms (max " + maxConnections + ")");
        this.waited = waited;
    }

    public Duration getWaited() {
        return waited;
    }
}
