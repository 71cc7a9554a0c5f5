package com.cistrade.infrastructure.impala;

/**
 * Connection pool with acquire/release semantics for concurrent callers.
 */
public interface ConnectionPool extends AutoCloseable {

    /**
     * Acquire a validated, non-expired connection bound to {@code database}.
     * Blocks at most the configured acquire timeout.
     *
     * @param database database name, or null for the pool's default database
     * @throws PoolExhaustedException if no connection became available in time
     * @throws ConnectionCreateException if a new session could not be opened
     */
    PooledConnection acquire(String database);

    default PooledConnection acquire() {
        return acquire(null);
    }

    /**
     * Return a connection. It is re-validated and either kept idle or closed.
     */
    void release(PooledConnection connection);

    /**
     * Close a checked-out connection without returning it, e.g. after a failed write.
     */
    void discard(PooledConnection connection);

    /**
     * Current pool statistics.
     */
    PoolStats stats();

    String defaultDatabase();

    /**
     * Close idle connections and refuse further acquires.
     */
    @Override
    void close();
}
