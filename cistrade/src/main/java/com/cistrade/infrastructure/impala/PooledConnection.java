package com.cistrade.infrastructure.impala;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;

/**
 * A pooled session handle bound to one database.
 *
 * Owned by the pool while idle and by exactly one caller while checked out.
 * {@link #close()} hands the connection back to the pool, so handles can be used
 * with try-with-resources:
 * <pre>
 * try (PooledConnection pc = pool.acquire("gmp_cis")) {
 *     pc.connection().prepareStatement(...);
 * }
 * </pre>
 */
public final class PooledConnection implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PooledConnection.class);

    enum State { CHECKED_OUT, RETURNING, IDLE, DISCARDED }

    private final long id;
    private final String database;
    private final Instant createdAt;
    private final Connection connection;
    private final ConnectionPool owner;

    // transitions happen under the owning pool's lock
    private volatile State state = State.CHECKED_OUT;

    PooledConnection(long id, String database, Instant createdAt, Connection connection, ConnectionPool owner) {
        this.id = id;
        this.database = database;
        this.createdAt = createdAt;
        this.connection = connection;
        this.owner = owner;
    }

    public long id() {
        return id;
    }

    public String database() {
        return database;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /**
     * The underlying JDBC connection. Only valid while this handle is checked out.
     *
     * @throws IllegalStateException if the handle was already released or discarded
     */
    public Connection connection() {
        if (state != State.CHECKED_OUT) {
            throw new IllegalStateException("Connection #" + id + " is not checked out (state=" + state + ")");
        }
        return connection;
    }

    public boolean isCheckedOut() {
        return state == State.CHECKED_OUT;
    }

    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }

    /**
     * True once the connection has lived for at least {@code maxLifetime}.
     */
    public boolean isExpired(Instant now, Duration maxLifetime) {
        return age(now).compareTo(maxLifetime) >= 0;
    }

    /**
     * Return the connection to its pool. Calling this more than once is harmless.
     */
    @Override
    public void close() {
        if (state == State.CHECKED_OUT) {
            owner.release(this);
        }
    }

    @Override
    public String toString() {
        return "PooledConnection#" + id + "[" + database + ", " + state + "]";
    }

    State state() {
        return state;
    }

    void state(State state) {
        this.state = state;
    }

    ConnectionPool owner() {
        return owner;
    }

    Connection raw() {
        return connection;
    }

    /**
     * Close the JDBC session. Failures are logged, the pool has already given up on it.
     */
    void closeRaw() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("[ImpalaPool] Error closing connection #{} to {}: {}", id, database, e.getMessage());
        }
    }
}
