package com.cistrade.infrastructure.impala;

import com.cistrade.config.PoolConfig;
import com.cistrade.domain.common.ErrorKind;
import com.cistrade.infrastructure.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded connection pool for Impala/Kudu sessions.
 *
 * Features:
 * - Validate on checkout: age check against max lifetime plus a liveness check
 * - Validate on checkin: invalid connections are closed instead of kept idle
 * - Hard cap on live connections ({@code outstanding <= maxConnections})
 * - Bounded wait: acquire blocks at most the acquire timeout, then fails
 * - Per-database free lists; idle sessions of another database are evicted to make room
 *
 * Locking:
 * One mutex guards the free lists and all counters. Driver calls (open, validate, close)
 * run outside the mutex; a slot is reserved under the mutex before a connection is
 * opened, so the cap holds while the network call is in flight.
 *
 * Usage:
 * <pre>
 * ImpalaConnectionPool pool = new ImpalaConnectionPool(factory, PoolConfig.fromEnv(), "gmp_cis", metrics);
 * try (PooledConnection pc = pool.acquire("gmp_cis")) {
 *     // use pc.connection()
 * }
 * pool.close();
 * </pre>
 */
public final class ImpalaConnectionPool implements ConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(ImpalaConnectionPool.class);

    private final ConnectionFactory factory;
    private final PoolConfig config;
    private final String defaultDatabase;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final AtomicLong ids = new AtomicLong();

    // Guarded by lock
    private final Map<String, Deque<PooledConnection>> idle = new HashMap<>();
    private int outstanding;
    private int idleCount;
    private int checkedOut;
    private int waiting;
    private long totalCreated;
    private long totalDestroyed;
    private long totalAcquired;
    private long totalExhausted;

    private volatile boolean closed;

    public ImpalaConnectionPool(ConnectionFactory factory, PoolConfig config, String defaultDatabase,
                                PipelineMetrics metrics) {
        this(factory, config, defaultDatabase, metrics, Clock.systemUTC());
    }

    public ImpalaConnectionPool(ConnectionFactory factory, PoolConfig config, String defaultDatabase,
                                PipelineMetrics metrics, Clock clock) {
        this.factory = factory;
        this.config = config;
        this.defaultDatabase = defaultDatabase;
        this.metrics = metrics != null ? metrics : PipelineMetrics.NOOP;
        this.clock = clock;
        log.info("[ImpalaPool] Initialized (max={}, lifetime={}s, acquireTimeout={}ms, default db={})",
            config.maxConnections(), config.maxLifetime().getSeconds(),
            config.acquireTimeout().toMillis(), defaultDatabase);
    }

    @Override
    public PooledConnection acquire(String database) {
        String db = database == null || database.isBlank() ? defaultDatabase : database;
        long start = System.nanoTime();
        long deadline = start + config.acquireTimeout().toNanos();

        try {
            while (true) {
                PooledConnection candidate = null;
                PooledConnection evicted = null;
                boolean reserved = false;

                lock.lock();
                try {
                    while (true) {
                        ensureOpen(db);

                        candidate = pollIdle(db);
                        if (candidate != null) {
                            candidate.state(PooledConnection.State.CHECKED_OUT);
                            checkedOut++;
                            break;
                        }

                        if (outstanding < config.maxConnections()) {
                            outstanding++;
                            reserved = true;
                            break;
                        }

                        // Cap reached: an idle session bound to another database can give up its slot
                        evicted = evictIdleOfOtherDatabase(db);
                        if (evicted != null) {
                            // one destroyed, one reserved: outstanding is unchanged
                            totalDestroyed++;
                            reserved = true;
                            break;
                        }

                        long remaining = deadline - System.nanoTime();
                        if (remaining <= 0) {
                            totalExhausted++;
                            throw new PoolExhaustedException(db, config.maxConnections(),
                                Duration.ofNanos(System.nanoTime() - start));
                        }

                        waiting++;
                        try {
                            changed.awaitNanos(remaining);
                        } finally {
                            waiting--;
                        }
                    }
                } finally {
                    lock.unlock();
                }

                if (evicted != null) {
                    log.debug("[ImpalaPool] Evicted idle {} to make room for {}", evicted, db);
                    evicted.closeRaw();
                    metrics.recordPoolEvent(PipelineMetrics.EVENT_DESTROYED);
                }

                if (reserved) {
                    // a session the driver just opened is not validated here; the next release validates it
                    PooledConnection created = openReserved(db);
                    metrics.recordAcquire(Duration.ofNanos(System.nanoTime() - start), true);
                    return created;
                }

                if (isUsable(candidate)) {
                    lock.lock();
                    try {
                        totalAcquired++;
                    } finally {
                        lock.unlock();
                    }
                    metrics.recordAcquire(Duration.ofNanos(System.nanoTime() - start), true);
                    return candidate;
                }

                // Stale or dead: drop it and go round again with whatever time is left
                destroyCheckedOut(candidate);
            }
        } catch (PoolExhaustedException e) {
            log.warn("[ImpalaPool] {}", e.getMessage());
            metrics.recordPoolEvent(PipelineMetrics.EVENT_EXHAUSTED);
            metrics.recordAcquire(Duration.ofNanos(System.nanoTime() - start), false);
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.recordAcquire(Duration.ofNanos(System.nanoTime() - start), false);
            throw new ImpalaAccessException(ErrorKind.POOL_EXHAUSTED, db,
                "Interrupted while waiting for a connection", e);
        } catch (ImpalaAccessException e) {
            metrics.recordAcquire(Duration.ofNanos(System.nanoTime() - start), false);
            throw e;
        }
    }

    @Override
    public void release(PooledConnection pc) {
        if (pc == null) {
            return;
        }
        if (pc.owner() != this) {
            log.warn("[ImpalaPool] Ignoring release of {} owned by another pool", pc);
            return;
        }

        lock.lock();
        try {
            if (pc.state() != PooledConnection.State.CHECKED_OUT) {
                log.warn("[ImpalaPool] Ignoring release of {} (not checked out)", pc);
                return;
            }
            pc.state(PooledConnection.State.RETURNING);
            checkedOut--;
        } finally {
            lock.unlock();
        }

        boolean keep = !closed && isUsable(pc);

        lock.lock();
        try {
            if (keep && !closed) {
                pc.state(PooledConnection.State.IDLE);
                idle.computeIfAbsent(pc.database(), k -> new ArrayDeque<>()).addFirst(pc);
                idleCount++;
            } else {
                keep = false;
                pc.state(PooledConnection.State.DISCARDED);
                outstanding--;
                totalDestroyed++;
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }

        if (!keep) {
            pc.closeRaw();
            metrics.recordPoolEvent(PipelineMetrics.EVENT_DESTROYED);
            log.debug("[ImpalaPool] Closed {} on release", pc);
        }
    }

    @Override
    public void discard(PooledConnection pc) {
        if (pc == null || pc.owner() != this) {
            return;
        }
        if (destroyCheckedOut(pc)) {
            log.info("[ImpalaPool] Discarded {} after failure", pc);
        }
    }

    @Override
    public PoolStats stats() {
        lock.lock();
        try {
            return new PoolStats(config.maxConnections(), outstanding, idleCount, checkedOut, waiting,
                totalCreated, totalDestroyed, totalAcquired, totalExhausted);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String defaultDatabase() {
        return defaultDatabase;
    }

    @Override
    public void close() {
        List<PooledConnection> toClose = new ArrayList<>();
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            for (Deque<PooledConnection> deque : idle.values()) {
                for (PooledConnection pc : deque) {
                    pc.state(PooledConnection.State.DISCARDED);
                    toClose.add(pc);
                }
            }
            idle.clear();
            outstanding -= toClose.size();
            totalDestroyed += toClose.size();
            idleCount = 0;
            changed.signalAll();
        } finally {
            lock.unlock();
        }

        for (PooledConnection pc : toClose) {
            pc.closeRaw();
        }
        log.info("[ImpalaPool] Closed ({} idle connections closed, {} still checked out)",
            toClose.size(), stats().checkedOut());
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Open a connection for a slot already counted in {@code outstanding}.
     */
    private PooledConnection openReserved(String db) {
        Connection raw;
        try {
            raw = factory.create(db);
            if (raw == null) {
                throw new SQLException("Driver returned no connection");
            }
        } catch (SQLException | RuntimeException e) {
            lock.lock();
            try {
                outstanding--;
                changed.signalAll();
            } finally {
                lock.unlock();
            }
            metrics.recordPoolEvent(PipelineMetrics.EVENT_CREATE_FAILED);
            log.error("[ImpalaPool] Failed to connect to Impala database {}: {}", db, e.getMessage());
            throw new ConnectionCreateException(db, "Failed to open connection: " + e.getMessage(), e);
        }

        PooledConnection pc = new PooledConnection(ids.incrementAndGet(), db, clock.instant(), raw, this);
        int live;
        lock.lock();
        try {
            totalCreated++;
            totalAcquired++;
            checkedOut++;
            live = outstanding;
        } finally {
            lock.unlock();
        }
        metrics.recordPoolEvent(PipelineMetrics.EVENT_CREATED);
        log.info("[ImpalaPool] Opened connection #{} to {} ({}/{} live)", pc.id(), db, live, config.maxConnections());
        return pc;
    }

    /**
     * Mark a checked-out connection discarded, free its slot, close it.
     *
     * @return false if it was not checked out
     */
    private boolean destroyCheckedOut(PooledConnection pc) {
        lock.lock();
        try {
            if (pc.state() != PooledConnection.State.CHECKED_OUT) {
                log.warn("[ImpalaPool] Ignoring discard of {} (not checked out)", pc);
                return false;
            }
            pc.state(PooledConnection.State.DISCARDED);
            checkedOut--;
            outstanding--;
            totalDestroyed++;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        pc.closeRaw();
        metrics.recordPoolEvent(PipelineMetrics.EVENT_DESTROYED);
        return true;
    }

    /**
     * Age check plus liveness check. Runs outside the lock.
     */
    private boolean isUsable(PooledConnection pc) {
        if (pc.isExpired(clock.instant(), config.maxLifetime())) {
            log.debug("[ImpalaPool] {} exceeded max lifetime ({}s)", pc, config.maxLifetime().getSeconds());
            metrics.recordPoolEvent(PipelineMetrics.EVENT_EXPIRED);
            return false;
        }
        try {
            checkLiveness(pc);
            return true;
        } catch (ConnectionValidationException e) {
            log.warn("[ImpalaPool] {}", e.getMessage());
            metrics.recordPoolEvent(PipelineMetrics.EVENT_VALIDATION_FAILED);
            return false;
        }
    }

    private void checkLiveness(PooledConnection pc) {
        try {
            if (pc.raw().isClosed()) {
                throw new ConnectionValidationException(pc.database(), "Connection #" + pc.id() + " is closed", null);
            }
            try (Statement st = pc.raw().createStatement()) {
                st.setQueryTimeout(config.validationTimeoutSeconds());
                st.execute(config.validationQuery());
            }
        } catch (SQLException e) {
            throw new ConnectionValidationException(pc.database(),
                "Liveness check failed on connection #" + pc.id() + ": " + e.getMessage(), e);
        }
    }

    private PooledConnection pollIdle(String db) {
        Deque<PooledConnection> deque = idle.get(db);
        if (deque == null || deque.isEmpty()) {
            return null;
        }
        idleCount--;
        return deque.pollFirst();
    }

    private PooledConnection evictIdleOfOtherDatabase(String db) {
        Iterator<Map.Entry<String, Deque<PooledConnection>>> it = idle.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Deque<PooledConnection>> entry = it.next();
            if (entry.getKey().equals(db) || entry.getValue().isEmpty()) {
                continue;
            }
            // oldest first
            PooledConnection victim = entry.getValue().pollLast();
            idleCount--;
            victim.state(PooledConnection.State.DISCARDED);
            return victim;
        }
        return null;
    }

    private void ensureOpen(String db) {
        if (closed) {
            throw new ImpalaAccessException(ErrorKind.CONNECTION_CREATE_FAILURE, db, "Pool is closed");
        }
    }
}
