package com.cistrade.infrastructure.metrics;

import com.cistrade.infrastructure.impala.PoolStats;

import java.time.Duration;

/**
 * Metrics for the connection pool and the audit pipeline.
 *
 * Implementations can publish to Prometheus or any other backend.
 *
 * Key metrics:
 * - Connection acquire latency and outcome
 * - Pool lifecycle events (created, destroyed, expired, validation failures, exhaustion)
 * - Pool occupancy (outstanding, idle, checked out)
 * - Audit entry outcomes (persisted, failed, fallback)
 * - Audit queue depth
 */
public interface PipelineMetrics {

    /**
     * Record an acquire attempt.
     *
     * @param wait time spent inside acquire
     * @param success whether a connection was handed out
     */
    void recordAcquire(Duration wait, boolean success);

    /**
     * Record a pool lifecycle event.
     *
     * @param event one of the {@code EVENT_*} constants
     */
    void recordPoolEvent(String event);

    /**
     * Publish current pool occupancy.
     */
    void updatePoolStats(PoolStats stats);

    /**
     * Record what happened to one audit entry.
     *
     * @param outcome one of the {@code AUDIT_*} constants
     */
    void recordAuditEntry(String outcome);

    /**
     * Publish the number of entries waiting in the audit queue.
     */
    void updateQueueDepth(int depth);

    String EVENT_CREATED = "created";
    String EVENT_CREATE_FAILED = "create_failed";
    String EVENT_DESTROYED = "destroyed";
    String EVENT_EXPIRED = "expired";
    String EVENT_VALIDATION_FAILED = "validation_failed";
    String EVENT_EXHAUSTED = "exhausted";

    String AUDIT_PERSISTED = "persisted";
    String AUDIT_FAILED = "failed";
    String AUDIT_REJECTED = "rejected";
    String AUDIT_FALLBACK_PERSISTED = "fallback_persisted";
    String AUDIT_FALLBACK_FAILED = "fallback_failed";

    /**
     * Metrics sink that drops everything. Used when no registry is wired.
     */
    PipelineMetrics NOOP = new PipelineMetrics() {
        @Override public void recordAcquire(Duration wait, boolean success) {}
        @Override public void recordPoolEvent(String event) {}
        @Override public void updatePoolStats(PoolStats stats) {}
        @Override public void recordAuditEntry(String outcome) {}
        @Override public void updateQueueDepth(int depth) {}
    };
}
