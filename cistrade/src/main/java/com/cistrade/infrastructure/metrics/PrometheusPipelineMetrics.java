package com.cistrade.infrastructure.metrics;

import com.cistrade.infrastructure.impala.PoolStats;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of PipelineMetrics.
 *
 * Key Metrics:
 * - impala_pool_connections{state} - outstanding / idle / checked_out / waiting / max
 * - impala_pool_acquire_seconds{result} - time spent in acquire
 * - impala_pool_events_total{event} - created, destroyed, expired, validation_failed, exhausted
 * - audit_entries_total{outcome} - persisted, failed, rejected, fallback_persisted, fallback_failed
 * - audit_queue_depth - entries waiting for a worker
 *
 * Usage:
 * <pre>
 * PrometheusPipelineMetrics metrics = new PrometheusPipelineMetrics();
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusPipelineMetrics implements PipelineMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusPipelineMetrics.class);

    private final CollectorRegistry registry;

    private final Gauge poolConnections;
    private final Histogram acquireLatency;
    private final Counter poolEventCounter;
    private final Counter auditEntryCounter;
    private final Gauge queueDepth;

    public PrometheusPipelineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusPipelineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.poolConnections = Gauge.build()
            .name("impala_pool_connections")
            .help("Impala pool connections by state")
            .labelNames("state")
            .register(registry);

        this.acquireLatency = Histogram.build()
            .name("impala_pool_acquire_seconds")
            .help("Time spent acquiring a pooled connection in seconds")
            .labelNames("result")
            .buckets(0.001, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0, 10.0, 30.0)
            .register(registry);

        this.poolEventCounter = Counter.build()
            .name("impala_pool_events_total")
            .help("Total number of connection lifecycle events")
            .labelNames("event")
            .register(registry);

        this.auditEntryCounter = Counter.build()
            .name("audit_entries_total")
            .help("Total number of audit entries by outcome")
            .labelNames("outcome")
            .register(registry);

        this.queueDepth = Gauge.build()
            .name("audit_queue_depth")
            .help("Audit entries waiting in the queue")
            .register(registry);

        log.info("[PrometheusPipelineMetrics] Initialized");
    }

    @Override
    public void recordAcquire(Duration wait, boolean success) {
        acquireLatency.labels(success ? "success" : "failure").observe(wait.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordPoolEvent(String event) {
        poolEventCounter.labels(event).inc();
    }

    @Override
    public void updatePoolStats(PoolStats stats) {
        poolConnections.labels("max").set(stats.maxConnections());
        poolConnections.labels("outstanding").set(stats.outstanding());
        poolConnections.labels("idle").set(stats.idle());
        poolConnections.labels("checked_out").set(stats.checkedOut());
        poolConnections.labels("waiting").set(stats.waiting());
    }

    @Override
    public void recordAuditEntry(String outcome) {
        auditEntryCounter.labels(outcome).inc();
    }

    @Override
    public void updateQueueDepth(int depth) {
        queueDepth.set(depth);
    }

    /**
     * Get Prometheus CollectorRegistry for /metrics endpoint.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
