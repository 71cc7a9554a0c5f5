package com.cistrade.bootstrap;

import com.cistrade.application.service.AsyncAuditWriter;
import com.cistrade.application.service.AuditStats;
import com.cistrade.application.service.QueueingAuditRecorder;
import com.cistrade.config.AuditConfig;
import com.cistrade.config.ImpalaConfig;
import com.cistrade.config.PoolConfig;
import com.cistrade.domain.common.DbResult;
import com.cistrade.infrastructure.impala.ImpalaConnectionPool;
import com.cistrade.infrastructure.impala.ImpalaQueryExecutor;
import com.cistrade.infrastructure.impala.JdbcConnectionFactory;
import com.cistrade.infrastructure.metrics.PrometheusMetricsHandler;
import com.cistrade.infrastructure.metrics.PrometheusPipelineMetrics;
import com.cistrade.infrastructure.persistence.ImpalaAuditRepository;
import com.cistrade.security.AuditSanitizer;
import com.cistrade.transport.http.AuditApiHandlers;
import com.cistrade.transport.http.AuditHttpHandler;
import com.cistrade.transport.http.AuditRequestClassifier;
import com.cistrade.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Service entry point: builds the pool, the audit pipeline and the HTTP surface, and
 * tears them down in reverse order on shutdown.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== CisTrade Audit Pipeline Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        int port = Env.getInt("PORT", 9090);

        ImpalaConfig impalaConfig;
        PoolConfig poolConfig;
        AuditConfig auditConfig;
        try {
            impalaConfig = ImpalaConfig.fromEnv();
            poolConfig = PoolConfig.fromEnv();
            auditConfig = AuditConfig.fromEnv();
            StartupConfigValidator.validate(impalaConfig, poolConfig, auditConfig);
        } catch (IllegalStateException | IllegalArgumentException e) {
            log.error("❌ STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(1);
            return;
        }

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusPipelineMetrics metrics = new PrometheusPipelineMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Impala connection pool
        // ═══════════════════════════════════════════════════════════════
        ImpalaConnectionPool pool = new ImpalaConnectionPool(
            new JdbcConnectionFactory(impalaConfig), poolConfig, impalaConfig.database(), metrics);
        ImpalaQueryExecutor executor = new ImpalaQueryExecutor(pool, impalaConfig.timeoutSeconds());
        log.info("✓ Impala pool ready: {}", impalaConfig);

        // ═══════════════════════════════════════════════════════════════
        // Audit pipeline
        // ═══════════════════════════════════════════════════════════════
        ImpalaAuditRepository auditRepo = new ImpalaAuditRepository(
            executor, auditConfig.table(), impalaConfig.database(), auditConfig.useUpsert(),
            auditConfig.partitionZone(), Clock.systemUTC());
        if (Env.getBool("AUDIT_CREATE_TABLE", false)) {
            DbResult<Void> ddl = auditRepo.ensureTable();
            if (!ddl.isSuccess()) {
                log.warn("⚠️  Could not create audit table {}: {}", auditConfig.table(), ddl.message());
            }
        }

        AsyncAuditWriter writer = new AsyncAuditWriter(auditRepo, auditConfig, new AuditStats(), metrics);
        if (auditConfig.enabled()) {
            writer.start();
        }
        QueueingAuditRecorder recorder = new QueueingAuditRecorder(auditConfig.enabled(), writer, auditRepo, metrics);
        log.info("✓ Audit pipeline initialized (enabled={})", auditConfig.enabled());

        if (executor.testConnection()) {
            log.info("✓ Impala connection test passed");
        } else {
            log.warn("⚠️  Impala connection test failed - audit writes will fail until the database is reachable");
        }

        // ═══════════════════════════════════════════════════════════════
        // HTTP handlers
        // ═══════════════════════════════════════════════════════════════
        AuditSanitizer sanitizer = new AuditSanitizer();
        AuditApiHandlers api = new AuditApiHandlers(
            recorder, auditRepo, writer, pool, executor, sanitizer, auditConfig.partitionZone());

        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry(), () -> {
            metrics.updatePoolStats(pool.stats());
            metrics.updateQueueDepth(writer.queueDepth());
        });
        log.info("✓ Prometheus /metrics endpoint ready");

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", new BlockingHandler(api::health))
            .post("/api/audit/events", new BlockingHandler(api::recordEvent))
            .get("/api/audit/events", new BlockingHandler(api::listEvents))
            .post("/api/audit/events/batch", new BlockingHandler(api::recordBatch))
            .get("/api/audit/statistics", new BlockingHandler(api::statistics))
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "CisTrade Audit Pipeline\n\n" +
                    "API:     GET /api/health, GET|POST /api/audit/events, POST /api/audit/events/batch,\n" +
                    "         GET /api/audit/statistics?days=30\n" +
                    "Metrics: GET /metrics\n"
                );
            });

        AuditHttpHandler auditedRoutes = new AuditHttpHandler(
            routes, recorder, new AuditRequestClassifier(), sanitizer, auditConfig.partitionZone());

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(auditedRoutes)
            .build();

        server.start();
        log.info("✓ HTTP API server started on port {}", port);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            server.stop();
            AsyncAuditWriter.ShutdownReport report = writer.shutdown(auditConfig.shutdownTimeout());
            if (report.remaining() > 0) {
                log.warn("⚠️  {} audit entries were not persisted before shutdown", report.remaining());
            }
            pool.close();
            log.info("CisTrade Audit Pipeline stopped");
        }, "shutdown-hook"));
    }
}
