package com.cistrade.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

/**
 * HTTP handler for Prometheus /metrics endpoint.
 *
 * Gauges that mirror polled state (pool occupancy, queue depth) are refreshed by
 * {@code beforeScrape} right before the registry is written out.
 *
 * Example output:
 * <pre>
 * # HELP impala_pool_connections Impala pool connections by state
 * # TYPE impala_pool_connections gauge
 * impala_pool_connections{state="outstanding",} 3.0
 * impala_pool_connections{state="idle",} 2.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;
    private final Runnable beforeScrape;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this(registry, () -> { });
    }

    public PrometheusMetricsHandler(CollectorRegistry registry, Runnable beforeScrape) {
        this.registry = registry;
        this.beforeScrape = beforeScrape;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        try {
            try {
                beforeScrape.run();
            } catch (RuntimeException e) {
                log.warn("[PrometheusMetricsHandler] Gauge refresh failed: {}", e.getMessage());
            }

            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);

            Writer writer = new StringWriter();
            TextFormat.write004(writer, registry.metricFamilySamples());

            String metricsOutput = writer.toString();

            exchange.setStatusCode(200);
            exchange.getResponseSender().send(metricsOutput);

            log.debug("[PrometheusMetricsHandler] Served metrics ({} bytes)", metricsOutput.length());

        } catch (IOException e) {
            log.error("[PrometheusMetricsHandler] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
        }
    }
}
