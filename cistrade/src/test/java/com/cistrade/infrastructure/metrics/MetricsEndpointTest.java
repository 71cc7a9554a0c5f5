package com.cistrade.infrastructure.metrics;

import com.cistrade.infrastructure.impala.PoolStats;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 */
public class MetricsEndpointTest {

    private static final int TEST_PORT = 19090;
    private Undertow server;
    private PrometheusPipelineMetrics metrics;
    private HttpClient httpClient;
    private final AtomicInteger scrapes = new AtomicInteger();

    @BeforeEach
    public void setUp() {
        metrics = new PrometheusPipelineMetrics(new CollectorRegistry());

        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry(), () -> {
            scrapes.incrementAndGet();
            metrics.updatePoolStats(new PoolStats(10, 3, 2, 1, 0, 3, 0, 11, 0));
            metrics.updateQueueDepth(7);
        });

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path().addPrefixPath("/metrics", metricsHandler))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> scrape() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics"))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMetricsEndpointAccessible() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode());
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        assertTrue(contentType.contains("text/plain"), "Content-Type should be Prometheus text format");
    }

    @Test
    public void testGaugesRefreshedBeforeScrape() throws Exception {
        String body = scrape().body();

        assertEquals(1, scrapes.get());
        assertTrue(body.contains("# TYPE audit_queue_depth gauge"));
        assertTrue(body.contains("audit_queue_depth 7.0"), body);
        assertTrue(body.contains("impala_pool_connections{state=\"outstanding\",} 3.0"), body);
    }

    @Test
    public void testRecordedEventsExported() throws Exception {
        metrics.recordPoolEvent(PipelineMetrics.EVENT_EXHAUSTED);
        metrics.recordAuditEntry(PipelineMetrics.AUDIT_FALLBACK_FAILED);

        String body = scrape().body();

        assertTrue(body.contains("impala_pool_events_total{event=\"exhausted\",} 1.0"), body);
        assertTrue(body.contains("audit_entries_total{outcome=\"fallback_failed\",} 1.0"), body);
    }
}
