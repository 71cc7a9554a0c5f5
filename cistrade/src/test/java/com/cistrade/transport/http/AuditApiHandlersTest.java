package com.cistrade.transport.http;

import com.cistrade.application.port.input.AuditRecorder;
import com.cistrade.application.port.output.AuditRepository;
import com.cistrade.application.service.AsyncAuditWriter;
import com.cistrade.application.service.AuditStats;
import com.cistrade.domain.audit.AuditAction;
import com.cistrade.domain.audit.AuditEntry;
import com.cistrade.domain.audit.AuditQuery;
import com.cistrade.domain.audit.AuditStatistics;
import com.cistrade.domain.common.DbResult;
import com.cistrade.domain.common.ErrorKind;
import com.cistrade.infrastructure.impala.ConnectionPool;
import com.cistrade.infrastructure.impala.ImpalaQueryExecutor;
import com.cistrade.infrastructure.impala.PoolStats;
import com.cistrade.security.AuditSanitizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.handlers.BlockingHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * Drives the audit API through a real Undertow listener, routed the same way App routes it.
 */
public class AuditApiHandlersTest {

    private static final int TEST_PORT = 19092;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<AuditEntry> recorded = new CopyOnWriteArrayList<>();
    private volatile AuditRecorder.RecordOutcome nextOutcome = AuditRecorder.RecordOutcome.QUEUED;

    private AuditRepository repository;
    private ConnectionPool pool;
    private ImpalaQueryExecutor executor;
    private Undertow server;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        repository = mock(AuditRepository.class);
        pool = mock(ConnectionPool.class);
        executor = mock(ImpalaQueryExecutor.class);
        when(pool.stats()).thenReturn(new PoolStats(10, 2, 1, 1, 0, 2, 0, 40, 0));

        AuditRecorder recorder = entry -> {
            recorded.add(entry);
            return nextOutcome;
        };
        AsyncAuditWriter writer = new AsyncAuditWriter(
            repository, 50, 1, Duration.ofMillis(50), new AuditStats(), null);

        AuditApiHandlers api = new AuditApiHandlers(
            recorder, repository, writer, pool, executor,
            new AuditSanitizer(), ZoneId.of("Asia/Singapore"));

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.routing()
                .get("/api/health", new BlockingHandler(api::health))
                .post("/api/audit/events", new BlockingHandler(api::recordEvent))
                .get("/api/audit/events", new BlockingHandler(api::listEvents))
                .post("/api/audit/events/batch", new BlockingHandler(api::recordBatch))
                .get("/api/audit/statistics", new BlockingHandler(api::statistics)))
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

    private HttpResponse<String> post(String body) throws Exception {
        return post("/api/audit/events", body);
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .header("Content-Type", "application/json")
            .header("X-Auth-User", "checker2")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String pathAndQuery) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + pathAndQuery))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testRecordEventIsAccepted() throws Exception {
        HttpResponse<String> response = post("{"
            + "\"action\":\"update\",\"objectType\":\"Portfolio\",\"objectId\":\"P-17\","
            + "\"oldValue\":{\"name\":\"Core\",\"password\":\"old-pw\"},"
            + "\"newValue\":{\"name\":\"Core Plus\",\"password\":\"new-pw\"},"
            + "\"requiresApproval\":true}");

        assertEquals(202, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("QUEUED", body.get("outcome").asText());

        assertEquals(1, recorded.size());
        AuditEntry entry = recorded.get(0);
        assertEquals(entry.entryId(), body.get("entryId").asText());
        assertEquals(AuditAction.UPDATE, entry.action());
        assertEquals("Portfolio", entry.objectType());
        assertEquals("P-17", entry.objectId());
        assertEquals("checker2", entry.username());
        assertTrue(entry.requiresApproval());
        assertEquals(AuditSanitizer.MASK, entry.oldValue().get("password").asText());
        assertEquals(AuditSanitizer.MASK, entry.newValue().get("password").asText());
        assertEquals("Core Plus", entry.changes().get("name").get("new").asText());
        assertEquals("/api/audit/events", entry.request().path());
    }

    @Test
    public void testRecordEventFailureIsUnavailable() throws Exception {
        nextOutcome = AuditRecorder.RecordOutcome.FAILED;

        HttpResponse<String> response = post("{\"action\":\"EXPORT\",\"objectType\":\"Report\"}");

        assertEquals(503, response.statusCode());
        assertEquals("FAILED", MAPPER.readTree(response.body()).get("outcome").asText());
    }

    @Test
    public void testMissingActionIsBadRequest() throws Exception {
        HttpResponse<String> response = post("{\"objectType\":\"Portfolio\"}");

        assertEquals(400, response.statusCode());
        assertEquals("action is required", MAPPER.readTree(response.body()).get("error").asText());
        assertTrue(recorded.isEmpty());
    }

    @Test
    public void testUnknownActionIsBadRequest() throws Exception {
        assertEquals(400, post("{\"action\":\"FROBNICATE\",\"objectType\":\"Portfolio\"}").statusCode());
    }

    @Test
    public void testMalformedJsonIsBadRequest() throws Exception {
        HttpResponse<String> response = post("{\"action\":");

        assertEquals(400, response.statusCode());
        assertTrue(MAPPER.readTree(response.body()).get("error").asText().startsWith("Malformed JSON"));
    }

    @Test
    public void testListEventsPassesFilters() throws Exception {
        AuditEntry stored = AuditEntry.builder(AuditAction.UPDATE, "Portfolio")
            .entryId("e-1")
            .eventTime(Instant.parse("2026-02-03T04:05:06Z"))
            .actor("7", "alice")
            .objectId("P-17")
            .build();
        when(repository.findRecent(any())).thenReturn(DbResult.ok(List.of(stored)));

        HttpResponse<String> response = get(
            "/api/audit/events?username=alice&action=update&from=2026-02-01&to=2026-02-04&limit=5");

        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals(1, body.get("count").asInt());
        assertEquals("e-1", body.get("entries").get(0).get("entryId").asText());
        assertEquals("2026-02-03T04:05:06Z", body.get("entries").get(0).get("eventTime").asText());

        ArgumentCaptor<AuditQuery> captor = ArgumentCaptor.forClass(AuditQuery.class);
        verify(repository).findRecent(captor.capture());
        AuditQuery query = captor.getValue();
        assertEquals("alice", query.username());
        assertEquals(AuditAction.UPDATE, query.action());
        assertEquals(LocalDate.of(2026, 2, 1), query.fromDate());
        assertEquals(LocalDate.of(2026, 2, 4), query.toDate());
        assertEquals(5, query.limit());
        assertNull(query.objectType());
    }

    @Test
    public void testListEventsRejectsBadDates() throws Exception {
        assertEquals(400, get("/api/audit/events?from=yesterday").statusCode());
        assertEquals(400, get("/api/audit/events?from=2026-02-05&to=2026-02-01").statusCode());
        verify(repository, never()).findRecent(any());
    }

    @Test
    public void testListEventsRepositoryFailure() throws Exception {
        when(repository.findRecent(any()))
            .thenReturn(DbResult.fail(ErrorKind.POOL_EXHAUSTED, "no connection within 30s"));

        HttpResponse<String> response = get("/api/audit/events");

        assertEquals(503, response.statusCode());
        assertEquals("POOL_EXHAUSTED", MAPPER.readTree(response.body()).get("error").asText());
    }

    @Test
    public void testHealthReportsPoolAndQueue() throws Exception {
        when(executor.testConnection()).thenReturn(true);

        HttpResponse<String> response = get("/api/health");

        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("ok", body.get("status").asText());
        assertTrue(body.get("impalaConnected").asBoolean());
        assertEquals(10, body.get("pool").get("maxConnections").asInt());
        assertEquals(2, body.get("pool").get("outstanding").asInt());
        assertFalse(body.get("audit").get("accepting").asBoolean());
        assertEquals(50, body.get("audit").get("queueCapacity").asInt());
        assertEquals(0, body.get("audit").get("queueDepth").asInt());
    }

    @Test
    public void testHealthDegradedWhenImpalaDown() throws Exception {
        when(executor.testConnection()).thenReturn(false);

        HttpResponse<String> response = get("/api/health");

        assertEquals(503, response.statusCode());
        assertEquals("degraded", MAPPER.readTree(response.body()).get("status").asText());
    }

    @Test
    public void testRecordBatchRecordsEveryEvent() throws Exception {
        HttpResponse<String> response = post("/api/audit/events/batch", "["
            + "{\"action\":\"create\",\"objectType\":\"Order\",\"objectId\":\"O-1\"},"
            + "{\"action\":\"APPROVE\",\"objectType\":\"Order\",\"objectId\":\"O-1\","
            + "\"newValue\":{\"token\":\"abc\"}}]");

        assertEquals(202, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals(2, body.get("count").asInt());
        assertEquals(2, body.get("queued").asInt());
        assertEquals(0, body.get("failed").asInt());

        assertEquals(2, recorded.size());
        assertEquals(recorded.get(0).entryId(), body.get("entryIds").get(0).asText());
        assertEquals(AuditAction.APPROVE, recorded.get(1).action());
        assertEquals("checker2", recorded.get(1).username());
        assertEquals(AuditSanitizer.MASK, recorded.get(1).newValue().get("token").asText());
    }

    @Test
    public void testRecordBatchReportsFailures() throws Exception {
        nextOutcome = AuditRecorder.RecordOutcome.FAILED;

        HttpResponse<String> response = post("/api/audit/events/batch",
            "[{\"action\":\"EXPORT\",\"objectType\":\"Report\"}]");

        assertEquals(503, response.statusCode());
        assertEquals(1, MAPPER.readTree(response.body()).get("failed").asInt());
    }

    @Test
    public void testInvalidEventRejectsWholeBatch() throws Exception {
        HttpResponse<String> response = post("/api/audit/events/batch",
            "[{\"action\":\"CREATE\",\"objectType\":\"Order\"},{\"objectType\":\"Order\"}]");

        assertEquals(400, response.statusCode());
        assertEquals("Event 1: action is required", MAPPER.readTree(response.body()).get("error").asText());
        assertTrue(recorded.isEmpty());
    }

    @Test
    public void testBatchMustBeNonEmptyArray() throws Exception {
        assertEquals(400, post("/api/audit/events/batch", "{\"action\":\"CREATE\"}").statusCode());
        assertEquals(400, post("/api/audit/events/batch", "[]").statusCode());
        assertEquals(400, post("/api/audit/events/batch", "[42]").statusCode());
        assertTrue(recorded.isEmpty());
    }

    @Test
    public void testStatistics() throws Exception {
        when(repository.statistics(7)).thenReturn(DbResult.ok(new AuditStatistics(
            7, LocalDate.of(2026, 2, 1), 42,
            Map.of("CREATE", 30L), Map.of("Portfolio", 42L), Map.of("maker1", 42L))));

        HttpResponse<String> response = get("/api/audit/statistics?days=7");

        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals(7, body.get("days").asInt());
        assertEquals("2026-02-01", body.get("fromDate").asText());
        assertEquals(42, body.get("totalCount").asLong());
        assertEquals(30, body.get("byAction").get("CREATE").asLong());
        assertEquals(42, body.get("byUser").get("maker1").asLong());
    }

    @Test
    public void testStatisticsDefaultsToThirtyDays() throws Exception {
        when(repository.statistics(AuditStatistics.DEFAULT_DAYS))
            .thenReturn(DbResult.fail(ErrorKind.POOL_EXHAUSTED, "no connection within 30s"));

        HttpResponse<String> response = get("/api/audit/statistics");

        assertEquals(503, response.statusCode());
        assertEquals("POOL_EXHAUSTED", MAPPER.readTree(response.body()).get("error").asText());
        verify(repository).statistics(30);
    }

    @Test
    public void testStatisticsRejectsBadDays() throws Exception {
        assertEquals(400, get("/api/audit/statistics?days=week").statusCode());
        assertEquals(400, get("/api/audit/statistics?days=0").statusCode());
        assertEquals(400, get("/api/audit/statistics?days=400").statusCode());
        verify(repository, never()).statistics(anyInt());
    }
}
