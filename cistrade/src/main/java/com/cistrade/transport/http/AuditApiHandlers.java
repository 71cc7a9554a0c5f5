package com.cistrade.transport.http;

import com.cistrade.application.port.input.AuditRecorder;
import com.cistrade.application.port.input.AuditRecorder.BatchOutcome;
import com.cistrade.application.port.input.AuditRecorder.RecordOutcome;
import com.cistrade.application.port.output.AuditRepository;
import com.cistrade.application.service.AsyncAuditWriter;
import com.cistrade.domain.audit.AuditAction;
import com.cistrade.domain.audit.AuditEntry;
import com.cistrade.domain.audit.AuditOutcome;
import com.cistrade.domain.audit.AuditQuery;
import com.cistrade.domain.audit.AuditSeverity;
import com.cistrade.domain.audit.AuditStatistics;
import com.cistrade.domain.audit.RequestMetadata;
import com.cistrade.domain.common.DbResult;
import com.cistrade.infrastructure.impala.ConnectionPool;
import com.cistrade.infrastructure.impala.ImpalaQueryExecutor;
import com.cistrade.security.AuditSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * HTTP API for the audit pipeline.
 *
 * Routes:
 * - POST /api/audit/events       - record an application event
 * - POST /api/audit/events/batch - record a JSON array of events
 * - GET  /api/audit/events       - read back recent entries
 * - GET  /api/audit/statistics   - counts per action, object type and user
 * - GET  /api/health             - pool, queue and database status
 */
public final class AuditApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(AuditApiHandlers.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final String CONTENT_TYPE_JSON = "application/json; charset=utf-8";

    static final int MAX_BATCH_SIZE = 500;

    private final AuditRecorder recorder;
    private final AuditRepository repository;
    private final AsyncAuditWriter writer;
    private final ConnectionPool pool;
    private final ImpalaQueryExecutor executor;
    private final AuditSanitizer sanitizer;
    private final ZoneId partitionZone;

    public AuditApiHandlers(
            AuditRecorder recorder,
            AuditRepository repository,
            AsyncAuditWriter writer,
            ConnectionPool pool,
            ImpalaQueryExecutor executor,
            AuditSanitizer sanitizer,
            ZoneId partitionZone) {
        this.recorder = recorder;
        this.repository = repository;
        this.writer = writer;
        this.pool = pool;
        this.executor = executor;
        this.sanitizer = sanitizer;
        this.partitionZone = partitionZone;
    }

    /**
     * POST /api/audit/events
     *
     * Body: {"action":"UPDATE","objectType":"Portfolio","objectId":"P-1", ...}
     * Responds 202 with the entry id and what the recorder did with it.
     */
    public void recordEvent(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                JsonNode json = MAPPER.readTree(body);
                if (json == null || !json.isObject()) {
                    badRequest(ex, "Request body must be a JSON object");
                    return;
                }

                AuditEntry entry = toEntry(ex, json);
                RecordOutcome outcome = recorder.record(entry);

                ObjectNode response = MAPPER.createObjectNode();
                response.put("entryId", entry.entryId());
                response.put("outcome", outcome.name());

                ex.setStatusCode(outcome == RecordOutcome.FAILED ? 503 : 202);
                ex.getResponseHeaders().put(Headers.CONTENT_TYPE, CONTENT_TYPE_JSON);
                ex.getResponseSender().send(response.toString(), StandardCharsets.UTF_8);

            } catch (JsonProcessingException e) {
                badRequest(ex, "Malformed JSON: " + e.getOriginalMessage());
            } catch (IllegalArgumentException | NullPointerException e) {
                badRequest(ex, e.getMessage());
            } catch (Exception e) {
                log.error("[AuditApi] Error recording event: {}", e.getMessage(), e);
                serverError(ex, "Failed to record audit event");
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * POST /api/audit/events/batch
     *
     * Body: a JSON array of event objects, each shaped like the single-event body.
     * The whole batch is validated before anything is recorded.
     */
    public void recordBatch(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                JsonNode json = MAPPER.readTree(body);
                if (json == null || !json.isArray()) {
                    badRequest(ex, "Request body must be a JSON array");
                    return;
                }
                if (json.isEmpty() || json.size() > MAX_BATCH_SIZE) {
                    badRequest(ex, "Batch must hold between 1 and " + MAX_BATCH_SIZE + " events");
                    return;
                }

                List<AuditEntry> entries = new ArrayList<>(json.size());
                for (int i = 0; i < json.size(); i++) {
                    JsonNode event = json.get(i);
                    if (!event.isObject()) {
                        badRequest(ex, "Event " + i + " is not a JSON object");
                        return;
                    }
                    try {
                        entries.add(toEntry(ex, event));
                    } catch (IllegalArgumentException | NullPointerException e) {
                        badRequest(ex, "Event " + i + ": " + e.getMessage());
                        return;
                    }
                }

                BatchOutcome outcome = recorder.recordAll(entries);

                ObjectNode response = MAPPER.createObjectNode();
                response.put("count", entries.size());
                response.put("queued", outcome.queued());
                response.put("fallbackPersisted", outcome.fallbackPersisted());
                response.put("failed", outcome.failed());
                response.put("disabled", outcome.disabled());
                ArrayNode ids = response.putArray("entryIds");
                for (AuditEntry entry : entries) {
                    ids.add(entry.entryId());
                }

                ex.setStatusCode(outcome.failed() > 0 ? 503 : 202);
                ex.getResponseHeaders().put(Headers.CONTENT_TYPE, CONTENT_TYPE_JSON);
                ex.getResponseSender().send(response.toString(), StandardCharsets.UTF_8);

            } catch (JsonProcessingException e) {
                badRequest(ex, "Malformed JSON: " + e.getOriginalMessage());
            } catch (Exception e) {
                log.error("[AuditApi] Error recording event batch: {}", e.getMessage(), e);
                serverError(ex, "Failed to record audit events");
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * GET /api/audit/events?username=&amp;objectType=&amp;objectId=&amp;action=&amp;from=&amp;to=&amp;limit=
     */
    public void listEvents(HttpServerExchange exchange) {
        AuditQuery query;
        try {
            String action = param(exchange, "action");
            String from = param(exchange, "from");
            String to = param(exchange, "to");
            String limit = param(exchange, "limit");
            query = new AuditQuery(
                param(exchange, "username"),
                param(exchange, "objectType"),
                param(exchange, "objectId"),
                action == null ? null : AuditAction.parse(action),
                from == null ? null : LocalDate.parse(from),
                to == null ? null : LocalDate.parse(to),
                limit == null ? AuditQuery.DEFAULT_LIMIT : Integer.parseInt(limit));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            badRequest(exchange, e.getMessage());
            return;
        }

        DbResult<List<AuditEntry>> result = repository.findRecent(query);
        if (!result.isSuccess()) {
            unavailable(exchange, result);
            return;
        }

        ObjectNode response = MAPPER.createObjectNode();
        response.put("count", result.value().size());
        ArrayNode entries = response.putArray("entries");
        for (AuditEntry e : result.value()) {
            entries.add(MAPPER.valueToTree(e));
        }

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, CONTENT_TYPE_JSON);
        exchange.getResponseSender().send(response.toString(), StandardCharsets.UTF_8);
    }

    /**
     * GET /api/audit/statistics?days=30
     */
    public void statistics(HttpServerExchange exchange) {
        int days;
        try {
            String raw = param(exchange, "days");
            days = AuditStatistics.checkDays(raw == null ? AuditStatistics.DEFAULT_DAYS : Integer.parseInt(raw.trim()));
        } catch (IllegalArgumentException e) {
            badRequest(exchange, e.getMessage());
            return;
        }

        DbResult<AuditStatistics> result = repository.statistics(days);
        if (!result.isSuccess()) {
            unavailable(exchange, result);
            return;
        }

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, CONTENT_TYPE_JSON);
        exchange.getResponseSender().send(MAPPER.valueToTree(result.value()).toString(), StandardCharsets.UTF_8);
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, CONTENT_TYPE_JSON);

        boolean connected = executor.testConnection();

        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", connected ? "ok" : "degraded");
        health.put("ts", Instant.now().toString());
        health.put("impalaConnected", connected);
        health.set("pool", MAPPER.valueToTree(pool.stats()));

        ObjectNode audit = health.putObject("audit");
        audit.put("accepting", writer.isAccepting());
        audit.put("queueDepth", writer.queueDepth());
        audit.put("queueCapacity", writer.capacity());
        audit.set("stats", MAPPER.valueToTree(writer.stats().snapshot()));

        exchange.setStatusCode(connected ? 200 : 503);
        exchange.getResponseSender().send(health.toString(), StandardCharsets.UTF_8);
    }

    private AuditEntry toEntry(HttpServerExchange exchange, JsonNode json) {
        String actionText = text(json, "action");
        String objectType = text(json, "objectType");
        if (actionText == null) {
            throw new IllegalArgumentException("action is required");
        }
        if (objectType == null) {
            throw new IllegalArgumentException("objectType is required");
        }

        String user = text(json, "username");
        if (user == null) {
            user = exchange.getRequestHeaders().getFirst(AuditHttpHandler.AUTH_USER_HEADER);
        }

        AuditOutcome outcome = json.path("success").asBoolean(true)
            ? new AuditOutcome(true, textOrEmpty(json, "message"), 0)
            : AuditOutcome.failure(textOrEmpty(json, "message"));

        String severity = text(json, "severity");

        return AuditEntry.builder(AuditAction.parse(actionText), objectType)
            .partitionZone(partitionZone)
            .actor(text(json, "userId"), user)
            .severity(severity == null ? AuditSeverity.INFO : AuditSeverity.valueOf(severity.toUpperCase(Locale.ROOT)))
            .objectId(text(json, "objectId"))
            .objectRepr(text(json, "objectRepr"))
            .oldValue(sanitizer.sanitizeJson(json.get("oldValue")))
            .newValue(sanitizer.sanitizeJson(json.get("newValue")))
            .description(sanitizer.sanitize(text(json, "description")))
            .additionalData(sanitizer.sanitizeJson(json.get("additionalData")))
            .requiresApproval(json.path("requiresApproval").asBoolean(false))
            .request(new RequestMetadata(
                exchange.getRequestMethod().toString(),
                exchange.getRequestPath(),
                null,
                exchange.getRequestHeaders().getFirst(Headers.USER_AGENT)))
            .outcome(outcome)
            .build();
    }

    private static String text(JsonNode json, String field) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    private static String textOrEmpty(JsonNode json, String field) {
        String value = text(json, field);
        return value == null ? "" : value;
    }

    private static String param(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.peekFirst();
        return value == null || value.isBlank() ? null : value;
    }

    private void badRequest(HttpServerExchange exchange, String message) {
        ObjectNode error = MAPPER.createObjectNode();
        error.put("error", message == null ? "Bad request" : message);
        exchange.setStatusCode(400);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, CONTENT_TYPE_JSON);
        exchange.getResponseSender().send(error.toString(), StandardCharsets.UTF_8);
    }

    private void unavailable(HttpServerExchange exchange, DbResult<?> failed) {
        ObjectNode error = MAPPER.createObjectNode();
        error.put("error", failed.error().name());
        exchange.setStatusCode(503);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, CONTENT_TYPE_JSON);
        exchange.getResponseSender().send(error.toString(), StandardCharsets.UTF_8);
    }

    private void serverError(HttpServerExchange exchange, String message) {
        ObjectNode error = MAPPER.createObjectNode();
        error.put("error", message);
        exchange.setStatusCode(500);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, CONTENT_TYPE_JSON);
        exchange.getResponseSender().send(error.toString(), StandardCharsets.UTF_8);
    }
}
