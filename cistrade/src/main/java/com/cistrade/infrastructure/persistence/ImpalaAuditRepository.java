package com.cistrade.infrastructure.persistence;

import com.cistrade.application.port.output.AuditRepository;
import com.cistrade.domain.audit.AuditAction;
import com.cistrade.domain.audit.AuditEntry;
import com.cistrade.domain.audit.AuditOutcome;
import com.cistrade.domain.audit.AuditQuery;
import com.cistrade.domain.audit.AuditSeverity;
import com.cistrade.domain.audit.AuditStatistics;
import com.cistrade.domain.audit.RequestMetadata;
import com.cistrade.domain.common.DbResult;
import com.cistrade.domain.common.ErrorKind;
import com.cistrade.infrastructure.impala.ImpalaQueryExecutor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Kudu (via Impala) implementation of AuditRepository.
 *
 * All values are bound as statement parameters. Only the table name is part of the
 * SQL text, and it is checked against a strict identifier pattern at construction.
 */
public final class ImpalaAuditRepository implements AuditRepository {
    private static final Logger log = LoggerFactory.getLogger(ImpalaAuditRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    static final int TOP_USERS = 20;

    static final List<String> COLUMNS = List.of(
        "entry_id", "partition_date", "event_time",
        "user_id", "username", "action", "severity",
        "object_type", "object_id", "object_repr",
        "old_value", "new_value", "changes",
        "ip_address", "user_agent", "request_path", "request_method",
        "success", "outcome_message", "status_code",
        "description", "additional_data", "requires_approval"
    );

    private final ImpalaQueryExecutor executor;
    private final String table;
    private final String database;
    private final String insertSql;
    private final String selectPrefix;
    private final ZoneId partitionZone;
    private final Clock clock;

    public ImpalaAuditRepository(ImpalaQueryExecutor executor, String table, String database, boolean useUpsert) {
        this(executor, table, database, useUpsert, ZoneOffset.UTC, Clock.systemUTC());
    }

    /**
     * @param executor      statement runner over the connection pool
     * @param table         target table, optionally qualified as {@code db.table}
     * @param database      database to connect to, null for the pool default
     * @param useUpsert     UPSERT makes retries of the same entry idempotent on Kudu
     * @param partitionZone zone partition dates are computed in, used to date statistics windows
     * @param clock         source of "today" for statistics
     */
    public ImpalaAuditRepository(
            ImpalaQueryExecutor executor,
            String table,
            String database,
            boolean useUpsert,
            ZoneId partitionZone,
            Clock clock) {
        if (!isValidTableName(table)) {
            throw new IllegalArgumentException("Invalid audit table name: " + table);
        }
        this.executor = executor;
        this.table = table;
        this.database = database;
        this.partitionZone = partitionZone;
        this.clock = clock;

        String placeholders = String.join(", ", Collections.nCopies(COLUMNS.size(), "?"));
        this.insertSql = (useUpsert ? "UPSERT" : "INSERT") + " INTO " + table
            + " (" + String.join(", ", COLUMNS) + ") VALUES (" + placeholders + ")";
        this.selectPrefix = "SELECT " + String.join(", ", COLUMNS) + " FROM " + table;
    }

    public static boolean isValidTableName(String table) {
        return table != null && TABLE_NAME.matcher(table).matches();
    }

    /**
     * Create the Kudu table if it does not exist yet.
     */
    public DbResult<Void> ensureTable() {
        String ddl = """
            CREATE TABLE IF NOT EXISTS %s (
                entry_id STRING,
                partition_date STRING,
                event_time TIMESTAMP,
                user_id STRING,
                username STRING,
                action STRING,
                severity STRING,
                object_type STRING,
                object_id STRING,
                object_repr STRING,
                old_value STRING,
                new_value STRING,
                changes STRING,
                ip_address STRING,
                user_agent STRING,
                request_path STRING,
                request_method STRING,
                success BOOLEAN,
                outcome_message STRING,
                status_code INT,
                description STRING,
                additional_data STRING,
                requires_approval BOOLEAN,
                PRIMARY KEY (entry_id, partition_date)
            )
            PARTITION BY HASH (entry_id) PARTITIONS 4
            STORED AS KUDU
            """.formatted(table);

        DbResult<Void> result = executor.write(ddl, List.of(), database).discardValue();
        if (result.isSuccess()) {
            log.info("[AuditRepo] Audit table {} is ready", table);
        }
        return result;
    }

    @Override
    public DbResult<Void> save(AuditEntry e) {
        List<Object> params;
        try {
            params = Arrays.asList(
                e.entryId(),
                e.partitionDate(),
                e.eventTime(),
                e.userId(),
                e.username(),
                e.action(),
                e.severity(),
                e.objectType(),
                e.objectId(),
                e.objectRepr(),
                json(e.oldValue()),
                json(e.newValue()),
                json(e.changes()),
                e.request().ipAddress(),
                e.request().userAgent(),
                e.request().path(),
                e.request().method(),
                e.outcome().success(),
                e.outcome().message(),
                e.outcome().statusCode(),
                e.description(),
                json(e.additionalData()),
                e.requiresApproval()
            );
        } catch (JsonProcessingException ex) {
            log.error("[AuditRepo] Failed to serialize entry {}: {}", e.entryId(), ex.getMessage());
            return DbResult.fail(ErrorKind.QUERY_EXECUTION_FAILURE, "Unserializable audit entry: " + ex.getMessage());
        }

        DbResult<Integer> result = executor.write(insertSql, params, database);
        if (!result.isSuccess()) {
            log.warn("[AuditRepo] Failed to save entry {} ({} {}): {}",
                e.entryId(), e.action(), e.objectType(), result.message());
        }
        return result.discardValue();
    }

    @Override
    public DbResult<Integer> saveAll(List<AuditEntry> entries) {
        DbResult<Integer> result = AuditRepository.super.saveAll(entries);
        int total = entries == null ? 0 : entries.size();
        if (result.isSuccess()) {
            log.info("[AuditRepo] Batch save: {}/{} entries saved", result.value(), total);
        } else {
            log.error("[AuditRepo] Batch save failed for all {} entries: {}", total, result.message());
        }
        return result;
    }

    @Override
    public DbResult<List<AuditEntry>> findRecent(AuditQuery q) {
        StringBuilder sql = new StringBuilder(selectPrefix);
        List<Object> params = new ArrayList<>();
        List<String> where = new ArrayList<>();

        if (q.username() != null) {
            where.add("username = ?");
            params.add(q.username());
        }
        if (q.objectType() != null) {
            where.add("object_type = ?");
            params.add(q.objectType());
        }
        if (q.objectId() != null) {
            where.add("object_id = ?");
            params.add(q.objectId());
        }
        if (q.action() != null) {
            where.add("action = ?");
            params.add(q.action());
        }
        // partition_date is stored as yyyy-MM-dd so string comparison orders correctly
        if (q.fromDate() != null) {
            where.add("partition_date >= ?");
            params.add(q.fromDate());
        }
        if (q.toDate() != null) {
            where.add("partition_date <= ?");
            params.add(q.toDate());
        }

        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", where));
        }
        // limit is clamped by AuditQuery, never user text
        sql.append(" ORDER BY event_time DESC LIMIT ").append(q.limit());

        return executor.query(sql.toString(), params, database, ImpalaAuditRepository::mapRow);
    }

    @Override
    public DbResult<AuditStatistics> statistics(int days) {
        AuditStatistics.checkDays(days);
        LocalDate fromDate = LocalDate.now(clock.withZone(partitionZone)).minusDays(days);
        List<Object> params = List.of(fromDate);
        String where = " FROM " + table + " WHERE partition_date >= ?";

        DbResult<List<Long>> total = executor.query(
            "SELECT COUNT(*) AS total_count" + where, params, database, rs -> rs.getLong("total_count"));
        if (!total.isSuccess()) {
            return statisticsFailure(days, total);
        }

        DbResult<Map<String, Long>> byAction = breakdown("action", where, params, null);
        if (!byAction.isSuccess()) {
            return statisticsFailure(days, byAction);
        }
        DbResult<Map<String, Long>> byObjectType = breakdown("object_type", where, params, null);
        if (!byObjectType.isSuccess()) {
            return statisticsFailure(days, byObjectType);
        }
        DbResult<Map<String, Long>> byUser = breakdown("username", where, params, TOP_USERS);
        if (!byUser.isSuccess()) {
            return statisticsFailure(days, byUser);
        }

        long count = total.value().isEmpty() ? 0L : total.value().get(0);
        return DbResult.ok(new AuditStatistics(
            days, fromDate, count, byAction.value(), byObjectType.value(), byUser.value()));
    }

    private DbResult<Map<String, Long>> breakdown(String column, String where, List<Object> params, Integer limit) {
        // column is one of our own constants, never request input
        String sql = "SELECT " + column + " AS bucket, COUNT(*) AS n" + where
            + " GROUP BY " + column + " ORDER BY n DESC"
            + (limit == null ? "" : " LIMIT " + limit);
        return executor.query(sql, params, database,
                rs -> Map.entry(bucketName(rs.getString("bucket")), rs.getLong("n")))
            .map(rows -> {
                Map<String, Long> counts = new LinkedHashMap<>();
                for (Map.Entry<String, Long> row : rows) {
                    counts.merge(row.getKey(), row.getValue(), Long::sum);
                }
                return counts;
            });
    }

    private static String bucketName(String value) {
        return value == null || value.isEmpty() ? "unknown" : value;
    }

    private static <T> DbResult<T> statisticsFailure(int days, DbResult<?> failed) {
        log.warn("[AuditRepo] Failed to compute {}-day audit statistics: {}", days, failed.message());
        return DbResult.fail(failed.error(), failed.message());
    }

    static AuditEntry mapRow(ResultSet rs) throws SQLException {
        Timestamp eventTime = rs.getTimestamp("event_time");
        if (eventTime == null) {
            throw new SQLException("Audit row " + rs.getString("entry_id") + " has no event_time");
        }
        return new AuditEntry(
            rs.getString("entry_id"),
            eventTime.toInstant(),
            LocalDate.parse(rs.getString("partition_date")),
            rs.getString("user_id"),
            rs.getString("username"),
            AuditAction.parse(rs.getString("action")),
            AuditSeverity.valueOf(rs.getString("severity")),
            rs.getString("object_type"),
            rs.getString("object_id"),
            rs.getString("object_repr"),
            readJson(rs, "old_value"),
            readJson(rs, "new_value"),
            readJson(rs, "changes"),
            new RequestMetadata(
                rs.getString("request_method"),
                rs.getString("request_path"),
                rs.getString("ip_address"),
                rs.getString("user_agent")),
            new AuditOutcome(rs.getBoolean("success"), rs.getString("outcome_message"), rs.getInt("status_code")),
            rs.getString("description"),
            readJson(rs, "additional_data"),
            rs.getBoolean("requires_approval")
        );
    }

    private static String json(JsonNode node) throws JsonProcessingException {
        return node == null ? null : MAPPER.writeValueAsString(node);
    }

    private static JsonNode readJson(ResultSet rs, String column) throws SQLException {
        String raw = rs.getString(column);
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new SQLException("Malformed JSON in column " + column + ": " + e.getOriginalMessage(), e);
        }
    }
}
