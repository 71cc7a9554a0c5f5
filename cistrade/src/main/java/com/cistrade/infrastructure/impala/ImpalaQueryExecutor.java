package com.cistrade.infrastructure.impala;

import com.cistrade.domain.common.DbResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs parameterized statements on pooled Impala connections.
 *
 * This is the repository boundary: pool and driver failures are caught here, logged
 * with the statement text (never the bound values), and returned as failed
 * {@link DbResult}s. Nothing thrown by the pool reaches the caller.
 *
 * Values are always bound through {@link PreparedStatement}; SQL text must not be
 * built from user input.
 */
public final class ImpalaQueryExecutor {
    private static final Logger log = LoggerFactory.getLogger(ImpalaQueryExecutor.class);
    private static final int MAX_LOGGED_SQL = 300;

    /**
     * Maps the current row of a result set.
     */
    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private final ConnectionPool pool;
    private final int queryTimeoutSeconds;

    public ImpalaQueryExecutor(ConnectionPool pool, int queryTimeoutSeconds) {
        this.pool = pool;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    /**
     * Run a query and return each row as column label to value, in column order.
     */
    public DbResult<List<Map<String, Object>>> query(String sql, List<?> params, String database) {
        return query(sql, params, database, ImpalaQueryExecutor::rowAsMap);
    }

    /**
     * Run a query against the pool's default database.
     */
    public DbResult<List<Map<String, Object>>> query(String sql, List<?> params) {
        return query(sql, params, null);
    }

    /**
     * Run a query, mapping each row with {@code mapper}.
     */
    public <T> DbResult<List<T>> query(String sql, List<?> params, String database, RowMapper<T> mapper) {
        PooledConnection pc;
        try {
            pc = pool.acquire(database);
        } catch (ImpalaAccessException e) {
            return failure("query", sql, e);
        }

        try {
            try (PreparedStatement ps = pc.connection().prepareStatement(sql)) {
                prepare(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    List<T> rows = new ArrayList<>();
                    while (rs.next()) {
                        try {
                            rows.add(mapper.map(rs));
                        } catch (RuntimeException e) {
                            throw new SQLException("Row " + (rows.size() + 1) + " could not be mapped: " + e.getMessage(), e);
                        }
                    }
                    return DbResult.ok(rows);
                }
            } catch (SQLException e) {
                throw new QueryExecutionException(pc.database(), "Query failed: " + e.getMessage(), e);
            }
        } catch (ImpalaAccessException e) {
            return failure("query", sql, e);
        } finally {
            // a failed SELECT rarely kills the session; release re-validates it anyway
            pool.release(pc);
        }
    }

    /**
     * Run an INSERT / UPSERT / UPDATE / DELETE.
     *
     * On failure the transaction is rolled back where the driver supports one, and the
     * connection is discarded rather than returned, so pool accounting stays exact.
     *
     * @return the update count
     */
    public DbResult<Integer> write(String sql, List<?> params, String database) {
        PooledConnection pc;
        try {
            pc = pool.acquire(database);
        } catch (ImpalaAccessException e) {
            return failure("write", sql, e);
        }

        boolean failed = true;
        try {
            Connection conn = pc.connection();
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                prepare(ps, params);
                int count = ps.executeUpdate();
                failed = false;
                log.debug("[ImpalaQuery] Write executed successfully ({} rows)", count);
                return DbResult.ok(count);
            } catch (SQLException e) {
                rollbackQuietly(conn);
                throw new QueryExecutionException(pc.database(), "Write failed: " + e.getMessage(), e);
            }
        } catch (ImpalaAccessException e) {
            return failure("write", sql, e);
        } finally {
            if (failed) {
                pool.discard(pc);
            } else {
                pool.release(pc);
            }
        }
    }

    public DbResult<Integer> write(String sql, List<?> params) {
        return write(sql, params, null);
    }

    /**
     * Check that a session to the default database can be opened and answers a trivial query.
     */
    public boolean testConnection() {
        DbResult<List<Map<String, Object>>> result = query("SELECT 1", List.of(), null);
        return result.isSuccess() && !result.value().isEmpty();
    }

    private void prepare(PreparedStatement ps, List<?> params) throws SQLException {
        if (queryTimeoutSeconds > 0) {
            ps.setQueryTimeout(queryTimeoutSeconds);
        }
        if (params == null) {
            return;
        }
        for (int i = 0; i < params.size(); i++) {
            bind(ps, i + 1, params.get(i));
        }
    }

    static void bind(PreparedStatement ps, int index, Object value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else if (value instanceof String) {
            ps.setString(index, (String) value);
        } else if (value instanceof Instant) {
            ps.setTimestamp(index, Timestamp.from((Instant) value));
        } else if (value instanceof LocalDate) {
            // Kudu has no DATE column type in the versions we target
            ps.setString(index, value.toString());
        } else if (value instanceof Boolean) {
            ps.setBoolean(index, (Boolean) value);
        } else if (value instanceof Integer) {
            ps.setInt(index, (Integer) value);
        } else if (value instanceof Long) {
            ps.setLong(index, (Long) value);
        } else if (value instanceof Enum<?>) {
            ps.setString(index, ((Enum<?>) value).name());
        } else {
            ps.setObject(index, value);
        }
    }

    private static Map<String, Object> rowAsMap(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        Map<String, Object> row = new LinkedHashMap<>();
        for (int c = 1; c <= md.getColumnCount(); c++) {
            row.put(md.getColumnLabel(c), rs.getObject(c));
        }
        return row;
    }

    private static void rollbackQuietly(Connection conn) {
        try {
            if (!conn.getAutoCommit()) {
                conn.rollback();
            }
        } catch (SQLException e) {
            log.warn("[ImpalaQuery] Rollback failed: {}", e.getMessage());
        }
    }

    private static <T> DbResult<T> failure(String op, String sql, ImpalaAccessException e) {
        log.error("[ImpalaQuery] Failed to execute {}: {}", op, e.getMessage());
        log.error("[ImpalaQuery] Query: {}", abbreviate(sql));
        return DbResult.fail(e.getKind(), e.getMessage());
    }

    private static String abbreviate(String sql) {
        String flat = sql == null ? "" : sql.replaceAll("\\s+", " ").trim();
        return flat.length() <= MAX_LOGGED_SQL ? flat : flat.substring(0, MAX_LOGGED_SQL) + "...";
    }
}
