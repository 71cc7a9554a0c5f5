package com.cistrade.config;

import com.cistrade.util.Env;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Settings for the audit pipeline (queue, workers, target table).
 *
 * @param enabled          master switch, AUDIT_LOG_ENABLED
 * @param queueCapacity    bound of the in-memory audit queue
 * @param workerCount      number of writer threads draining the queue
 * @param pollInterval     how long a worker waits on an empty queue before re-checking the stop flag
 * @param shutdownTimeout  drain budget used by the JVM shutdown hook
 * @param table            Kudu table receiving audit rows
 * @param useUpsert        write with UPSERT instead of INSERT (idempotent on entry_id)
 * @param partitionZone    zone used to derive the partition date from the event time
 */
public record AuditConfig(
    boolean enabled,
    int queueCapacity,
    int workerCount,
    Duration pollInterval,
    Duration shutdownTimeout,
    String table,
    boolean useUpsert,
    ZoneId partitionZone
) {

    public static AuditConfig fromEnv() {
        return new AuditConfig(
            Env.getBool("AUDIT_LOG_ENABLED", true),
            Env.getInt("AUDIT_QUEUE_CAPACITY", 10_000),
            Env.getInt("AUDIT_WORKERS", 4),
            Env.getMillis("AUDIT_POLL_INTERVAL_MS", 500),
            Env.getSeconds("AUDIT_SHUTDOWN_TIMEOUT_SECONDS", 30),
            Env.get("AUDIT_TABLE", "core_audit_log"),
            Env.getBool("AUDIT_USE_UPSERT", true),
            ZoneId.of(Env.get("AUDIT_PARTITION_ZONE", "Asia/Singapore"))
        );
    }
}
