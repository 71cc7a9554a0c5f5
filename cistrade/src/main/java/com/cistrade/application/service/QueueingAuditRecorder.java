package com.cistrade.application.service;

import com.cistrade.application.port.input.AuditRecorder;
import com.cistrade.application.port.output.AuditRepository;
import com.cistrade.domain.audit.AuditEntry;
import com.cistrade.domain.common.DbResult;
import com.cistrade.infrastructure.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Hands audit entries to the async writer and falls back to a synchronous save when
 * the queue refuses them.
 *
 * Never throws: auditing must not break the action being audited.
 */
public final class QueueingAuditRecorder implements AuditRecorder {
    private static final Logger log = LoggerFactory.getLogger(QueueingAuditRecorder.class);

    private final boolean enabled;
    private final AsyncAuditWriter writer;
    private final AuditRepository repository;
    private final AuditStats stats;
    private final PipelineMetrics metrics;

    public QueueingAuditRecorder(
            boolean enabled,
            AsyncAuditWriter writer,
            AuditRepository repository,
            PipelineMetrics metrics) {
        this.enabled = enabled;
        this.writer = writer;
        this.repository = repository;
        this.stats = writer.stats();
        this.metrics = metrics != null ? metrics : PipelineMetrics.NOOP;
    }

    @Override
    public RecordOutcome record(AuditEntry entry) {
        if (!enabled) {
            return RecordOutcome.DISABLED;
        }
        if (entry == null) {
            log.warn("[AuditRecorder] Ignoring null audit entry");
            return RecordOutcome.FAILED;
        }

        try {
            if (writer.enqueue(entry)) {
                return RecordOutcome.QUEUED;
            }

            metrics.recordAuditEntry(PipelineMetrics.AUDIT_REJECTED);
            log.warn("[AuditRecorder] Audit queue full, writing entry {} synchronously", entry.entryId());

            DbResult<Void> result = repository.save(entry);
            if (result.isSuccess()) {
                stats.onFallbackPersisted();
                metrics.recordAuditEntry(PipelineMetrics.AUDIT_FALLBACK_PERSISTED);
                return RecordOutcome.FALLBACK_PERSISTED;
            }

            stats.onFallbackFailed();
            metrics.recordAuditEntry(PipelineMetrics.AUDIT_FALLBACK_FAILED);
            log.error("[AuditRecorder] Synchronous audit write failed for entry {} ({} {}): {}",
                entry.entryId(), entry.action(), entry.objectType(), result.message());
            return RecordOutcome.FAILED;

        } catch (RuntimeException e) {
            stats.onFallbackFailed();
            metrics.recordAuditEntry(PipelineMetrics.AUDIT_FALLBACK_FAILED);
            log.error("[AuditRecorder] Failed to record audit entry {}: {}", entry.entryId(), e.getMessage(), e);
            return RecordOutcome.FAILED;
        }
    }

    /**
     * Queues what the writer accepts and saves the rest as one synchronous batch.
     */
    @Override
    public BatchOutcome recordAll(List<AuditEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return BatchOutcome.EMPTY;
        }
        if (!enabled) {
            return new BatchOutcome(0, 0, 0, entries.size());
        }

        int queued = 0;
        int invalid = 0;
        List<AuditEntry> rejected = new ArrayList<>();
        for (AuditEntry entry : entries) {
            if (entry == null) {
                invalid++;
            } else if (writer.enqueue(entry)) {
                queued++;
            } else {
                metrics.recordAuditEntry(PipelineMetrics.AUDIT_REJECTED);
                rejected.add(entry);
            }
        }
        if (invalid > 0) {
            log.warn("[AuditRecorder] Ignoring {} null entries in audit batch", invalid);
        }
        if (rejected.isEmpty()) {
            return new BatchOutcome(queued, 0, invalid, 0);
        }

        log.warn("[AuditRecorder] Audit queue full, writing {} of {} batch entries synchronously",
            rejected.size(), entries.size());
        int persisted;
        try {
            DbResult<Integer> result = repository.saveAll(rejected);
            persisted = result.isSuccess() ? result.value() : 0;
            if (!result.isSuccess()) {
                log.error("[AuditRecorder] Synchronous batch write failed: {}", result.message());
            }
        } catch (RuntimeException e) {
            log.error("[AuditRecorder] Synchronous batch write failed: {}", e.getMessage(), e);
            persisted = 0;
        }

        int lost = rejected.size() - persisted;
        for (int i = 0; i < persisted; i++) {
            stats.onFallbackPersisted();
            metrics.recordAuditEntry(PipelineMetrics.AUDIT_FALLBACK_PERSISTED);
        }
        for (int i = 0; i < lost; i++) {
            stats.onFallbackFailed();
            metrics.recordAuditEntry(PipelineMetrics.AUDIT_FALLBACK_FAILED);
        }
        if (lost > 0) {
            log.error("[AuditRecorder] {} of {} rejected batch entries were not persisted", lost, rejected.size());
        }
        return new BatchOutcome(queued, persisted, invalid + lost, 0);
    }

    public boolean isEnabled() {
        return enabled;
    }
}
