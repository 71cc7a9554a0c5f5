package com.cistrade.application.port.input;

import com.cistrade.domain.audit.AuditEntry;

import java.util.List;

/**
 * Entry point for anything that produces audit events (HTTP handlers, services, batch jobs).
 *
 * Implementations must not block on the database in the common case and must never
 * throw: auditing failures cannot fail the action being audited.
 */
public interface AuditRecorder {

    /**
     * What happened to a recorded entry.
     */
    enum RecordOutcome {
        /** Auditing is switched off; the entry was dropped on purpose. */
        DISABLED,
        /** Accepted by the asynchronous writer. */
        QUEUED,
        /** Queue was full; the entry was written synchronously instead. */
        FALLBACK_PERSISTED,
        /** Queue was full and the synchronous write failed too. */
        FAILED
    }

    /**
     * Tally of a {@link #recordAll} call.
     */
    record BatchOutcome(int queued, int fallbackPersisted, int failed, int disabled) {
        public static final BatchOutcome EMPTY = new BatchOutcome(0, 0, 0, 0);

        public int total() {
            return queued + fallbackPersisted + failed + disabled;
        }
    }

    RecordOutcome record(AuditEntry entry);

    /**
     * Record several entries. Same guarantees as {@link #record}, applied to each entry.
     */
    default BatchOutcome recordAll(List<AuditEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return BatchOutcome.EMPTY;
        }
        int queued = 0;
        int persisted = 0;
        int failed = 0;
        int disabled = 0;
        for (AuditEntry entry : entries) {
            switch (record(entry)) {
                case QUEUED -> queued++;
                case FALLBACK_PERSISTED -> persisted++;
                case DISABLED -> disabled++;
                default -> failed++;
            }
        }
        return new BatchOutcome(queued, persisted, failed, disabled);
    }
}
