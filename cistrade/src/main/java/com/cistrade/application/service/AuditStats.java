package com.cistrade.application.service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters shared by the audit writer workers and the recorder.
 */
public final class AuditStats {
    private final AtomicLong enqueued = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong fallbackPersisted = new AtomicLong();
    private final AtomicLong fallbackFailed = new AtomicLong();

    void onEnqueued() { enqueued.incrementAndGet(); }
    void onRejected() { rejected.incrementAndGet(); }
    void onProcessed() { processed.incrementAndGet(); }
    void onFailed() { failed.incrementAndGet(); }
    void onFallbackPersisted() { fallbackPersisted.incrementAndGet(); }
    void onFallbackFailed() { fallbackFailed.incrementAndGet(); }

    public long enqueued() { return enqueued.get(); }

    /** Entries the queue refused (full or not accepting). */
    public long rejected() { return rejected.get(); }

    /** Entries a worker persisted. */
    public long processed() { return processed.get(); }

    /** Entries a worker failed to persist. */
    public long failed() { return failed.get(); }

    public long fallbackPersisted() { return fallbackPersisted.get(); }

    public long fallbackFailed() { return fallbackFailed.get(); }

    public Snapshot snapshot() {
        return new Snapshot(enqueued(), rejected(), processed(), failed(), fallbackPersisted(), fallbackFailed());
    }

    public record Snapshot(
        long enqueued,
        long rejected,
        long processed,
        long failed,
        long fallbackPersisted,
        long fallbackFailed
    ) {}
}
