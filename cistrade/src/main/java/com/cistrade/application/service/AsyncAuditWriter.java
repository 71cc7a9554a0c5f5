package com.cistrade.application.service;

import com.cistrade.application.port.output.AuditRepository;
import com.cistrade.config.AuditConfig;
import com.cistrade.domain.audit.AuditEntry;
import com.cistrade.domain.common.DbResult;
import com.cistrade.infrastructure.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * AsyncAuditWriter - bounded queue drained by a fixed set of worker threads.
 *
 * Producers never block: {@link #enqueue} offers and returns false when the queue is
 * full, leaving the decision (fallback, drop) to the caller. Each worker polls with a
 * timeout so it notices the stop flag even when the queue stays empty.
 *
 * There is no ordering between entries handled by different workers.
 */
public final class AsyncAuditWriter {
    private static final Logger log = LoggerFactory.getLogger(AsyncAuditWriter.class);
    private static final long DRAIN_CHECK_MILLIS = 10;

    private enum State { NEW, RUNNING, STOPPING, STOPPED }

    private final AuditRepository repository;
    private final BlockingQueue<AuditEntry> queue;
    private final int workerCount;
    private final Duration pollInterval;
    private final AuditStats stats;
    private final PipelineMetrics metrics;
    private final List<Thread> workers = new ArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();

    // read side: enqueue's state check plus offer; write side: state transitions
    private final ReentrantReadWriteLock stateLock = new ReentrantReadWriteLock();

    private volatile State state = State.NEW;
    private volatile boolean stopRequested = false;

    public AsyncAuditWriter(AuditRepository repository, AuditConfig config, AuditStats stats, PipelineMetrics metrics) {
        this(repository, config.queueCapacity(), config.workerCount(), config.pollInterval(), stats, metrics);
    }

    public AsyncAuditWriter(
            AuditRepository repository,
            int queueCapacity,
            int workerCount,
            Duration pollInterval,
            AuditStats stats,
            PipelineMetrics metrics) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1");
        }
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1");
        }
        this.repository = repository;
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.workerCount = workerCount;
        this.pollInterval = pollInterval;
        this.stats = stats;
        this.metrics = metrics != null ? metrics : PipelineMetrics.NOOP;
    }

    /**
     * Start the worker threads. Calling it again, or after shutdown, is a no-op.
     */
    public void start() {
        stateLock.writeLock().lock();
        try {
            if (state != State.NEW) {
                log.warn("[AuditWriter] start() ignored, writer is {}", state);
                return;
            }
            for (int i = 0; i < workerCount; i++) {
                Thread t = new Thread(this::workerLoop, "audit-writer-" + i);
                t.setDaemon(true);
                workers.add(t);
                t.start();
            }
            state = State.RUNNING;
        } finally {
            stateLock.writeLock().unlock();
        }
        log.info("[AuditWriter] Started {} workers (queue capacity {})", workerCount, capacity());
    }

    /**
     * Offer an entry without blocking.
     *
     * @return false if the queue is full or the writer is not running
     */
    public boolean enqueue(AuditEntry entry) {
        boolean accepted;
        stateLock.readLock().lock();
        try {
            if (state != State.RUNNING) {
                stats.onRejected();
                return false;
            }
            // shutdown cannot leave RUNNING until this offer is done, so the drain sees it
            accepted = queue.offer(entry);
        } finally {
            stateLock.readLock().unlock();
        }
        if (accepted) {
            stats.onEnqueued();
        } else {
            stats.onRejected();
            log.debug("[AuditWriter] Queue full, rejected entry {}", entry.entryId());
        }
        metrics.updateQueueDepth(queue.size());
        return accepted;
    }

    /**
     * Stop accepting entries, give the workers up to {@code timeout} to drain the
     * queue, then stop them.
     *
     * Returns within roughly {@code timeout}. Workers are never interrupted, so a
     * write in progress when the budget runs out completes on its daemon thread.
     */
    public ShutdownReport shutdown(Duration timeout) {
        stateLock.writeLock().lock();
        try {
            if (state == State.NEW) {
                state = State.STOPPED;
                return report();
            }
            if (state != State.RUNNING) {
                return report();
            }
            state = State.STOPPING;
        } finally {
            stateLock.writeLock().unlock();
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        log.info("[AuditWriter] Shutting down, {} entries queued, timeout {}ms", queue.size(), timeout.toMillis());

        try {
            while ((!queue.isEmpty() || inFlight.get() > 0) && System.nanoTime() < deadline) {
                long leftMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                Thread.sleep(Math.max(1, Math.min(DRAIN_CHECK_MILLIS, leftMs)));
            }

            stopRequested = true;

            for (Thread t : workers) {
                long leftMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (leftMs <= 0) {
                    break;
                }
                t.join(leftMs);
            }
        } catch (InterruptedException e) {
            stopRequested = true;
            Thread.currentThread().interrupt();
        }

        state = State.STOPPED;
        ShutdownReport report = report();
        if (report.remaining() > 0) {
            log.warn("[AuditWriter] Shutdown timed out: processed={}, failed={}, fallback={}, remaining={}",
                report.processed(), report.failed(), report.fallback(), report.remaining());
        } else {
            log.info("[AuditWriter] Shutdown complete: processed={}, failed={}, fallback={}, remaining=0",
                report.processed(), report.failed(), report.fallback());
        }
        return report;
    }

    public AuditStats stats() {
        return stats;
    }

    public int queueDepth() {
        return queue.size();
    }

    public int capacity() {
        return queue.size() + queue.remainingCapacity();
    }

    public boolean isAccepting() {
        return state == State.RUNNING;
    }

    private ShutdownReport report() {
        return new ShutdownReport(
            stats.processed(),
            stats.failed(),
            stats.fallbackPersisted(),
            queue.size());
    }

    private void workerLoop() {
        String name = Thread.currentThread().getName();
        log.debug("[AuditWriter] {} running", name);

        while (!stopRequested) {
            AuditEntry entry;
            try {
                entry = queue.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[AuditWriter] {} interrupted, exiting", name);
                return;
            }
            if (entry == null) {
                continue;
            }

            inFlight.incrementAndGet();
            try {
                persist(entry);
            } finally {
                inFlight.decrementAndGet();
                metrics.updateQueueDepth(queue.size());
            }
        }
        log.debug("[AuditWriter] {} stopped", name);
    }

    private void persist(AuditEntry entry) {
        try {
            DbResult<Void> result = repository.save(entry);
            if (result.isSuccess()) {
                stats.onProcessed();
                metrics.recordAuditEntry(PipelineMetrics.AUDIT_PERSISTED);
            } else {
                stats.onFailed();
                metrics.recordAuditEntry(PipelineMetrics.AUDIT_FAILED);
                log.error("[AuditWriter] Failed to persist audit entry {}: {}", entry.entryId(), result.message());
            }
        } catch (RuntimeException e) {
            stats.onFailed();
            metrics.recordAuditEntry(PipelineMetrics.AUDIT_FAILED);
            log.error("[AuditWriter] Error persisting audit entry {}: {}", entry.entryId(), e.getMessage(), e);
        }
    }

    /**
     * Counters at the end of {@link #shutdown}.
     *
     * @param remaining entries still queued when the budget ran out
     */
    public record ShutdownReport(long processed, long failed, long fallback, int remaining) {}
}
