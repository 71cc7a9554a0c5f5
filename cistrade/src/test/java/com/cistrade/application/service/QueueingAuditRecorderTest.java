package com.cistrade.application.service;

import com.cistrade.application.port.input.AuditRecorder.BatchOutcome;
import com.cistrade.application.port.input.AuditRecorder.RecordOutcome;
import com.cistrade.application.port.output.AuditRepository;
import com.cistrade.domain.audit.AuditAction;
import com.cistrade.domain.audit.AuditEntry;
import com.cistrade.domain.common.DbResult;
import com.cistrade.domain.common.ErrorKind;
import com.cistrade.infrastructure.metrics.PipelineMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QueueingAuditRecorderTest {

    @Mock
    private AsyncAuditWriter writer;
    @Mock
    private AuditRepository repository;
    @Mock
    private PipelineMetrics metrics;

    private AuditStats stats;
    private AuditEntry entry;

    @BeforeEach
    void setUp() {
        stats = new AuditStats();
        entry = AuditEntry.builder(AuditAction.APPROVE, "Portfolio").objectId("P-9").actor("7", "checker1").build();
    }

    private QueueingAuditRecorder recorder(boolean enabled) {
        when(writer.stats()).thenReturn(stats);
        return new QueueingAuditRecorder(enabled, writer, repository, metrics);
    }

    @Test
    void disabledRecorderDropsEntries() {
        QueueingAuditRecorder recorder = recorder(false);

        assertEquals(RecordOutcome.DISABLED, recorder.record(entry));
        verify(writer, never()).enqueue(any());
        verifyNoInteractions(repository);
    }

    @Test
    void acceptedEntryIsQueued() {
        when(writer.enqueue(entry)).thenReturn(true);

        assertEquals(RecordOutcome.QUEUED, recorder(true).record(entry));
        verifyNoInteractions(repository);
    }

    @Test
    void fullQueueFallsBackToSynchronousSave() {
        when(writer.enqueue(entry)).thenReturn(false);
        when(repository.save(entry)).thenReturn(DbResult.done());

        assertEquals(RecordOutcome.FALLBACK_PERSISTED, recorder(true).record(entry));
        assertEquals(1, stats.fallbackPersisted());
        verify(metrics).recordAuditEntry(PipelineMetrics.AUDIT_REJECTED);
        verify(metrics).recordAuditEntry(PipelineMetrics.AUDIT_FALLBACK_PERSISTED);
    }

    @Test
    void failedFallbackIsReportedNotThrown() {
        when(writer.enqueue(entry)).thenReturn(false);
        when(repository.save(entry)).thenReturn(DbResult.fail(ErrorKind.POOL_EXHAUSTED, "no connection in 30s"));

        assertEquals(RecordOutcome.FAILED, recorder(true).record(entry));
        assertEquals(1, stats.fallbackFailed());
        verify(metrics).recordAuditEntry(PipelineMetrics.AUDIT_FALLBACK_FAILED);
    }

    @Test
    void exceptionInFallbackIsContained() {
        when(writer.enqueue(entry)).thenReturn(false);
        when(repository.save(entry)).thenThrow(new IllegalStateException("driver bug"));

        QueueingAuditRecorder recorder = recorder(true);

        assertDoesNotThrow(() -> assertEquals(RecordOutcome.FAILED, recorder.record(entry)));
    }

    @Test
    void nullEntryIsRejected() {
        assertEquals(RecordOutcome.FAILED, recorder(true).record(null));
        verify(writer, never()).enqueue(any());
    }

    @Test
    void everyRecordedEntryIsPersistedByWorkerOrFallback() throws Exception {
        InMemoryAuditRepository repo = new InMemoryAuditRepository();
        repo.delay(2);
        AsyncAuditWriter realWriter = new AsyncAuditWriter(repo, 5, 2, Duration.ofMillis(20), new AuditStats(), null);
        realWriter.start();
        QueueingAuditRecorder recorder = new QueueingAuditRecorder(true, realWriter, repo, null);

        int producers = 4;
        int perProducer = 50;
        Set<String> ids = ConcurrentHashMap.newKeySet();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(producers);
        List<Future<?>> futures = new ArrayList<>();
        for (int p = 0; p < producers; p++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < perProducer; i++) {
                    AuditEntry e = AuditEntry.builder(AuditAction.CREATE, "Order").objectId(i).build();
                    ids.add(e.entryId());
                    RecordOutcome outcome = recorder.record(e);
                    assertNotEquals(RecordOutcome.FAILED, outcome);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(60, TimeUnit.SECONDS);
        }
        executor.shutdown();

        AsyncAuditWriter.ShutdownReport report = realWriter.shutdown(Duration.ofSeconds(20));

        assertEquals(0, report.remaining());
        assertEquals(producers * perProducer, ids.size());
        assertEquals(ids, repo.saved.keySet());
        assertEquals(ids.size(), report.processed() + report.fallback());
    }

    @Test
    void batchQueuesWhatFitsAndSavesTheRestTogether() {
        AuditEntry second = AuditEntry.builder(AuditAction.UPDATE, "Portfolio").objectId("P-10").build();
        AuditEntry third = AuditEntry.builder(AuditAction.DELETE, "Portfolio").objectId("P-11").build();
        when(writer.enqueue(entry)).thenReturn(true);
        when(writer.enqueue(second)).thenReturn(false);
        when(writer.enqueue(third)).thenReturn(false);
        when(repository.saveAll(List.of(second, third))).thenReturn(DbResult.ok(1));

        BatchOutcome outcome = recorder(true).recordAll(List.of(entry, second, third));

        assertEquals(new BatchOutcome(1, 1, 1, 0), outcome);
        assertEquals(3, outcome.total());
        assertEquals(1, stats.fallbackPersisted());
        assertEquals(1, stats.fallbackFailed());
        verify(metrics, times(2)).recordAuditEntry(PipelineMetrics.AUDIT_REJECTED);
        verify(repository, never()).save(any());
    }

    @Test
    void batchThatFitsNeverTouchesRepository() {
        when(writer.enqueue(any())).thenReturn(true);

        BatchOutcome outcome = recorder(true).recordAll(Arrays.asList(entry, null));

        assertEquals(new BatchOutcome(1, 0, 1, 0), outcome);
        verifyNoInteractions(repository);
    }

    @Test
    void disabledBatchIsCountedNotWritten() {
        BatchOutcome outcome = recorder(false).recordAll(List.of(entry));

        assertEquals(new BatchOutcome(0, 0, 0, 1), outcome);
        verify(writer, never()).enqueue(any());
        verifyNoInteractions(repository);
    }

    @Test
    void exceptionInBatchFallbackIsContained() {
        when(writer.enqueue(entry)).thenReturn(false);
        when(repository.saveAll(any())).thenThrow(new IllegalStateException("driver bug"));

        BatchOutcome outcome = recorder(true).recordAll(List.of(entry));

        assertEquals(new BatchOutcome(0, 0, 1, 0), outcome);
        assertEquals(1, stats.fallbackFailed());
    }

    @Test
    void rejectedBatchIsSavedEntryByEntry() {
        InMemoryAuditRepository repo = new InMemoryAuditRepository();
        AuditEntry refused = AuditEntry.builder(AuditAction.EXPORT, "Report").objectId("R-1").build();
        repo.override(e -> e == refused ? DbResult.fail(ErrorKind.QUERY_EXECUTION_FAILURE, "Kudu write timed out") : null);
        AuditEntry second = AuditEntry.builder(AuditAction.CREATE, "Report").objectId("R-2").build();
        when(writer.stats()).thenReturn(stats);
        when(writer.enqueue(any())).thenReturn(false);

        BatchOutcome outcome = new QueueingAuditRecorder(true, writer, repo, metrics)
            .recordAll(List.of(entry, refused, second));

        assertEquals(new BatchOutcome(0, 2, 1, 0), outcome);
        assertEquals(2, stats.fallbackPersisted());
        assertEquals(1, stats.fallbackFailed());
        assertEquals(2L, repo.statistics(7).value().totalCount());
        assertEquals(1L, repo.statistics(7).value().byAction().get("APPROVE"));
        assertFalse(repo.saved.containsKey(refused.entryId()));
    }
}
