package com.ivamare.agentqueue.ops;

import com.ivamare.agentqueue.audit.DlqRepository;
import com.ivamare.agentqueue.audit.impl.InMemoryAuditStore;
import com.ivamare.agentqueue.dedup.IdempotencyStore;
import com.ivamare.agentqueue.dedup.impl.InMemoryIdempotencyStore;
import com.ivamare.agentqueue.metrics.QueueMetrics;
import com.ivamare.agentqueue.model.DlqMessage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RetentionCleanerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T03:30:00Z");

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private static DlqMessage row(String messageId, Instant at) {
        return new DlqMessage(null, "acme", messageId, "tool_call", Map.of("message_id", messageId),
            new DlqMessage.Failure("TRANSIENT", "boom"), true, at);
    }

    @Test
    void shouldPurgeRowsAndKeysPastRetention() {
        InMemoryAuditStore store = new InMemoryAuditStore();
        store.recordDlqMessage(row("old", NOW.minus(Duration.ofDays(31))));
        store.recordDlqMessage(row("recent", NOW.minus(Duration.ofDays(2))));

        InMemoryIdempotencyStore keys = new InMemoryIdempotencyStore(
            Clock.fixed(NOW.minus(Duration.ofDays(8)), ZoneOffset.UTC));
        keys.markIfAbsent("acme", "k-old");

        RetentionCleaner cleaner = new RetentionCleaner(store, keys, new QueueMetrics(meterRegistry),
            Duration.ofDays(30), Duration.ofDays(7), Clock.fixed(NOW, ZoneOffset.UTC));

        RetentionCleaner.PurgeResult result = cleaner.purge();

        assertEquals(1, result.dlqRows());
        assertEquals(1, result.idempotencyKeys());
        assertEquals(1, store.dlqRows().size());
        assertEquals("recent", store.dlqRows().get(0).messageId());
        assertFalse(keys.contains("acme", "k-old"));
        assertEquals(1.0, meterRegistry.get("agentqueue.dlq.purged").counter().count());
    }

    @Test
    void shouldPassRetentionCutoffsToStores() {
        DlqRepository dlq = mock(DlqRepository.class);
        IdempotencyStore keys = mock(IdempotencyStore.class);
        when(dlq.purgeOlderThan(NOW.minus(Duration.ofDays(30)))).thenReturn(4);
        when(keys.purgeOlderThan(NOW.minus(Duration.ofDays(7)))).thenReturn(9);

        RetentionCleaner cleaner = new RetentionCleaner(dlq, keys, new QueueMetrics(meterRegistry),
            Duration.ofDays(30), Duration.ofDays(7), Clock.fixed(NOW, ZoneOffset.UTC));

        assertEquals(new RetentionCleaner.PurgeResult(4, 9), cleaner.purge());
    }

    @Test
    void scheduledPurgeShouldNotPropagateFailures() {
        DlqRepository dlq = mock(DlqRepository.class);
        IdempotencyStore keys = mock(IdempotencyStore.class);
        when(dlq.purgeOlderThan(any())).thenThrow(new IllegalStateException("database down"));

        RetentionCleaner cleaner = new RetentionCleaner(dlq, keys, new QueueMetrics(meterRegistry),
            Duration.ofDays(30), Duration.ofDays(7), Clock.fixed(NOW, ZoneOffset.UTC));

        assertDoesNotThrow(cleaner::scheduledPurge);
        verify(keys, never()).purgeOlderThan(any());
    }
}
