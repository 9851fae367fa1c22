package com.ivamare.agentqueue.audit.impl;

import com.ivamare.agentqueue.audit.AuditRepository;
import com.ivamare.agentqueue.audit.AuditSink;
import com.ivamare.agentqueue.audit.DlqQuery;
import com.ivamare.agentqueue.audit.DlqRepository;
import com.ivamare.agentqueue.model.DlqMessage;
import com.ivamare.agentqueue.model.MessageEvent;
import com.ivamare.agentqueue.model.MessageRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local audit storage for development and tests.
 */
public class InMemoryAuditStore implements AuditSink, AuditRepository, DlqRepository {

    private final Map<RecordKey, MessageRecord> records = new ConcurrentHashMap<>();
    private final List<MessageEvent> events = new ArrayList<>();
    private final Map<Long, DlqMessage> dlq = new ConcurrentHashMap<>();
    private final AtomicLong eventIds = new AtomicLong();
    private final AtomicLong dlqIds = new AtomicLong();

    @Override
    public void upsertMessage(MessageRecord record) {
        records.merge(new RecordKey(record.orgId(), record.messageId()), record, (existing, update) -> new MessageRecord(
            update.messageId(), update.orgId(), update.agentId(), update.type(), update.priority(),
            update.status(), update.payload(), existing.createdAt(), update.updatedAt()));
    }

    @Override
    public synchronized void recordMessageEvent(MessageEvent event) {
        events.add(new MessageEvent(eventIds.incrementAndGet(), event.messageId(), event.orgId(),
            event.eventType(), event.details(), event.createdAt()));
    }

    @Override
    public synchronized void recordDlqMessage(DlqMessage entry) {
        boolean exists = dlq.values().stream().anyMatch(d -> d.orgId().equals(entry.orgId())
            && Objects.equals(d.messageId(), entry.messageId())
            && d.dlqTimestamp().equals(entry.dlqTimestamp()));
        if (exists) {
            return;
        }
        long id = dlqIds.incrementAndGet();
        dlq.put(id, new DlqMessage(id, entry.orgId(), entry.messageId(), entry.type(), entry.originalMessage(),
            entry.error(), entry.canReplay(), entry.dlqTimestamp()));
    }

    @Override
    public synchronized List<MessageEvent> findEvents(String messageId) {
        return events.stream()
            .filter(e -> e.messageId().equals(messageId))
            .sorted(Comparator.comparing(MessageEvent::createdAt).thenComparing(MessageEvent::id))
            .toList();
    }

    @Override
    public Optional<MessageRecord> findMessage(String orgId, String messageId) {
        return Optional.ofNullable(records.get(new RecordKey(orgId, messageId)));
    }

    @Override
    public List<DlqMessage> findReplayable(DlqQuery query) {
        return dlq.values().stream()
            .filter(d -> d.orgId().equals(query.orgId()) && d.canReplay())
            .filter(d -> query.type() == null || query.type().equals(d.type()))
            .filter(d -> query.since() == null || !d.dlqTimestamp().isBefore(query.since()))
            .filter(d -> query.until() == null || d.dlqTimestamp().isBefore(query.until()))
            .sorted(Comparator.comparing(DlqMessage::dlqTimestamp).thenComparing(DlqMessage::id))
            .limit(query.limit())
            .toList();
    }

    @Override
    public int markReplayed(Collection<Long> ids) {
        int updated = 0;
        for (Long id : ids) {
            DlqMessage row = dlq.computeIfPresent(id, (k, d) -> new DlqMessage(d.id(), d.orgId(), d.messageId(),
                d.type(), d.originalMessage(), d.error(), false, d.dlqTimestamp()));
            if (row != null) {
                updated++;
            }
        }
        return updated;
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        int before = dlq.size();
        dlq.values().removeIf(d -> d.dlqTimestamp().isBefore(cutoff));
        return before - dlq.size();
    }

    /**
     * All DLQ rows regardless of replay state.
     */
    public List<DlqMessage> dlqRows() {
        return dlq.values().stream().sorted(Comparator.comparing(DlqMessage::id)).toList();
    }

    public synchronized List<MessageEvent> allEvents() {
        return List.copyOf(events);
    }

    private record RecordKey(String orgId, String messageId) {
    }
}
