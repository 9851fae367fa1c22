package com.ivamare.agentqueue.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.agentqueue.model.DlqMessage;
import com.ivamare.agentqueue.model.MessageEvent;
import com.ivamare.agentqueue.model.MessageEventType;
import com.ivamare.agentqueue.model.MessageRecord;
import com.ivamare.agentqueue.model.MessageStatus;
import com.ivamare.agentqueue.model.RequestMessage;
import com.ivamare.agentqueue.policy.RetryDecision;
import com.ivamare.agentqueue.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Lifecycle audit helpers used by the producer, worker and replay tool.
 *
 * <p>Every method is best-effort: sink failures are logged and swallowed so
 * that auditing never changes how a message is disposed of.
 */
public class AuditTrail {

    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

    private final AuditSink sink;
    private final ObjectMapper objectMapper;
    private final AuditRedactor redactor;

    public AuditTrail(AuditSink sink, ObjectMapper objectMapper, AuditRedactor redactor) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.redactor = redactor != null ? redactor : new AuditRedactor(false);
    }

    // --- Producer ---

    public void createdAndEnqueued(RequestMessage message, String exchange) {
        event(message, MessageEventType.CREATED, details("type", message.type(), "priority", message.priority()));
        event(message, MessageEventType.ENQUEUED, details("exchange", exchange));
        upsert(message, MessageStatus.QUEUED);
    }

    public void publishFailed(RequestMessage message, String error) {
        event(message, MessageEventType.FAILED, details("stage", "publish", "error", error));
        upsert(message, MessageStatus.FAILED);
    }

    // --- Worker ---

    public void dequeued(RequestMessage message, String queue, String workerId) {
        event(message, MessageEventType.DEQUEUED, details("queue", queue, "worker_id", workerId,
            "retry_count", message.retryCountOrZero()));
    }

    public void processing(RequestMessage message, String workerId) {
        event(message, MessageEventType.PROCESSING, details("worker_id", workerId));
        upsert(message, MessageStatus.PROCESSING);
    }

    public void duplicateSkipped(RequestMessage message, String dedupKey) {
        event(message, MessageEventType.DUPLICATE_SKIPPED, details("dedup_key", dedupKey));
        upsert(message, MessageStatus.DUPLICATE);
    }

    public void completed(RequestMessage message, String workerId, String responseAgentId) {
        event(message, MessageEventType.COMPLETED, details("worker_id", workerId, "response_agent", responseAgentId));
        upsert(message, MessageStatus.COMPLETED);
    }

    public void failed(RequestMessage message, String errorType, String errorMessage, int failureCount) {
        event(message, MessageEventType.FAILED, details("error_type", errorType, "error", errorMessage,
            "failure_count", failureCount, "retry_count", message.retryCountOrZero()));
        upsert(message, MessageStatus.FAILED);
    }

    public void retryScheduled(RequestMessage retried, RetryDecision decision) {
        event(retried, MessageEventType.RETRY_SCHEDULED, details("delay_ms", decision.delayMs(),
            "retry_count", decision.nextRetryCount(), "priority", decision.nextPriority().level()));
        upsert(retried, MessageStatus.RETRYING);
    }

    public void deadLettered(RequestMessage message, DlqMessage.Failure error) {
        event(message, MessageEventType.DEAD_LETTER, details("error_type", error.type(), "error", error.message()));
        dlq(new DlqMessage(null, message.orgId(), message.messageId(), message.type(),
            Jsons.toMap(objectMapper, message), error, true, Instant.now()));
        upsert(message, MessageStatus.DEAD_LETTERED);
    }

    /**
     * DLQ row for a body that could not be parsed; never replayable.
     */
    public void unparseableDeadLettered(String orgId, String rawBody, String error) {
        dlq(new DlqMessage(null, orgId, null, null, details("raw", rawBody),
            new DlqMessage.Failure("VALIDATION", error), false, Instant.now()));
    }

    /**
     * DLQ row, under the consuming organization, for a message that names
     * another organization; never replayable.
     */
    public void foreignDeadLettered(String orgId, RequestMessage message, String error) {
        dlq(new DlqMessage(null, orgId, message.messageId(), message.type(), Jsons.toMap(objectMapper, message),
            new DlqMessage.Failure("VALIDATION", error), false, Instant.now()));
    }

    public void quarantined(RequestMessage message, String dedupKey, int failureCount) {
        event(message, MessageEventType.POISON_QUARANTINED, details("dedup_key", dedupKey,
            "failure_count", failureCount));
        upsert(message, MessageStatus.QUARANTINED);
    }

    // --- Replay ---

    public void replayed(RequestMessage message, long dlqId) {
        event(message, MessageEventType.REPLAYED, details("dlq_id", dlqId, "priority", message.priority()));
        upsert(message, MessageStatus.QUEUED);
    }

    // --- Internals ---

    private void event(RequestMessage message, MessageEventType type, Map<String, Object> details) {
        try {
            sink.recordMessageEvent(redactor.redact(MessageEvent.of(message.messageId(), message.orgId(), type, details)));
        } catch (RuntimeException e) {
            log.warn("Audit event {} for {} not recorded: {}", type, message.messageId(), e.getMessage());
        }
    }

    private void upsert(RequestMessage message, MessageStatus status) {
        try {
            Instant now = Instant.now();
            MessageRecord record = new MessageRecord(
                message.messageId(),
                message.orgId(),
                message.agentId(),
                message.type(),
                message.priority() != null ? message.priority() : message.logicalPriority().level(),
                status,
                Jsons.toMap(objectMapper, message),
                message.createdAt() != null ? message.createdAt() : now,
                now
            );
            sink.upsertMessage(redactor.redact(record));
        } catch (RuntimeException e) {
            log.warn("Audit record {} -> {} not written: {}", message.messageId(), status, e.getMessage());
        }
    }

    private void dlq(DlqMessage entry) {
        try {
            sink.recordDlqMessage(redactor.redact(entry));
        } catch (RuntimeException e) {
            log.warn("DLQ row for {} not written: {}", entry.messageId(), e.getMessage());
        }
    }

    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            details.put((String) keyValues[i], keyValues[i + 1]);
        }
        return details;
    }
}
