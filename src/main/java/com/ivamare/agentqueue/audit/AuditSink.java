package com.ivamare.agentqueue.audit;

import com.ivamare.agentqueue.model.DlqMessage;
import com.ivamare.agentqueue.model.MessageEvent;
import com.ivamare.agentqueue.model.MessageRecord;

/**
 * Write side of the audit trail.
 *
 * <p>Writes are idempotent by key: records upsert on message id, DLQ rows
 * collapse on {@code (org_id, message_id, dlq_timestamp)}.
 */
public interface AuditSink {

    void upsertMessage(MessageRecord record);

    void recordMessageEvent(MessageEvent event);

    void recordDlqMessage(DlqMessage entry);
}
