package com.ivamare.agentqueue.audit;

import com.ivamare.agentqueue.model.MessageEvent;
import com.ivamare.agentqueue.model.MessageRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the audit trail.
 */
public interface AuditRepository {

    /**
     * Events for a message in the order they happened.
     *
     * @param messageId The message ID
     * @return events ordered by {@code (created_at, id)}
     */
    List<MessageEvent> findEvents(String messageId);

    /**
     * Current record of a message within one organization.
     */
    Optional<MessageRecord> findMessage(String orgId, String messageId);
}
