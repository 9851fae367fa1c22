package com.ivamare.agentqueue.model;

import java.time.Instant;
import java.util.Map;

/**
 * Current-state projection of a message, upserted at every lifecycle phase.
 *
 * @param messageId Message identifier (primary key)
 * @param orgId Owning organization
 * @param agentId Target agent (nullable)
 * @param type Operation kind wire value
 * @param priority Logical priority 0..3
 * @param status Current status
 * @param payload Message body as stored
 * @param createdAt When the message was created
 * @param updatedAt When the record was last written
 */
public record MessageRecord(
    String messageId,
    String orgId,
    String agentId,
    String type,
    int priority,
    MessageStatus status,
    Map<String, Object> payload,
    Instant createdAt,
    Instant updatedAt
) {
    public MessageRecord withPayload(Map<String, Object> newPayload) {
        return new MessageRecord(messageId, orgId, agentId, type, priority, status, newPayload, createdAt, updatedAt);
    }
}
