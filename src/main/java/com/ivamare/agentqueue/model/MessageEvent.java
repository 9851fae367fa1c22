package com.ivamare.agentqueue.model;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only lifecycle event.
 *
 * @param id Database identifier (null before insert)
 * @param messageId The message this event belongs to
 * @param orgId Owning organization
 * @param eventType Event type
 * @param details Event-specific details (nullable)
 * @param createdAt When the event occurred
 */
public record MessageEvent(
    Long id,
    String messageId,
    String orgId,
    MessageEventType eventType,
    Map<String, Object> details,
    Instant createdAt
) {
    public static MessageEvent of(String messageId, String orgId, MessageEventType eventType,
                                  Map<String, Object> details) {
        return new MessageEvent(null, messageId, orgId, eventType, details, Instant.now());
    }

    public MessageEvent withDetails(Map<String, Object> newDetails) {
        return new MessageEvent(id, messageId, orgId, eventType, newDetails, createdAt);
    }
}
