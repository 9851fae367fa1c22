package com.ivamare.agentqueue.model;

import java.time.Instant;
import java.util.Map;

/**
 * A terminally failed message parked for operator inspection and replay.
 *
 * @param id Database identifier (null before insert)
 * @param orgId Owning organization
 * @param messageId Message identifier (nullable for unparseable bodies)
 * @param type Operation kind wire value (nullable for unparseable bodies)
 * @param originalMessage The message as last delivered
 * @param error Captured failure
 * @param canReplay Whether the replay tool may republish this row
 * @param dlqTimestamp When the message was dead-lettered
 */
public record DlqMessage(
    Long id,
    String orgId,
    String messageId,
    String type,
    Map<String, Object> originalMessage,
    Failure error,
    boolean canReplay,
    Instant dlqTimestamp
) {
    /**
     * Error captured at dead-letter time.
     *
     * @param type Error classification or exception type
     * @param message Error message
     */
    public record Failure(String type, String message) {
        public Map<String, Object> toMap() {
            return Map.of("type", type != null ? type : "", "message", message != null ? message : "");
        }
    }

    public DlqMessage withContent(Map<String, Object> newOriginalMessage, Failure newError) {
        return new DlqMessage(id, orgId, messageId, type, newOriginalMessage, newError, canReplay, dlqTimestamp);
    }
}
