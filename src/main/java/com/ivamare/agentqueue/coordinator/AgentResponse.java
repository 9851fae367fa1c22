package com.ivamare.agentqueue.coordinator;

import java.time.Instant;
import java.util.Map;

/**
 * A response payload received for a locally hosted agent.
 *
 * @param agentId Agent the response was addressed to
 * @param requestId The {@code request_id} routing field (nullable)
 * @param type The {@code type} routing field, {@code malformed} for unreadable bodies
 * @param payload Payload as received
 * @param traceId Trace id propagated with the response
 * @param receivedAt When the coordinator received it
 */
public record AgentResponse(
    String agentId,
    String requestId,
    String type,
    Map<String, Object> payload,
    String traceId,
    Instant receivedAt
) {
}
