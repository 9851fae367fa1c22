package com.ivamare.agentqueue.amqp;

import com.ivamare.agentqueue.model.Priority;
import com.ivamare.agentqueue.model.RequestMessage;

import java.util.Map;

/**
 * Publishing side of the transport.
 *
 * <p>All methods publish persistent JSON messages and throw
 * {@link com.ivamare.agentqueue.exception.PublishException} when the broker
 * does not accept them.
 */
public interface MessagePublisher {

    /**
     * Publish to the organization request exchange.
     *
     * @param orgId Organization
     * @param message Message body
     * @param priority Logical priority, mapped to the AMQP priority
     * @param headers Extra headers (trace context)
     */
    void publishRequest(String orgId, RequestMessage message, Priority priority, Map<String, Object> headers);

    /**
     * Publish to the delay queue for {@code delayMs}; the broker routes it back
     * to the request queue when the TTL expires.
     */
    void scheduleRetry(String orgId, RequestMessage message, long delayMs, Priority priority,
                       Map<String, Object> headers);

    /**
     * Publish a body to the organization dead-letter exchange.
     */
    void publishToDlq(String orgId, Object body, Map<String, Object> headers);

    /**
     * Publish a response payload to an agent's response exchange.
     */
    void publishResponse(String agentId, Map<String, Object> payload, Map<String, Object> headers);
}
