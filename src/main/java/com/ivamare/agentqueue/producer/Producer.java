package com.ivamare.agentqueue.producer;

import com.ivamare.agentqueue.model.Priority;
import com.ivamare.agentqueue.model.RequestMessage;
import com.ivamare.agentqueue.model.SubmitResult;

import java.util.List;
import java.util.Map;

/**
 * Submits request messages to an organization's request queue.
 *
 * <p>Submission validates the message, waits for rate-limit tokens, applies
 * backpressure admission control, records the audit trail and publishes.
 */
public interface Producer {

    /**
     * Submit a message.
     *
     * @param orgId Target organization
     * @param message Message to submit
     * @param priority Logical priority; null keeps the message's own priority
     * @return PUBLISHED, or THROTTLED when backpressure shed the message
     * @throws com.ivamare.agentqueue.exception.MessageValidationException if the message is invalid
     * @throws com.ivamare.agentqueue.exception.PublishException if the broker rejected the publish
     */
    SubmitResult submit(String orgId, RequestMessage message, Priority priority);

    default SubmitResult submit(String orgId, RequestMessage message) {
        return submit(orgId, message, null);
    }

    /**
     * Submit a message given as a JSON-shaped map (snake_case field names).
     */
    SubmitResult submitRaw(String orgId, Map<String, Object> message, Priority priority);

    /**
     * Submit messages in order, stopping at the first validation failure.
     *
     * @return one result per submitted message
     */
    List<SubmitResult> submitAll(String orgId, List<RequestMessage> messages);

    /**
     * Publish an already-audited message again, bypassing rate limiting and
     * backpressure. Used by DLQ replay.
     */
    SubmitResult republish(RequestMessage message, Priority priority);
}
