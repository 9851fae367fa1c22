package com.ivamare.agentqueue.handler;

import com.ivamare.agentqueue.model.RequestMessage;

/**
 * Functional interface for message handlers.
 *
 * <p>The return value becomes the {@code result} of the response payload sent to
 * the requesting agent. Handlers signal how a failure should be treated by throwing:
 * <ul>
 *   <li>{@link com.ivamare.agentqueue.exception.MessageValidationException} - never retried</li>
 *   <li>{@link com.ivamare.agentqueue.exception.RateLimitedException} - retried with a long backoff at a lower priority</li>
 *   <li>Any other exception - transient, retried along the delay ladder</li>
 * </ul>
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Process a message.
     *
     * @param message The message to process
     * @param context Handler context with retry state and response helpers
     * @return Result for the response payload (may be null)
     * @throws Exception on processing failure
     */
    Object handle(RequestMessage message, HandlerContext context) throws Exception;
}
