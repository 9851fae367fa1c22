package com.ivamare.agentqueue.exception;

import com.ivamare.agentqueue.model.ErrorKind;

/**
 * Raised by handlers when a downstream dependency reports it is saturated.
 *
 * <p>The retry is scheduled after the long rate-limit backoff and at one
 * priority level lower.
 */
public class RateLimitedException extends AgentQueueException {

    private final String resource;

    public RateLimitedException(String resource, String message) {
        super(message, ErrorKind.RATE_LIMITED);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
