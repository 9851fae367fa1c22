package com.ivamare.agentqueue.exception;

import com.ivamare.agentqueue.model.ErrorKind;

/**
 * Base exception for all agent queue errors.
 *
 * <p>Carries the {@link ErrorKind} the retry policy acts on, so handlers
 * can signal intent without relying on exception class names.
 */
public class AgentQueueException extends RuntimeException {

    private final ErrorKind errorKind;

    public AgentQueueException(String message, ErrorKind errorKind) {
        super(message);
        this.errorKind = errorKind;
    }

    public AgentQueueException(String message, ErrorKind errorKind, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
