package com.ivamare.agentqueue.exception;

import com.ivamare.agentqueue.model.ErrorKind;

import java.util.Map;

/**
 * Raised for retryable failures (network, timeout, temporary unavailability).
 *
 * <p>The message is retried on the backoff ladder until its retry budget
 * is spent, then dead-lettered.
 */
public class TransientMessageException extends AgentQueueException {

    private final String code;
    private final String errorMessage;
    private final Map<String, Object> details;

    public TransientMessageException(String code, String message) {
        this(code, message, Map.of());
    }

    public TransientMessageException(String code, String message, Map<String, Object> details) {
        super("[" + code + "] " + message, ErrorKind.TRANSIENT);
        this.code = code;
        this.errorMessage = message;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public String getCode() {
        return code;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
