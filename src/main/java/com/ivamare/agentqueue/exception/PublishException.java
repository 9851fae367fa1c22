package com.ivamare.agentqueue.exception;

import com.ivamare.agentqueue.model.ErrorKind;

/**
 * Raised when a message cannot be handed to the broker.
 */
public class PublishException extends AgentQueueException {

    private final String exchange;

    public PublishException(String exchange, String message, Throwable cause) {
        super(message, ErrorKind.TRANSIENT, cause);
        this.exchange = exchange;
    }

    public String getExchange() {
        return exchange;
    }
}
