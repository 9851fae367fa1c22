package com.ivamare.agentqueue.exception;

import com.ivamare.agentqueue.model.ErrorKind;
import com.ivamare.agentqueue.model.MessageType;

/**
 * Thrown when attempting to register a handler for a message type that already has one.
 */
public class HandlerAlreadyRegisteredException extends AgentQueueException {

    private final MessageType messageType;

    public HandlerAlreadyRegisteredException(MessageType messageType) {
        super("Handler already registered for " + messageType.getValue(), ErrorKind.VALIDATION);
        this.messageType = messageType;
    }

    public MessageType getMessageType() {
        return messageType;
    }
}
