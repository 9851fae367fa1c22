package com.ivamare.agentqueue.exception;

import com.ivamare.agentqueue.model.ErrorKind;

import java.util.List;

/**
 * Raised when a message fails structural validation.
 *
 * <p>Thrown synchronously by the producer (nothing is queued) and by handlers
 * that reject their input; in the latter case the message is dead-lettered
 * without retry.
 */
public class MessageValidationException extends AgentQueueException {

    private final List<String> violations;

    public MessageValidationException(List<String> violations) {
        super("Invalid message: " + String.join("; ", violations), ErrorKind.VALIDATION);
        this.violations = List.copyOf(violations);
    }

    public MessageValidationException(String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}
