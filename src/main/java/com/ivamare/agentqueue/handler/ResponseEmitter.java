package com.ivamare.agentqueue.handler;

import java.util.Map;

/**
 * Sends an intermediate response payload to the requesting agent.
 */
@FunctionalInterface
public interface ResponseEmitter {

    void emit(Map<String, Object> payload);

    static ResponseEmitter discarding() {
        return payload -> { };
    }
}
