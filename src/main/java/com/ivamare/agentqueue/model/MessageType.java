package com.ivamare.agentqueue.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Closed set of operation kinds a request message can carry.
 *
 * <p>Each kind carries the retry budget applied when a submitted message
 * does not state its own {@code max_retries}.
 */
public enum MessageType {
    MODEL_CALL("model_call", 3),
    TOOL_CALL("tool_call", 5),
    AGENT_MESSAGE("agent_message", 3),
    MEMORY_SAVE("memory_save", 10),
    MEMORY_RETRIEVE("memory_retrieve", 5),
    MEMORY_UPDATE("memory_update", 10),
    AGENT_SPAWN("agent_spawn", 3),
    AGENT_TERMINATE("agent_terminate", 3);

    private final String value;
    private final int defaultMaxRetries;

    MessageType(String value, int defaultMaxRetries) {
        this.value = value;
        this.defaultMaxRetries = defaultMaxRetries;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    @JsonCreator
    public static MessageType fromValue(String value) {
        return find(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown MessageType: " + value));
    }

    /**
     * Lenient lookup used by the dispatcher, which routes unknown kinds to a fallback.
     *
     * @param value wire value such as {@code model_call}
     * @return matching type, or empty
     */
    public static Optional<MessageType> find(String value) {
        for (MessageType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
