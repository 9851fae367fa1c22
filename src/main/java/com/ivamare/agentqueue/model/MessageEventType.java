package com.ivamare.agentqueue.model;

/**
 * Types of append-only lifecycle events.
 */
public enum MessageEventType {
    CREATED("CREATED"),
    ENQUEUED("ENQUEUED"),
    DEQUEUED("DEQUEUED"),
    PROCESSING("PROCESSING"),
    COMPLETED("COMPLETED"),
    FAILED("FAILED"),
    RETRY_SCHEDULED("RETRY_SCHEDULED"),
    DEAD_LETTER("DEAD_LETTER"),
    DUPLICATE_SKIPPED("DUPLICATE_SKIPPED"),
    REPLAYED("REPLAYED"),
    POISON_QUARANTINED("POISON_QUARANTINED");

    private final String value;

    MessageEventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static MessageEventType fromValue(String value) {
        for (MessageEventType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown MessageEventType: " + value);
    }
}
