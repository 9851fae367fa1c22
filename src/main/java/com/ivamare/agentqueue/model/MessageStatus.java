package com.ivamare.agentqueue.model;

/**
 * Current-state status of a message record.
 */
public enum MessageStatus {
    /** Accepted by the producer and handed to the broker */
    QUEUED("QUEUED"),

    /** Claimed by a worker, handler running */
    PROCESSING("PROCESSING"),

    /** Handler succeeded and the result was published */
    COMPLETED("COMPLETED"),

    /** Handler or publish failed, disposition pending */
    FAILED("FAILED"),

    /** Parked on a delay queue awaiting redelivery */
    RETRYING("RETRYING"),

    /** Retry budget exhausted or non-retryable error */
    DEAD_LETTERED("DEAD_LETTERED"),

    /** Redelivery of an already processed message */
    DUPLICATE("DUPLICATE"),

    /** Failed too many times for the same dedup key */
    QUARANTINED("QUARANTINED");

    private final String value;

    MessageStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == DEAD_LETTERED || this == QUARANTINED;
    }

    public static MessageStatus fromValue(String value) {
        for (MessageStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown MessageStatus: " + value);
    }
}
