package com.ivamare.agentqueue.model;

import java.time.Duration;

/**
 * Outcome of a producer submission.
 *
 * @param messageId The submitted message id
 * @param status Whether the message was published or shed by backpressure
 * @param priority Logical priority it was submitted at
 * @param throttleMode Backpressure mode observed at admission
 * @param rateLimitWait Time spent waiting for rate-limit tokens
 * @param traceId Trace id propagated with the message (null when throttled)
 */
public record SubmitResult(
    String messageId,
    Status status,
    Priority priority,
    ThrottleMode throttleMode,
    Duration rateLimitWait,
    String traceId
) {
    public enum Status {
        PUBLISHED,
        THROTTLED
    }

    public static SubmitResult published(String messageId, Priority priority, ThrottleMode mode,
                                         Duration waited, String traceId) {
        return new SubmitResult(messageId, Status.PUBLISHED, priority, mode, waited, traceId);
    }

    public static SubmitResult throttled(String messageId, Priority priority, ThrottleMode mode, Duration waited) {
        return new SubmitResult(messageId, Status.THROTTLED, priority, mode, waited, null);
    }

    public boolean isPublished() {
        return status == Status.PUBLISHED;
    }
}
