package com.ivamare.agentqueue.policy;

import com.ivamare.agentqueue.model.Priority;

/**
 * Result of a retry policy evaluation.
 *
 * @param shouldRetry Whether the message goes to a delay queue
 * @param delayMs Delay before redelivery (0 when not retrying)
 * @param nextPriority Priority for the redelivered copy
 * @param nextRetryCount Retry count carried by the redelivered copy
 */
public record RetryDecision(
    boolean shouldRetry,
    long delayMs,
    Priority nextPriority,
    int nextRetryCount
) {
    public static RetryDecision terminal(Priority priority, int retryCount) {
        return new RetryDecision(false, 0L, priority, retryCount);
    }

    public boolean isDemotion(Priority original) {
        return nextPriority != original;
    }
}
