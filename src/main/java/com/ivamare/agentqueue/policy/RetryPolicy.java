package com.ivamare.agentqueue.policy;

import com.ivamare.agentqueue.model.ErrorKind;
import com.ivamare.agentqueue.model.Priority;

import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Pure retry decision for failed messages.
 *
 * <p>Validation failures never retry. Rate-limited failures retry after a fixed
 * long backoff, one priority level lower. Everything else walks the delay
 * ladder at unchanged priority. A retry is only granted while
 * {@code retryCount < maxRetries}.
 *
 * @param delayLadderMs Delays in milliseconds indexed by retry count
 * @param rateLimitedBackoffMs Fixed delay for rate-limited failures
 */
public record RetryPolicy(
    List<Long> delayLadderMs,
    long rateLimitedBackoffMs
) {
    public static final List<Long> DEFAULT_LADDER_MS = List.of(1_000L, 2_000L, 4_000L, 8_000L);
    public static final long DEFAULT_RATE_LIMITED_BACKOFF_MS = 60_000L;

    public RetryPolicy {
        Objects.requireNonNull(delayLadderMs, "delayLadderMs");
        if (delayLadderMs.isEmpty()) {
            throw new IllegalArgumentException("delay ladder must not be empty");
        }
        if (delayLadderMs.stream().anyMatch(d -> d == null || d <= 0)) {
            throw new IllegalArgumentException("delay ladder entries must be positive: " + delayLadderMs);
        }
        if (rateLimitedBackoffMs <= 0) {
            throw new IllegalArgumentException("rate-limited backoff must be positive");
        }
        delayLadderMs = List.copyOf(delayLadderMs);
    }

    /**
     * Default policy: ladder [1s, 2s, 4s, 8s], 60s rate-limited backoff.
     *
     * @return Default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(DEFAULT_LADDER_MS, DEFAULT_RATE_LIMITED_BACKOFF_MS);
    }

    /**
     * Decide what happens to a failed message.
     *
     * @param priority Current logical priority
     * @param retryCount Retries already performed
     * @param maxRetries Retry budget
     * @param errorKind Classification of the failure
     * @return the decision; never null
     */
    public RetryDecision decide(Priority priority, int retryCount, int maxRetries, ErrorKind errorKind) {
        if (errorKind == ErrorKind.VALIDATION || retryCount >= maxRetries) {
            return RetryDecision.terminal(priority, retryCount);
        }
        if (errorKind == ErrorKind.RATE_LIMITED) {
            return new RetryDecision(true, rateLimitedBackoffMs, priority.demote(), retryCount + 1);
        }
        return new RetryDecision(true, nextDelay(retryCount, delayLadderMs), priority, retryCount + 1);
    }

    /**
     * Ladder lookup clamped to the last step.
     *
     * @param retryCount Retries already performed (negative treated as 0)
     * @param ladder Delay ladder
     * @return delay in milliseconds
     */
    public static long nextDelay(int retryCount, List<Long> ladder) {
        int index = Math.min(Math.max(retryCount, 0), ladder.size() - 1);
        return ladder.get(index);
    }

    /**
     * Every delay this policy can produce; one delay queue is declared per value.
     */
    public SortedSet<Long> distinctDelays() {
        SortedSet<Long> delays = new TreeSet<>(delayLadderMs);
        delays.add(rateLimitedBackoffMs);
        return delays;
    }
}
