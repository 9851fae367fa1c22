package com.ivamare.agentqueue.poison;

/**
 * Outcome of recording a handler failure.
 *
 * @param failureCount Failures recorded for the dedup key, -1 if the store was unavailable
 * @param quarantined Whether the count exceeded the threshold
 */
public record PoisonVerdict(int failureCount, boolean quarantined) {

    public static PoisonVerdict unknown() {
        return new PoisonVerdict(-1, false);
    }
}
