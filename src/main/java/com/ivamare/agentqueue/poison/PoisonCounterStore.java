package com.ivamare.agentqueue.poison;

/**
 * Failure counters keyed by {@code (orgId, dedupKey)}, shared across worker processes.
 */
public interface PoisonCounterStore {

    /**
     * Atomically add one failure.
     *
     * @return the count after incrementing
     */
    int increment(String orgId, String dedupKey);

    void reset(String orgId, String dedupKey);

    int count(String orgId, String dedupKey);
}
