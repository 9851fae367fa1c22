package com.ivamare.agentqueue.dedup;

import java.time.Instant;

/**
 * Duplicate-delivery detection keyed by {@code (orgId, dedupKey)}.
 *
 * <p>Implementations must make {@link #markIfAbsent} atomic across worker processes.
 */
public interface IdempotencyStore {

    /**
     * Atomically record the key if it is not present.
     *
     * @param orgId Organization
     * @param dedupKey Message fingerprint
     * @return true on first sighting, false if the key already existed
     */
    boolean markIfAbsent(String orgId, String dedupKey);

    /**
     * Forget a key so the message can be claimed again (retry or replay).
     *
     * @param orgId Organization
     * @param dedupKey Message fingerprint
     */
    void release(String orgId, String dedupKey);

    boolean contains(String orgId, String dedupKey);

    /**
     * Delete keys recorded before the cutoff.
     *
     * @param cutoff Oldest timestamp to keep
     * @return number of keys removed
     */
    int purgeOlderThan(Instant cutoff);
}
