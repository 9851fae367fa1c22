package com.ivamare.agentqueue.dedup.impl;

import com.ivamare.agentqueue.dedup.IdempotencyStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local idempotency store for development and tests.
 */
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private final Map<String, Instant> keys = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryIdempotencyStore() {
        this(Clock.systemUTC());
    }

    public InMemoryIdempotencyStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean markIfAbsent(String orgId, String dedupKey) {
        return keys.putIfAbsent(key(orgId, dedupKey), clock.instant()) == null;
    }

    @Override
    public void release(String orgId, String dedupKey) {
        keys.remove(key(orgId, dedupKey));
    }

    @Override
    public boolean contains(String orgId, String dedupKey) {
        return keys.containsKey(key(orgId, dedupKey));
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        int before = keys.size();
        keys.values().removeIf(createdAt -> createdAt.isBefore(cutoff));
        return before - keys.size();
    }

    private static String key(String orgId, String dedupKey) {
        return orgId + "\u0000" + dedupKey;
    }
}
