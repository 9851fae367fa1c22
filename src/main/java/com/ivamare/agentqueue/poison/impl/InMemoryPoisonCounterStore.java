package com.ivamare.agentqueue.poison.impl;

import com.ivamare.agentqueue.poison.PoisonCounterStore;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local poison counters for development and tests.
 */
public class InMemoryPoisonCounterStore implements PoisonCounterStore {

    private final Map<String, Integer> counters = new ConcurrentHashMap<>();

    @Override
    public int increment(String orgId, String dedupKey) {
        return counters.merge(key(orgId, dedupKey), 1, Integer::sum);
    }

    @Override
    public void reset(String orgId, String dedupKey) {
        counters.remove(key(orgId, dedupKey));
    }

    @Override
    public int count(String orgId, String dedupKey) {
        return counters.getOrDefault(key(orgId, dedupKey), 0);
    }

    private static String key(String orgId, String dedupKey) {
        return orgId + "\u0000" + dedupKey;
    }
}
