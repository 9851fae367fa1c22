package com.ivamare.agentqueue.poison;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Quarantines messages whose handler keeps failing.
 *
 * <p>A message is quarantined once its consecutive failure count exceeds the
 * threshold, regardless of the retry budget it has left. Success resets the count.
 */
public class PoisonDetector {

    private static final Logger log = LoggerFactory.getLogger(PoisonDetector.class);

    private final PoisonCounterStore store;
    private final int threshold;

    public PoisonDetector(PoisonCounterStore store, int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("poison threshold must be at least 1");
        }
        this.store = Objects.requireNonNull(store, "store");
        this.threshold = threshold;
    }

    public PoisonVerdict recordFailure(String orgId, String dedupKey) {
        try {
            int count = store.increment(orgId, dedupKey);
            return new PoisonVerdict(count, count > threshold);
        } catch (RuntimeException e) {
            log.warn("Poison counter unavailable for org={} key={}: {}", orgId, dedupKey, e.getMessage());
            return PoisonVerdict.unknown();
        }
    }

    public void recordSuccess(String orgId, String dedupKey) {
        try {
            store.reset(orgId, dedupKey);
        } catch (RuntimeException e) {
            log.warn("Poison counter reset failed for org={} key={}: {}", orgId, dedupKey, e.getMessage());
        }
    }

    public int threshold() {
        return threshold;
    }
}
