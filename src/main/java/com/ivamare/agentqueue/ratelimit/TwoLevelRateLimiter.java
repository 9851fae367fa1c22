package com.ivamare.agentqueue.ratelimit;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.BlockingStrategy;
import io.github.bucket4j.Bucket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Admission control with one token bucket per organization and one per
 * organization user, consumed in that order.
 *
 * <p>Buckets refill greedily (proportional to elapsed time) up to their burst
 * size. When a bucket is empty the caller is parked for exactly the time
 * until the next token accrues. A level whose rate is non-positive is skipped.
 */
public class TwoLevelRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TwoLevelRateLimiter.class);

    private final TokenBucketSpec orgSpec;
    private final TokenBucketSpec userSpec;
    private final BlockingStrategy blockingStrategy;

    private final ConcurrentHashMap<String, Bucket> orgBuckets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bucket> userBuckets = new ConcurrentHashMap<>();

    public TwoLevelRateLimiter(TokenBucketSpec orgSpec, TokenBucketSpec userSpec) {
        this(orgSpec, userSpec, BlockingStrategy.PARKING);
    }

    /**
     * Creates a limiter with a custom parking strategy (for testing).
     *
     * @param orgSpec Organization bucket parameters
     * @param userSpec User bucket parameters
     * @param blockingStrategy How callers are suspended while waiting for tokens
     */
    public TwoLevelRateLimiter(TokenBucketSpec orgSpec, TokenBucketSpec userSpec, BlockingStrategy blockingStrategy) {
        this.orgSpec = orgSpec != null ? orgSpec : TokenBucketSpec.disabled();
        this.userSpec = userSpec != null ? userSpec : TokenBucketSpec.disabled();
        this.blockingStrategy = Objects.requireNonNull(blockingStrategy, "blockingStrategy");
    }

    public boolean isEnabled() {
        return orgSpec.enabled() || userSpec.enabled();
    }

    /**
     * Take one token from the organization bucket, then one from the user bucket.
     *
     * @param orgId Organization
     * @param userId User within the organization (nullable; skips the user level)
     * @return total time the caller was parked
     * @throws InterruptedException if interrupted while parked
     */
    public Duration acquire(String orgId, String userId) throws InterruptedException {
        long waitedNanos = 0;
        if (orgSpec.enabled()) {
            waitedNanos += consume(orgBuckets.computeIfAbsent(orgId, k -> newBucket(orgSpec)));
        }
        if (userSpec.enabled() && userId != null) {
            String key = orgId + ":" + userId;
            waitedNanos += consume(userBuckets.computeIfAbsent(key, k -> newBucket(userSpec)));
        }
        if (waitedNanos > 0) {
            log.debug("Rate limited org={} user={} for {}ms", orgId, userId, waitedNanos / 1_000_000);
        }
        return Duration.ofNanos(waitedNanos);
    }

    /**
     * Tokens currently available to the organization (burst size if untouched).
     */
    public long availableOrgTokens(String orgId) {
        if (!orgSpec.enabled()) {
            return Long.MAX_VALUE;
        }
        return orgBuckets.computeIfAbsent(orgId, k -> newBucket(orgSpec)).getAvailableTokens();
    }

    private long consume(Bucket bucket) throws InterruptedException {
        MeasuringStrategy measuring = new MeasuringStrategy(blockingStrategy);
        bucket.asBlocking().consume(1, measuring);
        return measuring.parkedNanos;
    }

    private static Bucket newBucket(TokenBucketSpec spec) {
        Duration refillPeriod = Duration.ofNanos(Math.max(1L, Math.round(1_000_000_000d / spec.tokensPerSecond())));
        return Bucket.builder()
            .addLimit(Bandwidth.builder()
                .capacity(spec.burst())
                .refillGreedy(1, refillPeriod)
                .build())
            .build();
    }

    private static final class MeasuringStrategy implements BlockingStrategy {

        private final BlockingStrategy delegate;
        private long parkedNanos;

        private MeasuringStrategy(BlockingStrategy delegate) {
            this.delegate = delegate;
        }

        @Override
        public void park(long nanosToPark) throws InterruptedException {
            parkedNanos += nanosToPark;
            delegate.park(nanosToPark);
        }
    }
}
