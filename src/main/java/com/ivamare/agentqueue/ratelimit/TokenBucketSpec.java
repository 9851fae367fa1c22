package com.ivamare.agentqueue.ratelimit;

/**
 * Token bucket parameters.
 *
 * @param tokensPerSecond Continuous refill rate; non-positive disables the bucket
 * @param burst Bucket capacity
 */
public record TokenBucketSpec(double tokensPerSecond, long burst) {

    public static TokenBucketSpec disabled() {
        return new TokenBucketSpec(0, 0);
    }

    public boolean enabled() {
        return tokensPerSecond > 0 && burst > 0;
    }
}
