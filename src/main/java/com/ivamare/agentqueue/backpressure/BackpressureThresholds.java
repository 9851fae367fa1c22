package com.ivamare.agentqueue.backpressure;

/**
 * Queue-depth marks for each throttle mode. A mark is crossed when depth is
 * strictly greater than it; {@link #DISABLED} switches a mode off.
 *
 * @param scale Depth above which more workers should be added
 * @param light Depth above which P3 is shed
 * @param heavy Depth above which P2 and P3 are shed
 * @param emergency Depth above which only P0 is admitted
 */
public record BackpressureThresholds(long scale, long light, long heavy, long emergency) {

    public static final long DISABLED = Long.MAX_VALUE;

    public BackpressureThresholds {
        long[] marks = {scale, light, heavy, emergency};
        long previous = -1;
        for (long mark : marks) {
            if (mark < 0) {
                throw new IllegalArgumentException("Thresholds must be non-negative");
            }
            if (mark != DISABLED) {
                if (mark <= previous) {
                    throw new IllegalArgumentException(
                        "Thresholds must be strictly increasing: scale=" + scale + ", light=" + light
                            + ", heavy=" + heavy + ", emergency=" + emergency);
                }
                previous = mark;
            }
        }
    }

    public static BackpressureThresholds defaults() {
        return new BackpressureThresholds(100, 500, 1_000, 5_000);
    }

    /**
     * Thresholds with only the light mark set.
     */
    public static BackpressureThresholds lightOnly(long light) {
        return new BackpressureThresholds(DISABLED, light, DISABLED, DISABLED);
    }
}
