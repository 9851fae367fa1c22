package com.ivamare.agentqueue.backpressure;

import com.ivamare.agentqueue.amqp.TopologyNames;
import com.ivamare.agentqueue.model.ThrottleMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Classifies organization queue depth into a throttle mode.
 *
 * <p>Depth reads fail open: a broker error counts as an empty queue.
 */
public class BackpressureMonitor {

    private static final Logger log = LoggerFactory.getLogger(BackpressureMonitor.class);

    private final QueueDepthReader reader;
    private final BackpressureThresholds thresholds;

    public BackpressureMonitor(QueueDepthReader reader, BackpressureThresholds thresholds) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    /**
     * Most severe mode whose mark the depth exceeds.
     *
     * @param depth Queue depth
     * @param thresholds Marks to compare against
     * @return throttle mode, {@link ThrottleMode#NONE} when no mark is exceeded
     */
    public static ThrottleMode decideThrottle(long depth, BackpressureThresholds thresholds) {
        if (depth > thresholds.emergency()) {
            return ThrottleMode.EMERGENCY;
        }
        if (depth > thresholds.heavy()) {
            return ThrottleMode.HEAVY;
        }
        if (depth > thresholds.light()) {
            return ThrottleMode.LIGHT;
        }
        if (depth > thresholds.scale()) {
            return ThrottleMode.SCALE;
        }
        return ThrottleMode.NONE;
    }

    public long getQueueDepth(String orgId) {
        String queue = TopologyNames.requestQueue(orgId);
        try {
            return Math.max(0L, reader.depth(queue));
        } catch (RuntimeException e) {
            log.warn("Queue depth read failed for {}, assuming empty: {}", queue, e.getMessage());
            return 0L;
        }
    }

    public ThrottleMode currentMode(String orgId) {
        long depth = getQueueDepth(orgId);
        ThrottleMode mode = decideThrottle(depth, thresholds);
        if (mode != ThrottleMode.NONE) {
            log.debug("Org {} queue depth {} -> throttle mode {}", orgId, depth, mode);
        }
        return mode;
    }

    public BackpressureThresholds thresholds() {
        return thresholds;
    }
}
