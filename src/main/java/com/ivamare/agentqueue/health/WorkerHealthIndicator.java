package com.ivamare.agentqueue.health;

import com.ivamare.agentqueue.backpressure.BackpressureMonitor;
import com.ivamare.agentqueue.model.ThrottleMode;
import com.ivamare.agentqueue.worker.Worker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Health indicator for organization workers.
 *
 * <p>Reports, per organization:
 * <ul>
 *   <li>Worker state and in-flight message count</li>
 *   <li>Consecutive acknowledgment failures</li>
 *   <li>Request queue depth and the throttle mode producers see for it</li>
 * </ul>
 *
 * <p>The indicator is DOWN when a worker is not running or its acknowledgments keep failing.
 * Throttling alone does not take it down: a deep queue means the organization is busy, and
 * organizations above NONE are listed under {@code throttledOrganizations}.
 */
public class WorkerHealthIndicator implements HealthIndicator {

    static final int ERROR_THRESHOLD = 5;

    private final List<Worker> workers;
    private final BackpressureMonitor backpressure;

    public WorkerHealthIndicator(List<Worker> workers) {
        this(workers, null);
    }

    /**
     * @param workers Workers to report on
     * @param backpressure Source of queue depth and throttle mode, null to leave both out
     */
    public WorkerHealthIndicator(List<Worker> workers, BackpressureMonitor backpressure) {
        this.workers = workers != null ? workers : List.of();
        this.backpressure = backpressure;
    }

    @Override
    public Health health() {
        if (workers.isEmpty()) {
            return Health.unknown()
                .withDetail("message", "No workers registered")
                .build();
        }

        Map<String, OrganizationStatus> organizations = new TreeMap<>();
        List<String> throttled = new ArrayList<>();
        boolean healthy = true;
        int totalInFlight = 0;
        int maxConsecutiveErrors = 0;

        for (Worker worker : workers) {
            String orgId = worker.orgId();
            if (organizations.containsKey(orgId)) {
                continue;
            }
            int inFlight = worker.inFlightCount();
            int errors = worker.getConsecutiveErrorCount();
            Long depth = null;
            ThrottleMode mode = null;
            if (backpressure != null) {
                depth = backpressure.getQueueDepth(orgId);
                mode = BackpressureMonitor.decideThrottle(depth, backpressure.thresholds());
                if (mode != ThrottleMode.NONE) {
                    throttled.add(orgId);
                }
            }
            organizations.put(orgId, new OrganizationStatus(worker.isRunning(), inFlight, errors, depth, mode));

            healthy &= worker.isRunning() && errors < ERROR_THRESHOLD;
            totalInFlight += inFlight;
            maxConsecutiveErrors = Math.max(maxConsecutiveErrors, errors);
        }

        Health.Builder builder = healthy ? Health.up() : Health.down();
        builder
            .withDetail("organizations", organizations)
            .withDetail("totalInFlight", totalInFlight)
            .withDetail("maxConsecutiveErrors", maxConsecutiveErrors);
        if (backpressure != null) {
            throttled.sort(null);
            builder.withDetail("throttledOrganizations", throttled);
        }
        return builder.build();
    }

    record OrganizationStatus(
        boolean running,
        int inFlight,
        int consecutiveErrors,
        Long queueDepth,
        ThrottleMode throttleMode
    ) {}
}
