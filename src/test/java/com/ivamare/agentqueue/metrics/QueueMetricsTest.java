package com.ivamare.agentqueue.metrics;

import com.ivamare.agentqueue.model.Priority;
import com.ivamare.agentqueue.model.ThrottleMode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class QueueMetricsTest {

    private SimpleMeterRegistry registry;
    private QueueMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new QueueMetrics(registry);
    }

    @Test
    void shouldTagPublishAttempts() {
        metrics.publishAttempt(Priority.P0, "published");
        metrics.publishAttempt(Priority.P0, "published");
        metrics.publishAttempt(Priority.P3, "throttled");

        assertEquals(2.0, registry.get("agentqueue.publish.attempts")
            .tags("priority", "P0", "result", "published").counter().count());
        assertEquals(1.0, registry.get("agentqueue.publish.attempts")
            .tags("priority", "P3", "result", "throttled").counter().count());
    }

    @Test
    void shouldCountThrottledWaitsOnly() {
        metrics.rateLimitWait(Duration.ZERO);
        metrics.rateLimitWait(Duration.ofMillis(250));

        assertEquals(2L, registry.get("agentqueue.ratelimit.wait").timer().count());
        assertEquals(1.0, registry.get("agentqueue.ratelimit.throttled").counter().count());
    }

    @Test
    void shouldLowerCaseModesAndStatuses() {
        metrics.backpressureDropped(ThrottleMode.EMERGENCY, Priority.P1);
        metrics.workerMessage("DEAD_LETTERED", null);

        assertEquals(1.0, registry.get("agentqueue.backpressure.dropped")
            .tags("mode", "emergency", "priority", "P1").counter().count());
        assertEquals(1.0, registry.get("agentqueue.worker.messages")
            .tags("status", "dead_lettered", "type", "unknown").counter().count());
    }

    @Test
    void shouldReportLatestQueueDepth() {
        metrics.queueDepth("acme", 12);
        metrics.queueDepth("acme", 40);

        assertEquals(40.0, registry.get("agentqueue.queue.depth").tag("org_id", "acme").gauge().value());
    }

    @Test
    void shouldAddReplayedCount() {
        metrics.dlqReplayed("acme", 3);
        metrics.dlqReplayed("acme", 2);

        assertEquals(5.0, registry.get("agentqueue.dlq.replayed").tag("org_id", "acme").counter().count());
    }
}
