package com.ivamare.agentqueue.metrics;

import com.ivamare.agentqueue.model.Priority;
import com.ivamare.agentqueue.model.ThrottleMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer instruments for producers, workers, coordinator and operator tools.
 *
 * <p>All meters are prefixed {@code agentqueue.} and scraped through the
 * actuator Prometheus endpoint. Recording never throws.
 */
public class QueueMetrics {

    private final MeterRegistry registry;
    private final ConcurrentMap<String, AtomicLong> queueDepthValues = new ConcurrentHashMap<>();

    public QueueMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public MeterRegistry registry() {
        return registry;
    }

    // --- Producer ---

    public void publishAttempt(Priority priority, String result) {
        counter("agentqueue.publish.attempts", "priority", priority.name(), "result", result);
    }

    public void publishFailure(String reason) {
        counter("agentqueue.publish.failures", "reason", reason);
    }

    public void rateLimitWait(Duration waited) {
        Timer.builder("agentqueue.ratelimit.wait")
            .description("Time producers spent waiting for rate-limit tokens")
            .register(registry)
            .record(waited);
        if (!waited.isZero()) {
            counter("agentqueue.ratelimit.throttled");
        }
    }

    public void backpressureDropped(ThrottleMode mode, Priority priority) {
        counter("agentqueue.backpressure.dropped", "mode", lower(mode.name()), "priority", priority.name());
    }

    // --- Worker ---

    public void workerMessage(String status, String type) {
        counter("agentqueue.worker.messages", "status", lower(status), "type", safe(type));
    }

    public void workerLatency(Duration elapsed) {
        Timer.builder("agentqueue.worker.latency")
            .description("Handler processing latency")
            .register(registry)
            .record(elapsed);
    }

    public void retryScheduled(String type) {
        counter("agentqueue.worker.retries", "type", safe(type));
    }

    public void deadLettered(String type) {
        counter("agentqueue.worker.dlq", "type", safe(type));
    }

    public void quarantined(String type) {
        counter("agentqueue.worker.poison", "type", safe(type));
    }

    public void demotion(Priority from, Priority to) {
        counter("agentqueue.retry.demotions", "from", from.name(), "to", to.name());
    }

    public void queueDepth(String orgId, long depth) {
        queueDepthValues.computeIfAbsent(orgId, this::registerDepthGauge).set(depth);
    }

    // --- Coordinator ---

    public void coordinatorForwarded(String responseType) {
        counter("agentqueue.coordinator.forwarded", "type", safe(responseType));
    }

    public void coordinatorDropped(String agentId) {
        counter("agentqueue.coordinator.dropped", "agent_id", safe(agentId));
    }

    public void coordinatorRequeued(String agentId) {
        counter("agentqueue.coordinator.requeued", "agent_id", safe(agentId));
    }

    // --- Operations ---

    public void dlqReplayed(String orgId, int count) {
        Counter.builder("agentqueue.dlq.replayed")
            .tags("org_id", orgId)
            .register(registry)
            .increment(count);
    }

    public void dlqPurged(int count) {
        Counter.builder("agentqueue.dlq.purged")
            .register(registry)
            .increment(count);
    }

    // --- Audit ---

    public void auditDropped(String operation) {
        counter("agentqueue.audit.dropped", "operation", operation);
    }

    public void auditFailure(String operation) {
        counter("agentqueue.audit.failures", "operation", operation);
    }

    private void counter(String name, String... tags) {
        Counter.builder(name)
            .tags(Tags.of(tags))
            .register(registry)
            .increment();
    }

    private AtomicLong registerDepthGauge(String orgId) {
        AtomicLong holder = new AtomicLong();
        Gauge.builder("agentqueue.queue.depth", holder, AtomicLong::doubleValue)
            .description("Ready messages on an organization request queue")
            .tags("org_id", orgId)
            .register(registry);
        return holder;
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }

    private static String safe(String value) {
        return value != null ? value : "unknown";
    }
}
