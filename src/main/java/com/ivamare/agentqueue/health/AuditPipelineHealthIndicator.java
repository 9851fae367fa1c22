package com.ivamare.agentqueue.health;

import com.ivamare.agentqueue.audit.AsyncAuditPipeline;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports the audit pipeline's buffer and whether its drainer thread is alive.
 *
 * <p>Dropped or failed writes do not make the pipeline unhealthy; a dead drainer does.
 */
public class AuditPipelineHealthIndicator implements HealthIndicator {

    private final AsyncAuditPipeline pipeline;

    public AuditPipelineHealthIndicator(AsyncAuditPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public Health health() {
        Health.Builder builder = pipeline.isRunning() && pipeline.isDrainerAlive()
            ? Health.up()
            : Health.down();
        return builder
            .withDetail("buffered", pipeline.bufferedCount())
            .withDetail("written", pipeline.writtenCount())
            .withDetail("dropped", pipeline.droppedCount())
            .withDetail("failed", pipeline.failedCount())
            .build();
    }
}
