package com.ivamare.agentqueue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.agentqueue.amqp.MessagePublisher;
import com.ivamare.agentqueue.amqp.TopologyManager;
import com.ivamare.agentqueue.audit.AuditTrail;
import com.ivamare.agentqueue.backpressure.BackpressureMonitor;
import com.ivamare.agentqueue.dedup.IdempotencyStore;
import com.ivamare.agentqueue.handler.HandlerRegistry;
import com.ivamare.agentqueue.health.WorkerHealthIndicator;
import com.ivamare.agentqueue.metrics.QueueMetrics;
import com.ivamare.agentqueue.poison.PoisonDetector;
import com.ivamare.agentqueue.policy.RetryPolicy;
import com.ivamare.agentqueue.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;

/**
 * Auto-start configuration for workers.
 *
 * <p>Enable with:
 * <pre>
 * agentqueue:
 *   worker:
 *     auto-start: true
 *     org-ids: [acme, globex]
 * </pre>
 *
 * <p>One worker is started per configured organization.
 */
@Configuration
@ConditionalOnProperty(prefix = "agentqueue.worker", name = "auto-start", havingValue = "true")
public class WorkerAutoStartConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WorkerAutoStartConfiguration.class);

    private final List<Worker> workers = new ArrayList<>();
    private final ObjectProvider<ConnectionFactory> connectionFactory;
    private final HandlerRegistry handlerRegistry;
    private final MessagePublisher publisher;
    private final TopologyManager topology;
    private final IdempotencyStore idempotencyStore;
    private final PoisonDetector poisonDetector;
    private final RetryPolicy retryPolicy;
    private final AuditTrail auditTrail;
    private final QueueMetrics metrics;
    private final BackpressureMonitor backpressureMonitor;
    private final ObjectMapper objectMapper;
    private final AgentQueueProperties properties;

    public WorkerAutoStartConfiguration(
            ObjectProvider<ConnectionFactory> connectionFactory,
            HandlerRegistry handlerRegistry,
            MessagePublisher publisher,
            TopologyManager topology,
            IdempotencyStore idempotencyStore,
            PoisonDetector poisonDetector,
            RetryPolicy retryPolicy,
            AuditTrail auditTrail,
            QueueMetrics metrics,
            BackpressureMonitor backpressureMonitor,
            ObjectMapper objectMapper,
            AgentQueueProperties properties) {
        this.connectionFactory = connectionFactory;
        this.handlerRegistry = handlerRegistry;
        this.publisher = publisher;
        this.topology = topology;
        this.idempotencyStore = idempotencyStore;
        this.poisonDetector = poisonDetector;
        this.retryPolicy = retryPolicy;
        this.auditTrail = auditTrail;
        this.metrics = metrics;
        this.backpressureMonitor = backpressureMonitor;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startWorkers() {
        AgentQueueProperties.WorkerProperties wp = properties.getWorker();
        List<String> orgIds = wp.getOrgIds();

        if (orgIds.isEmpty()) {
            log.warn("No organizations configured (agentqueue.worker.org-ids), no workers to start");
            return;
        }
        if (handlerRegistry.registeredTypes().isEmpty()) {
            log.warn("No handlers registered, every message will go to the fallback handler");
        }

        for (String orgId : orgIds) {
            Worker worker = Worker.builder()
                .orgId(orgId)
                .workerId(wp.getWorkerId() != null ? wp.getWorkerId() + "-" + orgId : null)
                .defaultAgentId(properties.getDefaultAgentId())
                .connectionFactory(connectionFactory.getIfAvailable())
                .handlerRegistry(handlerRegistry)
                .publisher(publisher)
                .topology(topology)
                .idempotencyStore(idempotencyStore)
                .poisonDetector(poisonDetector)
                .retryPolicy(retryPolicy)
                .auditTrail(auditTrail)
                .metrics(metrics)
                .depthMonitor(backpressureMonitor)
                .objectMapper(objectMapper)
                .concurrency(wp.getConcurrency())
                .prefetch(wp.getPrefetch())
                .depthSampleInterval(wp.getDepthSampleInterval())
                .build();

            worker.start();
            workers.add(worker);

            log.info("Started worker for org={}", orgId);
        }
    }

    @PreDestroy
    public void stopWorkers() {
        if (workers.isEmpty()) {
            return;
        }

        log.info("Stopping {} workers...", workers.size());

        workers.stream()
            .map(w -> w.stop(properties.getWorker().getShutdownTimeout()))
            .toList()
            .forEach(f -> f.join());

        log.info("All workers stopped");
    }

    @Bean
    public List<Worker> agentQueueWorkers() {
        return workers;
    }

    @Bean
    public HealthIndicator workerHealthIndicator() {
        return new WorkerHealthIndicator(workers, backpressureMonitor);
    }
}
