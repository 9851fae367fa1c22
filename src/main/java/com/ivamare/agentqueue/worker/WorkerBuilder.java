package com.ivamare.agentqueue.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.agentqueue.amqp.MessagePublisher;
import com.ivamare.agentqueue.amqp.TopologyManager;
import com.ivamare.agentqueue.audit.AuditTrail;
import com.ivamare.agentqueue.backpressure.BackpressureMonitor;
import com.ivamare.agentqueue.dedup.DedupKeys;
import com.ivamare.agentqueue.dedup.IdempotencyStore;
import com.ivamare.agentqueue.handler.HandlerRegistry;
import com.ivamare.agentqueue.metrics.QueueMetrics;
import com.ivamare.agentqueue.poison.PoisonDetector;
import com.ivamare.agentqueue.policy.RetryPolicy;
import com.ivamare.agentqueue.util.Jsons;
import com.ivamare.agentqueue.worker.impl.DefaultWorker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;

import java.time.Duration;
import java.util.UUID;

/**
 * Builder for creating Worker instances.
 */
public class WorkerBuilder {

    private String orgId;
    private String workerId;
    private String defaultAgentId;
    private ConnectionFactory connectionFactory;
    private HandlerRegistry handlerRegistry;
    private MessagePublisher publisher;
    private TopologyManager topology;
    private IdempotencyStore idempotencyStore;
    private PoisonDetector poisonDetector;
    private RetryPolicy retryPolicy;
    private AuditTrail auditTrail;
    private QueueMetrics metrics;
    private BackpressureMonitor depthMonitor;
    private ObjectMapper objectMapper;
    private int concurrency = 4;
    private int prefetch = 10;
    private Duration depthSampleInterval = Duration.ofSeconds(15);

    /**
     * Set the organization whose request queue is consumed.
     *
     * @param orgId The organization id
     * @return this builder
     */
    public WorkerBuilder orgId(String orgId) {
        this.orgId = orgId;
        return this;
    }

    /**
     * Set the id recorded in audit events (default: random).
     *
     * @param workerId The worker id
     * @return this builder
     */
    public WorkerBuilder workerId(String workerId) {
        this.workerId = workerId;
        return this;
    }

    /**
     * Set the agent answered when a message carries no agent_id.
     *
     * @param defaultAgentId The fallback agent
     * @return this builder
     */
    public WorkerBuilder defaultAgentId(String defaultAgentId) {
        this.defaultAgentId = defaultAgentId;
        return this;
    }

    /**
     * Set the broker connection. Without one the worker only processes
     * deliveries handed to it directly.
     *
     * @param connectionFactory The connection factory
     * @return this builder
     */
    public WorkerBuilder connectionFactory(ConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
        return this;
    }

    public WorkerBuilder handlerRegistry(HandlerRegistry handlerRegistry) {
        this.handlerRegistry = handlerRegistry;
        return this;
    }

    public WorkerBuilder publisher(MessagePublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    public WorkerBuilder topology(TopologyManager topology) {
        this.topology = topology;
        return this;
    }

    public WorkerBuilder idempotencyStore(IdempotencyStore idempotencyStore) {
        this.idempotencyStore = idempotencyStore;
        return this;
    }

    public WorkerBuilder poisonDetector(PoisonDetector poisonDetector) {
        this.poisonDetector = poisonDetector;
        return this;
    }

    /**
     * Set the retry policy (default: ladder [1s, 2s, 4s, 8s], 60s rate-limited backoff).
     *
     * @param retryPolicy The retry policy
     * @return this builder
     */
    public WorkerBuilder retryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
        return this;
    }

    public WorkerBuilder auditTrail(AuditTrail auditTrail) {
        this.auditTrail = auditTrail;
        return this;
    }

    public WorkerBuilder metrics(QueueMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    /**
     * Enable the queue depth gauge, sampled from this monitor.
     *
     * @param depthMonitor The monitor to read depth from
     * @return this builder
     */
    public WorkerBuilder depthMonitor(BackpressureMonitor depthMonitor) {
        this.depthMonitor = depthMonitor;
        return this;
    }

    public WorkerBuilder objectMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        return this;
    }

    /**
     * Set the concurrency level (default: 4).
     *
     * @param concurrency Number of concurrent handler executions
     * @return this builder
     */
    public WorkerBuilder concurrency(int concurrency) {
        this.concurrency = concurrency;
        return this;
    }

    /**
     * Set the broker prefetch (default: 10).
     *
     * @param prefetch Unacknowledged deliveries allowed
     * @return this builder
     */
    public WorkerBuilder prefetch(int prefetch) {
        this.prefetch = prefetch;
        return this;
    }

    public WorkerBuilder depthSampleInterval(Duration depthSampleInterval) {
        this.depthSampleInterval = depthSampleInterval;
        return this;
    }

    /**
     * Build the worker instance.
     *
     * @return configured Worker
     * @throws IllegalStateException if required properties not set
     */
    public DefaultWorker build() {
        if (orgId == null || orgId.isBlank()) {
            throw new IllegalStateException("orgId is required");
        }
        if (handlerRegistry == null) {
            throw new IllegalStateException("handlerRegistry is required");
        }
        if (publisher == null) {
            throw new IllegalStateException("publisher is required");
        }
        if (topology == null) {
            throw new IllegalStateException("topology is required");
        }
        if (idempotencyStore == null) {
            throw new IllegalStateException("idempotencyStore is required");
        }
        if (poisonDetector == null) {
            throw new IllegalStateException("poisonDetector is required");
        }
        if (auditTrail == null) {
            throw new IllegalStateException("auditTrail is required");
        }
        if (concurrency < 1 || prefetch < 1) {
            throw new IllegalStateException("concurrency and prefetch must be at least 1");
        }

        if (objectMapper == null) {
            objectMapper = Jsons.newObjectMapper();
        }
        if (retryPolicy == null) {
            retryPolicy = RetryPolicy.defaultPolicy();
        }
        if (metrics == null) {
            metrics = new QueueMetrics(new SimpleMeterRegistry());
        }
        if (workerId == null) {
            workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);
        }

        return new DefaultWorker(
            orgId,
            workerId,
            defaultAgentId,
            connectionFactory,
            handlerRegistry,
            publisher,
            topology,
            idempotencyStore,
            new DedupKeys(objectMapper),
            poisonDetector,
            retryPolicy,
            auditTrail,
            metrics,
            depthMonitor,
            objectMapper,
            concurrency,
            prefetch,
            depthSampleInterval
        );
    }
}
