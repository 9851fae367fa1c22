package com.ivamare.agentqueue.worker.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.agentqueue.amqp.MessagePublisher;
import com.ivamare.agentqueue.amqp.TopologyManager;
import com.ivamare.agentqueue.amqp.TopologyNames;
import com.ivamare.agentqueue.audit.AuditTrail;
import com.ivamare.agentqueue.backpressure.BackpressureMonitor;
import com.ivamare.agentqueue.dedup.DedupKeys;
import com.ivamare.agentqueue.dedup.IdempotencyStore;
import com.ivamare.agentqueue.exception.ErrorClassifier;
import com.ivamare.agentqueue.handler.HandlerContext;
import com.ivamare.agentqueue.handler.HandlerRegistry;
import com.ivamare.agentqueue.handler.MessageHandler;
import com.ivamare.agentqueue.metrics.QueueMetrics;
import com.ivamare.agentqueue.model.DlqMessage;
import com.ivamare.agentqueue.model.ErrorKind;
import com.ivamare.agentqueue.model.Priority;
import com.ivamare.agentqueue.model.RequestMessage;
import com.ivamare.agentqueue.model.ResponsePayloads;
import com.ivamare.agentqueue.poison.PoisonDetector;
import com.ivamare.agentqueue.poison.PoisonVerdict;
import com.ivamare.agentqueue.policy.RetryDecision;
import com.ivamare.agentqueue.policy.RetryPolicy;
import com.ivamare.agentqueue.tracing.TraceContext;
import com.ivamare.agentqueue.tracing.TracePropagation;
import com.ivamare.agentqueue.worker.Worker;
import com.ivamare.agentqueue.worker.WorkerState;
import com.rabbitmq.client.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.listener.DirectMessageListenerContainer;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default worker consuming through a Spring AMQP {@link DirectMessageListenerContainer}.
 *
 * <p>The container's prefetch caps unacknowledged deliveries; a local semaphore caps
 * concurrent handler executions. {@link #process(Message)} runs one delivery through
 * the state machine and returns the state it ended in.
 */
public class DefaultWorker implements Worker, ChannelAwareMessageListener {

    private static final Logger log = LoggerFactory.getLogger(DefaultWorker.class);

    private final String orgId;
    private final String workerId;
    private final String defaultAgentId;
    private final String queueName;
    private final ConnectionFactory connectionFactory;
    private final HandlerRegistry handlerRegistry;
    private final MessagePublisher publisher;
    private final TopologyManager topology;
    private final IdempotencyStore idempotencyStore;
    private final DedupKeys dedupKeys;
    private final PoisonDetector poisonDetector;
    private final RetryPolicy retryPolicy;
    private final AuditTrail audit;
    private final QueueMetrics metrics;
    private final BackpressureMonitor depthMonitor;
    private final ObjectMapper objectMapper;
    private final int concurrency;
    private final int prefetch;
    private final Duration depthSampleInterval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicInteger inFlightCount = new AtomicInteger(0);
    private final AtomicInteger consecutiveErrors = new AtomicInteger(0);
    private final Semaphore semaphore;

    private ExecutorService executor;
    private ScheduledExecutorService sampler;
    private DirectMessageListenerContainer container;

    /**
     * Creates a new DefaultWorker.
     *
     * @param orgId Organization whose request queue is consumed
     * @param workerId Identifier recorded in audit events
     * @param defaultAgentId Agent answered when a message names none (nullable)
     * @param connectionFactory Broker connection (nullable: no listener, {@link #process} only)
     * @param handlerRegistry Registry of message handlers
     * @param publisher Publisher for retries, DLQ entries and responses
     * @param topology Topology declarations
     * @param idempotencyStore Duplicate-delivery store
     * @param dedupKeys Dedup key calculator
     * @param poisonDetector Poison counter
     * @param retryPolicy Retry policy
     * @param audit Audit trail
     * @param metrics Queue metrics
     * @param depthMonitor Queue depth source for the depth gauge (nullable: no sampling)
     * @param objectMapper Object mapper for message bodies
     * @param concurrency Concurrent handler executions
     * @param prefetch Unacknowledged deliveries allowed by the broker
     * @param depthSampleInterval Queue depth sampling interval
     */
    public DefaultWorker(
            String orgId,
            String workerId,
            String defaultAgentId,
            ConnectionFactory connectionFactory,
            HandlerRegistry handlerRegistry,
            MessagePublisher publisher,
            TopologyManager topology,
            IdempotencyStore idempotencyStore,
            DedupKeys dedupKeys,
            PoisonDetector poisonDetector,
            RetryPolicy retryPolicy,
            AuditTrail audit,
            QueueMetrics metrics,
            BackpressureMonitor depthMonitor,
            ObjectMapper objectMapper,
            int concurrency,
            int prefetch,
            Duration depthSampleInterval) {

        this.orgId = orgId;
        this.workerId = workerId;
        this.defaultAgentId = defaultAgentId;
        this.queueName = TopologyNames.requestQueue(orgId);
        this.connectionFactory = connectionFactory;
        this.handlerRegistry = handlerRegistry;
        this.publisher = publisher;
        this.topology = topology;
        this.idempotencyStore = idempotencyStore;
        this.dedupKeys = dedupKeys;
        this.poisonDetector = poisonDetector;
        this.retryPolicy = retryPolicy;
        this.audit = audit;
        this.metrics = metrics;
        this.depthMonitor = depthMonitor;
        this.objectMapper = objectMapper;
        this.concurrency = concurrency;
        this.prefetch = prefetch;
        this.depthSampleInterval = depthSampleInterval;

        this.semaphore = new Semaphore(concurrency);
    }

    @Override
    public void start() {
        if (running.getAndSet(true)) {
            log.warn("Worker for {} already running", orgId);
            return;
        }

        stopping.set(false);
        executor = Executors.newFixedThreadPool(concurrency,
            new CustomizableThreadFactory("agentqueue-worker-" + orgId + "-"));

        topology.ensureOrgTopology(orgId);

        log.info("Starting worker {} for org={}, concurrency={}, prefetch={}",
            workerId, orgId, concurrency, prefetch);

        if (connectionFactory != null) {
            container = new DirectMessageListenerContainer(connectionFactory);
            container.setQueueNames(queueName);
            container.setAcknowledgeMode(AcknowledgeMode.MANUAL);
            container.setPrefetchCount(prefetch);
            container.setConsumersPerQueue(1);
            container.setDefaultRequeueRejected(false);
            container.setMessageListener(this);
            container.start();
        }

        if (depthMonitor != null && depthSampleInterval != null && !depthSampleInterval.isZero()) {
            sampler = Executors.newSingleThreadScheduledExecutor(
                new CustomizableThreadFactory("agentqueue-depth-" + orgId + "-"));
            long periodMs = depthSampleInterval.toMillis();
            sampler.scheduleAtFixedRate(this::sampleDepth, 0L, periodMs, TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public CompletableFuture<Void> stop(Duration timeout) {
        if (!running.get()) {
            return CompletableFuture.completedFuture(null);
        }

        stopping.set(true);
        log.info("Stopping worker for {}, waiting for {} in-flight messages",
            orgId, inFlightCount.get());

        if (container != null) {
            container.stop();
        }

        return CompletableFuture.runAsync(() -> {
            try {
                long deadline = System.currentTimeMillis() + timeout.toMillis();
                while (inFlightCount.get() > 0 && System.currentTimeMillis() < deadline) {
                    Thread.sleep(100);
                }

                if (inFlightCount.get() > 0) {
                    log.warn("Timeout waiting for {} in-flight messages", inFlightCount.get());
                }

                shutdownExecutors();
                running.set(false);

                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }

                log.info("Worker for {} stopped", orgId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
    }

    @Override
    public void stopNow() {
        stopping.set(true);
        running.set(false);
        if (container != null) {
            container.stop();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
        if (sampler != null) {
            sampler.shutdownNow();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get() && !stopping.get();
    }

    @Override
    public int inFlightCount() {
        return inFlightCount.get();
    }

    @Override
    public String orgId() {
        return orgId;
    }

    @Override
    public int getConsecutiveErrorCount() {
        return consecutiveErrors.get();
    }

    // --- Delivery ---

    @Override
    public void onMessage(Message message, Channel channel) throws Exception {
        long deliveryTag = message.getMessageProperties().getDeliveryTag();
        semaphore.acquire();
        inFlightCount.incrementAndGet();

        try {
            executor.submit(() -> {
                try {
                    process(message);
                } catch (RuntimeException e) {
                    log.error("Unexpected failure processing delivery {} on {}", deliveryTag, queueName, e);
                } finally {
                    ack(channel, deliveryTag);
                    inFlightCount.decrementAndGet();
                    semaphore.release();
                }
            });
        } catch (RejectedExecutionException e) {
            inFlightCount.decrementAndGet();
            semaphore.release();
            log.warn("Worker for {} is shutting down, delivery {} left unacknowledged", orgId, deliveryTag);
        }
    }

    private void ack(Channel channel, long deliveryTag) {
        try {
            channel.basicAck(deliveryTag, false);
            consecutiveErrors.set(0);
        } catch (IOException | RuntimeException e) {
            int errors = consecutiveErrors.incrementAndGet();
            log.error("Ack of delivery {} on {} failed (consecutive errors={}): {}",
                deliveryTag, queueName, errors, e.getMessage());
        }
    }

    /**
     * Run one delivery through the state machine.
     *
     * @param delivery The AMQP message
     * @return the terminal state the delivery ended in
     */
    public WorkerState process(Message delivery) {
        long started = System.nanoTime();
        Map<String, Object> headers = delivery.getMessageProperties().getHeaders();
        TraceContext trace = TracePropagation.continueFrom(headers);

        RequestMessage message = parse(delivery.getBody());
        if (message == null) {
            try (TracePropagation.MdcScope ignored = TracePropagation.open(trace, null, orgId)) {
                return deadLetterUnparseable(delivery.getBody(), trace);
            }
        }

        try (TracePropagation.MdcScope ignored = TracePropagation.open(trace, message.messageId(), orgId)) {
            if (!orgId.equals(message.orgId())) {
                return deadLetterForeign(message, trace);
            }
            WorkerState state = handle(message, trace);
            metrics.workerMessage(state.label(), message.type());
            metrics.workerLatency(Duration.ofNanos(System.nanoTime() - started));
            return state;
        }
    }

    private WorkerState handle(RequestMessage message, TraceContext trace) {
        Transitions states = new Transitions(message.messageId());
        audit.dequeued(message, queueName, workerId);

        states.advance(WorkerState.DEDUP_CHECK);
        String dedupKey = dedupKeys.compute(message);
        if (!claim(dedupKey)) {
            log.info("Skipping duplicate {} (dedup_key={})", message.messageId(), dedupKey);
            audit.duplicateSkipped(message, dedupKey);
            return states.advance(WorkerState.DUPLICATE);
        }

        states.advance(WorkerState.PROCESSING);
        audit.processing(message, workerId);
        String agentId = responseAgent(message);
        HandlerContext context = new HandlerContext(message, dedupKey, agentId,
            payload -> respond(agentId, payload, trace));

        Object result;
        try {
            MessageHandler handler = handlerRegistry.resolve(message.type());
            result = handler.handle(message, context);
        } catch (Exception e) {
            states.advance(WorkerState.FAILED);
            return onFailure(message, dedupKey, agentId, ErrorClassifier.unwrap(e), trace, states);
        }

        respond(agentId, ResponsePayloads.result(message, result), trace);
        poisonDetector.recordSuccess(orgId, dedupKey);
        audit.completed(message, workerId, agentId);
        log.info("Completed {} type={} (retry_count={})", message.messageId(), message.type(),
            message.retryCountOrZero());
        return states.advance(WorkerState.COMPLETED);
    }

    private WorkerState onFailure(RequestMessage message, String dedupKey, String agentId, Throwable error,
                                  TraceContext trace, Transitions states) {
        ErrorKind kind = ErrorClassifier.classify(error);
        String errorType = ErrorClassifier.errorType(error);
        String errorMessage = String.valueOf(error.getMessage());

        PoisonVerdict verdict = poisonDetector.recordFailure(orgId, dedupKey);
        audit.failed(message, errorType, errorMessage, verdict.failureCount());
        log.debug("Handler failed for {} kind={} failures={}: {}",
            message.messageId(), kind, verdict.failureCount(), errorMessage);

        if (verdict.quarantined()) {
            audit.quarantined(message, dedupKey, verdict.failureCount());
            metrics.quarantined(message.type());
            respond(agentId, ResponsePayloads.error(message, "POISON_QUARANTINED", errorMessage), trace);
            log.warn("Quarantined {} after {} consecutive failures (threshold={})",
                message.messageId(), verdict.failureCount(), poisonDetector.threshold());
            return states.advance(WorkerState.QUARANTINED);
        }

        Priority priority = message.logicalPriority();
        RetryDecision decision = retryPolicy.decide(priority, message.retryCountOrZero(),
            message.effectiveMaxRetries(), kind);

        release(dedupKey);

        if (decision.shouldRetry() && scheduleRetry(message, decision, trace)) {
            if (decision.isDemotion(priority)) {
                metrics.demotion(priority, decision.nextPriority());
            }
            return states.advance(WorkerState.RETRY_SCHEDULED);
        }

        deadLetter(message, new DlqMessage.Failure(errorType, errorMessage), trace);
        respond(agentId, ResponsePayloads.error(message, errorType, errorMessage), trace);
        return states.advance(WorkerState.DEAD_LETTERED);
    }

    private boolean scheduleRetry(RequestMessage message, RetryDecision decision, TraceContext trace) {
        RequestMessage retried = message.withRetry(decision.nextRetryCount(), decision.nextPriority());
        try {
            publisher.scheduleRetry(orgId, retried, decision.delayMs(), decision.nextPriority(),
                TracePropagation.inject(trace.child(), null));
        } catch (RuntimeException e) {
            log.error("Retry publish for {} failed, dead-lettering instead: {}", message.messageId(), e.getMessage());
            return false;
        }
        audit.retryScheduled(retried, decision);
        metrics.retryScheduled(message.type());
        log.info("Scheduled retry {}/{} for {} in {}ms at {}", decision.nextRetryCount(),
            message.effectiveMaxRetries(), message.messageId(), decision.delayMs(), decision.nextPriority());
        return true;
    }

    private void deadLetter(RequestMessage message, DlqMessage.Failure failure, TraceContext trace) {
        try {
            publisher.publishToDlq(orgId, message, TracePropagation.inject(trace.child(), null));
        } catch (RuntimeException e) {
            log.error("DLQ publish for {} failed, keeping audit row only: {}", message.messageId(), e.getMessage());
        }
        audit.deadLettered(message, failure);
        metrics.deadLettered(message.type());
        log.warn("Dead-lettered {} type={} after {} retries: [{}] {}", message.messageId(), message.type(),
            message.retryCountOrZero(), failure.type(), failure.message());
    }

    private WorkerState deadLetterForeign(RequestMessage message, TraceContext trace) {
        Transitions states = new Transitions(message.messageId());
        states.advance(WorkerState.FAILED);
        String error = "org_id " + message.orgId() + " does not match queue organization " + orgId;
        try {
            publisher.publishToDlq(orgId, message, TracePropagation.inject(trace.child(), null));
        } catch (RuntimeException e) {
            log.error("DLQ publish of foreign message {} failed: {}", message.messageId(), e.getMessage());
        }
        audit.foreignDeadLettered(orgId, message, error);
        metrics.deadLettered(message.type());
        metrics.workerMessage(WorkerState.DEAD_LETTERED.label(), message.type());
        log.warn("Dead-lettered {} from {}: {}", message.messageId(), queueName, error);
        return states.advance(WorkerState.DEAD_LETTERED);
    }

    private WorkerState deadLetterUnparseable(byte[] body, TraceContext trace) {
        Transitions states = new Transitions(null);
        states.advance(WorkerState.FAILED);
        String raw = new String(body, StandardCharsets.UTF_8);
        try {
            publisher.publishToDlq(orgId, Map.of("raw", raw), TracePropagation.inject(trace.child(), null));
        } catch (RuntimeException e) {
            log.error("DLQ publish of unparseable body on {} failed: {}", queueName, e.getMessage());
        }
        audit.unparseableDeadLettered(orgId, raw, "unparseable message body");
        metrics.deadLettered("unknown");
        metrics.workerMessage(WorkerState.DEAD_LETTERED.label(), "unknown");
        log.warn("Dead-lettered unparseable body on {} ({} bytes)", queueName, body.length);
        return states.advance(WorkerState.DEAD_LETTERED);
    }

    // --- Helpers ---

    private RequestMessage parse(byte[] body) {
        try {
            RequestMessage message = objectMapper.readValue(body, RequestMessage.class);
            if (message == null || isBlank(message.messageId()) || isBlank(message.orgId())) {
                return null;
            }
            return message;
        } catch (IOException e) {
            log.debug("Body on {} is not a request message: {}", queueName, e.getMessage());
            return null;
        }
    }

    private boolean claim(String dedupKey) {
        try {
            return idempotencyStore.markIfAbsent(orgId, dedupKey);
        } catch (RuntimeException e) {
            log.warn("Idempotency store unavailable, processing {} without dedup: {}", dedupKey, e.getMessage());
            return true;
        }
    }

    private void release(String dedupKey) {
        try {
            idempotencyStore.release(orgId, dedupKey);
        } catch (RuntimeException e) {
            log.warn("Could not release idempotency key {}: {}", dedupKey, e.getMessage());
        }
    }

    private String responseAgent(RequestMessage message) {
        return isBlank(message.agentId()) ? defaultAgentId : message.agentId();
    }

    private void respond(String agentId, Map<String, Object> payload, TraceContext trace) {
        if (isBlank(agentId)) {
            return;
        }
        try {
            topology.ensureAgentTopology(agentId);
            publisher.publishResponse(agentId, payload, TracePropagation.inject(trace.child(), null));
        } catch (RuntimeException e) {
            log.warn("Response {} to agent {} not delivered: {}", payload.get("type"), agentId, e.getMessage());
        }
    }

    private void sampleDepth() {
        try {
            metrics.queueDepth(orgId, depthMonitor.getQueueDepth(orgId));
        } catch (RuntimeException e) {
            log.debug("Depth sample for {} failed: {}", orgId, e.getMessage());
        }
    }

    private void shutdownExecutors() {
        executor.shutdown();
        if (sampler != null) {
            sampler.shutdownNow();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Tracks the current state of one delivery and rejects illegal transitions.
     */
    private static final class Transitions {

        private final String messageId;
        private WorkerState current = WorkerState.RECEIVED;

        Transitions(String messageId) {
            this.messageId = messageId;
        }

        WorkerState advance(WorkerState next) {
            if (!current.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal transition " + current + " -> " + next);
            }
            log.debug("{}: {} -> {}", messageId, current, next);
            current = next;
            return next;
        }
    }
}
