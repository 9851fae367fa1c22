package com.ivamare.agentqueue.producer.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.agentqueue.amqp.MessagePublisher;
import com.ivamare.agentqueue.amqp.TopologyManager;
import com.ivamare.agentqueue.amqp.TopologyNames;
import com.ivamare.agentqueue.audit.AuditTrail;
import com.ivamare.agentqueue.backpressure.BackpressureMonitor;
import com.ivamare.agentqueue.exception.MessageValidationException;
import com.ivamare.agentqueue.exception.PublishException;
import com.ivamare.agentqueue.exception.TransientMessageException;
import com.ivamare.agentqueue.metrics.QueueMetrics;
import com.ivamare.agentqueue.model.Priority;
import com.ivamare.agentqueue.model.RequestMessage;
import com.ivamare.agentqueue.model.SubmitResult;
import com.ivamare.agentqueue.model.ThrottleMode;
import com.ivamare.agentqueue.producer.Producer;
import com.ivamare.agentqueue.ratelimit.TwoLevelRateLimiter;
import com.ivamare.agentqueue.tracing.TraceContext;
import com.ivamare.agentqueue.tracing.TracePropagation;
import com.ivamare.agentqueue.validation.MessageValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default producer publishing through a {@link MessagePublisher}.
 */
public class DefaultProducer implements Producer {

    private static final Logger log = LoggerFactory.getLogger(DefaultProducer.class);

    private final MessageValidator validator;
    private final TwoLevelRateLimiter rateLimiter;
    private final BackpressureMonitor backpressure;
    private final TopologyManager topology;
    private final MessagePublisher publisher;
    private final AuditTrail audit;
    private final QueueMetrics metrics;
    private final ObjectMapper objectMapper;

    public DefaultProducer(
            MessageValidator validator,
            TwoLevelRateLimiter rateLimiter,
            BackpressureMonitor backpressure,
            TopologyManager topology,
            MessagePublisher publisher,
            AuditTrail audit,
            QueueMetrics metrics,
            ObjectMapper objectMapper) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.backpressure = Objects.requireNonNull(backpressure, "backpressure");
        this.topology = Objects.requireNonNull(topology, "topology");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.audit = Objects.requireNonNull(audit, "audit");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public SubmitResult submit(String orgId, RequestMessage message, Priority priority) {
        validator.validate(orgId, message);

        Priority effective = priority != null ? priority : message.logicalPriority();
        RequestMessage outgoing = message.withDefaults().withPriority(effective);

        Duration waited = acquireTokens(orgId, outgoing.userId());

        ThrottleMode mode = backpressure.currentMode(orgId);
        if (!mode.admits(effective)) {
            metrics.backpressureDropped(mode, effective);
            metrics.publishAttempt(effective, "throttled");
            log.warn("Dropped {} for org={} at {}: backpressure mode {}",
                outgoing.messageId(), orgId, effective, mode);
            return SubmitResult.throttled(outgoing.messageId(), effective, mode, waited);
        }

        TraceContext trace = TracePropagation.currentOrNew();
        publish(orgId, outgoing, effective, trace, true);

        log.info("Submitted {} type={} org={} priority={}", outgoing.messageId(), outgoing.type(), orgId, effective);
        return SubmitResult.published(outgoing.messageId(), effective, mode, waited, trace.traceId());
    }

    @Override
    public SubmitResult submitRaw(String orgId, Map<String, Object> message, Priority priority) {
        RequestMessage parsed;
        try {
            parsed = objectMapper.convertValue(message, RequestMessage.class);
        } catch (IllegalArgumentException e) {
            throw new MessageValidationException("message is not a valid request: " + e.getMessage());
        }
        return submit(orgId, parsed, priority);
    }

    @Override
    public List<SubmitResult> submitAll(String orgId, List<RequestMessage> messages) {
        List<SubmitResult> results = new ArrayList<>(messages.size());
        for (RequestMessage message : messages) {
            results.add(submit(orgId, message, null));
        }
        return results;
    }

    @Override
    public SubmitResult republish(RequestMessage message, Priority priority) {
        validator.validate(message.orgId(), message);
        Priority effective = priority != null ? priority : message.logicalPriority();
        RequestMessage outgoing = message.withDefaults().withPriority(effective);

        TraceContext trace = TracePropagation.currentOrNew();
        publish(outgoing.orgId(), outgoing, effective, trace, false);

        log.info("Republished {} org={} priority={}", outgoing.messageId(), outgoing.orgId(), effective);
        return SubmitResult.published(outgoing.messageId(), effective, ThrottleMode.NONE, Duration.ZERO,
            trace.traceId());
    }

    private void publish(String orgId, RequestMessage message, Priority priority, TraceContext trace,
                         boolean recordCreation) {
        String exchange = TopologyNames.requestExchange(orgId);
        try {
            topology.ensureOrgTopology(orgId);
            if (recordCreation) {
                audit.createdAndEnqueued(message, exchange);
            }
            publisher.publishRequest(orgId, message, priority, TracePropagation.inject(trace, null));
            metrics.publishAttempt(priority, "published");
        } catch (PublishException | AmqpException e) {
            metrics.publishAttempt(priority, "failed");
            metrics.publishFailure(e.getClass().getSimpleName());
            audit.publishFailed(message, e.getMessage());
            log.error("Publish of {} to {} failed: {}", message.messageId(), exchange, e.getMessage());
            if (e instanceof PublishException pe) {
                throw pe;
            }
            throw new PublishException(exchange, "Publish to " + exchange + " failed: " + e.getMessage(), e);
        }
    }

    private Duration acquireTokens(String orgId, String userId) {
        if (!rateLimiter.isEnabled()) {
            return Duration.ZERO;
        }
        try {
            Duration waited = rateLimiter.acquire(orgId, userId);
            metrics.rateLimitWait(waited);
            return waited;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientMessageException("INTERRUPTED", "Interrupted while waiting for rate-limit tokens");
        } catch (RuntimeException e) {
            log.warn("Rate limiter failed for org={}, admitting without wait: {}", orgId, e.getMessage());
            return Duration.ZERO;
        }
    }
}
