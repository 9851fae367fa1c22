package com.ivamare.agentqueue.amqp;

import com.ivamare.agentqueue.model.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Declares organization and agent topology.
 *
 * <p>Per organization: a priority request queue on a direct exchange, one
 * TTL delay queue per retry delay that dead-letters back into the request
 * exchange, and a dead-letter exchange with its DLQ. Per agent: a response
 * queue. Declarations are idempotent; {@code ensure*} methods skip topology
 * already declared by this process.
 */
public class TopologyManager {

    private static final Logger log = LoggerFactory.getLogger(TopologyManager.class);

    private final AmqpAdmin amqpAdmin;
    private final SortedSet<Long> retryDelaysMs;
    private final Set<String> declaredOrgs = ConcurrentHashMap.newKeySet();
    private final Set<String> declaredAgents = ConcurrentHashMap.newKeySet();

    public TopologyManager(AmqpAdmin amqpAdmin, Collection<Long> retryDelaysMs) {
        this.amqpAdmin = Objects.requireNonNull(amqpAdmin, "amqpAdmin");
        this.retryDelaysMs = new TreeSet<>(retryDelaysMs);
        for (Long delay : this.retryDelaysMs) {
            if (delay <= 0 || delay > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Unsupported retry delay: " + delay);
            }
        }
    }

    /**
     * Declare organization topology once per process.
     */
    public void ensureOrgTopology(String orgId) {
        if (declaredOrgs.contains(orgId)) {
            return;
        }
        declareOrgTopology(orgId);
        declaredOrgs.add(orgId);
    }

    public void ensureAgentTopology(String agentId) {
        if (declaredAgents.contains(agentId)) {
            return;
        }
        declareAgentResponseTopology(agentId);
        declaredAgents.add(agentId);
    }

    public void declareOrgTopology(String orgId) {
        requireName(orgId, "orgId");

        DirectExchange requests = new DirectExchange(TopologyNames.requestExchange(orgId), true, false);
        amqpAdmin.declareExchange(requests);
        Queue requestQueue = QueueBuilder.durable(TopologyNames.requestQueue(orgId))
            .maxPriority(Priority.MAX_TRANSPORT_PRIORITY)
            .build();
        amqpAdmin.declareQueue(requestQueue);
        amqpAdmin.declareBinding(BindingBuilder.bind(requestQueue).to(requests).with(TopologyNames.REQUESTS_ROUTING_KEY));

        declareRetryTopology(orgId);

        DirectExchange dlx = new DirectExchange(TopologyNames.deadLetterExchange(orgId), true, false);
        amqpAdmin.declareExchange(dlx);
        Queue dlq = QueueBuilder.durable(TopologyNames.deadLetterQueue(orgId)).build();
        amqpAdmin.declareQueue(dlq);
        amqpAdmin.declareBinding(BindingBuilder.bind(dlq).to(dlx).with(TopologyNames.DEAD_ROUTING_KEY));

        log.info("Declared topology for org={} (delays={}ms)", orgId, retryDelaysMs);
    }

    public void declareAgentResponseTopology(String agentId) {
        requireName(agentId, "agentId");

        DirectExchange responses = new DirectExchange(TopologyNames.agentResponseExchange(agentId), true, false);
        amqpAdmin.declareExchange(responses);
        Queue queue = QueueBuilder.durable(TopologyNames.agentResponseQueue(agentId)).build();
        amqpAdmin.declareQueue(queue);
        amqpAdmin.declareBinding(BindingBuilder.bind(queue).to(responses).with(TopologyNames.RESPONSES_ROUTING_KEY));

        log.info("Declared response topology for agent={}", agentId);
    }

    public List<Long> retryDelays() {
        return List.copyOf(retryDelaysMs);
    }

    public boolean supportsDelay(long delayMs) {
        return retryDelaysMs.contains(delayMs);
    }

    private void declareRetryTopology(String orgId) {
        DirectExchange retry = new DirectExchange(TopologyNames.retryExchange(orgId), true, false);
        amqpAdmin.declareExchange(retry);
        for (Long delay : retryDelaysMs) {
            Queue delayQueue = QueueBuilder.durable(TopologyNames.delayQueue(orgId, delay))
                .ttl(delay.intValue())
                .deadLetterExchange(TopologyNames.requestExchange(orgId))
                .deadLetterRoutingKey(TopologyNames.REQUESTS_ROUTING_KEY)
                .build();
            amqpAdmin.declareQueue(delayQueue);
            amqpAdmin.declareBinding(BindingBuilder.bind(delayQueue).to(retry).with(TopologyNames.delayRoutingKey(delay)));
        }
    }

    private static void requireName(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
