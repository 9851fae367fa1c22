package com.ivamare.agentqueue.coordinator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.agentqueue.amqp.TopologyManager;
import com.ivamare.agentqueue.amqp.TopologyNames;
import com.ivamare.agentqueue.metrics.QueueMetrics;
import com.ivamare.agentqueue.tracing.TraceContext;
import com.ivamare.agentqueue.tracing.TracePropagation;
import com.ivamare.agentqueue.util.Jsons;
import com.rabbitmq.client.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;
import org.springframework.amqp.rabbit.listener.DirectMessageListenerContainer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Routes agent responses from the broker to in-process queues.
 *
 * <p>One listener container (one connection) consumes every locally hosted
 * agent's response queue. Each response lands on that agent's bounded local
 * queue; only the {@code request_id} and {@code type} fields are read.
 *
 * <p>Deliveries are acknowledged manually once the response is on the local
 * queue. When the queue stays full for the offer timeout the delivery is
 * rejected with requeue, so the broker keeps the response until the agent
 * catches up.
 */
public class AgentCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AgentCoordinator.class);

    public static final String MALFORMED_TYPE = "malformed";

    public static final Duration DEFAULT_OFFER_TIMEOUT = Duration.ofSeconds(5);

    private final ConnectionFactory connectionFactory;
    private final TopologyManager topology;
    private final QueueMetrics metrics;
    private final ObjectMapper objectMapper;
    private final int capacity;
    private final Duration offerTimeout;
    private final Map<String, BlockingQueue<AgentResponse>> localQueues = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private DirectMessageListenerContainer container;

    public AgentCoordinator(ConnectionFactory connectionFactory, TopologyManager topology, QueueMetrics metrics,
                            ObjectMapper objectMapper, Collection<String> agentIds, int capacity) {
        this(connectionFactory, topology, metrics, objectMapper, agentIds, capacity, DEFAULT_OFFER_TIMEOUT);
    }

    public AgentCoordinator(ConnectionFactory connectionFactory, TopologyManager topology, QueueMetrics metrics,
                            ObjectMapper objectMapper, Collection<String> agentIds, int capacity,
                            Duration offerTimeout) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        if (offerTimeout == null || offerTimeout.isNegative()) {
            throw new IllegalArgumentException("offerTimeout must not be negative");
        }
        this.offerTimeout = offerTimeout;
        this.connectionFactory = connectionFactory;
        this.topology = Objects.requireNonNull(topology, "topology");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.capacity = capacity;
        for (String agentId : agentIds) {
            localQueues.put(agentId, new LinkedBlockingQueue<>(capacity));
        }
    }

    public void start() {
        if (running.getAndSet(true)) {
            log.warn("Coordinator already running");
            return;
        }
        localQueues.keySet().forEach(topology::ensureAgentTopology);

        if (connectionFactory != null && !localQueues.isEmpty()) {
            container = new DirectMessageListenerContainer(connectionFactory);
            container.setQueueNames(localQueues.keySet().stream()
                .map(TopologyNames::agentResponseQueue)
                .toArray(String[]::new));
            container.setAcknowledgeMode(AcknowledgeMode.MANUAL);
            container.setMessageListener((ChannelAwareMessageListener) this::onDelivery);
            container.start();
        }
        log.info("Coordinator started for agents {}", localQueues.keySet());
    }

    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (container != null) {
            container.stop();
            container = null;
        }
        log.info("Coordinator stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Host another agent; subscribes to its response queue when running.
     */
    public void addAgent(String agentId) {
        if (localQueues.putIfAbsent(agentId, new LinkedBlockingQueue<>(capacity)) != null) {
            return;
        }
        if (running.get()) {
            topology.ensureAgentTopology(agentId);
            if (container != null) {
                container.addQueueNames(TopologyNames.agentResponseQueue(agentId));
            }
        }
        log.info("Coordinator now hosts agent {}", agentId);
    }

    public Set<String> agentIds() {
        return Set.copyOf(localQueues.keySet());
    }

    /**
     * Settle one broker delivery: ack once the response is queued locally,
     * nack with requeue while the agent's queue is full.
     */
    void onDelivery(Message message, Channel channel) throws IOException {
        long deliveryTag = message.getMessageProperties().getDeliveryTag();
        String queue = message.getMessageProperties().getConsumerQueue();
        String agentId = TopologyNames.agentIdFromResponseQueue(queue);
        if (agentId == null || !localQueues.containsKey(agentId)) {
            log.warn("Discarding response from queue {} with no hosted agent", queue);
            metrics.coordinatorDropped(agentId);
            channel.basicAck(deliveryTag, false);
            return;
        }

        if (forward(agentId, message.getBody(), message.getMessageProperties().getHeaders())) {
            channel.basicAck(deliveryTag, false);
        } else {
            metrics.coordinatorRequeued(agentId);
            channel.basicNack(deliveryTag, false, true);
        }
    }

    /**
     * Place a response on the agent's local queue, waiting up to the offer
     * timeout for room.
     *
     * @param agentId Receiving agent
     * @param body Raw payload bytes
     * @param headers Transport headers carrying trace context
     * @return true if queued, false if the agent is unknown or its queue stayed full
     */
    public boolean forward(String agentId, byte[] body, Map<String, Object> headers) {
        TraceContext trace = TracePropagation.continueFrom(headers);
        Map<String, Object> payload = readPayload(body);
        Object requestId = payload.get("request_id");
        Object type = payload.getOrDefault("type", MALFORMED_TYPE);

        try (TracePropagation.MdcScope ignored = TracePropagation.open(trace,
                requestId != null ? requestId.toString() : null, null)) {
            BlockingQueue<AgentResponse> queue = localQueues.get(agentId);
            if (queue == null) {
                log.warn("Response for agent {} not hosted here, dropped", agentId);
                metrics.coordinatorDropped(agentId);
                return false;
            }

            AgentResponse response = new AgentResponse(agentId,
                requestId != null ? requestId.toString() : null,
                String.valueOf(type), payload, trace.traceId(), Instant.now());
            if (!offer(queue, response)) {
                log.warn("Local queue for agent {} full ({}), response {} not accepted", agentId, capacity, requestId);
                return false;
            }

            metrics.coordinatorForwarded(response.type());
            log.debug("Forwarded {} response {} to agent {}", response.type(), requestId, agentId);
            return true;
        }
    }

    /**
     * Wait for the next response for an agent.
     *
     * @return the response, or null on timeout
     */
    public AgentResponse poll(String agentId, Duration timeout) throws InterruptedException {
        BlockingQueue<AgentResponse> queue = localQueues.get(agentId);
        if (queue == null) {
            throw new IllegalArgumentException("Agent " + agentId + " is not hosted by this coordinator");
        }
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int pending(String agentId) {
        BlockingQueue<AgentResponse> queue = localQueues.get(agentId);
        return queue != null ? queue.size() : 0;
    }

    private boolean offer(BlockingQueue<AgentResponse> queue, AgentResponse response) {
        try {
            return queue.offer(response, offerTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Map<String, Object> readPayload(byte[] body) {
        try {
            Map<String, Object> payload = objectMapper.readValue(body, Jsons.MAP_TYPE);
            if (payload != null) {
                return payload;
            }
        } catch (IOException e) {
            log.debug("Unreadable response body: {}", e.getMessage());
        }
        Map<String, Object> malformed = new LinkedHashMap<>();
        malformed.put("malformed", true);
        malformed.put("type", MALFORMED_TYPE);
        malformed.put("raw", new String(body, StandardCharsets.UTF_8));
        return malformed;
    }
}
