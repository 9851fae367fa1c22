package com.ivamare.agentqueue.amqp.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.agentqueue.amqp.MessagePublisher;
import com.ivamare.agentqueue.amqp.TopologyNames;
import com.ivamare.agentqueue.exception.PublishException;
import com.ivamare.agentqueue.model.Priority;
import com.ivamare.agentqueue.model.RequestMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.util.Map;
import java.util.Objects;

/**
 * {@link MessagePublisher} on a Spring AMQP {@link RabbitTemplate}.
 */
public class RabbitMessagePublisher implements MessagePublisher {

    private static final Logger log = LoggerFactory.getLogger(RabbitMessagePublisher.class);

    public static final String MESSAGE_ID_HEADER = "x-message-id";
    public static final String ORG_ID_HEADER = "x-org-id";

    private final RabbitTemplate rabbitTemplate;
    private final ObjectMapper objectMapper;

    public RabbitMessagePublisher(RabbitTemplate rabbitTemplate, ObjectMapper objectMapper) {
        this.rabbitTemplate = Objects.requireNonNull(rabbitTemplate, "rabbitTemplate");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public void publishRequest(String orgId, RequestMessage message, Priority priority, Map<String, Object> headers) {
        send(TopologyNames.requestExchange(orgId), TopologyNames.REQUESTS_ROUTING_KEY, message, priority,
            message.messageId(), orgId, headers);
    }

    @Override
    public void scheduleRetry(String orgId, RequestMessage message, long delayMs, Priority priority,
                              Map<String, Object> headers) {
        send(TopologyNames.retryExchange(orgId), TopologyNames.delayRoutingKey(delayMs), message, priority,
            message.messageId(), orgId, headers);
    }

    @Override
    public void publishToDlq(String orgId, Object body, Map<String, Object> headers) {
        String messageId = body instanceof RequestMessage rm ? rm.messageId() : null;
        send(TopologyNames.deadLetterExchange(orgId), TopologyNames.DEAD_ROUTING_KEY, body, null,
            messageId, orgId, headers);
    }

    @Override
    public void publishResponse(String agentId, Map<String, Object> payload, Map<String, Object> headers) {
        Object requestId = payload.get("request_id");
        send(TopologyNames.agentResponseExchange(agentId), TopologyNames.RESPONSES_ROUTING_KEY, payload, null,
            requestId != null ? requestId.toString() : null, null, headers);
    }

    private void send(String exchange, String routingKey, Object body, Priority priority, String messageId,
                      String orgId, Map<String, Object> headers) {
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new PublishException(exchange, "Failed to serialize message for " + exchange, e);
        }

        MessageProperties properties = new MessageProperties();
        properties.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        properties.setContentEncoding("UTF-8");
        properties.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
        if (priority != null) {
            properties.setPriority(priority.transportPriority());
        }
        if (messageId != null) {
            properties.setMessageId(messageId);
            properties.setHeader(MESSAGE_ID_HEADER, messageId);
        }
        if (orgId != null) {
            properties.setHeader(ORG_ID_HEADER, orgId);
        }
        if (headers != null) {
            headers.forEach(properties::setHeader);
        }

        try {
            rabbitTemplate.send(exchange, routingKey, new Message(bytes, properties));
            log.debug("Published {} to {} [{}]", messageId, exchange, routingKey);
        } catch (AmqpException e) {
            throw new PublishException(exchange, "Publish to " + exchange + " failed: " + e.getMessage(), e);
        }
    }
}
