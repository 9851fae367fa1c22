package com.ivamare.agentqueue.amqp.impl;

import com.ivamare.agentqueue.backpressure.QueueDepthReader;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.rabbit.core.RabbitAdmin;

import java.util.Objects;
import java.util.Properties;

/**
 * Queue depth from a passive queue declaration through {@link AmqpAdmin}.
 */
public class RabbitQueueDepthReader implements QueueDepthReader {

    private final AmqpAdmin amqpAdmin;

    public RabbitQueueDepthReader(AmqpAdmin amqpAdmin) {
        this.amqpAdmin = Objects.requireNonNull(amqpAdmin, "amqpAdmin");
    }

    @Override
    public long depth(String queueName) {
        Properties props = amqpAdmin.getQueueProperties(queueName);
        if (props == null) {
            return 0L;
        }
        Object count = props.get(RabbitAdmin.QUEUE_MESSAGE_COUNT);
        if (count instanceof Number number) {
            return number.longValue();
        }
        return count != null ? Long.parseLong(count.toString()) : 0L;
    }
}
