package com.ivamare.agentqueue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.agentqueue.amqp.TopologyManager;
import com.ivamare.agentqueue.coordinator.AgentCoordinator;
import com.ivamare.agentqueue.metrics.QueueMetrics;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

/**
 * Auto-start configuration for the response coordinator.
 *
 * <p>Enable with:
 * <pre>
 * agentqueue:
 *   coordinator:
 *     auto-start: true
 *     agent-ids: [planner, researcher]
 * </pre>
 */
@Configuration
@ConditionalOnProperty(prefix = "agentqueue.coordinator", name = "auto-start", havingValue = "true")
public class CoordinatorAutoStartConfiguration {

    @Bean(destroyMethod = "stop")
    @ConditionalOnMissingBean
    public AgentCoordinator agentCoordinator(
            ObjectProvider<ConnectionFactory> connectionFactory,
            TopologyManager topologyManager,
            QueueMetrics metrics,
            ObjectMapper objectMapper,
            AgentQueueProperties properties) {
        AgentQueueProperties.CoordinatorProperties cp = properties.getCoordinator();
        return new AgentCoordinator(connectionFactory.getIfAvailable(), topologyManager, metrics, objectMapper,
            cp.getAgentIds(), cp.getCapacity(), cp.getOfferTimeout());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startCoordinator(ApplicationReadyEvent event) {
        event.getApplicationContext().getBean(AgentCoordinator.class).start();
    }
}
