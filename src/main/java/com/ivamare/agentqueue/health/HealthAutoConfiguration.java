package com.ivamare.agentqueue.health;

import com.ivamare.agentqueue.AgentQueueAutoConfiguration;
import com.ivamare.agentqueue.audit.AsyncAuditPipeline;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for agent queue health indicators.
 */
@AutoConfiguration(after = AgentQueueAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnProperty(prefix = "agentqueue", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnBean(AsyncAuditPipeline.class)
    @ConditionalOnMissingBean(AuditPipelineHealthIndicator.class)
    public AuditPipelineHealthIndicator auditPipelineHealthIndicator(AsyncAuditPipeline pipeline) {
        return new AuditPipelineHealthIndicator(pipeline);
    }
}
