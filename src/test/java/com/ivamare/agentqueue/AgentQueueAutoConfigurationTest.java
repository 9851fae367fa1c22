package com.ivamare.agentqueue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.agentqueue.amqp.MessagePublisher;
import com.ivamare.agentqueue.amqp.TopologyManager;
import com.ivamare.agentqueue.audit.AsyncAuditPipeline;
import com.ivamare.agentqueue.audit.AuditTrail;
import com.ivamare.agentqueue.audit.DlqRepository;
import com.ivamare.agentqueue.audit.impl.InMemoryAuditStore;
import com.ivamare.agentqueue.audit.impl.JdbcDlqRepository;
import com.ivamare.agentqueue.backpressure.BackpressureMonitor;
import com.ivamare.agentqueue.coordinator.AgentCoordinator;
import com.ivamare.agentqueue.dedup.IdempotencyStore;
import com.ivamare.agentqueue.dedup.impl.InMemoryIdempotencyStore;
import com.ivamare.agentqueue.dedup.impl.JdbcIdempotencyStore;
import com.ivamare.agentqueue.handler.Handler;
import com.ivamare.agentqueue.handler.HandlerContext;
import com.ivamare.agentqueue.handler.HandlerRegistry;
import com.ivamare.agentqueue.handler.impl.DefaultHandlerRegistry;
import com.ivamare.agentqueue.metrics.QueueMetrics;
import com.ivamare.agentqueue.model.MessageType;
import com.ivamare.agentqueue.model.RequestMessage;
import com.ivamare.agentqueue.model.ThrottleMode;
import com.ivamare.agentqueue.ops.DlqReplayService;
import com.ivamare.agentqueue.ops.RetentionCleaner;
import com.ivamare.agentqueue.poison.PoisonDetector;
import com.ivamare.agentqueue.policy.RetryPolicy;
import com.ivamare.agentqueue.producer.Producer;
import com.ivamare.agentqueue.ratelimit.TwoLevelRateLimiter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("AgentQueueAutoConfiguration")
class AgentQueueAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(AgentQueueAutoConfiguration.class))
        .withUserConfiguration(MockBrokerConfig.class)
        .withPropertyValues("agentqueue.store=memory");

    @Test
    @DisplayName("should create all beans when enabled")
    void shouldCreateAllBeansWhenEnabled() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ObjectMapper.class);
            assertThat(context).hasSingleBean(QueueMetrics.class);
            assertThat(context).hasSingleBean(RetryPolicy.class);
            assertThat(context).hasSingleBean(TwoLevelRateLimiter.class);
            assertThat(context).hasSingleBean(BackpressureMonitor.class);
            assertThat(context).hasSingleBean(TopologyManager.class);
            assertThat(context).hasSingleBean(MessagePublisher.class);
            assertThat(context).hasSingleBean(HandlerRegistry.class);
            assertThat(context).hasSingleBean(IdempotencyStore.class);
            assertThat(context).hasSingleBean(PoisonDetector.class);
            assertThat(context).hasSingleBean(AsyncAuditPipeline.class);
            assertThat(context).hasSingleBean(AuditTrail.class);
            assertThat(context).hasSingleBean(DlqRepository.class);
            assertThat(context).hasSingleBean(Producer.class);
            assertThat(context).hasSingleBean(DlqReplayService.class);
            assertThat(context).doesNotHaveBean(RetentionCleaner.class);
            assertThat(context).doesNotHaveBean(AgentCoordinator.class);
        });
    }

    @Test
    @DisplayName("should use in-memory stores when configured")
    void shouldUseMemoryStores() {
        contextRunner.run(context -> {
            assertThat(context.getBean(IdempotencyStore.class)).isInstanceOf(InMemoryIdempotencyStore.class);
            assertThat(context.getBean(DlqRepository.class))
                .isSameAs(context.getBean(AgentQueueAutoConfiguration.AUDIT_STORE_BEAN))
                .isInstanceOf(InMemoryAuditStore.class);
        });
    }

    @Test
    @DisplayName("should use JDBC stores by default")
    void shouldUseJdbcStoresByDefault() {
        new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(AgentQueueAutoConfiguration.class))
            .withUserConfiguration(MockBrokerConfig.class, MockJdbcConfig.class)
            .run(context -> {
                assertThat(context.getBean(IdempotencyStore.class)).isInstanceOf(JdbcIdempotencyStore.class);
                assertThat(context.getBean(DlqRepository.class)).isInstanceOf(JdbcDlqRepository.class);
            });
    }

    @Test
    @DisplayName("should not create beans when disabled")
    void shouldNotCreateBeansWhenDisabled() {
        contextRunner
            .withPropertyValues("agentqueue.enabled=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(Producer.class);
                assertThat(context).doesNotHaveBean(DlqReplayService.class);
                assertThat(context).doesNotHaveBean(AsyncAuditPipeline.class);
            });
    }

    @Test
    @DisplayName("should use custom RetryPolicy if provided")
    void shouldUseCustomRetryPolicyIfProvided() {
        contextRunner
            .withUserConfiguration(CustomRetryPolicyConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(RetryPolicy.class);
                assertThat(context.getBean(RetryPolicy.class)).isSameAs(CustomRetryPolicyConfig.CUSTOM_POLICY);
                assertThat(context.getBean(TopologyManager.class).retryDelays()).containsExactly(250L);
            });
    }

    @Test
    @DisplayName("should use custom HandlerRegistry if provided")
    void shouldUseCustomHandlerRegistryIfProvided() {
        contextRunner
            .withUserConfiguration(CustomHandlerRegistryConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(HandlerRegistry.class);
                assertThat(context.getBean(HandlerRegistry.class)).isSameAs(CustomHandlerRegistryConfig.CUSTOM_REGISTRY);
            });
    }

    @Test
    @DisplayName("should register @Handler methods of application beans")
    void shouldRegisterAnnotatedHandlers() {
        contextRunner
            .withUserConfiguration(HandlerBeanConfig.class)
            .run(context -> {
                HandlerRegistry registry = context.getBean(HandlerRegistry.class);
                assertThat(registry.registeredTypes()).containsExactly(MessageType.TOOL_CALL);
            });
    }

    @Test
    @DisplayName("should bind AgentQueueProperties")
    void shouldBindProperties() {
        contextRunner
            .withPropertyValues(
                "agentqueue.default-agent-id=orchestrator",
                "agentqueue.retry.delays-ms=500,1500",
                "agentqueue.retry.rate-limited-backoff-ms=30000",
                "agentqueue.worker.org-ids=acme,globex",
                "agentqueue.worker.concurrency=8",
                "agentqueue.worker.poison-threshold=5",
                "agentqueue.worker.shutdown-timeout=45s",
                "agentqueue.backpressure.scale=20",
                "agentqueue.backpressure.light=50",
                "agentqueue.audit.batch-size=25",
                "agentqueue.coordinator.capacity=16",
                "agentqueue.coordinator.offer-timeout=250ms"
            )
            .run(context -> {
                AgentQueueProperties props = context.getBean(AgentQueueProperties.class);
                assertThat(props.getDefaultAgentId()).isEqualTo("orchestrator");
                assertThat(props.getWorker().getOrgIds()).containsExactly("acme", "globex");
                assertThat(props.getWorker().getConcurrency()).isEqualTo(8);
                assertThat(props.getWorker().getShutdownTimeout()).isEqualTo(Duration.ofSeconds(45));
                assertThat(props.getAudit().getBatchSize()).isEqualTo(25);
                assertThat(props.getCoordinator().getCapacity()).isEqualTo(16);
                assertThat(props.getCoordinator().getOfferTimeout()).isEqualTo(Duration.ofMillis(250));

                RetryPolicy policy = context.getBean(RetryPolicy.class);
                assertThat(policy.delayLadderMs()).containsExactly(500L, 1500L);
                assertThat(policy.rateLimitedBackoffMs()).isEqualTo(30_000L);
                assertThat(context.getBean(PoisonDetector.class).threshold()).isEqualTo(5);
                assertThat(BackpressureMonitor.decideThrottle(60, context.getBean(BackpressureMonitor.class).thresholds()))
                    .isEqualTo(ThrottleMode.LIGHT);
            });
    }

    @Test
    @DisplayName("should write audit synchronously when async is off")
    void shouldSkipPipelineWhenSynchronous() {
        contextRunner
            .withPropertyValues("agentqueue.audit.async=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(AsyncAuditPipeline.class);
                assertThat(context).hasSingleBean(AuditTrail.class);

                RequestMessage message = TestMessages.message("acme", MessageType.TOOL_CALL);
                context.getBean(AuditTrail.class).createdAndEnqueued(message, "org.acme.requests");

                InMemoryAuditStore store = context.getBean(InMemoryAuditStore.class);
                assertThat(store.findEvents(message.messageId())).hasSize(2);
                assertThat(store.findMessage(message.orgId(), message.messageId())).isPresent();
            });
    }

    @Test
    @DisplayName("should create the retention cleaner when enabled")
    void shouldCreateRetentionCleaner() {
        contextRunner
            .withPropertyValues("agentqueue.retention.enabled=true")
            .run(context -> assertThat(context).hasSingleBean(RetentionCleaner.class));
    }

    @Test
    @DisplayName("should create the coordinator when auto-start is enabled")
    void shouldCreateCoordinator() {
        contextRunner
            .withPropertyValues(
                "agentqueue.coordinator.auto-start=true",
                "agentqueue.coordinator.agent-ids=planner,researcher")
            .run(context -> {
                assertThat(context).hasSingleBean(AgentCoordinator.class);
                assertThat(context.getBean(AgentCoordinator.class).agentIds())
                    .isEqualTo(Set.of("planner", "researcher"));
            });
    }

    @Test
    @DisplayName("should expose worker health when auto-start is enabled")
    void shouldExposeWorkerHealth() {
        contextRunner
            .withPropertyValues("agentqueue.worker.auto-start=true", "agentqueue.worker.org-ids=acme")
            .run(context -> {
                assertThat(context).hasSingleBean(WorkerAutoStartConfiguration.class);
                assertThat(context).hasBean("workerHealthIndicator");
            });
    }

    @Configuration
    static class MockBrokerConfig {

        @Bean
        AmqpAdmin amqpAdmin() {
            return mock(AmqpAdmin.class);
        }

        @Bean
        RabbitTemplate rabbitTemplate() {
            return mock(RabbitTemplate.class);
        }
    }

    @Configuration
    static class MockJdbcConfig {

        @Bean
        JdbcTemplate jdbcTemplate() {
            return mock(JdbcTemplate.class);
        }
    }

    @Configuration
    static class CustomRetryPolicyConfig {
        static final RetryPolicy CUSTOM_POLICY = new RetryPolicy(List.of(250L), 10_000L);

        @Bean
        RetryPolicy retryPolicy() {
            return CUSTOM_POLICY;
        }
    }

    @Configuration
    static class CustomHandlerRegistryConfig {
        static final DefaultHandlerRegistry CUSTOM_REGISTRY = new DefaultHandlerRegistry();

        @Bean
        HandlerRegistry handlerRegistry() {
            return CUSTOM_REGISTRY;
        }
    }

    @Configuration
    static class HandlerBeanConfig {

        @Bean
        ToolHandlers toolHandlers() {
            return new ToolHandlers();
        }
    }

    public static class ToolHandlers {

        @Handler(MessageType.TOOL_CALL)
        public Map<String, Object> callTool(RequestMessage message, HandlerContext context) {
            return Map.of("ok", true);
        }
    }
}
