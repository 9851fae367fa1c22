package com.ivamare.agentqueue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.agentqueue.amqp.MessagePublisher;
import com.ivamare.agentqueue.amqp.TopologyManager;
import com.ivamare.agentqueue.amqp.impl.RabbitMessagePublisher;
import com.ivamare.agentqueue.amqp.impl.RabbitQueueDepthReader;
import com.ivamare.agentqueue.audit.AsyncAuditPipeline;
import com.ivamare.agentqueue.audit.AuditRedactor;
import com.ivamare.agentqueue.audit.AuditSink;
import com.ivamare.agentqueue.audit.AuditTrail;
import com.ivamare.agentqueue.audit.DlqRepository;
import com.ivamare.agentqueue.audit.impl.InMemoryAuditStore;
import com.ivamare.agentqueue.audit.impl.JdbcAuditStore;
import com.ivamare.agentqueue.audit.impl.JdbcDlqRepository;
import com.ivamare.agentqueue.backpressure.BackpressureMonitor;
import com.ivamare.agentqueue.backpressure.QueueDepthReader;
import com.ivamare.agentqueue.dedup.IdempotencyStore;
import com.ivamare.agentqueue.dedup.impl.InMemoryIdempotencyStore;
import com.ivamare.agentqueue.dedup.impl.JdbcIdempotencyStore;
import com.ivamare.agentqueue.handler.HandlerRegistry;
import com.ivamare.agentqueue.handler.impl.DefaultHandlerRegistry;
import com.ivamare.agentqueue.metrics.QueueMetrics;
import com.ivamare.agentqueue.ops.DlqReplayService;
import com.ivamare.agentqueue.ops.RetentionCleaner;
import com.ivamare.agentqueue.poison.PoisonCounterStore;
import com.ivamare.agentqueue.poison.PoisonDetector;
import com.ivamare.agentqueue.poison.impl.InMemoryPoisonCounterStore;
import com.ivamare.agentqueue.poison.impl.JdbcPoisonCounterStore;
import com.ivamare.agentqueue.policy.RetryPolicy;
import com.ivamare.agentqueue.producer.Producer;
import com.ivamare.agentqueue.producer.impl.DefaultProducer;
import com.ivamare.agentqueue.ratelimit.TwoLevelRateLimiter;
import com.ivamare.agentqueue.util.Jsons;
import com.ivamare.agentqueue.validation.MessageValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validator;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Auto-configuration for the agent queue.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Idempotency, poison and audit stores (JDBC or in-memory)</li>
 *   <li>Audit pipeline and trail</li>
 *   <li>Topology manager and AMQP publisher</li>
 *   <li>Rate limiter and backpressure monitor</li>
 *   <li>Handler registry and retry policy</li>
 *   <li>Producer and DLQ replay service</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * agentqueue.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {
    DataSourceAutoConfiguration.class,
    JdbcTemplateAutoConfiguration.class,
    RabbitAutoConfiguration.class,
    JacksonAutoConfiguration.class
})
@ConditionalOnClass(RabbitTemplate.class)
@ConditionalOnProperty(prefix = "agentqueue", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(AgentQueueProperties.class)
@Import({WorkerAutoStartConfiguration.class, CoordinatorAutoStartConfiguration.class})
public class AgentQueueAutoConfiguration {

    public static final String AUDIT_STORE_BEAN = "agentQueueAuditStore";

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper agentQueueObjectMapper() {
        return Jsons.newObjectMapper();
    }

    // --- Metrics ---

    @Bean
    @ConditionalOnMissingBean
    public QueueMetrics queueMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new QueueMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    // --- Policies ---

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(AgentQueueProperties properties) {
        return properties.getRetry().toPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageValidator messageValidator(ObjectProvider<Validator> validator) {
        Validator available = validator.getIfAvailable();
        return available != null ? new MessageValidator(available) : MessageValidator.createDefault();
    }

    @Bean
    @ConditionalOnMissingBean
    public TwoLevelRateLimiter rateLimiter(AgentQueueProperties properties) {
        AgentQueueProperties.RateLimitProperties rl = properties.getRateLimit();
        return new TwoLevelRateLimiter(rl.orgSpec(), rl.userSpec());
    }

    @Bean
    @ConditionalOnMissingBean
    public PoisonDetector poisonDetector(PoisonCounterStore poisonCounterStore, AgentQueueProperties properties) {
        return new PoisonDetector(poisonCounterStore, properties.getWorker().getPoisonThreshold());
    }

    // --- Handler Registry ---

    @Bean
    @ConditionalOnMissingBean(HandlerRegistry.class)
    public static DefaultHandlerRegistry handlerRegistry() {
        return new DefaultHandlerRegistry();
    }

    // --- Transport ---

    @Bean
    @ConditionalOnMissingBean
    public TopologyManager topologyManager(AmqpAdmin amqpAdmin, RetryPolicy retryPolicy) {
        return new TopologyManager(amqpAdmin, retryPolicy.distinctDelays());
    }

    @Bean
    @ConditionalOnMissingBean
    public MessagePublisher messagePublisher(RabbitTemplate rabbitTemplate, ObjectMapper objectMapper) {
        return new RabbitMessagePublisher(rabbitTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueueDepthReader queueDepthReader(AmqpAdmin amqpAdmin) {
        return new RabbitQueueDepthReader(amqpAdmin);
    }

    @Bean
    @ConditionalOnMissingBean
    public BackpressureMonitor backpressureMonitor(QueueDepthReader queueDepthReader, AgentQueueProperties properties) {
        return new BackpressureMonitor(queueDepthReader, properties.getBackpressure().toThresholds());
    }

    // --- Audit ---

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "agentqueue.audit", name = "async", havingValue = "true", matchIfMissing = true)
    public AsyncAuditPipeline auditPipeline(
            @Qualifier(AUDIT_STORE_BEAN) AuditSink auditStore,
            QueueMetrics metrics,
            AgentQueueProperties properties) {
        AgentQueueProperties.AuditProperties audit = properties.getAudit();
        AsyncAuditPipeline pipeline = new AsyncAuditPipeline(auditStore, metrics,
            audit.getBufferCapacity(), audit.getBatchSize(), audit.getFlushInterval());
        pipeline.start();
        return pipeline;
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditTrail auditTrail(
            @Qualifier(AUDIT_STORE_BEAN) AuditSink auditStore,
            ObjectProvider<AsyncAuditPipeline> pipeline,
            ObjectMapper objectMapper,
            AgentQueueProperties properties) {
        AuditSink sink = pipeline.getIfAvailable();
        if (sink == null) {
            sink = auditStore;
        }
        return new AuditTrail(sink, objectMapper, new AuditRedactor(properties.getAudit().isRedactPayloads()));
    }

    // --- Producer and operations ---

    @Bean
    @ConditionalOnMissingBean
    public Producer producer(
            MessageValidator validator,
            TwoLevelRateLimiter rateLimiter,
            BackpressureMonitor backpressureMonitor,
            TopologyManager topologyManager,
            MessagePublisher messagePublisher,
            AuditTrail auditTrail,
            QueueMetrics metrics,
            ObjectMapper objectMapper) {
        return new DefaultProducer(validator, rateLimiter, backpressureMonitor, topologyManager,
            messagePublisher, auditTrail, metrics, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public DlqReplayService dlqReplayService(
            DlqRepository dlqRepository,
            Producer producer,
            AuditTrail auditTrail,
            QueueMetrics metrics,
            ObjectMapper objectMapper) {
        return new DlqReplayService(dlqRepository, producer, auditTrail, metrics, objectMapper);
    }

    /**
     * PostgreSQL-backed stores (default).
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(JdbcTemplate.class)
    @ConditionalOnProperty(prefix = "agentqueue", name = "store", havingValue = "jdbc", matchIfMissing = true)
    static class JdbcStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public IdempotencyStore idempotencyStore(JdbcTemplate jdbcTemplate) {
            return new JdbcIdempotencyStore(jdbcTemplate);
        }

        @Bean
        @ConditionalOnMissingBean
        public PoisonCounterStore poisonCounterStore(JdbcTemplate jdbcTemplate) {
            return new JdbcPoisonCounterStore(jdbcTemplate);
        }

        @Bean(AUDIT_STORE_BEAN)
        @ConditionalOnMissingBean(name = AUDIT_STORE_BEAN)
        public JdbcAuditStore agentQueueAuditStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcAuditStore(jdbcTemplate, objectMapper);
        }

        @Bean
        @ConditionalOnMissingBean
        public DlqRepository dlqRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcDlqRepository(jdbcTemplate, objectMapper);
        }
    }

    /**
     * In-process stores for local development and tests.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "agentqueue", name = "store", havingValue = "memory")
    static class MemoryStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public IdempotencyStore idempotencyStore() {
            return new InMemoryIdempotencyStore();
        }

        @Bean
        @ConditionalOnMissingBean
        public PoisonCounterStore poisonCounterStore() {
            return new InMemoryPoisonCounterStore();
        }

        @Bean(AUDIT_STORE_BEAN)
        @ConditionalOnMissingBean(name = AUDIT_STORE_BEAN)
        public InMemoryAuditStore agentQueueAuditStore() {
            return new InMemoryAuditStore();
        }
    }

    /**
     * Scheduled retention purge.
     */
    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnProperty(prefix = "agentqueue.retention", name = "enabled", havingValue = "true")
    static class RetentionConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public RetentionCleaner retentionCleaner(
                DlqRepository dlqRepository,
                IdempotencyStore idempotencyStore,
                QueueMetrics metrics,
                AgentQueueProperties properties) {
            AgentQueueProperties.RetentionProperties retention = properties.getRetention();
            return new RetentionCleaner(dlqRepository, idempotencyStore, metrics,
                retention.getDlq(), retention.getIdempotencyKeys(), Clock.systemUTC());
        }
    }
}
