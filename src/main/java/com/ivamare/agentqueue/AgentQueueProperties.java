package com.ivamare.agentqueue;

import com.ivamare.agentqueue.backpressure.BackpressureThresholds;
import com.ivamare.agentqueue.policy.RetryPolicy;
import com.ivamare.agentqueue.ratelimit.TokenBucketSpec;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the agent queue.
 *
 * <p>Example configuration:
 * <pre>
 * agentqueue:
 *   enabled: true
 *   store: jdbc
 *   default-agent-id: orchestrator
 *   retry:
 *     delays-ms: [1000, 2000, 4000, 8000]
 *     rate-limited-backoff-ms: 60000
 *   worker:
 *     auto-start: true
 *     org-ids: [acme]
 *     concurrency: 4
 *     prefetch: 10
 *     poison-threshold: 3
 *   rate-limit:
 *     org-tokens-per-second: 50
 *     org-burst: 100
 *   backpressure:
 *     light: 500
 *   audit:
 *     redact-payloads: true
 *   coordinator:
 *     auto-start: true
 *     agent-ids: [planner, researcher]
 * </pre>
 */
@ConfigurationProperties(prefix = "agentqueue")
public class AgentQueueProperties {

    public enum Store {
        JDBC,
        MEMORY
    }

    /**
     * Enable/disable agent queue auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Backing store for idempotency keys, poison counters and the audit trail.
     */
    private Store store = Store.JDBC;

    /**
     * Agent answered when a message carries no agent_id.
     */
    private String defaultAgentId;

    private RetryProperties retry = new RetryProperties();

    private WorkerProperties worker = new WorkerProperties();

    private RateLimitProperties rateLimit = new RateLimitProperties();

    private BackpressureProperties backpressure = new BackpressureProperties();

    private AuditProperties audit = new AuditProperties();

    private CoordinatorProperties coordinator = new CoordinatorProperties();

    private RetentionProperties retention = new RetentionProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public String getDefaultAgentId() {
        return defaultAgentId;
    }

    public void setDefaultAgentId(String defaultAgentId) {
        this.defaultAgentId = defaultAgentId;
    }

    public RetryProperties getRetry() {
        return retry;
    }

    public void setRetry(RetryProperties retry) {
        this.retry = retry;
    }

    public WorkerProperties getWorker() {
        return worker;
    }

    public void setWorker(WorkerProperties worker) {
        this.worker = worker;
    }

    public RateLimitProperties getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimitProperties rateLimit) {
        this.rateLimit = rateLimit;
    }

    public BackpressureProperties getBackpressure() {
        return backpressure;
    }

    public void setBackpressure(BackpressureProperties backpressure) {
        this.backpressure = backpressure;
    }

    public AuditProperties getAudit() {
        return audit;
    }

    public void setAudit(AuditProperties audit) {
        this.audit = audit;
    }

    public CoordinatorProperties getCoordinator() {
        return coordinator;
    }

    public void setCoordinator(CoordinatorProperties coordinator) {
        this.coordinator = coordinator;
    }

    public RetentionProperties getRetention() {
        return retention;
    }

    public void setRetention(RetentionProperties retention) {
        this.retention = retention;
    }

    /**
     * Retry delay ladder and rate-limited backoff.
     */
    public static class RetryProperties {

        /**
         * Delay before retry n+1, indexed by retry count; the last entry repeats.
         */
        private List<Long> delaysMs = new ArrayList<>(RetryPolicy.DEFAULT_LADDER_MS);

        /**
         * Fixed delay for rate-limited failures.
         */
        private long rateLimitedBackoffMs = RetryPolicy.DEFAULT_RATE_LIMITED_BACKOFF_MS;

        public RetryPolicy toPolicy() {
            return new RetryPolicy(delaysMs, rateLimitedBackoffMs);
        }

        public List<Long> getDelaysMs() {
            return delaysMs;
        }

        public void setDelaysMs(List<Long> delaysMs) {
            this.delaysMs = delaysMs;
        }

        public long getRateLimitedBackoffMs() {
            return rateLimitedBackoffMs;
        }

        public void setRateLimitedBackoffMs(long rateLimitedBackoffMs) {
            this.rateLimitedBackoffMs = rateLimitedBackoffMs;
        }
    }

    /**
     * Worker-specific configuration.
     */
    public static class WorkerProperties {

        /**
         * Start workers for {@link #orgIds} on application ready.
         */
        private boolean autoStart = false;

        /**
         * Organizations whose request queues this process consumes.
         */
        private List<String> orgIds = new ArrayList<>();

        /**
         * Worker id recorded in audit events (default: random per worker).
         */
        private String workerId;

        /**
         * Concurrent handler executions per worker.
         */
        private int concurrency = 4;

        /**
         * Unacknowledged deliveries the broker may push to a worker.
         */
        private int prefetch = 10;

        /**
         * Consecutive failures tolerated before a message is quarantined.
         */
        private int poisonThreshold = 3;

        /**
         * How long graceful shutdown waits for in-flight messages.
         */
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        /**
         * Queue depth gauge sampling interval; zero disables sampling.
         */
        private Duration depthSampleInterval = Duration.ofSeconds(15);

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public List<String> getOrgIds() {
            return orgIds;
        }

        public void setOrgIds(List<String> orgIds) {
            this.orgIds = orgIds;
        }

        public String getWorkerId() {
            return workerId;
        }

        public void setWorkerId(String workerId) {
            this.workerId = workerId;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getPrefetch() {
            return prefetch;
        }

        public void setPrefetch(int prefetch) {
            this.prefetch = prefetch;
        }

        public int getPoisonThreshold() {
            return poisonThreshold;
        }

        public void setPoisonThreshold(int poisonThreshold) {
            this.poisonThreshold = poisonThreshold;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }

        public Duration getDepthSampleInterval() {
            return depthSampleInterval;
        }

        public void setDepthSampleInterval(Duration depthSampleInterval) {
            this.depthSampleInterval = depthSampleInterval;
        }
    }

    /**
     * Producer-side token buckets. A non-positive rate disables that level.
     */
    public static class RateLimitProperties {

        private double orgTokensPerSecond = 0;

        private long orgBurst = 100;

        private double userTokensPerSecond = 0;

        private long userBurst = 20;

        public TokenBucketSpec orgSpec() {
            return new TokenBucketSpec(orgTokensPerSecond, orgBurst);
        }

        public TokenBucketSpec userSpec() {
            return new TokenBucketSpec(userTokensPerSecond, userBurst);
        }

        public double getOrgTokensPerSecond() {
            return orgTokensPerSecond;
        }

        public void setOrgTokensPerSecond(double orgTokensPerSecond) {
            this.orgTokensPerSecond = orgTokensPerSecond;
        }

        public long getOrgBurst() {
            return orgBurst;
        }

        public void setOrgBurst(long orgBurst) {
            this.orgBurst = orgBurst;
        }

        public double getUserTokensPerSecond() {
            return userTokensPerSecond;
        }

        public void setUserTokensPerSecond(double userTokensPerSecond) {
            this.userTokensPerSecond = userTokensPerSecond;
        }

        public long getUserBurst() {
            return userBurst;
        }

        public void setUserBurst(long userBurst) {
            this.userBurst = userBurst;
        }
    }

    /**
     * Queue depth marks. An unset mark disables that mode.
     */
    public static class BackpressureProperties {

        private Long scale = 100L;

        private Long light = 500L;

        private Long heavy = 1_000L;

        private Long emergency = 5_000L;

        public BackpressureThresholds toThresholds() {
            return new BackpressureThresholds(mark(scale), mark(light), mark(heavy), mark(emergency));
        }

        private static long mark(Long value) {
            return value != null ? value : BackpressureThresholds.DISABLED;
        }

        public Long getScale() {
            return scale;
        }

        public void setScale(Long scale) {
            this.scale = scale;
        }

        public Long getLight() {
            return light;
        }

        public void setLight(Long light) {
            this.light = light;
        }

        public Long getHeavy() {
            return heavy;
        }

        public void setHeavy(Long heavy) {
            this.heavy = heavy;
        }

        public Long getEmergency() {
            return emergency;
        }

        public void setEmergency(Long emergency) {
            this.emergency = emergency;
        }
    }

    /**
     * Audit buffering and redaction.
     */
    public static class AuditProperties {

        /**
         * Write audit records from a background drainer instead of the caller's thread.
         */
        private boolean async = true;

        private int bufferCapacity = 10_000;

        private int batchSize = 100;

        private Duration flushInterval = Duration.ofMillis(200);

        /**
         * Replace payloads and error details with a redaction marker before storage.
         */
        private boolean redactPayloads = false;

        public boolean isAsync() {
            return async;
        }

        public void setAsync(boolean async) {
            this.async = async;
        }

        public int getBufferCapacity() {
            return bufferCapacity;
        }

        public void setBufferCapacity(int bufferCapacity) {
            this.bufferCapacity = bufferCapacity;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getFlushInterval() {
            return flushInterval;
        }

        public void setFlushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
        }

        public boolean isRedactPayloads() {
            return redactPayloads;
        }

        public void setRedactPayloads(boolean redactPayloads) {
            this.redactPayloads = redactPayloads;
        }
    }

    /**
     * Response coordinator for locally hosted agents.
     */
    public static class CoordinatorProperties {

        private boolean autoStart = false;

        private List<String> agentIds = new ArrayList<>();

        /**
         * Capacity of each agent's local response queue.
         */
        private int capacity = 1_000;

        /**
         * How long a delivery waits for room in a full local queue before it is
         * returned to the broker.
         */
        private Duration offerTimeout = Duration.ofSeconds(5);

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public List<String> getAgentIds() {
            return agentIds;
        }

        public void setAgentIds(List<String> agentIds) {
            this.agentIds = agentIds;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public Duration getOfferTimeout() {
            return offerTimeout;
        }

        public void setOfferTimeout(Duration offerTimeout) {
            this.offerTimeout = offerTimeout;
        }
    }

    /**
     * Scheduled purge of old DLQ rows and idempotency keys.
     */
    public static class RetentionProperties {

        private boolean enabled = false;

        private String cron = "0 30 3 * * *";

        private Duration dlq = Duration.ofDays(90);

        private Duration idempotencyKeys = Duration.ofDays(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public Duration getDlq() {
            return dlq;
        }

        public void setDlq(Duration dlq) {
            this.dlq = dlq;
        }

        public Duration getIdempotencyKeys() {
            return idempotencyKeys;
        }

        public void setIdempotencyKeys(Duration idempotencyKeys) {
            this.idempotencyKeys = idempotencyKeys;
        }
    }
}
