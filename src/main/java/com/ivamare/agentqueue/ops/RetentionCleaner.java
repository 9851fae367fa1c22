package com.ivamare.agentqueue.ops;

import com.ivamare.agentqueue.audit.DlqRepository;
import com.ivamare.agentqueue.dedup.IdempotencyStore;
import com.ivamare.agentqueue.metrics.QueueMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deletes DLQ rows and idempotency keys past their retention.
 */
public class RetentionCleaner {

    private static final Logger log = LoggerFactory.getLogger(RetentionCleaner.class);

    private final DlqRepository dlqRepository;
    private final IdempotencyStore idempotencyStore;
    private final QueueMetrics metrics;
    private final Duration dlqRetention;
    private final Duration keyRetention;
    private final Clock clock;

    public RetentionCleaner(DlqRepository dlqRepository, IdempotencyStore idempotencyStore, QueueMetrics metrics,
                            Duration dlqRetention, Duration keyRetention, Clock clock) {
        this.dlqRepository = dlqRepository;
        this.idempotencyStore = idempotencyStore;
        this.metrics = metrics;
        this.dlqRetention = dlqRetention;
        this.keyRetention = keyRetention;
        this.clock = clock;
    }

    /**
     * Rows removed by one purge.
     *
     * @param dlqRows DLQ rows deleted
     * @param idempotencyKeys Idempotency keys deleted
     */
    public record PurgeResult(int dlqRows, int idempotencyKeys) {
    }

    @Scheduled(cron = "${agentqueue.retention.cron:0 30 3 * * *}")
    public void scheduledPurge() {
        try {
            purge();
        } catch (RuntimeException e) {
            log.error("Retention purge failed: {}", e.getMessage(), e);
        }
    }

    public PurgeResult purge() {
        Instant now = clock.instant();
        int dlqRows = dlqRepository.purgeOlderThan(now.minus(dlqRetention));
        int keys = idempotencyStore.purgeOlderThan(now.minus(keyRetention));
        metrics.dlqPurged(dlqRows);
        log.info("Retention purge removed {} DLQ rows (>{}d) and {} idempotency keys (>{}d)",
            dlqRows, dlqRetention.toDays(), keys, keyRetention.toDays());
        return new PurgeResult(dlqRows, keys);
    }
}
