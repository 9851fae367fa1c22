package com.ivamare.agentqueue.ops;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.agentqueue.audit.AuditTrail;
import com.ivamare.agentqueue.audit.DlqRepository;
import com.ivamare.agentqueue.metrics.QueueMetrics;
import com.ivamare.agentqueue.model.DlqMessage;
import com.ivamare.agentqueue.model.Priority;
import com.ivamare.agentqueue.model.RequestMessage;
import com.ivamare.agentqueue.producer.Producer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Replays dead-lettered messages back onto the organization request queue.
 *
 * <p>Replayed copies keep their message id, restart at retry count 0 and record
 * the DLQ row they came from under {@code context.replayed_from}. Replayed rows are
 * flagged so they are not selected again.
 *
 * <p>Example:
 * <pre>
 * ReplayResult preview = replay.replay(request.asDryRun());
 * ReplayResult done = replay.replay(request);
 * </pre>
 */
public class DlqReplayService {

    private static final Logger log = LoggerFactory.getLogger(DlqReplayService.class);

    private final DlqRepository dlqRepository;
    private final Producer producer;
    private final AuditTrail audit;
    private final QueueMetrics metrics;
    private final ObjectMapper objectMapper;

    public DlqReplayService(DlqRepository dlqRepository, Producer producer, AuditTrail audit,
                            QueueMetrics metrics, ObjectMapper objectMapper) {
        this.dlqRepository = Objects.requireNonNull(dlqRepository, "dlqRepository");
        this.producer = Objects.requireNonNull(producer, "producer");
        this.audit = Objects.requireNonNull(audit, "audit");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public ReplayResult replay(ReplayRequest request) {
        List<DlqMessage> candidates = dlqRepository.findReplayable(request.toQuery());
        if (candidates.isEmpty()) {
            log.info("No replayable DLQ rows for org={} type={}", request.orgId(), request.type());
            return ReplayResult.noCandidates();
        }

        List<String> candidateIds = candidates.stream().map(DlqMessage::messageId).toList();
        if (request.dryRun()) {
            log.info("Dry run: {} DLQ rows would be replayed for org={}", candidates.size(), request.orgId());
            return new ReplayResult(ReplayResult.Status.DRY_RUN, candidates.size(), 0, candidateIds);
        }

        if (request.priorityOverride() != null && !request.confirmed() && changesPriority(candidates, request)) {
            log.warn("Replay for org={} changes priority to {}; confirmation required",
                request.orgId(), request.priorityOverride());
            return new ReplayResult(ReplayResult.Status.CONFIRMATION_REQUIRED, candidates.size(), 0, candidateIds);
        }

        List<String> replayed = new ArrayList<>();
        List<Long> replayedRows = new ArrayList<>();
        int failed = 0;
        for (DlqMessage row : candidates) {
            try {
                RequestMessage message = toMessage(row).forReplay(row.id(), row.dlqTimestamp());
                Priority priority = request.priorityOverride() != null
                    ? request.priorityOverride()
                    : message.logicalPriority();
                producer.republish(message, priority);
                audit.replayed(message.withPriority(priority), row.id());
                replayed.add(message.messageId());
                replayedRows.add(row.id());
            } catch (RuntimeException e) {
                failed++;
                log.error("Replay of DLQ row {} ({}) failed: {}", row.id(), row.messageId(), e.getMessage());
            }
        }

        if (!replayedRows.isEmpty()) {
            dlqRepository.markReplayed(replayedRows);
            metrics.dlqReplayed(request.orgId(), replayedRows.size());
        }
        log.info("Replayed {} DLQ rows for org={} ({} failed)", replayed.size(), request.orgId(), failed);
        return new ReplayResult(ReplayResult.Status.REPLAYED, replayed.size(), failed, replayed);
    }

    private boolean changesPriority(List<DlqMessage> candidates, ReplayRequest request) {
        for (DlqMessage row : candidates) {
            Priority original = Priority.parse(row.originalMessage().get("priority"));
            if (original != request.priorityOverride()) {
                return true;
            }
        }
        return false;
    }

    private RequestMessage toMessage(DlqMessage row) {
        return objectMapper.convertValue(row.originalMessage(), RequestMessage.class);
    }
}
