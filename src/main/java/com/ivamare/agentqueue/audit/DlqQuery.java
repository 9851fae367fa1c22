package com.ivamare.agentqueue.audit;

import java.time.Instant;

/**
 * Selection of replayable DLQ rows.
 *
 * @param orgId Organization (required)
 * @param type Message type filter (nullable)
 * @param since Inclusive lower bound on dlq_timestamp (nullable)
 * @param until Exclusive upper bound on dlq_timestamp (nullable)
 * @param limit Maximum rows, oldest first
 */
public record DlqQuery(String orgId, String type, Instant since, Instant until, int limit) {

    public DlqQuery {
        if (orgId == null || orgId.isBlank()) {
            throw new IllegalArgumentException("orgId is required");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
    }

    public static DlqQuery forOrg(String orgId, int limit) {
        return new DlqQuery(orgId, null, null, null, limit);
    }
}
