package com.ivamare.agentqueue.ops;

import com.ivamare.agentqueue.audit.DlqQuery;
import com.ivamare.agentqueue.model.Priority;

import java.time.Instant;

/**
 * Operator request to replay dead-lettered messages.
 *
 * @param orgId Organization (required)
 * @param type Message type filter (nullable)
 * @param since Inclusive lower bound on dead-letter time (nullable)
 * @param until Exclusive upper bound on dead-letter time (nullable)
 * @param limit Maximum rows to replay
 * @param priorityOverride Priority to republish at; null keeps each message's own
 * @param dryRun Report candidates without publishing
 * @param confirmed Operator confirmed a priority override that changes priorities
 */
public record ReplayRequest(
    String orgId,
    String type,
    Instant since,
    Instant until,
    int limit,
    Priority priorityOverride,
    boolean dryRun,
    boolean confirmed
) {
    public DlqQuery toQuery() {
        return new DlqQuery(orgId, type, since, until, limit);
    }

    public static ReplayRequest forOrg(String orgId, int limit) {
        return new ReplayRequest(orgId, null, null, null, limit, null, false, false);
    }

    public ReplayRequest asDryRun() {
        return new ReplayRequest(orgId, type, since, until, limit, priorityOverride, true, confirmed);
    }
}
