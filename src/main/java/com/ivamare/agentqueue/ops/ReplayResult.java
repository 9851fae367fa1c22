package com.ivamare.agentqueue.ops;

import java.util.List;

/**
 * Outcome of a DLQ replay.
 *
 * @param status What the replay did
 * @param count Candidates for DRY_RUN and CONFIRMATION_REQUIRED, republished messages for REPLAYED
 * @param failed Candidates that could not be republished
 * @param messageIds Ids of the candidates (DRY_RUN) or republished messages (REPLAYED)
 */
public record ReplayResult(Status status, int count, int failed, List<String> messageIds) {

    public enum Status {
        NO_CANDIDATES,
        DRY_RUN,
        CONFIRMATION_REQUIRED,
        REPLAYED
    }

    public static ReplayResult noCandidates() {
        return new ReplayResult(Status.NO_CANDIDATES, 0, 0, List.of());
    }
}
