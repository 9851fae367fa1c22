package com.ivamare.agentqueue.worker;

import java.util.EnumSet;
import java.util.Set;

/**
 * States a delivery passes through inside a worker.
 *
 * <pre>
 * RECEIVED -&gt; DEDUP_CHECK -&gt; DUPLICATE
 *                         -&gt; PROCESSING -&gt; COMPLETED
 *                                       -&gt; FAILED -&gt; RETRY_SCHEDULED | DEAD_LETTERED | QUARANTINED
 * </pre>
 *
 * <p>RECEIVED may go straight to FAILED when the body cannot be parsed.
 * RETRY_SCHEDULED ends this delivery; the redelivered copy starts again at RECEIVED.
 */
public enum WorkerState {
    RECEIVED,
    DEDUP_CHECK,
    DUPLICATE,
    PROCESSING,
    COMPLETED,
    FAILED,
    RETRY_SCHEDULED,
    DEAD_LETTERED,
    QUARANTINED;

    public Set<WorkerState> successors() {
        return switch (this) {
            case RECEIVED -> EnumSet.of(DEDUP_CHECK, FAILED);
            case DEDUP_CHECK -> EnumSet.of(DUPLICATE, PROCESSING);
            case PROCESSING -> EnumSet.of(COMPLETED, FAILED);
            case FAILED -> EnumSet.of(RETRY_SCHEDULED, DEAD_LETTERED, QUARANTINED);
            default -> EnumSet.noneOf(WorkerState.class);
        };
    }

    public boolean canTransitionTo(WorkerState next) {
        return successors().contains(next);
    }

    /**
     * True for states that end a delivery; the message is acknowledged after reaching one.
     */
    public boolean isTerminal() {
        return successors().isEmpty();
    }

    public String label() {
        return name().toLowerCase();
    }
}
