package com.ivamare.agentqueue.model;

/**
 * Admission mode derived from request queue depth, ordered by severity.
 */
public enum ThrottleMode {
    /** No pressure */
    NONE,

    /** Depth above the scale-out mark; everything still admitted */
    SCALE,

    /** P3 is shed */
    LIGHT,

    /** P2 and P3 are shed */
    HEAVY,

    /** Only P0 is admitted */
    EMERGENCY;

    /**
     * Whether a submission at the given priority is admitted in this mode.
     *
     * @param priority logical priority of the submission
     * @return true if the message may be published
     */
    public boolean admits(Priority priority) {
        return switch (this) {
            case NONE, SCALE -> true;
            case LIGHT -> priority != Priority.P3;
            case HEAVY -> priority == Priority.P0 || priority == Priority.P1;
            case EMERGENCY -> priority == Priority.P0;
        };
    }

    public boolean isMoreSevereThan(ThrottleMode other) {
        return ordinal() > other.ordinal();
    }
}
