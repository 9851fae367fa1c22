package com.ivamare.agentqueue.model;

/**
 * Classification of a processing failure, the only input the retry policy
 * looks at besides counters and priority.
 */
public enum ErrorKind {
    /** Malformed message or arguments; never retried */
    VALIDATION,

    /** Network or dependency failure; retried on the backoff ladder */
    TRANSIENT,

    /** Downstream capacity signal; retried late and at lower priority */
    RATE_LIMITED
}
