package com.example.spimex.domain.enums;

/**
 * Lifecycle of a task message as tracked by the broker status store.
 */
public enum TaskStatus {

    /**
     * Accepted by the broker, waiting for a worker
     */
    QUEUED,

    /**
     * Claimed by a worker and currently executing
     */
    RUNNING,

    /**
     * Failed with a retryable error, parked until its next attempt is due
     */
    RETRY_PENDING,

    /**
     * Completed successfully.
     * Terminal state.
     */
    SUCCEEDED,

    /**
     * Failed permanently or ran out of attempts; moved to the dead-letter list.
     * Terminal state - requires manual intervention.
     */
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
