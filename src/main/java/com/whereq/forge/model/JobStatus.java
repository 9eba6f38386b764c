package com.whereq.forge.model;

/**
 * Persisted job lifecycle states
 *
 * State transitions:
 * PENDING → PROCESSING → {COMPLETED, FAILED}
 * PROCESSING → PENDING (requeue on shutdown or expired lease)
 */
public enum JobStatus {
    /**
     * Waiting in the queue
     */
    PENDING,

    /**
     * Claimed by a worker
     */
    PROCESSING,

    /**
     * All stages completed
     */
    COMPLETED,

    /**
     * Terminated with error
     */
    FAILED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Lowercase name used in events and the status cache
     */
    public String wireName() {
        return name().toLowerCase();
    }
}
