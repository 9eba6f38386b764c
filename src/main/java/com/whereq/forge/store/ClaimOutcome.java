package com.whereq.forge.store;

/**
 * Result of trying to claim a dequeued job
 */
public enum ClaimOutcome {
    /**
     * The job is now PROCESSING under this worker's lease
     */
    CLAIMED,

    /**
     * The job already reached COMPLETED or FAILED (duplicate queue entry)
     */
    ALREADY_TERMINAL,

    /**
     * Another worker holds the job
     */
    HELD_ELSEWHERE
}
