package com.whereq.forge.worker;

/**
 * How a worker's handling of one dequeued job ended
 */
public enum JobOutcome {
    COMPLETED,
    FAILED,

    /**
     * Duplicate queue entry or a job held by another worker
     */
    SKIPPED,

    /**
     * Shutdown or a lost lease handed the job back; nothing more was written
     */
    ABANDONED,

    /**
     * The terminal write lost to a concurrent transition (requeue or reclaim)
     */
    LOST
}
