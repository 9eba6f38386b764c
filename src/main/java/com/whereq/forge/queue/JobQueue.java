package com.whereq.forge.queue;

import com.whereq.forge.model.QueuedJob;

import java.time.Duration;
import java.util.Optional;

/**
 * Durable FIFO of jobs waiting for a worker.
 * <p>
 * A pop is exclusive: each entry is handed to exactly one caller.
 */
public interface JobQueue {
    /**
     * Append a job to the tail of the queue
     *
     * @param job the job to enqueue
     * @return queue length after the push
     */
    long enqueue(QueuedJob job);

    /**
     * Put a job back at the head of the queue so it is the next one popped
     *
     * @param job the job to return
     */
    void pushBack(QueuedJob job);

    /**
     * Block until a job is available or the timeout elapses
     *
     * @param timeout maximum time to wait
     * @return the popped job, or empty when the queue stayed empty or the entry was unreadable
     */
    Optional<QueuedJob> pop(Duration timeout);

    /**
     * Get current queue size
     *
     * @return number of waiting jobs
     */
    long size();

    /**
     * Connectivity check
     *
     * @return true when the broker answered
     */
    boolean ping();
}
