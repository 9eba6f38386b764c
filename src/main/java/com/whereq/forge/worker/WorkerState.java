package com.whereq.forge.worker;

import com.whereq.forge.model.QueuedJob;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Optional;

/**
 * Process-local state of one worker.
 * <p>
 * {@link #beginJob}, {@link #finishJob} and {@link #requestShutdown} share one lock, so a
 * job popped while a shutdown signal arrives is either seen by the shutdown handler or
 * refused by {@link #beginJob}, never lost between the two.
 */
public class WorkerState {

    @Getter
    private final String workerId;

    @Getter
    @Setter
    private volatile boolean running;

    @Getter
    private volatile boolean shutdownRequested;

    @Getter
    @Setter
    private volatile Instant lastHealthCheck;

    private QueuedJob currentJob;

    private boolean abandoned;

    public WorkerState(String workerId) {
        this.workerId = workerId;
    }

    /**
     * Make the job current
     *
     * @return false when shutdown was already requested; the caller must return the job to the queue
     */
    public synchronized boolean beginJob(QueuedJob job) {
        if (shutdownRequested) {
            return false;
        }
        currentJob = job;
        abandoned = false;
        return true;
    }

    public synchronized void finishJob() {
        currentJob = null;
        abandoned = false;
    }

    /**
     * Flag shutdown. A current job is marked abandoned: its runner must stop writing.
     *
     * @return the job that was current, for the caller to requeue
     */
    public synchronized Optional<QueuedJob> requestShutdown() {
        shutdownRequested = true;
        if (currentJob != null) {
            abandoned = true;
        }
        return Optional.ofNullable(currentJob);
    }

    /**
     * Mark the current job abandoned if it is the given one (lease lost)
     */
    public synchronized boolean abandon(String jobId) {
        if (currentJob != null && currentJob.getJobId().equals(jobId)) {
            abandoned = true;
            return true;
        }
        return false;
    }

    public synchronized boolean isAbandoned() {
        return abandoned;
    }

    public synchronized Optional<QueuedJob> getCurrentJob() {
        return Optional.ofNullable(currentJob);
    }

    public synchronized String getCurrentJobId() {
        return currentJob != null ? currentJob.getJobId() : null;
    }
}
