package com.whereq.forge.worker;

import com.whereq.forge.config.ForgeProperties;
import com.whereq.forge.entity.GenerationJob;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.model.QueuedJob;
import com.whereq.forge.model.StatusEvent;
import com.whereq.forge.progress.ProgressPublisher;
import com.whereq.forge.queue.JobQueue;
import com.whereq.forge.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Keeps the leases of jobs in progress alive and returns jobs whose lease expired
 * (their worker was killed without a chance to requeue) to the queue.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "forge.lease", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LeaseKeeper {

    static final String EXPIRED_REASON = "Worker lease expired";

    private final WorkerPool workerPool;
    private final JobStore jobStore;
    private final JobQueue jobQueue;
    private final ProgressPublisher publisher;
    private final ForgeProperties properties;
    private final Clock clock;

    /**
     * Renew the lease of every job currently processed in this process.
     * A job whose lease was lost is abandoned by its worker.
     */
    @Scheduled(fixedDelayString = "${forge.lease.heartbeat-interval-ms:20000}")
    public void heartbeat() {
        Instant leaseUntil = clock.instant().plus(properties.getLease().getDuration());

        for (JobWorker worker : workerPool.getWorkers()) {
            WorkerState state = worker.getState();
            String jobId = state.getCurrentJobId();
            if (jobId == null) {
                continue;
            }

            try {
                if (!jobStore.renewLease(jobId, state.getWorkerId(), leaseUntil)) {
                    log.warn("Worker {} lost the lease on job {}, abandoning it", state.getWorkerId(), jobId);
                    state.abandon(jobId);
                }
            } catch (Exception e) {
                log.error("Failed to renew lease of job {} for worker {}: {}", jobId, state.getWorkerId(), e.getMessage());
            }
        }
    }

    @Scheduled(fixedDelayString = "${forge.lease.reaper-interval-ms:30000}")
    public void reapExpiredLeases() {
        int requeued = requeueExpired();
        if (requeued > 0) {
            log.info("Requeued {} job(s) with an expired lease", requeued);
        }
    }

    /**
     * Reset PROCESSING jobs with an expired lease to PENDING and queue them again.
     * The reset is conditional, so with several reapers each job is requeued once.
     *
     * @return number of jobs requeued
     */
    int requeueExpired() {
        List<GenerationJob> expired;
        try {
            expired = jobStore.findExpiredLeases(clock.instant());
        } catch (Exception e) {
            log.error("Failed to look up expired leases: {}", e.getMessage());
            return 0;
        }

        int requeued = 0;
        for (GenerationJob job : expired) {
            if (requeue(job)) {
                requeued++;
            }
        }
        return requeued;
    }

    private boolean requeue(GenerationJob job) {
        int requeueCount = job.getRequeueCount() + 1;
        try {
            if (!jobStore.reclaimExpired(job.getId(), EXPIRED_REASON)) {
                return false;
            }
        } catch (Exception e) {
            log.error("Failed to reclaim job {}: {}", job.getId(), e.getMessage());
            return false;
        }

        try {
            jobQueue.enqueue(QueuedJob.builder()
                .jobId(job.getId())
                .jobType(job.getJobType())
                .input(job.getInput())
                .enqueuedAt(clock.instant())
                .requeueCount(requeueCount)
                .build());
        } catch (Exception e) {
            // back to an expired lease, the next sweep tries again
            log.error("Failed to queue reclaimed job {}: {}", job.getId(), e.getMessage());
            try {
                jobStore.expirePending(job.getId(), JobWorker.REQUEUE_FAILED_REASON);
            } catch (Exception storeError) {
                log.error("Job {} is PENDING without a queue entry: {}", job.getId(), storeError.getMessage());
            }
            return false;
        }

        workerPool.getRequeuedCounter().increment();
        publisher.publishStatus(StatusEvent.builder()
            .jobId(job.getId())
            .status(JobStatus.PENDING.wireName())
            .errorMessage(EXPIRED_REASON)
            .timestamp(clock.instant())
            .build());
        log.warn("Job {} held by {} had an expired lease, returned to the queue", job.getId(), job.getLeaseOwner());
        return true;
    }
}
