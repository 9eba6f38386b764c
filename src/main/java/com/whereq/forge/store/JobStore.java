package com.whereq.forge.store;

import com.whereq.forge.entity.GenerationJob;
import com.whereq.forge.entity.JobStage;
import com.whereq.forge.model.ErrorRecord;
import com.whereq.forge.model.QueuedJob;
import com.whereq.forge.model.StageDescriptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent store for jobs and their stages, keyed by job id (and stage name).
 * <p>
 * Job transitions that can race (claim, terminal writes, requeue, lease reclaim) return
 * {@code true} only for the caller that actually performed the transition.
 */
public interface JobStore {

    /**
     * Create a PENDING job row
     *
     * @throws org.springframework.dao.DuplicateKeyException if a job with this id exists
     */
    GenerationJob createPending(String jobId, String jobType, Map<String, Object> input);

    /**
     * Move a job to PROCESSING under the given worker's lease.
     * Creates the row when the enqueuer did not.
     */
    ClaimOutcome claim(QueuedJob job, String workerId, Instant leaseUntil);

    Optional<GenerationJob> findJob(String jobId);

    List<JobStage> findStages(String jobId);

    void recordStageCount(String jobId, int stageCount);

    /**
     * Create or fetch the stage row, enter PROCESSING and count one more attempt
     */
    JobStage startStageAttempt(String jobId, StageDescriptor stage, int stageIndex);

    /**
     * Raise stage progress; lower values are ignored
     */
    void updateStageProgress(String jobId, String stageName, int progress);

    void completeStage(String jobId, String stageName, Map<String, Object> stageData);

    /**
     * Record a failed attempt. {@code terminal} also stamps the final timestamp.
     */
    void failStage(String jobId, String stageName, ErrorRecord error, boolean terminal);

    /**
     * Raise the job's overall progress; lower values are ignored
     */
    void updateJobProgress(String jobId, int progress);

    boolean completeJob(String jobId, String workerId, String outputRef);

    boolean failJob(String jobId, String workerId, ErrorRecord error);

    /**
     * Return a job this worker holds to PENDING so it can be queued again
     */
    boolean releaseToPending(String jobId, String workerId, String reason);

    /**
     * Hand a PENDING job that never made it onto the queue to the lease reaper: it goes back
     * to PROCESSING with no owner and a lease that is already expired.
     */
    boolean expirePending(String jobId, String reason);

    boolean renewLease(String jobId, String workerId, Instant leaseUntil);

    List<GenerationJob> findExpiredLeases(Instant now);

    /**
     * Return a PROCESSING job whose lease expired to PENDING
     */
    boolean reclaimExpired(String jobId, String reason);

    /**
     * Connectivity check
     */
    boolean ping();
}
