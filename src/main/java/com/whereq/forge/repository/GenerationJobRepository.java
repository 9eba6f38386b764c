package com.whereq.forge.repository;

import com.whereq.forge.entity.GenerationJob;
import com.whereq.forge.model.ErrorKind;
import com.whereq.forge.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Spring Data JPA repository for the {@link GenerationJob} entity.
 * <p>
 * Every state transition is a conditional update whose row count tells the caller
 * whether it won the transition. This is what makes terminal writes happen exactly once
 * and keeps a requeue from racing a completion.
 */
@Repository
public interface GenerationJobRepository extends JpaRepository<GenerationJob, String> {

    @Modifying
    @Query("UPDATE GenerationJob j SET j.status = com.whereq.forge.model.JobStatus.PROCESSING, "
        + "j.leaseOwner = :workerId, j.leaseExpiresAt = :leaseUntil, j.updatedAt = :now "
        + "WHERE j.id = :jobId AND j.status = com.whereq.forge.model.JobStatus.PENDING")
    int claimPending(@Param("jobId") String jobId,
                     @Param("workerId") String workerId,
                     @Param("leaseUntil") Instant leaseUntil,
                     @Param("now") Instant now);

    @Modifying
    @Query("UPDATE GenerationJob j SET j.leaseExpiresAt = :leaseUntil "
        + "WHERE j.id = :jobId AND j.leaseOwner = :workerId "
        + "AND j.status = com.whereq.forge.model.JobStatus.PROCESSING")
    int renewLease(@Param("jobId") String jobId,
                   @Param("workerId") String workerId,
                   @Param("leaseUntil") Instant leaseUntil);

    @Modifying
    @Query("UPDATE GenerationJob j SET j.status = com.whereq.forge.model.JobStatus.COMPLETED, "
        + "j.outputRef = :outputRef, j.progress = 100, j.errorKind = null, j.errorMessage = null, "
        + "j.leaseOwner = null, j.leaseExpiresAt = null, j.completedAt = :now, j.updatedAt = :now "
        + "WHERE j.id = :jobId AND j.leaseOwner = :workerId "
        + "AND j.status = com.whereq.forge.model.JobStatus.PROCESSING")
    int markCompleted(@Param("jobId") String jobId,
                      @Param("workerId") String workerId,
                      @Param("outputRef") String outputRef,
                      @Param("now") Instant now);

    @Modifying
    @Query("UPDATE GenerationJob j SET j.status = com.whereq.forge.model.JobStatus.FAILED, "
        + "j.errorKind = :errorKind, j.errorMessage = :errorMessage, "
        + "j.errorAttempts = :attempts, j.errorExhausted = :exhausted, "
        + "j.leaseOwner = null, j.leaseExpiresAt = null, j.completedAt = :now, j.updatedAt = :now "
        + "WHERE j.id = :jobId AND j.leaseOwner = :workerId "
        + "AND j.status = com.whereq.forge.model.JobStatus.PROCESSING")
    int markFailed(@Param("jobId") String jobId,
                   @Param("workerId") String workerId,
                   @Param("errorKind") ErrorKind errorKind,
                   @Param("errorMessage") String errorMessage,
                   @Param("attempts") int attempts,
                   @Param("exhausted") boolean exhausted,
                   @Param("now") Instant now);

    @Modifying
    @Query("UPDATE GenerationJob j SET j.status = com.whereq.forge.model.JobStatus.PENDING, "
        + "j.errorMessage = :reason, j.requeueCount = j.requeueCount + 1, "
        + "j.leaseOwner = null, j.leaseExpiresAt = null, j.updatedAt = :now "
        + "WHERE j.id = :jobId AND j.leaseOwner = :workerId "
        + "AND j.status = com.whereq.forge.model.JobStatus.PROCESSING")
    int releaseToPending(@Param("jobId") String jobId,
                         @Param("workerId") String workerId,
                         @Param("reason") String reason,
                         @Param("now") Instant now);

    @Modifying
    @Query("UPDATE GenerationJob j SET j.status = com.whereq.forge.model.JobStatus.PENDING, "
        + "j.errorMessage = :reason, j.requeueCount = j.requeueCount + 1, "
        + "j.leaseOwner = null, j.leaseExpiresAt = null, j.updatedAt = :now "
        + "WHERE j.id = :jobId AND j.status = com.whereq.forge.model.JobStatus.PROCESSING "
        + "AND j.leaseExpiresAt < :now")
    int reclaimExpired(@Param("jobId") String jobId,
                       @Param("reason") String reason,
                       @Param("now") Instant now);

    @Modifying
    @Query("UPDATE GenerationJob j SET j.status = com.whereq.forge.model.JobStatus.PROCESSING, "
        + "j.errorMessage = :reason, j.leaseOwner = null, j.leaseExpiresAt = :now, j.updatedAt = :now "
        + "WHERE j.id = :jobId AND j.status = com.whereq.forge.model.JobStatus.PENDING")
    int expirePending(@Param("jobId") String jobId,
                      @Param("reason") String reason,
                      @Param("now") Instant now);

    @Modifying
    @Query("UPDATE GenerationJob j SET j.progress = :progress, j.updatedAt = :now "
        + "WHERE j.id = :jobId AND j.progress < :progress")
    int raiseProgress(@Param("jobId") String jobId,
                      @Param("progress") int progress,
                      @Param("now") Instant now);

    @Modifying
    @Query("UPDATE GenerationJob j SET j.stageCount = :stageCount, j.updatedAt = :now WHERE j.id = :jobId")
    int updateStageCount(@Param("jobId") String jobId,
                         @Param("stageCount") int stageCount,
                         @Param("now") Instant now);

    List<GenerationJob> findByStatusAndLeaseExpiresAtBefore(JobStatus status, Instant threshold);
}
