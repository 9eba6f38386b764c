package com.whereq.forge.store;

import com.whereq.forge.entity.GenerationJob;
import com.whereq.forge.entity.JobStage;
import com.whereq.forge.model.ErrorRecord;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.model.QueuedJob;
import com.whereq.forge.model.StageDescriptor;
import com.whereq.forge.model.StageStatus;
import com.whereq.forge.repository.GenerationJobRepository;
import com.whereq.forge.repository.JobStageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relational {@link JobStore} backed by Spring Data JPA.
 * <p>
 * Each method runs in its own transaction so a state change is durable as soon as the
 * call returns, independent of whatever the worker does next.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaJobStore implements JobStore {

    private final GenerationJobRepository jobRepository;
    private final JobStageRepository stageRepository;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @Override
    @Transactional
    public GenerationJob createPending(String jobId, String jobType, Map<String, Object> input) {
        // save() merges on an assigned id, which would reset an existing job
        if (jobRepository.existsById(jobId)) {
            throw new DuplicateKeyException("Job " + jobId + " already exists");
        }
        GenerationJob job = newJob(jobId, jobType, input, clock.instant());
        job.setStatus(JobStatus.PENDING);
        return jobRepository.saveAndFlush(job);
    }

    @Override
    @Transactional
    public ClaimOutcome claim(QueuedJob queued, String workerId, Instant leaseUntil) {
        Instant now = clock.instant();
        if (jobRepository.claimPending(queued.getJobId(), workerId, leaseUntil, now) == 1) {
            return ClaimOutcome.CLAIMED;
        }

        Optional<GenerationJob> existing = jobRepository.findById(queued.getJobId());
        if (existing.isEmpty()) {
            log.info("Job {} has no row yet, creating it as PROCESSING for worker {}", queued.getJobId(), workerId);
            GenerationJob job = newJob(queued.getJobId(), queued.getJobType(), queued.getInput(), now);
            job.setStatus(JobStatus.PROCESSING);
            job.setLeaseOwner(workerId);
            job.setLeaseExpiresAt(leaseUntil);
            job.setRequeueCount(queued.getRequeueCount());
            jobRepository.saveAndFlush(job);
            return ClaimOutcome.CLAIMED;
        }

        GenerationJob job = existing.get();
        if (job.getStatus().isTerminal()) {
            return ClaimOutcome.ALREADY_TERMINAL;
        }
        return ClaimOutcome.HELD_ELSEWHERE;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<GenerationJob> findJob(String jobId) {
        return jobRepository.findById(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<JobStage> findStages(String jobId) {
        return stageRepository.findByJobIdOrderByStageIndexAsc(jobId);
    }

    @Override
    @Transactional
    public void recordStageCount(String jobId, int stageCount) {
        jobRepository.updateStageCount(jobId, stageCount, clock.instant());
    }

    @Override
    @Transactional
    public JobStage startStageAttempt(String jobId, StageDescriptor descriptor, int stageIndex) {
        Instant now = clock.instant();
        JobStage stage = stageRepository.findByJobIdAndStageName(jobId, descriptor.getName())
            .orElseGet(() -> {
                JobStage created = new JobStage();
                created.setJobId(jobId);
                created.setStageName(descriptor.getName());
                created.setStageIndex(stageIndex);
                created.setExecutor(descriptor.getExecutor());
                created.setStatus(StageStatus.PENDING);
                return created;
            });

        stage.setStatus(StageStatus.PROCESSING);
        stage.setAttempts(stage.getAttempts() + 1);
        if (stage.getStartedAt() == null) {
            stage.setStartedAt(now);
        }
        stage.setUpdatedAt(now);
        return stageRepository.save(stage);
    }

    @Override
    @Transactional
    public void updateStageProgress(String jobId, String stageName, int progress) {
        stageRepository.findByJobIdAndStageName(jobId, stageName).ifPresent(stage -> {
            if (progress > stage.getProgress()) {
                stage.setProgress(progress);
                stage.setUpdatedAt(clock.instant());
                stageRepository.save(stage);
            }
        });
    }

    @Override
    @Transactional
    public void completeStage(String jobId, String stageName, Map<String, Object> stageData) {
        JobStage stage = requireStage(jobId, stageName);
        Instant now = clock.instant();
        stage.setStatus(StageStatus.COMPLETED);
        stage.setProgress(100);
        stage.setStageData(stageData != null ? new LinkedHashMap<>(stageData) : new LinkedHashMap<>());
        stage.setErrorKind(null);
        stage.setErrorMessage(null);
        stage.setErrorRetryable(false);
        if (stage.getCompletedAt() == null) {
            stage.setCompletedAt(now);
        }
        stage.setUpdatedAt(now);
        stageRepository.save(stage);
    }

    @Override
    @Transactional
    public void failStage(String jobId, String stageName, ErrorRecord error, boolean terminal) {
        JobStage stage = requireStage(jobId, stageName);
        Instant now = clock.instant();
        stage.setStatus(StageStatus.FAILED);
        stage.setErrorKind(error.getKind());
        stage.setErrorMessage(error.getMessage());
        stage.setErrorRetryable(error.isRetryable());
        if (terminal && stage.getCompletedAt() == null) {
            stage.setCompletedAt(now);
        }
        stage.setUpdatedAt(now);
        stageRepository.save(stage);
    }

    @Override
    @Transactional
    public void updateJobProgress(String jobId, int progress) {
        jobRepository.raiseProgress(jobId, progress, clock.instant());
    }

    @Override
    @Transactional
    public boolean completeJob(String jobId, String workerId, String outputRef) {
        return jobRepository.markCompleted(jobId, workerId, outputRef, clock.instant()) == 1;
    }

    @Override
    @Transactional
    public boolean failJob(String jobId, String workerId, ErrorRecord error) {
        return jobRepository.markFailed(jobId, workerId, error.getKind(), error.getMessage(),
            error.getAttempts(), error.isExhausted(), clock.instant()) == 1;
    }

    @Override
    @Transactional
    public boolean releaseToPending(String jobId, String workerId, String reason) {
        return jobRepository.releaseToPending(jobId, workerId, reason, clock.instant()) == 1;
    }

    @Override
    @Transactional
    public boolean expirePending(String jobId, String reason) {
        return jobRepository.expirePending(jobId, reason, clock.instant()) == 1;
    }

    @Override
    @Transactional
    public boolean renewLease(String jobId, String workerId, Instant leaseUntil) {
        return jobRepository.renewLease(jobId, workerId, leaseUntil) == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public List<GenerationJob> findExpiredLeases(Instant now) {
        return jobRepository.findByStatusAndLeaseExpiresAtBefore(JobStatus.PROCESSING, now);
    }

    @Override
    @Transactional
    public boolean reclaimExpired(String jobId, String reason) {
        return jobRepository.reclaimExpired(jobId, reason, clock.instant()) == 1;
    }

    @Override
    public boolean ping() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (Exception e) {
            log.error("Database ping failed: {}", e.getMessage());
            return false;
        }
    }

    private JobStage requireStage(String jobId, String stageName) {
        return stageRepository.findByJobIdAndStageName(jobId, stageName)
            .orElseThrow(() -> new IllegalStateException(
                "Stage " + stageName + " of job " + jobId + " does not exist"));
    }

    private GenerationJob newJob(String jobId, String jobType, Map<String, Object> input, Instant now) {
        GenerationJob job = new GenerationJob();
        job.setId(jobId);
        job.setJobType(jobType);
        job.setInput(input != null ? new LinkedHashMap<>(input) : new LinkedHashMap<>());
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        return job;
    }
}
