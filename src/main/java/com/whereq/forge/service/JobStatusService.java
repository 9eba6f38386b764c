package com.whereq.forge.service;

import com.whereq.forge.dto.JobStatusResponse;
import com.whereq.forge.entity.GenerationJob;
import com.whereq.forge.entity.JobStage;
import com.whereq.forge.exception.JobNotFoundException;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.model.StageStatus;
import com.whereq.forge.status.JobStatusCache;
import com.whereq.forge.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Read side: durable job state from the store, combined with the live status cache
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStatusService {

    private final JobStore jobStore;
    private final JobStatusCache statusCache;

    /**
     * Get job status
     *
     * @param jobId job identifier
     * @return Mono with the status, or an error of {@link JobNotFoundException}
     */
    public Mono<JobStatusResponse> getStatus(String jobId) {
        Mono<JobStatusResponse> persisted = Mono.fromCallable(() -> {
                GenerationJob job = jobStore.findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
                return toResponse(job, jobStore.findStages(jobId));
            })
            .subscribeOn(Schedulers.boundedElastic());

        Mono<String> live = statusCache.getStatus(jobId)
            .onErrorResume(e -> {
                log.warn("Status cache unavailable for job {}: {}", jobId, e.getMessage());
                return Mono.empty();
            })
            .defaultIfEmpty("");

        return Mono.zip(persisted, live)
            .map(tuple -> {
                JobStatusResponse response = tuple.getT1();
                if (!tuple.getT2().isEmpty()) {
                    response.setLiveStatus(tuple.getT2());
                }
                return response;
            });
    }

    JobStatusResponse toResponse(GenerationJob job, List<JobStage> stages) {
        int stagesCompleted = (int) stages.stream().filter(s -> s.getStatus() == StageStatus.COMPLETED).count();

        return JobStatusResponse.builder()
            .jobId(job.getId())
            .jobType(job.getJobType())
            .status(job.getStatus())
            .progress(JobStatusResponse.JobProgress.builder()
                .percentage(overallProgress(job, stages))
                .currentStage(currentStage(stages))
                .stagesCompleted(stagesCompleted)
                .stagesTotal(Math.max(job.getStageCount(), stages.size()))
                .build())
            .stages(stages.stream().map(this::toStageInfo).toList())
            .outputRef(job.getOutputRef())
            .error(job.getErrorKind() != null
                ? JobStatusResponse.ErrorInfo.builder()
                    .kind(job.getErrorKind())
                    .message(job.getErrorMessage())
                    .retryable(job.getErrorKind().isRetryable())
                    .attempts(job.getErrorAttempts())
                    .exhausted(job.isErrorExhausted())
                    .build()
                : null)
            .requeueCount(job.getRequeueCount())
            .createdAt(job.getCreatedAt())
            .updatedAt(job.getUpdatedAt())
            .completedAt(job.getCompletedAt())
            .build();
    }

    /**
     * Mean of stage progress over all planned stages; stages not started count as 0
     */
    static int overallProgress(GenerationJob job, List<JobStage> stages) {
        if (job.getStatus() == JobStatus.COMPLETED) {
            return 100;
        }
        int planned = Math.max(job.getStageCount(), stages.size());
        if (planned == 0) {
            return job.getProgress();
        }
        int sum = stages.stream().mapToInt(JobStage::getProgress).sum();
        return sum / planned;
    }

    private static String currentStage(List<JobStage> stages) {
        return stages.stream()
            .filter(s -> s.getStatus() == StageStatus.PROCESSING || s.getStatus() == StageStatus.FAILED)
            .reduce((first, second) -> second)
            .map(JobStage::getStageName)
            .orElse(null);
    }

    private JobStatusResponse.StageInfo toStageInfo(JobStage stage) {
        return JobStatusResponse.StageInfo.builder()
            .name(stage.getStageName())
            .status(stage.getStatus())
            .progress(stage.getProgress())
            .attempts(stage.getAttempts())
            .error(stage.getErrorKind() != null
                ? JobStatusResponse.ErrorInfo.builder()
                    .kind(stage.getErrorKind())
                    .message(stage.getErrorMessage())
                    .retryable(stage.isErrorRetryable())
                    .build()
                : null)
            .startedAt(stage.getStartedAt())
            .completedAt(stage.getCompletedAt())
            .build();
    }
}
