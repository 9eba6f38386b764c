package com.whereq.forge.service;

import com.whereq.forge.model.JobStatus;
import com.whereq.forge.model.QueuedJob;
import com.whereq.forge.model.StatusEvent;
import com.whereq.forge.pipeline.PipelineRegistry;
import com.whereq.forge.queue.JobQueue;
import com.whereq.forge.status.JobStatusCache;
import com.whereq.forge.store.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Enqueue side of the worker contract: what a job-creating API does to hand work over
 */
@Slf4j
@Service
public class JobSubmissionService {

    private static final String REQUEUE_FAILED_REASON = "Queue push failed, waiting for the lease reaper";

    @Autowired
    private JobStore jobStore;

    @Autowired
    private JobQueue jobQueue;

    @Autowired
    private JobStatusCache statusCache;

    @Autowired
    private PipelineRegistry pipelineRegistry;

    @Autowired
    private Clock clock;

    /**
     * Submit a job for async execution
     *
     * @param jobId   caller-supplied id, or null to generate one
     * @param jobType pipeline selector, null for the default pipeline
     * @param input   generation parameters
     * @return Mono with the queued job
     */
    public Mono<QueuedJob> submit(String jobId, String jobType, Map<String, Object> input) {
        String id = jobId != null && !jobId.isBlank() ? jobId : generateJobId();
        String type = pipelineRegistry.normalize(jobType);
        Map<String, Object> params = input != null ? new LinkedHashMap<>(input) : new LinkedHashMap<>();

        return Mono.fromCallable(() -> jobStore.createPending(id, type, params))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(job -> statusCache.update(StatusEvent.builder()
                    .jobId(id)
                    .status(JobStatus.PENDING.wireName())
                    .progress(0)
                    .timestamp(clock.instant())
                    .build())
                .onErrorResume(e -> {
                    log.warn("Failed to cache pending status of job {}: {}", id, e.getMessage());
                    return Mono.empty();
                })
                .thenReturn(job))
            .map(job -> QueuedJob.builder()
                .jobId(id)
                .jobType(type)
                .input(params)
                .enqueuedAt(clock.instant())
                .requeueCount(0)
                .build())
            .flatMap(queued -> Mono.fromCallable(() -> jobQueue.enqueue(queued))
                .subscribeOn(Schedulers.boundedElastic())
                .thenReturn(queued)
                .onErrorResume(e -> handToReaper(queued, e)))
            .doOnSuccess(queued -> log.info("Job {} ({}) submitted", id, type))
            .doOnError(e -> log.error("Job submission failed for {}: {}", id, e.getMessage()));
    }

    /**
     * The row exists but the queue push failed: let the lease reaper queue the job
     */
    private Mono<QueuedJob> handToReaper(QueuedJob queued, Throwable error) {
        log.warn("Failed to queue job {}, handing it to the lease reaper: {}", queued.getJobId(), error.getMessage());
        return Mono.fromCallable(() -> jobStore.expirePending(queued.getJobId(), REQUEUE_FAILED_REASON))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(handed -> handed ? Mono.just(queued) : Mono.<QueuedJob>error(error));
    }

    private String generateJobId() {
        return "job-" + UUID.randomUUID();
    }
}
