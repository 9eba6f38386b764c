package com.whereq.forge.worker;

import com.whereq.forge.config.ForgeProperties;
import com.whereq.forge.entity.JobStage;
import com.whereq.forge.exception.ErrorClassifier;
import com.whereq.forge.executor.StageContext;
import com.whereq.forge.executor.StageExecutor;
import com.whereq.forge.executor.StageExecutorRegistry;
import com.whereq.forge.executor.StageResult;
import com.whereq.forge.model.ErrorKind;
import com.whereq.forge.model.ErrorRecord;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.model.ProgressEvent;
import com.whereq.forge.model.QueuedJob;
import com.whereq.forge.model.RetryPolicy;
import com.whereq.forge.model.StageDescriptor;
import com.whereq.forge.model.StageStatus;
import com.whereq.forge.model.StatusEvent;
import com.whereq.forge.pipeline.PipelineDefinition;
import com.whereq.forge.pipeline.PipelineRegistry;
import com.whereq.forge.progress.ProgressPublisher;
import com.whereq.forge.store.ClaimOutcome;
import com.whereq.forge.store.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives one job through its planned stages.
 * <p>
 * Stages run strictly in order. Completed stages of a resumed job are skipped and their
 * data is fed forward. A failed attempt is classified: retryable failures back off and
 * retry until the policy is exhausted, anything else fails the job at once. Terminal job
 * writes are conditional on this worker still holding the job, so they happen exactly once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StageRunner {

    static final String OUTPUT_REF_KEY = "outputRef";

    private final JobStore jobStore;
    private final ProgressPublisher publisher;
    private final PipelineRegistry pipelineRegistry;
    private final StageExecutorRegistry executorRegistry;
    private final ErrorClassifier errorClassifier;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ForgeProperties properties;
    private final MeterRegistry meterRegistry;

    private Counter completedCounter;
    private Counter failedCounter;
    private Counter retriedCounter;

    @PostConstruct
    public void initialize() {
        completedCounter = Counter.builder("forge.jobs.completed")
            .description("Number of jobs completed")
            .register(meterRegistry);

        failedCounter = Counter.builder("forge.jobs.failed")
            .description("Number of jobs failed")
            .register(meterRegistry);

        retriedCounter = Counter.builder("forge.stages.retried")
            .description("Number of stage attempts retried after a transient failure")
            .register(meterRegistry);
    }

    /**
     * Process a dequeued job on the calling thread
     *
     * @param queued the job as popped from the queue
     * @param state  state of the calling worker
     * @return how processing ended
     */
    public JobOutcome run(QueuedJob queued, WorkerState state) {
        QueuedJob job = queued.toBuilder().jobType(pipelineRegistry.normalize(queued.getJobType())).build();
        String jobId = job.getJobId();
        String workerId = state.getWorkerId();

        ClaimOutcome claim = jobStore.claim(job, workerId, clock.instant().plus(properties.getLease().getDuration()));
        if (claim == ClaimOutcome.ALREADY_TERMINAL) {
            log.info("Job {} already finished, skipping duplicate queue entry", jobId);
            return JobOutcome.SKIPPED;
        }
        if (claim == ClaimOutcome.HELD_ELSEWHERE) {
            log.warn("Job {} is held by another worker, skipping", jobId);
            return JobOutcome.SKIPPED;
        }

        log.info("Worker {} claimed job {} ({})", workerId, jobId, job.getJobType());
        publisher.publishStatus(statusEvent(jobId, JobStatus.PROCESSING.wireName(), workerId).build());

        Optional<PipelineDefinition> pipeline = pipelineRegistry.find(job.getJobType());
        if (pipeline.isEmpty()) {
            return failJob(jobId, state, null,
                ErrorRecord.of(ErrorKind.INVALID_INPUT, "Unknown job type: " + job.getJobType()), 0);
        }

        List<StageDescriptor> stages;
        try {
            stages = pipeline.get().plan(job.getInput());
        } catch (IllegalArgumentException e) {
            log.warn("Job {} has invalid input: {}", jobId, e.getMessage());
            return failJob(jobId, state, null, ErrorRecord.of(ErrorKind.INVALID_INPUT, e.getMessage()), 0);
        }

        jobStore.recordStageCount(jobId, stages.size());
        ProgressTracker tracker = new ProgressTracker(stages);
        Map<String, Map<String, Object>> stageData = new LinkedHashMap<>();
        Set<String> completed = new HashSet<>();
        String outputRef = null;

        for (JobStage existing : jobStore.findStages(jobId)) {
            tracker.update(existing.getStageName(), existing.getProgress());
            if (existing.getStatus() == StageStatus.COMPLETED) {
                completed.add(existing.getStageName());
                stageData.put(existing.getStageName(), existing.getStageData());
            }
        }
        if (!completed.isEmpty()) {
            log.info("Resuming job {}: {} of {} stages already completed", jobId, completed.size(), stages.size());
        }

        for (int index = 0; index < stages.size(); index++) {
            StageDescriptor stage = stages.get(index);
            if (completed.contains(stage.getName())) {
                outputRef = outputRefOf(stageData.get(stage.getName()), outputRef);
                continue;
            }

            StageRun run = runStage(job, stage, index, state, tracker, stageData);
            if (run.outcome() != null) {
                return run.outcome();
            }
            stageData.put(stage.getName(), run.data());
            outputRef = outputRefOf(run.data(), outputRef);
        }

        return completeJob(jobId, state, stages, tracker, outputRef);
    }

    private StageRun runStage(QueuedJob job, StageDescriptor stage, int index, WorkerState state,
                              ProgressTracker tracker, Map<String, Map<String, Object>> stageData) {
        String jobId = job.getJobId();
        String workerId = state.getWorkerId();

        Optional<StageExecutor> executor = executorRegistry.find(stage.getExecutor());
        if (executor.isEmpty()) {
            ErrorRecord error = ErrorRecord.of(ErrorKind.UNSUPPORTED_PIPELINE,
                "No executor available for stage " + stage.getName()).toBuilder().attempts(1).build();
            log.error("Job {} stage {}: no executor registered for {}", jobId, stage.getName(), stage.getExecutor());
            jobStore.startStageAttempt(jobId, stage, index);
            jobStore.failStage(jobId, stage.getName(), error, true);
            publishProgress(jobId, stage.getName(), tracker, StageStatus.FAILED.wireName(), workerId);
            return StageRun.ended(failJob(jobId, state, stage.getName(), error, tracker.overall()));
        }

        Timer timer = Timer.builder("forge.stages.execution.time")
            .description("Stage attempt execution time")
            .tag("executor", stage.getExecutor())
            .register(meterRegistry);

        for (int attempt = 1; ; attempt++) {
            if (state.isAbandoned()) {
                return StageRun.ended(JobOutcome.ABANDONED);
            }

            jobStore.startStageAttempt(jobId, stage, index);
            publishProgress(jobId, stage.getName(), tracker, StageStatus.PROCESSING.wireName(), workerId);
            log.info("Job {} stage {} attempt {}/{} started", jobId, stage.getName(), attempt, retryPolicy.getMaxAttempts());

            StageContext context = StageContext.builder()
                .jobId(jobId)
                .jobType(job.getJobType())
                .stageName(stage.getName())
                .stageIndex(index)
                .attempt(attempt)
                .input(job.getInput())
                .params(stage.getParams())
                .priorStageData(Collections.unmodifiableMap(new LinkedHashMap<>(stageData)))
                .progressReporter(percent -> reportProgress(jobId, stage.getName(), percent, tracker, state))
                .build();

            StageResult result;
            try {
                result = timer.recordCallable(() -> executor.get().execute(context));
            } catch (Exception e) {
                if (state.isAbandoned()) {
                    return StageRun.ended(JobOutcome.ABANDONED);
                }

                ErrorRecord error = errorClassifier.classify(e).toBuilder().attempts(attempt).build();
                if (error.isRetryable() && retryPolicy.hasAttemptsRemaining(attempt)) {
                    Duration delay = retryPolicy.backoffAfter(attempt);
                    log.warn("Job {} stage {} attempt {}/{} failed ({}), retrying in {}ms: {}",
                        jobId, stage.getName(), attempt, retryPolicy.getMaxAttempts(),
                        error.getKind(), delay.toMillis(), e.getMessage());

                    jobStore.failStage(jobId, stage.getName(), error, false);
                    publishProgress(jobId, stage.getName(), tracker, StatusEvent.RETRYING, workerId);
                    publisher.publishStatus(statusEvent(jobId, StatusEvent.RETRYING, workerId)
                        .stage(stage.getName())
                        .attempt(attempt)
                        .maxAttempts(retryPolicy.getMaxAttempts())
                        .retryDelayMs(delay.toMillis())
                        .errorKind(error.getKind())
                        .errorMessage(error.getMessage())
                        .progress(tracker.overall())
                        .build());
                    retriedCounter.increment();

                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException ie) {
                        if (state.isAbandoned()) {
                            return StageRun.ended(JobOutcome.ABANDONED);
                        }
                        // only the shutdown handler interrupts workers, and it abandons first
                        log.warn("Backoff of job {} interrupted, retrying now", jobId);
                    }
                    continue;
                }

                ErrorRecord finalError = error.isRetryable() ? error.toBuilder().exhausted(true).build() : error;
                if (finalError.isExhausted()) {
                    log.error("Job {} stage {} failed after {} attempts ({}): {}",
                        jobId, stage.getName(), attempt, error.getKind(), e.getMessage(), e);
                } else {
                    log.error("Job {} stage {} failed with fatal error ({}): {}",
                        jobId, stage.getName(), error.getKind(), e.getMessage(), e);
                }

                jobStore.failStage(jobId, stage.getName(), finalError, true);
                publishProgress(jobId, stage.getName(), tracker, StageStatus.FAILED.wireName(), workerId);
                return StageRun.ended(failJob(jobId, state, stage.getName(), finalError, tracker.overall()));
            }

            if (state.isAbandoned()) {
                return StageRun.ended(JobOutcome.ABANDONED);
            }

            Map<String, Object> data = new LinkedHashMap<>();
            if (result != null && result.getData() != null) {
                data.putAll(result.getData());
            }
            if (result != null && result.getOutputRef() != null) {
                data.putIfAbsent(OUTPUT_REF_KEY, result.getOutputRef());
            }

            jobStore.completeStage(jobId, stage.getName(), data);
            tracker.update(stage.getName(), 100);
            publishProgress(jobId, stage.getName(), tracker, StageStatus.COMPLETED.wireName(), workerId);
            log.info("Job {} stage {} completed on attempt {}", jobId, stage.getName(), attempt);
            return StageRun.succeeded(data);
        }
    }

    private void reportProgress(String jobId, String stage, int percent, ProgressTracker tracker, WorkerState state) {
        if (state.isAbandoned() || !tracker.update(stage, percent)) {
            return;
        }
        try {
            jobStore.updateStageProgress(jobId, stage, tracker.stageProgress(stage));
            publishProgress(jobId, stage, tracker, StageStatus.PROCESSING.wireName(), state.getWorkerId());
        } catch (Exception e) {
            log.warn("Failed to record progress {}% of job {} stage {}: {}", percent, jobId, stage, e.getMessage());
        }
    }

    private JobOutcome completeJob(String jobId, WorkerState state, List<StageDescriptor> stages,
                                   ProgressTracker tracker, String outputRef) {
        if (state.isAbandoned()) {
            return JobOutcome.ABANDONED;
        }
        if (!jobStore.completeJob(jobId, state.getWorkerId(), outputRef)) {
            log.warn("Job {} is no longer held by worker {}, completion not recorded", jobId, state.getWorkerId());
            return JobOutcome.LOST;
        }

        completedCounter.increment();
        log.info("Job {} completed, output: {}", jobId, outputRef);

        String lastStage = stages.isEmpty() ? null : stages.get(stages.size() - 1).getName();
        publisher.publishProgress(ProgressEvent.builder()
            .jobId(jobId)
            .stage(lastStage)
            .progress(100)
            .stageProgress(100)
            .status(JobStatus.COMPLETED.wireName())
            .workerId(state.getWorkerId())
            .timestamp(clock.instant())
            .build());
        publisher.publishStatus(statusEvent(jobId, JobStatus.COMPLETED.wireName(), state.getWorkerId())
            .outputRef(outputRef)
            .progress(100)
            .build());
        return JobOutcome.COMPLETED;
    }

    private JobOutcome failJob(String jobId, WorkerState state, String stage, ErrorRecord error, int progress) {
        if (state.isAbandoned()) {
            return JobOutcome.ABANDONED;
        }
        if (!jobStore.failJob(jobId, state.getWorkerId(), error)) {
            log.warn("Job {} is no longer held by worker {}, failure not recorded", jobId, state.getWorkerId());
            return JobOutcome.LOST;
        }

        failedCounter.increment();
        log.warn("Job {} failed ({}): {}", jobId, error.getKind(), error.getMessage());

        publisher.publishStatus(statusEvent(jobId, JobStatus.FAILED.wireName(), state.getWorkerId())
            .stage(stage)
            .attempt(error.getAttempts() > 0 ? error.getAttempts() : null)
            .maxAttempts(error.getAttempts() > 0 ? retryPolicy.getMaxAttempts() : null)
            .errorKind(error.getKind())
            .errorMessage(error.getMessage())
            .progress(progress)
            .build());
        return JobOutcome.FAILED;
    }

    private void publishProgress(String jobId, String stage, ProgressTracker tracker, String status, String workerId) {
        int overall = tracker.overall();
        try {
            jobStore.updateJobProgress(jobId, overall);
        } catch (Exception e) {
            log.warn("Failed to persist progress of job {}: {}", jobId, e.getMessage());
        }

        publisher.publishProgress(ProgressEvent.builder()
            .jobId(jobId)
            .stage(stage)
            .progress(overall)
            .stageProgress(tracker.stageProgress(stage))
            .status(status)
            .workerId(workerId)
            .timestamp(clock.instant())
            .build());
    }

    private StatusEvent.StatusEventBuilder statusEvent(String jobId, String status, String workerId) {
        return StatusEvent.builder()
            .jobId(jobId)
            .status(status)
            .workerId(workerId)
            .timestamp(clock.instant());
    }

    private static String outputRefOf(Map<String, Object> data, String current) {
        if (data == null) {
            return current;
        }
        Object ref = data.get(OUTPUT_REF_KEY);
        return ref != null ? ref.toString() : current;
    }

    /**
     * Either the data of a completed stage, or the outcome that ended the job
     */
    private record StageRun(Map<String, Object> data, JobOutcome outcome) {

        static StageRun succeeded(Map<String, Object> data) {
            return new StageRun(data, null);
        }

        static StageRun ended(JobOutcome outcome) {
            return new StageRun(null, outcome);
        }
    }
}
