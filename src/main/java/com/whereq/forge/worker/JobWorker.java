package com.whereq.forge.worker;

import com.whereq.forge.config.ForgeProperties;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.model.QueuedJob;
import com.whereq.forge.model.StatusEvent;
import com.whereq.forge.progress.ProgressPublisher;
import com.whereq.forge.queue.JobQueue;
import com.whereq.forge.store.JobStore;
import io.micrometer.core.instrument.Counter;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.Optional;

/**
 * One worker: a single-threaded loop that pops a job, runs it to the end, and pops again.
 * <p>
 * The loop survives broker and store errors; it only leaves when shutdown is requested.
 * On shutdown a job in progress goes back to PENDING and onto the queue, so no job stays
 * stuck in PROCESSING.
 */
@Slf4j
public class JobWorker implements Runnable {

    static final String MDC_WORKER_ID = "workerId";
    static final String MDC_JOB_ID = "jobId";

    static final String SHUTDOWN_REASON = "Worker shutdown";
    static final String REQUEUE_FAILED_REASON = "Requeue failed, waiting for the lease reaper";

    @Getter
    private final WorkerState state;

    private final JobQueue jobQueue;
    private final JobStore jobStore;
    private final StageRunner stageRunner;
    private final ProgressPublisher publisher;
    private final WorkerHealthChecker healthChecker;
    private final ForgeProperties.WorkerConfig config;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Counter requeuedCounter;

    private volatile Thread thread;

    public JobWorker(WorkerState state,
                     JobQueue jobQueue,
                     JobStore jobStore,
                     StageRunner stageRunner,
                     ProgressPublisher publisher,
                     WorkerHealthChecker healthChecker,
                     ForgeProperties.WorkerConfig config,
                     Sleeper sleeper,
                     Clock clock,
                     Counter requeuedCounter) {
        this.state = state;
        this.jobQueue = jobQueue;
        this.jobStore = jobStore;
        this.stageRunner = stageRunner;
        this.publisher = publisher;
        this.healthChecker = healthChecker;
        this.config = config;
        this.sleeper = sleeper;
        this.clock = clock;
        this.requeuedCounter = requeuedCounter;
    }

    @Override
    public void run() {
        thread = Thread.currentThread();
        state.setRunning(true);
        MDC.put(MDC_WORKER_ID, state.getWorkerId());
        log.info("Worker {} started", state.getWorkerId());

        try {
            while (!state.isShutdownRequested()) {
                pollOnce();
            }
        } finally {
            state.setRunning(false);
            log.info("Worker {} stopped", state.getWorkerId());
            MDC.clear();
        }
    }

    /**
     * One loop iteration: health check when due, blocking pop, process
     */
    void pollOnce() {
        try {
            healthChecker.checkIfDue(state);

            Optional<QueuedJob> popped = jobQueue.pop(config.getPopTimeout());
            if (popped.isPresent()) {
                process(popped.get());
            }
        } catch (Exception e) {
            if (state.isShutdownRequested()) {
                log.debug("Worker {} loop interrupted by shutdown: {}", state.getWorkerId(), e.getMessage());
                return;
            }
            log.error("Worker {} loop error, continuing: {}", state.getWorkerId(), e.getMessage(), e);
            backoff();
        }
    }

    void process(QueuedJob job) {
        if (job.getJobId() == null || job.getJobId().isBlank()) {
            log.error("Dropping queue entry without job id: {}", job);
            return;
        }

        if (!state.beginJob(job)) {
            log.info("Shutdown requested, returning job {} to the queue", job.getJobId());
            try {
                jobQueue.pushBack(job);
            } catch (Exception e) {
                log.error("Failed to return job {} to the queue, handing it to the lease reaper", job.getJobId(), e);
                expireForReaper(job.getJobId());
            }
            return;
        }

        MDC.put(MDC_JOB_ID, job.getJobId());
        try {
            JobOutcome outcome = stageRunner.run(job, state);
            log.info("Job {} finished on worker {}: {}", job.getJobId(), state.getWorkerId(), outcome);
        } finally {
            state.finishJob();
            MDC.remove(MDC_JOB_ID);
            // clear an interrupt left by the shutdown handler
            Thread.interrupted();
        }
    }

    /**
     * Stop taking jobs. A job in progress is released to PENDING and pushed back on the
     * queue with its requeue count raised; the loop then stops writing for it.
     * Safe to call from any thread, more than once.
     */
    public void requestShutdown() {
        Optional<QueuedJob> current = state.requestShutdown();
        if (current.isEmpty()) {
            log.info("Worker {} shutting down, no job in progress", state.getWorkerId());
            return;
        }

        QueuedJob job = current.get();
        try {
            requeue(job);
        } finally {
            Thread worker = thread;
            if (worker != null) {
                worker.interrupt();
            }
        }
    }

    private void requeue(QueuedJob job) {
        try {
            if (!jobStore.releaseToPending(job.getJobId(), state.getWorkerId(), SHUTDOWN_REASON)) {
                log.info("Worker {} shutting down, job {} already left PROCESSING", state.getWorkerId(), job.getJobId());
                return;
            }
        } catch (Exception e) {
            log.error("Failed to release job {} on shutdown of worker {}; it stays PROCESSING until its lease expires",
                job.getJobId(), state.getWorkerId(), e);
            return;
        }

        try {
            jobQueue.enqueue(job.toBuilder()
                .requeueCount(job.getRequeueCount() + 1)
                .enqueuedAt(clock.instant())
                .build());
        } catch (Exception e) {
            log.error("Failed to push job {} back on the queue, handing it to the lease reaper", job.getJobId(), e);
            expireForReaper(job.getJobId());
            return;
        }

        requeuedCounter.increment();
        publisher.publishStatus(StatusEvent.builder()
            .jobId(job.getJobId())
            .status(JobStatus.PENDING.wireName())
            .workerId(state.getWorkerId())
            .errorMessage(SHUTDOWN_REASON)
            .timestamp(clock.instant())
            .build());
        log.warn("Worker {} shutting down, job {} returned to the queue", state.getWorkerId(), job.getJobId());
    }

    private void expireForReaper(String jobId) {
        try {
            if (!jobStore.expirePending(jobId, REQUEUE_FAILED_REASON)) {
                log.warn("Job {} left PENDING before it could be handed to the lease reaper", jobId);
            }
        } catch (Exception e) {
            log.error("Job {} is PENDING without a queue entry and could not be handed to the lease reaper", jobId, e);
        }
    }

    private void backoff() {
        try {
            sleeper.sleep(config.getErrorBackoff());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
