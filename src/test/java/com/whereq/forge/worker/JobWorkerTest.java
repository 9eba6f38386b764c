package com.whereq.forge.worker;

import com.whereq.forge.entity.GenerationJob;
import com.whereq.forge.model.ErrorKind;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.model.QueuedJob;
import com.whereq.forge.model.StageStatus;
import com.whereq.forge.model.StatusEvent;
import com.whereq.forge.support.WorkerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Dequeue loop and shutdown handling.
 */
class JobWorkerTest {

    private WorkerFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new WorkerFixture();
    }

    @Test
    void testShutdownDuringBackoffRequeuesAndResumes() {
        JobWorker worker = fixture.newWorker("worker-1");
        fixture.queue.enqueue(job("job-d"));
        fixture.executor.failWith("voice_gen", new SocketTimeoutException("read timed out"));
        fixture.sleeper.onSleep(worker::requestShutdown);

        worker.run();

        GenerationJob job = fixture.store.job("job-d");
        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getLeaseOwner()).isNull();
        assertThat(job.getRequeueCount()).isEqualTo(1);
        assertThat(fixture.store.stage("job-d", "script_gen").getStatus()).isEqualTo(StageStatus.COMPLETED);
        assertThat(fixture.store.stage("job-d", "voice_gen").getAttempts()).isEqualTo(1);
        assertThat(fixture.store.terminalWrites()).isZero();

        assertThat(fixture.queue.snapshot()).singleElement()
            .satisfies(requeued -> {
                assertThat(requeued.getJobId()).isEqualTo("job-d");
                assertThat(requeued.getRequeueCount()).isEqualTo(1);
            });
        StatusEvent last = fixture.publisher.statusEvents().get(fixture.publisher.statusEvents().size() - 1);
        assertThat(last.getStatus()).isEqualTo("pending");
        assertThat(fixture.counter("forge.jobs.requeued")).isEqualTo(1.0);
        assertThat(worker.getState().isRunning()).isFalse();
        assertThat(Thread.currentThread().isInterrupted()).isFalse();

        // a fresh worker picks the job up and only runs what is left
        fixture.sleeper.onSleep(null);
        JobWorker next = fixture.newWorker("worker-2");
        next.process(fixture.queue.pop(Duration.ofMillis(10)).orElseThrow());

        assertThat(fixture.store.job("job-d").getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(fixture.executor.callsFor("script_gen")).isEqualTo(1);
        assertThat(fixture.executor.callsFor("voice_gen")).isEqualTo(2);
        assertThat(fixture.store.terminalWrites()).isEqualTo(1);
    }

    @Test
    void testShutdownRequeueFailureLeavesJobToTheReaper() {
        JobWorker worker = fixture.newWorker("worker-1");
        fixture.queue.enqueue(job("job-lost"));
        fixture.executor.failWith("voice_gen", new SocketTimeoutException("read timed out"));
        fixture.sleeper.onSleep(() -> {
            fixture.queue.failNextEnqueues(1);
            worker.requestShutdown();
        });

        worker.run();

        GenerationJob job = fixture.store.job("job-lost");
        assertThat(job.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(job.getLeaseOwner()).isNull();
        assertThat(job.getLeaseExpiresAt()).isEqualTo(fixture.clock.instant());
        assertThat(fixture.queue.size()).isZero();
        assertThat(fixture.publisher.statuses()).doesNotContain("pending");
        assertThat(fixture.counter("forge.jobs.requeued")).isZero();

        fixture.sleeper.onSleep(null);
        fixture.clock.advance(Duration.ofSeconds(30));
        WorkerPool workerPool = mock(WorkerPool.class);
        when(workerPool.getRequeuedCounter()).thenReturn(fixture.requeuedCounter);
        LeaseKeeper leaseKeeper = new LeaseKeeper(workerPool, fixture.store, fixture.queue, fixture.publisher,
            fixture.properties, fixture.clock);

        assertThat(leaseKeeper.requeueExpired()).isEqualTo(1);

        fixture.newWorker("worker-2").pollOnce();
        assertThat(fixture.store.job("job-lost").getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(fixture.store.terminalWrites()).isEqualTo(1);
    }

    @Test
    void testPushBackFailureAfterShutdownLeavesJobToTheReaper() {
        fixture.store.createPending("job-late", "ad_creative", Map.of("prompt", "city at night"));
        JobWorker worker = fixture.newWorker("worker-late");
        worker.requestShutdown();
        fixture.queue.failNextPushBacks(1);

        worker.process(job("job-late"));

        GenerationJob job = fixture.store.job("job-late");
        assertThat(job.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(job.getLeaseOwner()).isNull();
        assertThat(fixture.store.findExpiredLeases(fixture.clock.instant().plusSeconds(1)))
            .extracting(GenerationJob::getId)
            .containsExactly("job-late");
    }

    @Test
    void testShutdownWithoutJobStopsTheLoop() throws Exception {
        JobWorker worker = fixture.newWorker("worker-idle");
        Thread thread = new Thread(worker, "test-worker");
        thread.start();

        long deadline = System.currentTimeMillis() + 2000;
        while (!worker.getState().isRunning() && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        worker.requestShutdown();
        thread.join(TimeUnit.SECONDS.toMillis(5));

        assertThat(thread.isAlive()).isFalse();
        assertThat(worker.getState().isRunning()).isFalse();
        assertThat(fixture.queue.size()).isZero();
    }

    @Test
    void testJobPoppedAfterShutdownGoesBackToQueue() {
        JobWorker worker = fixture.newWorker("worker-late");
        worker.requestShutdown();

        worker.process(job("job-late"));

        assertThat(fixture.queue.snapshot()).extracting(QueuedJob::getJobId).containsExactly("job-late");
        assertThat(fixture.store.job("job-late")).isNull();
        assertThat(fixture.executor.calls()).isEmpty();
    }

    @Test
    void testEntryWithoutJobIdIsDropped() {
        JobWorker worker = fixture.newWorker("worker-1");

        worker.process(QueuedJob.builder().jobType("ad_creative").build());

        assertThat(fixture.executor.calls()).isEmpty();
        assertThat(fixture.queue.size()).isZero();
        assertThat(worker.getState().getCurrentJob()).isEmpty();
    }

    @Test
    void testBrokerErrorDoesNotStopTheLoop() {
        JobWorker worker = fixture.newWorker("worker-1");
        fixture.queue.failNextPops(1);
        fixture.queue.enqueue(job("job-after-error"));

        worker.pollOnce();
        worker.pollOnce();

        assertThat(fixture.sleeper.sleeps()).containsExactly(fixture.properties.getWorker().getErrorBackoff());
        assertThat(fixture.store.job("job-after-error").getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void testFailedJobDoesNotStopTheLoop() {
        JobWorker worker = fixture.newWorker("worker-1");
        fixture.queue.enqueue(QueuedJob.builder().jobId("job-bad").jobType("hologram").build());
        fixture.queue.enqueue(job("job-good"));

        worker.pollOnce();
        worker.pollOnce();

        assertThat(fixture.store.job("job-bad").getErrorKind()).isEqualTo(ErrorKind.INVALID_INPUT);
        assertThat(fixture.store.job("job-good").getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void testCurrentJobIsClearedAfterProcessing() {
        JobWorker worker = fixture.newWorker("worker-1");
        fixture.executor.during("video_gen",
            context -> assertThat(worker.getState().getCurrentJobId()).isEqualTo("job-current"));

        worker.process(job("job-current"));

        assertThat(worker.getState().getCurrentJob()).isEmpty();
        assertThat(fixture.store.job("job-current").getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void testHealthIsCheckedOnlyWhenDue() {
        JobWorker worker = fixture.newWorker("worker-1");

        worker.pollOnce();
        Instant firstCheck = worker.getState().getLastHealthCheck();
        fixture.clock.advance(Duration.ofSeconds(10));
        worker.pollOnce();

        assertThat(firstCheck).isNotNull();
        assertThat(worker.getState().getLastHealthCheck()).isEqualTo(firstCheck);

        fixture.clock.advance(Duration.ofSeconds(25));
        worker.pollOnce();
        assertThat(worker.getState().getLastHealthCheck()).isAfter(firstCheck);
    }

    private static QueuedJob job(String jobId) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("prompt", "a lighthouse in a storm");
        return QueuedJob.builder().jobId(jobId).jobType("ad_creative").input(input).build();
    }
}
