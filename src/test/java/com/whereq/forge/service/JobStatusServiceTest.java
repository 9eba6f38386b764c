package com.whereq.forge.service;

import com.whereq.forge.entity.GenerationJob;
import com.whereq.forge.exception.JobNotFoundException;
import com.whereq.forge.model.ErrorKind;
import com.whereq.forge.model.ErrorRecord;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.model.QueuedJob;
import com.whereq.forge.model.StageDescriptor;
import com.whereq.forge.model.StageStatus;
import com.whereq.forge.status.JobStatusCache;
import com.whereq.forge.support.InMemoryJobStore;
import com.whereq.forge.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobStatusServiceTest {

    @Mock
    private JobStatusCache statusCache;

    private InMemoryJobStore store;
    private JobStatusService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore(new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));
        service = new JobStatusService(store, statusCache);
        lenient().when(statusCache.getStatus(anyString())).thenReturn(Mono.empty());
    }

    @Test
    void testUnknownJob() {
        StepVerifier.create(service.getStatus("job-missing"))
            .expectError(JobNotFoundException.class)
            .verify();
    }

    @Test
    void testProgressOverPlannedStages() {
        startJob("job-1");
        store.recordStageCount("job-1", 4);
        store.startStageAttempt("job-1", StageDescriptor.of("script_gen"), 0);
        store.completeStage("job-1", "script_gen", Map.of("script", "Open on a skyline"));
        store.startStageAttempt("job-1", StageDescriptor.of("voice_gen"), 1);
        store.updateStageProgress("job-1", "voice_gen", 60);
        when(statusCache.getStatus("job-1")).thenReturn(Mono.just("processing"));

        StepVerifier.create(service.getStatus("job-1"))
            .assertNext(response -> {
                assertThat(response.getStatus()).isEqualTo(JobStatus.PROCESSING);
                assertThat(response.getLiveStatus()).isEqualTo("processing");
                assertThat(response.getProgress().getPercentage()).isEqualTo(40);
                assertThat(response.getProgress().getCurrentStage()).isEqualTo("voice_gen");
                assertThat(response.getProgress().getStagesCompleted()).isEqualTo(1);
                assertThat(response.getProgress().getStagesTotal()).isEqualTo(4);
                assertThat(response.getStages()).extracting("name").containsExactly("script_gen", "voice_gen");
            })
            .verifyComplete();
    }

    @Test
    void testFailedJobCarriesError() {
        startJob("job-2");
        store.recordStageCount("job-2", 4);
        store.startStageAttempt("job-2", StageDescriptor.of("script_gen"), 0);
        ErrorRecord error = ErrorRecord.of(ErrorKind.CONTENT_REJECTED, null);
        store.failStage("job-2", "script_gen", error, true);
        store.failJob("job-2", "worker-1", error);

        StepVerifier.create(service.getStatus("job-2"))
            .assertNext(response -> {
                assertThat(response.getStatus()).isEqualTo(JobStatus.FAILED);
                assertThat(response.getLiveStatus()).isNull();
                assertThat(response.getError().getKind()).isEqualTo(ErrorKind.CONTENT_REJECTED);
                assertThat(response.getError().isRetryable()).isFalse();
                assertThat(response.getStages().get(0).getStatus()).isEqualTo(StageStatus.FAILED);
                assertThat(response.getStages().get(0).getError().getMessage())
                    .isEqualTo(ErrorKind.CONTENT_REJECTED.getUserMessage());
            })
            .verifyComplete();
    }

    @Test
    void testExhaustedRetriesAreReportedOnTheJobError() {
        startJob("job-4");
        store.recordStageCount("job-4", 4);
        store.startStageAttempt("job-4", StageDescriptor.of("script_gen"), 0);
        ErrorRecord error = ErrorRecord.of(ErrorKind.UPSTREAM_UNAVAILABLE, null).toBuilder()
            .attempts(3)
            .exhausted(true)
            .build();
        store.failStage("job-4", "script_gen", error, true);
        store.failJob("job-4", "worker-1", error);

        StepVerifier.create(service.getStatus("job-4"))
            .assertNext(response -> {
                assertThat(response.getError().getKind()).isEqualTo(ErrorKind.UPSTREAM_UNAVAILABLE);
                assertThat(response.getError().isRetryable()).isTrue();
                assertThat(response.getError().getAttempts()).isEqualTo(3);
                assertThat(response.getError().getExhausted()).isTrue();
                assertThat(response.getStages().get(0).getError().getAttempts()).isNull();
            })
            .verifyComplete();
    }

    @Test
    void testCacheOutageStillAnswersFromStore() {
        startJob("job-3");
        when(statusCache.getStatus("job-3")).thenReturn(Mono.error(new IllegalStateException("redis down")));

        StepVerifier.create(service.getStatus("job-3"))
            .assertNext(response -> assertThat(response.getLiveStatus()).isNull())
            .verifyComplete();
    }

    @Test
    void testCompletedJobIsFullProgress() {
        GenerationJob job = new GenerationJob();
        job.setStatus(JobStatus.COMPLETED);
        job.setStageCount(4);

        assertThat(JobStatusService.overallProgress(job, List.of())).isEqualTo(100);
    }

    private void startJob(String jobId) {
        store.claim(QueuedJob.builder().jobId(jobId).jobType("ad_creative").build(), "worker-1",
            Instant.parse("2026-01-01T00:02:00Z"));
    }
}
