package com.whereq.forge.controller;

import com.whereq.forge.dto.JobStatusResponse;
import com.whereq.forge.exception.JobNotFoundException;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.service.JobStatusService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobStatusControllerTest {

    @Mock
    private JobStatusService jobStatusService;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        JobStatusController controller = new JobStatusController();
        ReflectionTestUtils.setField(controller, "jobStatusService", jobStatusService);
        client = WebTestClient.bindToController(controller).build();
    }

    @Test
    void testKnownJob() {
        when(jobStatusService.getStatus("job-1")).thenReturn(Mono.just(JobStatusResponse.builder()
            .jobId("job-1")
            .jobType("ad_creative")
            .status(JobStatus.COMPLETED)
            .outputRef("s3://bucket/final.mp4")
            .build()));

        client.get().uri("/api/v1/jobs/job-1")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.jobId").isEqualTo("job-1")
            .jsonPath("$.outputRef").isEqualTo("s3://bucket/final.mp4");
    }

    @Test
    void testUnknownJob() {
        when(jobStatusService.getStatus("job-404")).thenReturn(Mono.error(new JobNotFoundException("job-404")));

        client.get().uri("/api/v1/jobs/job-404")
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    void testStoreFailure() {
        when(jobStatusService.getStatus("job-500")).thenReturn(Mono.error(new IllegalStateException("db down")));

        client.get().uri("/api/v1/jobs/job-500")
            .exchange()
            .expectStatus().is5xxServerError();
    }
}
