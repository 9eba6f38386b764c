package com.whereq.forge.controller;

import com.whereq.forge.dto.JobStatusResponse;
import com.whereq.forge.exception.JobNotFoundException;
import com.whereq.forge.service.JobStatusService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Read-only job status endpoint
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@Tag(name = "Jobs", description = "Generation job status")
public class JobStatusController {

    @Autowired
    private JobStatusService jobStatusService;

    /**
     * Get job status
     *
     * @param jobId job identifier
     * @return Mono with job status, 404 when the job is unknown
     */
    @GetMapping("/{jobId}")
    @Operation(summary = "Job status", description = "Status, progress, stages and result of a generation job")
    public Mono<ResponseEntity<JobStatusResponse>> getJobStatus(@PathVariable String jobId) {
        log.debug("Job status request for {}", jobId);

        return jobStatusService.getStatus(jobId)
            .map(ResponseEntity::ok)
            .onErrorResume(JobNotFoundException.class, e -> {
                log.debug(e.getMessage());
                return Mono.just(ResponseEntity.notFound().build());
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Failed to read status of job {}", jobId, e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }
}
