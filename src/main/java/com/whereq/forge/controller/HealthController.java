package com.whereq.forge.controller;

import com.whereq.forge.model.WorkerHealth;
import com.whereq.forge.worker.JobWorker;
import com.whereq.forge.worker.WorkerHealthChecker;
import com.whereq.forge.worker.WorkerPool;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check controller reporting every worker of this process.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    @Autowired
    private WorkerPool workerPool;

    @Autowired
    private WorkerHealthChecker healthChecker;

    @GetMapping
    @Operation(summary = "Health check", description = "Check that workers run and reach the broker and the job store")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(() -> workerPool.getWorkers().stream()
                .map(JobWorker::getState)
                .map(healthChecker::check)
                .toList())
            .subscribeOn(Schedulers.boundedElastic())
            .map(workers -> {
                boolean healthy = workers.stream().allMatch(WorkerHealth::isHealthy);

                Map<String, Object> health = new LinkedHashMap<>();
                health.put("status", healthy ? "UP" : "DEGRADED");
                health.put("service", "whereq-forge");
                health.put("workers", workers);

                return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
            })
            .onErrorResume(e -> {
                Map<String, Object> health = new LinkedHashMap<>();
                health.put("status", "DOWN");
                health.put("service", "whereq-forge");
                health.put("error", e.getMessage());
                return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(health));
            });
    }
}
