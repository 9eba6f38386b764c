package com.whereq.forge.worker;

import com.whereq.forge.config.ForgeProperties;
import com.whereq.forge.model.WorkerHealth;
import com.whereq.forge.queue.JobQueue;
import com.whereq.forge.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Broker and store connectivity checks for workers
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkerHealthChecker {

    private final JobQueue jobQueue;
    private final JobStore jobStore;
    private final ForgeProperties properties;
    private final Clock clock;

    /**
     * Run {@link #check} when the configured interval has passed since the last one.
     * Called between pops, so it never delays a job.
     */
    public void checkIfDue(WorkerState state) {
        Instant last = state.getLastHealthCheck();
        Duration interval = properties.getWorker().getHealthCheckInterval();
        if (last == null || !clock.instant().isBefore(last.plus(interval))) {
            check(state);
        }
    }

    /**
     * Ping broker and store and log the result
     *
     * @param state worker to report on
     * @return health snapshot
     */
    public WorkerHealth check(WorkerState state) {
        boolean brokerHealthy = jobQueue.ping();
        boolean storeHealthy = jobStore.ping();
        Instant now = clock.instant();
        state.setLastHealthCheck(now);

        WorkerHealth health = WorkerHealth.builder()
            .workerId(state.getWorkerId())
            .running(state.isRunning())
            .currentJob(state.getCurrentJobId())
            .brokerHealthy(brokerHealthy)
            .storeHealthy(storeHealthy)
            .healthy(brokerHealthy && storeHealthy && state.isRunning())
            .timestamp(now)
            .build();

        if (health.isHealthy()) {
            log.debug("Worker {} healthy", state.getWorkerId());
        } else {
            log.warn("Worker {} unhealthy: running={}, broker={}, store={}",
                state.getWorkerId(), state.isRunning(), brokerHealthy, storeHealthy);
        }
        return health;
    }
}
