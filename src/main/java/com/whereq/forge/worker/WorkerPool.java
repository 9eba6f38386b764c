package com.whereq.forge.worker;

import com.whereq.forge.config.ForgeProperties;
import com.whereq.forge.progress.ProgressPublisher;
import com.whereq.forge.queue.JobQueue;
import com.whereq.forge.store.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Runs {@code forge.worker.count} independent workers, each on its own thread.
 * <p>
 * Started with the application context and stopped first when it closes, which is what
 * SIGTERM and SIGINT trigger through the JVM shutdown hook.
 */
@Slf4j
@Component
public class WorkerPool implements SmartLifecycle {

    private final JobQueue jobQueue;
    private final JobStore jobStore;
    private final StageRunner stageRunner;
    private final ProgressPublisher publisher;
    private final WorkerHealthChecker healthChecker;
    private final ForgeProperties properties;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Counter requeuedCounter;
    private final String baseWorkerId;

    private final List<JobWorker> workers = new ArrayList<>();
    private final List<Thread> threads = new ArrayList<>();
    private volatile boolean running;

    public WorkerPool(JobQueue jobQueue,
                      JobStore jobStore,
                      StageRunner stageRunner,
                      ProgressPublisher publisher,
                      WorkerHealthChecker healthChecker,
                      ForgeProperties properties,
                      Sleeper sleeper,
                      Clock clock,
                      MeterRegistry meterRegistry,
                      ApplicationArguments arguments) {
        this.jobQueue = jobQueue;
        this.jobStore = jobStore;
        this.stageRunner = stageRunner;
        this.publisher = publisher;
        this.healthChecker = healthChecker;
        this.properties = properties;
        this.sleeper = sleeper;
        this.clock = clock;
        this.requeuedCounter = Counter.builder("forge.jobs.requeued")
            .description("Number of jobs returned to the queue by shutdown or lease expiry")
            .register(meterRegistry);
        this.baseWorkerId = resolveWorkerId(arguments, properties.getWorker().getId());
    }

    /**
     * First non-option program argument, then {@code forge.worker.id}, then a random id
     */
    static String resolveWorkerId(ApplicationArguments arguments, String configured) {
        if (arguments != null && !arguments.getNonOptionArgs().isEmpty()) {
            String fromArgs = arguments.getNonOptionArgs().get(0);
            if (fromArgs != null && !fromArgs.isBlank()) {
                return fromArgs.trim();
            }
        }
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        return "worker-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }

        int count = properties.getWorker().getCount();
        for (int n = 1; n <= count; n++) {
            String workerId = count == 1 ? baseWorkerId : baseWorkerId + "-" + n;
            JobWorker worker = new JobWorker(new WorkerState(workerId), jobQueue, jobStore, stageRunner,
                publisher, healthChecker, properties.getWorker(), sleeper, clock, requeuedCounter);
            Thread thread = new Thread(worker, "forge-" + workerId);
            workers.add(worker);
            threads.add(thread);
            thread.start();
        }

        running = true;
        log.info("Started {} worker(s) on queue {}", count, properties.getQueue().getName());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }

        log.info("Shutdown signal received, stopping {} worker(s)", workers.size());
        workers.forEach(JobWorker::requestShutdown);

        long deadline = System.nanoTime() + properties.getWorker().getShutdownGracePeriod().toNanos();
        for (Thread thread : threads) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            try {
                thread.join(Duration.ofNanos(remaining).toMillis() + 1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        threads.stream()
            .filter(Thread::isAlive)
            .forEach(thread -> log.warn("Worker thread {} still running after the grace period", thread.getName()));

        workers.clear();
        threads.clear();
        running = false;
        log.info("All workers stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getWorker().isEnabled();
    }

    /**
     * Stop before anything the workers depend on (connection factories, data source)
     */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    public synchronized List<JobWorker> getWorkers() {
        return Collections.unmodifiableList(new ArrayList<>(workers));
    }

    Counter getRequeuedCounter() {
        return requeuedCounter;
    }
}
