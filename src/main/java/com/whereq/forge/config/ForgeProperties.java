package com.whereq.forge.config;

import com.whereq.forge.model.RetryPolicy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for WhereQ Forge.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "forge")
@Validated
@Data
public class ForgeProperties {

    private WorkerConfig worker = new WorkerConfig();

    private RetryConfig retry = new RetryConfig();

    private QueueConfig queue = new QueueConfig();

    private LeaseConfig lease = new LeaseConfig();

    private ExecutorConfig executors = new ExecutorConfig();

    @Data
    public static class WorkerConfig {
        /**
         * Start the dequeue loops with the application.
         * Disable to run a process that only serves status queries.
         */
        private boolean enabled = true;

        /**
         * Worker identifier. Overridden by the first non-option program argument.
         * When neither is set a random identifier is generated.
         */
        private String id;

        /**
         * Number of independent workers run by this process.
         * Each worker owns one job at a time.
         */
        @Min(1)
        private int count = 1;

        /**
         * Blocking pop timeout. Bounds shutdown latency when idle.
         */
        private Duration popTimeout = Duration.ofSeconds(1);

        /**
         * Interval between broker/store connectivity checks.
         */
        private Duration healthCheckInterval = Duration.ofSeconds(30);

        /**
         * How long shutdown waits for worker threads to leave their loop.
         */
        private Duration shutdownGracePeriod = Duration.ofSeconds(30);

        /**
         * Pause after an unexpected error in the dequeue loop.
         */
        private Duration errorBackoff = Duration.ofSeconds(1);
    }

    @Data
    public static class RetryConfig {
        /**
         * Total attempts per stage, including the first one.
         */
        @Min(1)
        private int maxAttempts = 3;

        private long initialIntervalMs = 2000;

        @Min(1)
        private int backoffMultiplier = 2;

        private long maxIntervalMs = 60000;

        public RetryPolicy toPolicy() {
            return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .initialIntervalMs(initialIntervalMs)
                .backoffMultiplier(backoffMultiplier)
                .maxIntervalMs(maxIntervalMs)
                .build();
        }
    }

    @Data
    public static class QueueConfig {
        @NotBlank
        private String name = "video_generation_queue";

        @NotBlank
        private String statusChannel = "job_status_updates";

        @NotBlank
        private String progressChannel = "job_progress_updates";

        private String statusKeyPrefix = "job:";

        /**
         * Time to live of the per-job status hash.
         */
        private Duration statusTtl = Duration.ofHours(24);
    }

    @Data
    public static class LeaseConfig {
        /**
         * Enable lease heartbeat and expired-lease reaping.
         * Without it a hard-killed worker leaves its job PROCESSING forever.
         */
        private boolean enabled = true;

        private Duration duration = Duration.ofMinutes(2);

        private long heartbeatIntervalMs = 20000;

        private long reaperIntervalMs = 30000;
    }

    @Data
    public static class ExecutorConfig {
        /**
         * Upper bound for one remote stage call.
         */
        private Duration defaultTimeout = Duration.ofMinutes(10);

        private Duration connectTimeout = Duration.ofSeconds(10);

        /**
         * Generation service endpoint per executor key (script_gen, voice_gen, ...).
         */
        private Map<String, String> endpoints = new LinkedHashMap<>();
    }
}
