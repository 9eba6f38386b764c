package com.whereq.forge.config;

import com.whereq.forge.executor.RemoteStageExecutor;
import com.whereq.forge.executor.StageExecutorRegistry;
import com.whereq.forge.model.RetryPolicy;
import com.whereq.forge.worker.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Beans shared by the workers: time source, sleeper, retry policy and stage executors
 */
@Slf4j
@Configuration
public class WorkerBeansConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public RetryPolicy retryPolicy(ForgeProperties properties) {
        return properties.getRetry().toPolicy();
    }

    /**
     * One remote executor per configured endpoint ({@code forge.executors.endpoints.<key>})
     */
    @Bean
    public StageExecutorRegistry stageExecutorRegistry(ForgeProperties properties, WebClient generationWebClient) {
        ForgeProperties.ExecutorConfig config = properties.getExecutors();

        StageExecutorRegistry registry = new StageExecutorRegistry();
        config.getEndpoints().forEach((key, endpoint) ->
            registry.register(key, new RemoteStageExecutor(key, endpoint, generationWebClient, config.getDefaultTimeout())));

        if (registry.keys().isEmpty()) {
            log.warn("No stage executor endpoints configured; every job will fail with UNSUPPORTED_PIPELINE");
        } else {
            log.info("Stage executors: {}", registry.keys());
        }
        return registry;
    }
}
