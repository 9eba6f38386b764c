package com.whereq.forge.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.forge.config.ForgeProperties;
import com.whereq.forge.model.ProgressEvent;
import com.whereq.forge.model.StatusEvent;
import com.whereq.forge.status.JobStatusCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Publishes progress and status events on Redis pub/sub channels.
 * Status events are also mirrored into the job status cache.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedisProgressPublisher implements ProgressPublisher {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final JobStatusCache statusCache;
    private final ForgeProperties properties;

    @Override
    public void publishProgress(ProgressEvent event) {
        send(properties.getQueue().getProgressChannel(), event.getJobId(), event);
    }

    @Override
    public void publishStatus(StatusEvent event) {
        send(properties.getQueue().getStatusChannel(), event.getJobId(), event);

        try {
            statusCache.update(event)
                .onErrorResume(error -> {
                    log.warn("Failed to cache status {} for job {}: {}",
                        event.getStatus(), event.getJobId(), error.getMessage());
                    return Mono.empty();
                })
                .subscribe();
        } catch (Exception e) {
            log.warn("Failed to cache status for job {}: {}", event.getJobId(), e.getMessage());
        }
    }

    private void send(String channel, String jobId, Object event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize event for job {}: {}", jobId, e.getMessage());
            return;
        }

        try {
            redisTemplate.convertAndSend(channel, payload)
                .doOnSuccess(receivers -> log.debug("Published to {} for job {} ({} receivers)",
                    channel, jobId, receivers))
                .onErrorResume(error -> {
                    log.warn("Failed to publish to {} for job {}: {}", channel, jobId, error.getMessage());
                    return Mono.empty();
                })
                .subscribe();
        } catch (Exception e) {
            log.warn("Failed to publish to {} for job {}: {}", channel, jobId, e.getMessage());
        }
    }
}
