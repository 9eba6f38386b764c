package com.whereq.forge.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.forge.config.ForgeProperties;
import com.whereq.forge.model.QueuedJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis list backed job queue.
 * Producers RPUSH, workers BLPOP, so each entry reaches exactly one worker.
 * <p>
 * Uses the imperative template: blocking list commands need a dedicated connection
 * and the worker loop is blocking anyway.
 */
@Slf4j
@Service
public class RedisJobQueue implements JobQueue {

    private static final int MAX_LOGGED_PAYLOAD = 200;

    @Autowired
    private StringRedisTemplate redisTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ForgeProperties properties;

    @Override
    public long enqueue(QueuedJob job) {
        Long size = redisTemplate.opsForList().rightPush(queueKey(), serialize(job));
        log.info("Enqueued job {}, queue size: {}", job.getJobId(), size);
        return size != null ? size : 0L;
    }

    @Override
    public void pushBack(QueuedJob job) {
        redisTemplate.opsForList().leftPush(queueKey(), serialize(job));
        log.info("Returned job {} to the head of the queue", job.getJobId());
    }

    @Override
    public Optional<QueuedJob> pop(Duration timeout) {
        String json = redisTemplate.opsForList().leftPop(queueKey(), timeout);
        if (json == null) {
            return Optional.empty();
        }

        try {
            QueuedJob job = objectMapper.readValue(json, QueuedJob.class);
            log.debug("Consumed job {} from queue", job.getJobId());
            return Optional.of(job);
        } catch (JsonProcessingException e) {
            log.error("Dropping unreadable queue entry: {}", abbreviate(json), e);
            return Optional.empty();
        }
    }

    @Override
    public long size() {
        Long size = redisTemplate.opsForList().size(queueKey());
        return size != null ? size : 0L;
    }

    @Override
    public boolean ping() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
            return "PONG".equalsIgnoreCase(pong);
        } catch (Exception e) {
            log.error("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    private String queueKey() {
        return properties.getQueue().getName();
    }

    private String serialize(QueuedJob job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize job " + job.getJobId(), e);
        }
    }

    private static String abbreviate(String json) {
        return json.length() > MAX_LOGGED_PAYLOAD ? json.substring(0, MAX_LOGGED_PAYLOAD) + "..." : json;
    }
}
