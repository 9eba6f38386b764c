package com.whereq.forge.status;

import com.whereq.forge.config.ForgeProperties;
import com.whereq.forge.model.StatusEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Track live job status in a Redis hash per job ({@code job:<id>}) with a TTL.
 * <p>
 * The hash is a read-optimised mirror; the job store stays the source of truth.
 */
@Slf4j
@Service
public class JobStatusCache {

    public static final String FIELD_STATUS = "status";
    public static final String FIELD_WORKER = "worker_id";
    public static final String FIELD_STAGE = "stage";
    public static final String FIELD_ATTEMPT = "attempt";
    public static final String FIELD_PROGRESS = "progress";
    public static final String FIELD_ERROR_KIND = "error_kind";
    public static final String FIELD_ERROR_MESSAGE = "error_message";
    public static final String FIELD_OUTPUT_REF = "output_ref";
    public static final String FIELD_UPDATED_AT = "updated_at";

    @Autowired
    private ReactiveRedisTemplate<String, String> redisTemplate;

    @Autowired
    private ForgeProperties properties;

    /**
     * Merge a status event into the job's hash and refresh its TTL
     *
     * @param event status change
     * @return Mono that completes when updated
     */
    public Mono<Void> update(StatusEvent event) {
        String key = statusKey(event.getJobId());
        Map<String, String> updates = toFields(event);

        return redisTemplate.opsForHash()
            .putAll(key, updates)
            .then(redisTemplate.expire(key, properties.getQueue().getStatusTtl()))
            .doOnSuccess(v -> log.debug("Job {} cached status: {}", event.getJobId(), event.getStatus()))
            .then();
    }

    /**
     * Get the cached fields of a job
     *
     * @param jobId job identifier
     * @return Mono with the hash entries, empty map when nothing is cached
     */
    public Mono<Map<String, String>> getEntries(String jobId) {
        return redisTemplate.<String, String>opsForHash()
            .entries(statusKey(jobId))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue, LinkedHashMap::new);
    }

    /**
     * Get the cached status string (pending, processing, retrying, completed, failed)
     */
    public Mono<String> getStatus(String jobId) {
        return redisTemplate.<String, String>opsForHash().get(statusKey(jobId), FIELD_STATUS);
    }

    String statusKey(String jobId) {
        return properties.getQueue().getStatusKeyPrefix() + jobId;
    }

    private static Map<String, String> toFields(StatusEvent event) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FIELD_STATUS, event.getStatus());
        putIfPresent(fields, FIELD_WORKER, event.getWorkerId());
        putIfPresent(fields, FIELD_STAGE, event.getStage());
        putIfPresent(fields, FIELD_ATTEMPT, event.getAttempt());
        putIfPresent(fields, FIELD_PROGRESS, event.getProgress());
        putIfPresent(fields, FIELD_ERROR_KIND, event.getErrorKind());
        putIfPresent(fields, FIELD_ERROR_MESSAGE, event.getErrorMessage());
        putIfPresent(fields, FIELD_OUTPUT_REF, event.getOutputRef());
        putIfPresent(fields, FIELD_UPDATED_AT, event.getTimestamp());
        return fields;
    }

    private static void putIfPresent(Map<String, String> fields, String field, Object value) {
        if (value != null) {
            fields.put(field, value.toString());
        }
    }
}
