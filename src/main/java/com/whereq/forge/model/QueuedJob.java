package com.whereq.forge.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Represents a job in the queue
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueuedJob {
    /**
     * Unique job identifier
     */
    @JsonAlias({"job_id", "id"})
    private String jobId;

    /**
     * Pipeline selector (ad_creative, music_video)
     */
    @JsonAlias("job_type")
    private String jobType;

    /**
     * Generation parameters, passed through to stage executors
     */
    @Builder.Default
    private Map<String, Object> input = new LinkedHashMap<>();

    /**
     * When the job was enqueued
     */
    @JsonAlias("enqueued_at")
    private Instant enqueuedAt;

    /**
     * Number of times the job went back to the queue
     */
    @Builder.Default
    @JsonAlias("requeue_count")
    private int requeueCount = 0;

    /**
     * Flat payloads put parameters next to the id; those land in the input map.
     */
    @JsonAnySetter
    public void putInput(String key, Object value) {
        if (input == null) {
            input = new LinkedHashMap<>();
        }
        input.put(key, value);
    }
}
