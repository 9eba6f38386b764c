package com.whereq.forge.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class QueuedJobTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    @Test
    void testReadSnakeCaseEntry() throws Exception {
        String json = """
            {"job_id": "job-1", "job_type": "music_video", "input": {"scene_count": 3},
             "enqueued_at": "2026-01-01T00:00:00Z", "requeue_count": 2}
            """;

        QueuedJob job = objectMapper.readValue(json, QueuedJob.class);

        assertThat(job.getJobId()).isEqualTo("job-1");
        assertThat(job.getJobType()).isEqualTo("music_video");
        assertThat(job.getInput()).containsEntry("scene_count", 3);
        assertThat(job.getEnqueuedAt()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
        assertThat(job.getRequeueCount()).isEqualTo(2);
    }

    @Test
    void testFlatPayloadLandsInInput() throws Exception {
        String json = """
            {"id": "job-2", "prompt": "a red car", "duration": 15}
            """;

        QueuedJob job = objectMapper.readValue(json, QueuedJob.class);

        assertThat(job.getJobId()).isEqualTo("job-2");
        assertThat(job.getJobType()).isNull();
        assertThat(job.getRequeueCount()).isZero();
        assertThat(job.getInput())
            .containsEntry("prompt", "a red car")
            .containsEntry("duration", 15);
    }

    @Test
    void testWrittenEntryReadsBack() throws Exception {
        QueuedJob job = QueuedJob.builder().jobId("job-3").jobType("ad_creative").requeueCount(1).build();
        job.getInput().put("prompt", "sunrise");

        QueuedJob read = objectMapper.readValue(objectMapper.writeValueAsString(job), QueuedJob.class);

        assertThat(read).isEqualTo(job);
    }
}
