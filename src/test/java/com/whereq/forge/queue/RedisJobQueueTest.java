package com.whereq.forge.queue;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.whereq.forge.config.ForgeProperties;
import com.whereq.forge.model.QueuedJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisJobQueueTest {

    private static final String QUEUE = "video_generation_queue";

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ListOperations<String, String> listOperations;

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private RedisJobQueue queue;

    @BeforeEach
    void setUp() {
        queue = new RedisJobQueue();
        ReflectionTestUtils.setField(queue, "redisTemplate", redisTemplate);
        ReflectionTestUtils.setField(queue, "objectMapper", objectMapper);
        ReflectionTestUtils.setField(queue, "properties", new ForgeProperties());
        when(redisTemplate.opsForList()).thenReturn(listOperations);
    }

    @Test
    void testEnqueueAppendsToTail() throws Exception {
        when(listOperations.rightPush(eq(QUEUE), anyString())).thenReturn(3L);

        long size = queue.enqueue(QueuedJob.builder().jobId("job-q").jobType("ad_creative").build());

        assertThat(size).isEqualTo(3);
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(listOperations).rightPush(eq(QUEUE), json.capture());
        assertThat(objectMapper.readTree(json.getValue()).get("jobId").asText()).isEqualTo("job-q");
    }

    @Test
    void testPushBackGoesToHead() {
        queue.pushBack(QueuedJob.builder().jobId("job-back").build());

        verify(listOperations).leftPush(eq(QUEUE), anyString());
    }

    @Test
    void testPopReadsEntry() {
        when(listOperations.leftPop(QUEUE, Duration.ofSeconds(1)))
            .thenReturn("{\"job_id\": \"job-pop\", \"job_type\": \"music_video\", \"prompt\": \"neon rain\"}");

        Optional<QueuedJob> job = queue.pop(Duration.ofSeconds(1));

        assertThat(job).hasValueSatisfying(popped -> {
            assertThat(popped.getJobId()).isEqualTo("job-pop");
            assertThat(popped.getInput()).containsEntry("prompt", "neon rain");
        });
    }

    @Test
    void testPopTimeout() {
        when(listOperations.leftPop(QUEUE, Duration.ofSeconds(1))).thenReturn(null);

        assertThat(queue.pop(Duration.ofSeconds(1))).isEmpty();
    }

    @Test
    void testUnreadableEntryIsDropped() {
        when(listOperations.leftPop(QUEUE, Duration.ofSeconds(1))).thenReturn("not json");

        assertThat(queue.pop(Duration.ofSeconds(1))).isEmpty();
    }
}
