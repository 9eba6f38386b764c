package com.whereq.forge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Job-level status change, published on the status channel and mirrored in the status cache
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusEvent {
    public static final String RETRYING = "retrying";

    private String jobId;

    /**
     * pending, processing, retrying, completed or failed
     */
    private String status;

    private String workerId;

    private String stage;

    private Integer attempt;

    private Integer maxAttempts;

    private Long retryDelayMs;

    private ErrorKind errorKind;

    private String errorMessage;

    private String outputRef;

    private Integer progress;

    private Instant timestamp;
}
