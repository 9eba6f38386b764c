package com.whereq.forge.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.forge.model.ErrorKind;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.model.StageStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response for job status query
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {
    /**
     * Job identifier
     */
    private String jobId;

    /**
     * Pipeline the job runs
     */
    private String jobType;

    /**
     * Persisted status
     */
    private JobStatus status;

    /**
     * Latest status from the live cache (may be "retrying")
     */
    private String liveStatus;

    /**
     * Job progress information
     */
    private JobProgress progress;

    /**
     * Per-stage breakdown in execution order
     */
    private List<StageInfo> stages;

    /**
     * Final artifact locator (if completed)
     */
    private String outputRef;

    /**
     * Error (if failed)
     */
    private ErrorInfo error;

    /**
     * Times the job went back to the queue
     */
    private int requeueCount;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant completedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class JobProgress {
        private int percentage;
        private String currentStage;
        private int stagesCompleted;
        private int stagesTotal;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class StageInfo {
        private String name;
        private StageStatus status;
        private int progress;
        private int attempts;
        private ErrorInfo error;
        private Instant startedAt;
        private Instant completedAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorInfo {
        private ErrorKind kind;
        private String message;
        private boolean retryable;

        /**
         * Attempts made before giving up (job level only)
         */
        private Integer attempts;

        /**
         * True when retries ran out (job level only)
         */
        private Boolean exhausted;
    }
}
