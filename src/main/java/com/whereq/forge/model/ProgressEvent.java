package com.whereq.forge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Granular progress update published on every stage status transition
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressEvent {
    private String jobId;

    private String stage;

    /**
     * Overall job progress, mean of all stage progress values
     */
    private int progress;

    /**
     * Progress of the reported stage alone
     */
    private int stageProgress;

    /**
     * Stage status (lowercase)
     */
    private String status;

    private String workerId;

    private Instant timestamp;
}
