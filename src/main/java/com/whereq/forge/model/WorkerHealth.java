package com.whereq.forge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Health snapshot of a single worker
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerHealth {
    private String workerId;

    private boolean running;

    private String currentJob;

    private boolean brokerHealthy;

    private boolean storeHealthy;

    private boolean healthy;

    private Instant timestamp;
}
