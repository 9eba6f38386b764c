package com.whereq.forge.entity;

import com.whereq.forge.model.ErrorKind;
import com.whereq.forge.model.JobStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One user-submitted generation request.
 * Terminal status is written through conditional updates so it is set exactly once.
 */
@Entity
@Table(name = "jobs", indexes = {
    @Index(name = "idx_jobs_status_lease", columnList = "status, leaseExpiresAt")
})
@Data
public class GenerationJob {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 64)
    private String jobType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private JobStatus status;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> input = new LinkedHashMap<>();

    @Column(length = 2048)
    private String outputRef;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private ErrorKind errorKind;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    /**
     * Attempts made on the failing stage in the final run
     */
    @Column(nullable = false)
    private int errorAttempts;

    /**
     * True when the failure was retryable but the retries ran out
     */
    @Column(nullable = false)
    private boolean errorExhausted;

    /**
     * Last published overall progress
     */
    @Column(nullable = false)
    private int progress;

    /**
     * Number of planned stages, the divisor of the overall progress mean
     */
    @Column(nullable = false)
    private int stageCount;

    @Column(length = 128)
    private String leaseOwner;

    private Instant leaseExpiresAt;

    @Column(nullable = false)
    private int requeueCount;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    private Instant completedAt;
}
