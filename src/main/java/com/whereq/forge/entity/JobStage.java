package com.whereq.forge.entity;

import com.whereq.forge.model.ErrorKind;
import com.whereq.forge.model.StageStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One pipeline step of a job. Rows are owned by their job and keyed by (jobId, stageName).
 */
@Entity
@Table(name = "job_stages", uniqueConstraints = {
    @UniqueConstraint(name = "uk_job_stages_job_stage", columnNames = {"jobId", "stageName"})
})
@Data
public class JobStage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String jobId;

    @Column(nullable = false, length = 128)
    private String stageName;

    @Column(nullable = false)
    private int stageIndex;

    @Column(nullable = false, length = 64)
    private String executor;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private StageStatus status;

    /**
     * 0-100 within this stage, never decreases
     */
    @Column(nullable = false)
    private int progress;

    @Column(nullable = false)
    private int attempts;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> stageData = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private ErrorKind errorKind;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @Column(nullable = false)
    private boolean errorRetryable;

    private Instant startedAt;

    /**
     * Set once, on success or final failure
     */
    private Instant completedAt;

    private Instant updatedAt;
}
