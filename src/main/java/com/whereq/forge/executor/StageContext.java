package com.whereq.forge.executor;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;
import java.util.function.IntConsumer;

/**
 * Everything a stage executor may look at for one attempt
 */
@Getter
@Builder
public class StageContext {

    private final String jobId;

    private final String jobType;

    private final String stageName;

    private final int stageIndex;

    /**
     * 1-based attempt number within this worker run
     */
    private final int attempt;

    /**
     * The job's input parameters
     */
    @Builder.Default
    private final Map<String, Object> input = Collections.emptyMap();

    /**
     * Static parameters fixed when the pipeline was planned
     */
    @Builder.Default
    private final Map<String, Object> params = Collections.emptyMap();

    /**
     * Data returned by earlier stages, keyed by stage name
     */
    @Builder.Default
    private final Map<String, Map<String, Object>> priorStageData = Collections.emptyMap();

    @Getter(AccessLevel.NONE)
    private final IntConsumer progressReporter;

    /**
     * Report intra-stage progress (0-100). Values below the last report are ignored.
     */
    public void reportProgress(int percent) {
        if (progressReporter != null) {
            progressReporter.accept(Math.max(0, Math.min(100, percent)));
        }
    }
}
