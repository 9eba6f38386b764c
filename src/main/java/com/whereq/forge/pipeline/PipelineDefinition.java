package com.whereq.forge.pipeline;

import com.whereq.forge.model.StageDescriptor;

import java.util.List;
import java.util.Map;

/**
 * Ordered stage plan for one job type.
 * Stages of a job run strictly in the planned order.
 */
public interface PipelineDefinition {

    /**
     * Job type this pipeline serves (ad_creative, music_video)
     */
    String getJobType();

    /**
     * Plan the stages of a job from its input
     *
     * @param input job input parameters
     * @return stages in execution order, names unique within the job
     * @throws IllegalArgumentException if the input cannot be planned
     */
    List<StageDescriptor> plan(Map<String, Object> input);
}
